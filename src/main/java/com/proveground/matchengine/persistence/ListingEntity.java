package com.proveground.matchengine.persistence;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Project listing as owned by the listing service. Read-only for the engine.
 */
@Entity
@Table(name = "listings")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ListingEntity {

    public enum Status {
        DRAFT,
        OPEN,
        CLOSED,
        ARCHIVED
    }

    /**
     * Who may see the listing outside of the owning tenant.
     */
    public enum Visibility {
        /** Owning tenant only. */
        PRIVATE,
        /** Partner network only. */
        NETWORK,
        /** Owning tenant and partner network. */
        HYBRID
    }

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "tenant_id", length = 64)
    private String tenantId;

    @Column(name = "author_id", length = 64)
    private String authorId;

    @Column(name = "title")
    private String title;

    @Column(name = "company_name")
    private String companyName;

    @Column(name = "category")
    private String category;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 20)
    private Status status;

    @Enumerated(EnumType.STRING)
    @Column(name = "visibility", length = 20)
    private Visibility visibility;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "listing_skills", joinColumns = @JoinColumn(name = "listing_id"))
    @OrderColumn(name = "position")
    @Column(name = "skill_name")
    @Builder.Default
    private List<String> skillsRequired = new ArrayList<>();

    @Column(name = "hours_per_week")
    private Integer hoursPerWeek;

    @Column(name = "start_date")
    private LocalDate startDate;

    @Column(name = "end_date")
    private LocalDate endDate;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public boolean isOpen() {
        return status == Status.OPEN;
    }

    public boolean isVisibleOutsideTenant() {
        return visibility == Visibility.NETWORK || visibility == Visibility.HYBRID;
    }
}
