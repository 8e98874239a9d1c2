package com.proveground.matchengine.signal;

import com.proveground.matchengine.persistence.AthleticSkillMappingEntity;
import com.proveground.matchengine.persistence.EngagementEntity;
import com.proveground.matchengine.persistence.ListingEntity;
import com.proveground.matchengine.persistence.StudentEntity;
import com.proveground.matchengine.persistence.StudentScheduleEntity;
import com.proveground.matchengine.persistence.TenantPartnerAccessEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything the evaluators may look at for one (student, listing) pair.
 * Loaded once per computation; evaluators only read it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluationContext {

    private StudentEntity student;
    private ListingEntity listing;
    @Builder.Default
    private List<EngagementEntity> engagements = new ArrayList<>();
    @Builder.Default
    private List<StudentScheduleEntity> schedules = new ArrayList<>();
    // skill mappings of the sports the student plays, strongest first
    @Builder.Default
    private List<AthleticSkillMappingEntity> athleticTransfers = new ArrayList<>();
    // active partner access between the student's tenant and the listing author, if any
    private TenantPartnerAccessEntity partnerAccess;
    private LocalDate asOf;

    /**
     * Engagements other than the one for the listing being scored.
     */
    public List<EngagementEntity> otherEngagements() {
        return engagements.stream()
                .filter(e -> listing == null || !listing.getId().equals(e.getListingId()))
                .toList();
    }
}
