package com.proveground.matchengine.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Grants a corporate partner access to a tenant's student network.
 */
@Entity
@Table(name = "tenant_partner_access",
        uniqueConstraints = @UniqueConstraint(columnNames = {"tenant_id", "partner_id"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TenantPartnerAccessEntity {

    public enum Relationship {
        EXCLUSIVE,
        PREFERRED,
        NETWORK
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    // listing author (corporate partner user)
    @Column(name = "partner_id", nullable = false, length = 64)
    private String partnerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "relationship", nullable = false, length = 20)
    private Relationship relationship;

    @Column(name = "is_active")
    private boolean active;
}
