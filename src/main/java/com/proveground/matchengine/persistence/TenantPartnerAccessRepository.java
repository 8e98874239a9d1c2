package com.proveground.matchengine.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface TenantPartnerAccessRepository extends JpaRepository<TenantPartnerAccessEntity, Long> {

    Optional<TenantPartnerAccessEntity> findFirstByTenantIdAndPartnerIdAndActiveTrue(String tenantId, String partnerId);

    List<TenantPartnerAccessEntity> findByPartnerIdAndActiveTrueAndRelationshipIn(
            String partnerId, Collection<TenantPartnerAccessEntity.Relationship> relationships);
}
