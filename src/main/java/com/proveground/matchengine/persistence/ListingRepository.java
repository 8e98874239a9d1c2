package com.proveground.matchengine.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface ListingRepository extends JpaRepository<ListingEntity, String> {

    /**
     * Open listings a student of the given tenant may see: the tenant's own
     * listings, every listing shared beyond its tenant, and private listings
     * of partners holding active exclusive or preferred access to the tenant.
     */
    @Query("SELECT l FROM ListingEntity l WHERE l.status = :status " +
            "AND (l.tenantId = :tenantId OR l.visibility <> :privateVisibility " +
            "OR EXISTS (SELECT a FROM TenantPartnerAccessEntity a WHERE a.tenantId = :tenantId " +
            "AND a.partnerId = l.authorId AND a.active = true AND a.relationship IN :privateRelationships))")
    List<ListingEntity> findVisibleToTenant(@Param("tenantId") String tenantId,
                                            @Param("status") ListingEntity.Status status,
                                            @Param("privateVisibility") ListingEntity.Visibility privateVisibility,
                                            @Param("privateRelationships") Collection<TenantPartnerAccessEntity.Relationship> privateRelationships);

    List<ListingEntity> findByStatusAndVisibilityNot(ListingEntity.Status status,
                                                     ListingEntity.Visibility visibility);
}
