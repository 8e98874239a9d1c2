package com.proveground.matchengine.service;

import com.proveground.matchengine.persistence.ListingEntity;
import com.proveground.matchengine.persistence.ListingRepository;
import com.proveground.matchengine.persistence.StudentEntity;
import com.proveground.matchengine.persistence.StudentRepository;
import com.proveground.matchengine.persistence.TenantPartnerAccessEntity;
import com.proveground.matchengine.persistence.TenantPartnerAccessEntity.Relationship;
import com.proveground.matchengine.persistence.TenantPartnerAccessRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Which (student, listing) pairs are worth scoring: open listings a
 * student's tenant can see.
 */
@Component
@RequiredArgsConstructor
public class CandidateResolver {

    // partner relationships that open a partner's private listings to the tenant
    static final Set<Relationship> PRIVATE_ACCESS = EnumSet.of(Relationship.EXCLUSIVE, Relationship.PREFERRED);

    private final ListingRepository listingRepository;
    private final StudentRepository studentRepository;
    private final TenantPartnerAccessRepository partnerAccessRepository;

    public List<ListingEntity> listingsFor(StudentEntity student) {
        if (student.getTenantId() == null) {
            return listingRepository.findByStatusAndVisibilityNot(ListingEntity.Status.OPEN,
                    ListingEntity.Visibility.PRIVATE);
        }
        return listingRepository.findVisibleToTenant(student.getTenantId(), ListingEntity.Status.OPEN,
                ListingEntity.Visibility.PRIVATE, PRIVATE_ACCESS);
    }

    public List<StudentEntity> studentsFor(ListingEntity listing) {
        if (!listing.isOpen()) {
            return List.of();
        }
        if (listing.isVisibleOutsideTenant()) {
            return studentRepository.findAll();
        }

        Set<String> tenants = new LinkedHashSet<>();
        if (listing.getTenantId() != null) {
            tenants.add(listing.getTenantId());
        }
        if (listing.getAuthorId() != null) {
            for (TenantPartnerAccessEntity access : partnerAccessRepository
                    .findByPartnerIdAndActiveTrueAndRelationshipIn(listing.getAuthorId(), PRIVATE_ACCESS)) {
                tenants.add(access.getTenantId());
            }
        }
        if (tenants.isEmpty()) {
            return List.of();
        }
        return studentRepository.findByTenantIdIn(tenants);
    }
}
