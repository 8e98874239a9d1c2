package com.proveground.matchengine.signal;

import com.proveground.matchengine.persistence.ListingEntity;
import com.proveground.matchengine.persistence.StudentEntity;
import com.proveground.matchengine.persistence.TenantPartnerAccessEntity;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Affinity between the student's tenant and the listing owner.
 */
@Component
public class NetworkAffinityEvaluator implements SignalEvaluator {

    private static final double SAME_TENANT = 1.0;
    private static final double OPEN_NETWORK = 0.4;
    private static final double NO_ACCESS = 0.0;

    @Override
    public SignalType getType() {
        return SignalType.NETWORK;
    }

    @Override
    public SignalOutcome evaluate(EvaluationContext context) {
        StudentEntity student = context.getStudent();
        ListingEntity listing = context.getListing();
        if (student.getTenantId() == null) {
            return SignalOutcome.neutral(getType(), "student has no tenant");
        }

        Map<String, Object> details = new LinkedHashMap<>();
        if (student.getTenantId().equals(listing.getTenantId())) {
            details.put("relationship", "same_tenant");
            return SignalOutcome.of(getType(), SAME_TENANT, details);
        }

        TenantPartnerAccessEntity access = context.getPartnerAccess();
        if (access != null && access.isActive()) {
            details.put("relationship", access.getRelationship().name().toLowerCase());
            return SignalOutcome.of(getType(), relationshipScore(access.getRelationship()), details);
        }

        if (listing.isVisibleOutsideTenant()) {
            details.put("relationship", "open_network");
            return SignalOutcome.of(getType(), OPEN_NETWORK, details);
        }

        details.put("relationship", "none");
        return SignalOutcome.of(getType(), NO_ACCESS, details);
    }

    static double relationshipScore(TenantPartnerAccessEntity.Relationship relationship) {
        return switch (relationship) {
            case EXCLUSIVE -> 0.95;
            case PREFERRED -> 0.85;
            case NETWORK -> 0.7;
        };
    }
}
