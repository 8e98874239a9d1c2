package com.proveground.matchengine.queue;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A (student, listing) pair to enqueue, with the tenant the score is filed under.
 */
@Data
@AllArgsConstructor
public class MatchPair {

    private String studentId;
    private String listingId;
    private String tenantId;
}
