package com.proveground.matchengine.web;

import com.proveground.matchengine.persistence.RecomputeQueueEntity.Reason;
import com.proveground.matchengine.service.StalenessTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Change notifications from the profile and listing services.
 */
@RestController
@RequestMapping("/api/match-engine/notifications")
@RequiredArgsConstructor
public class ChangeNotificationController {

    private final StalenessTracker stalenessTracker;

    @PostMapping("/students/{studentId}/profile")
    public ResponseEntity<Map<String, Integer>> studentChanged(@PathVariable String studentId) {
        int queued = stalenessTracker.onStudentChanged(studentId, Reason.PROFILE_CHANGE);
        return ResponseEntity.accepted().body(Map.of("queued", queued));
    }

    @PostMapping("/listings/{listingId}")
    public ResponseEntity<Map<String, Integer>> listingChanged(@PathVariable String listingId) {
        int queued = stalenessTracker.onListingChanged(listingId);
        return ResponseEntity.accepted().body(Map.of("queued", queued));
    }

    @DeleteMapping("/students/{studentId}")
    public ResponseEntity<Void> studentDeleted(@PathVariable String studentId) {
        stalenessTracker.onStudentDeleted(studentId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/listings/{listingId}")
    public ResponseEntity<Void> listingDeleted(@PathVariable String listingId) {
        stalenessTracker.onListingDeleted(listingId);
        return ResponseEntity.noContent().build();
    }
}
