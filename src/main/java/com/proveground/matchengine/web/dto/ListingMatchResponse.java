package com.proveground.matchengine.web.dto;

import com.proveground.matchengine.persistence.SignalScore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * A student ranked for a listing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ListingMatchResponse {

    private String studentId;
    private String firstName;
    private String lastName;
    private String email;
    private String university;
    private int compositeScore;
    private List<String> matchedSkills;
    private List<String> missingSkills;
    private Map<String, SignalScore> signals;
    private boolean stale;
    private LocalDateTime computedAt;
}
