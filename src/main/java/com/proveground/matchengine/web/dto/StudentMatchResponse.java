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
 * A listing ranked for a student.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StudentMatchResponse {

    private String listingId;
    private String title;
    private String companyName;
    private String category;
    private int compositeScore;
    private List<String> matchedSkills;
    private List<String> missingSkills;
    private Map<String, SignalScore> signals;
    private boolean stale;
    private LocalDateTime computedAt;
}
