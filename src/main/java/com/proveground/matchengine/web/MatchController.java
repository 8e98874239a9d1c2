package com.proveground.matchengine.web;

import com.proveground.matchengine.service.MatchQueryService;
import com.proveground.matchengine.web.dto.ListingMatchResponse;
import com.proveground.matchengine.web.dto.StudentMatchResponse;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/match-engine/matches")
@Validated
@RequiredArgsConstructor
public class MatchController {

    private final MatchQueryService matchQueryService;

    @GetMapping("/listing/{listingId}")
    public ResponseEntity<List<ListingMatchResponse>> forListing(
            @PathVariable String listingId,
            @RequestParam(defaultValue = "50") @Min(1) @Max(500) int limit) {
        return ResponseEntity.ok(matchQueryService.matchesForListing(listingId, limit));
    }

    @GetMapping("/student/{studentId}")
    public ResponseEntity<List<StudentMatchResponse>> forStudent(
            @PathVariable String studentId,
            @RequestParam(defaultValue = "50") @Min(1) @Max(500) int limit) {
        return ResponseEntity.ok(matchQueryService.matchesForStudent(studentId, limit));
    }
}
