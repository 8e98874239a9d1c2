package com.proveground.matchengine.service;

import com.proveground.matchengine.exception.ResourceNotFoundException;
import com.proveground.matchengine.persistence.ListingEntity;
import com.proveground.matchengine.persistence.ListingRepository;
import com.proveground.matchengine.persistence.MatchScoreEntity;
import com.proveground.matchengine.persistence.MatchScoreRepository;
import com.proveground.matchengine.persistence.RecomputeQueueEntity.Reason;
import com.proveground.matchengine.persistence.StudentEntity;
import com.proveground.matchengine.persistence.StudentRepository;
import com.proveground.matchengine.persistence.TenantMatchConfigEntity;
import com.proveground.matchengine.queue.MatchPair;
import com.proveground.matchengine.queue.RecomputeQueueService;
import com.proveground.matchengine.web.dto.ListingMatchResponse;
import com.proveground.matchengine.web.dto.StudentMatchResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Ranked reads over the score cache. Stale scores are returned as they are;
 * candidates without a score are omitted and queued. The owning tenant's
 * settings set the score floor and cap the page size.
 */
@Service
@Slf4j
public class MatchQueryService {

    private final ScoreStore scoreStore;
    private final MatchScoreRepository scoreRepository;
    private final StudentRepository studentRepository;
    private final ListingRepository listingRepository;
    private final CandidateResolver candidateResolver;
    private final RecomputeQueueService queueService;
    private final TenantConfigService tenantConfigService;
    private final int onDemandPriority;

    public MatchQueryService(ScoreStore scoreStore,
                             MatchScoreRepository scoreRepository,
                             StudentRepository studentRepository,
                             ListingRepository listingRepository,
                             CandidateResolver candidateResolver,
                             RecomputeQueueService queueService,
                             TenantConfigService tenantConfigService,
                             @Value("${matchengine.queue.on-demand-priority:5}") int onDemandPriority) {
        this.scoreStore = scoreStore;
        this.scoreRepository = scoreRepository;
        this.studentRepository = studentRepository;
        this.listingRepository = listingRepository;
        this.candidateResolver = candidateResolver;
        this.queueService = queueService;
        this.tenantConfigService = tenantConfigService;
        this.onDemandPriority = onDemandPriority;
    }

    public List<ListingMatchResponse> matchesForListing(String listingId, int limit) {
        ListingEntity listing = listingRepository.findById(listingId)
                .orElseThrow(() -> new ResourceNotFoundException("Listing " + listingId + " not found"));

        enqueueUnscoredStudents(listing);

        TenantMatchConfigEntity settings = tenantConfigService.settingsFor(listing.getTenantId());
        List<MatchScoreEntity> ranked = scoreStore.rankedForListing(listingId,
                settings.getMinScoreThreshold(), Math.min(limit, settings.getMaxResultsPerQuery()));
        Map<String, StudentEntity> students = studentRepository
                .findAllById(ranked.stream().map(MatchScoreEntity::getStudentId).toList())
                .stream()
                .collect(Collectors.toMap(StudentEntity::getId, Function.identity()));

        List<ListingMatchResponse> result = new ArrayList<>();
        for (MatchScoreEntity score : ranked) {
            StudentEntity student = students.get(score.getStudentId());
            if (student == null) {
                continue;
            }
            result.add(ListingMatchResponse.builder()
                    .studentId(student.getId())
                    .firstName(student.getFirstName())
                    .lastName(student.getLastName())
                    .email(student.getEmail())
                    .university(student.getUniversity())
                    .compositeScore(score.getCompositeScore())
                    .matchedSkills(score.getMatchedSkills())
                    .missingSkills(score.getMissingSkills())
                    .signals(score.getSignals())
                    .stale(score.isStale())
                    .computedAt(score.getComputedAt())
                    .build());
        }
        return result;
    }

    public List<StudentMatchResponse> matchesForStudent(String studentId, int limit) {
        StudentEntity student = studentRepository.findById(studentId)
                .orElseThrow(() -> new ResourceNotFoundException("Student " + studentId + " not found"));

        enqueueUnscoredListings(student);

        TenantMatchConfigEntity settings = tenantConfigService.settingsFor(student.getTenantId());
        List<MatchScoreEntity> ranked = scoreStore.rankedForStudent(studentId,
                settings.getMinScoreThreshold(), Math.min(limit, settings.getMaxResultsPerQuery()));
        Map<String, ListingEntity> listings = listingRepository
                .findAllById(ranked.stream().map(MatchScoreEntity::getListingId).toList())
                .stream()
                .collect(Collectors.toMap(ListingEntity::getId, Function.identity()));

        List<StudentMatchResponse> result = new ArrayList<>();
        for (MatchScoreEntity score : ranked) {
            ListingEntity listing = listings.get(score.getListingId());
            if (listing == null) {
                continue;
            }
            result.add(StudentMatchResponse.builder()
                    .listingId(listing.getId())
                    .title(listing.getTitle())
                    .companyName(listing.getCompanyName())
                    .category(listing.getCategory())
                    .compositeScore(score.getCompositeScore())
                    .matchedSkills(score.getMatchedSkills())
                    .missingSkills(score.getMissingSkills())
                    .signals(score.getSignals())
                    .stale(score.isStale())
                    .computedAt(score.getComputedAt())
                    .build());
        }
        return result;
    }

    private void enqueueUnscoredStudents(ListingEntity listing) {
        Set<String> scored = new HashSet<>(scoreRepository.findStudentIdsByListingId(listing.getId()));
        List<MatchPair> missing = new ArrayList<>();
        for (StudentEntity student : candidateResolver.studentsFor(listing)) {
            if (!scored.contains(student.getId())) {
                missing.add(new MatchPair(student.getId(), listing.getId(), student.getTenantId()));
            }
        }
        if (!missing.isEmpty()) {
            log.debug("Listing {} has {} unscored candidates, queueing", listing.getId(), missing.size());
            queueService.enqueueAll(missing, Reason.MANUAL, onDemandPriority);
        }
    }

    private void enqueueUnscoredListings(StudentEntity student) {
        Set<String> scored = new HashSet<>(scoreRepository.findListingIdsByStudentId(student.getId()));
        List<MatchPair> missing = new ArrayList<>();
        for (ListingEntity listing : candidateResolver.listingsFor(student)) {
            if (!scored.contains(listing.getId())) {
                missing.add(new MatchPair(student.getId(), listing.getId(), student.getTenantId()));
            }
        }
        if (!missing.isEmpty()) {
            log.debug("Student {} has {} unscored candidate listings, queueing", student.getId(), missing.size());
            queueService.enqueueAll(missing, Reason.MANUAL, onDemandPriority);
        }
    }
}
