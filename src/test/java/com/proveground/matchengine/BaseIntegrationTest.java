package com.proveground.matchengine;

import com.proveground.matchengine.persistence.AthleticSkillMappingRepository;
import com.proveground.matchengine.persistence.EngagementRepository;
import com.proveground.matchengine.persistence.ListingRepository;
import com.proveground.matchengine.persistence.MatchScoreEntity;
import com.proveground.matchengine.persistence.MatchScoreHistoryRepository;
import com.proveground.matchengine.persistence.MatchScoreRepository;
import com.proveground.matchengine.persistence.RecomputeQueueRepository;
import com.proveground.matchengine.persistence.SportSeasonRepository;
import com.proveground.matchengine.persistence.StudentRepository;
import com.proveground.matchengine.persistence.StudentScheduleRepository;
import com.proveground.matchengine.persistence.TenantMatchConfigRepository;
import com.proveground.matchengine.persistence.TenantPartnerAccessRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;

/**
 * Base class for integration tests.
 * Uses H2 in-memory database and test profile; background jobs are off.
 */
@SpringBootTest
@ActiveProfiles("test")
@TestPropertySource(locations = "classpath:application-test.properties")
public abstract class BaseIntegrationTest {

    @Autowired
    protected StudentRepository studentRepository;

    @Autowired
    protected ListingRepository listingRepository;

    @Autowired
    protected EngagementRepository engagementRepository;

    @Autowired
    protected StudentScheduleRepository scheduleRepository;

    @Autowired
    protected SportSeasonRepository sportSeasonRepository;

    @Autowired
    protected TenantPartnerAccessRepository partnerAccessRepository;

    @Autowired
    protected AthleticSkillMappingRepository athleticSkillMappingRepository;

    @Autowired
    protected TenantMatchConfigRepository tenantConfigRepository;

    @Autowired
    protected MatchScoreRepository scoreRepository;

    @Autowired
    protected MatchScoreHistoryRepository historyRepository;

    @Autowired
    protected RecomputeQueueRepository queueRepository;

    protected void cleanDatabase() {
        queueRepository.deleteAll();
        historyRepository.deleteAll();
        scoreRepository.deleteAll();
        scheduleRepository.deleteAll();
        sportSeasonRepository.deleteAll();
        engagementRepository.deleteAll();
        partnerAccessRepository.deleteAll();
        athleticSkillMappingRepository.deleteAll();
        tenantConfigRepository.deleteAll();
        listingRepository.deleteAll();
        studentRepository.deleteAll();
    }

    /**
     * Store a cached score directly, bypassing computation.
     */
    protected MatchScoreEntity storeScore(String studentId, String listingId, String tenantId,
                                          int score, LocalDateTime computedAt) {
        return scoreRepository.save(MatchScoreEntity.builder()
                .studentId(studentId)
                .listingId(listingId)
                .tenantId(tenantId)
                .compositeScore(score)
                .signals(new LinkedHashMap<>())
                .matchedSkills(new ArrayList<>())
                .missingSkills(new ArrayList<>())
                .weightsVersion("test-v1")
                .computedAt(computedAt)
                .build());
    }
}
