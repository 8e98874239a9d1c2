package com.proveground.matchengine.web;

import com.proveground.matchengine.BaseIntegrationTest;
import com.proveground.matchengine.TestFixtures;
import com.proveground.matchengine.persistence.MatchScoreEntity;
import com.proveground.matchengine.persistence.TenantMatchConfigEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("MatchController Tests")
@AutoConfigureMockMvc
class MatchControllerTest extends BaseIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        cleanDatabase();
        studentRepository.save(TestFixtures.student("s1", "t1", "Java"));
        studentRepository.save(TestFixtures.student("s2", "t1", "Java"));
        studentRepository.save(TestFixtures.student("s3", "t1", "Java"));
        listingRepository.save(TestFixtures.listing("l1", "t1", "Java"));
        listingRepository.save(TestFixtures.listing("l2", "t1", "SQL"));
    }

    @Test
    @DisplayName("Listing matches are ranked by score, ties by older computation")
    void listingRanking() throws Exception {
        LocalDateTime now = LocalDateTime.now();
        storeScore("s1", "l1", "t1", 80, now.minusHours(1));
        storeScore("s2", "l1", "t1", 90, now);
        storeScore("s3", "l1", "t1", 80, now.minusHours(5));

        mockMvc.perform(get("/api/match-engine/matches/listing/l1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(3)))
                .andExpect(jsonPath("$[*].studentId", contains("s2", "s3", "s1")))
                .andExpect(jsonPath("$[0].compositeScore").value(90))
                .andExpect(jsonPath("$[0].firstName").value("First s2"));
    }

    @Test
    @DisplayName("Limit caps the number of results")
    void listingLimit() throws Exception {
        storeScore("s1", "l1", "t1", 80, LocalDateTime.now());
        storeScore("s2", "l1", "t1", 70, LocalDateTime.now());

        mockMvc.perform(get("/api/match-engine/matches/listing/l1").param("limit", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].studentId").value("s1"));
    }

    @Test
    @DisplayName("Unscored candidates are queued on read")
    void unscoredCandidatesQueued() throws Exception {
        storeScore("s1", "l1", "t1", 80, LocalDateTime.now());

        mockMvc.perform(get("/api/match-engine/matches/listing/l1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)));

        assertEquals(2, queueRepository.count());
        assertTrue(queueRepository.findAll().stream().allMatch(item -> item.getPriority() == 5));
    }

    @Test
    @DisplayName("Stale scores are served with their flag")
    void staleScoresServed() throws Exception {
        MatchScoreEntity score = storeScore("s1", "l1", "t1", 80, LocalDateTime.now());
        score.setStale(true);
        scoreRepository.save(score);

        mockMvc.perform(get("/api/match-engine/matches/listing/l1"))
                .andExpect(jsonPath("$[0].stale").value(true));
    }

    @Test
    @DisplayName("Student matches list listings best first")
    void studentMatches() throws Exception {
        storeScore("s1", "l1", "t1", 55, LocalDateTime.now());
        storeScore("s1", "l2", "t1", 75, LocalDateTime.now());

        mockMvc.perform(get("/api/match-engine/matches/student/s1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].listingId", contains("l2", "l1")))
                .andExpect(jsonPath("$[0].title").value("Listing l2"));
    }

    @Test
    @DisplayName("Tenant settings drop low scores and cap the page size")
    void tenantSettingsApplied() throws Exception {
        tenantConfigRepository.save(TenantMatchConfigEntity.builder()
                .tenantId("t1")
                .minScoreThreshold(60)
                .maxResultsPerQuery(1)
                .athleticTransferEnabled(true)
                .build());
        storeScore("s1", "l1", "t1", 80, LocalDateTime.now());
        storeScore("s2", "l1", "t1", 70, LocalDateTime.now());
        storeScore("s3", "l1", "t1", 40, LocalDateTime.now());
        storeScore("s1", "l2", "t1", 59, LocalDateTime.now());

        mockMvc.perform(get("/api/match-engine/matches/listing/l1").param("limit", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].studentId").value("s1"));

        mockMvc.perform(get("/api/match-engine/matches/student/s1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].listingId", contains("l1")));
    }

    @Test
    @DisplayName("Unknown listing is 404")
    void unknownListing() throws Exception {
        mockMvc.perform(get("/api/match-engine/matches/listing/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));
    }

    @Test
    @DisplayName("Out of range limit is 400")
    void invalidLimit() throws Exception {
        mockMvc.perform(get("/api/match-engine/matches/listing/l1").param("limit", "0"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/match-engine/matches/listing/l1").param("limit", "abc"))
                .andExpect(status().isBadRequest());
    }
}
