package com.proveground.matchengine.web;

import com.proveground.matchengine.BaseIntegrationTest;
import com.proveground.matchengine.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("ChangeNotificationController Tests")
@AutoConfigureMockMvc
class ChangeNotificationControllerTest extends BaseIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        cleanDatabase();
        studentRepository.save(TestFixtures.student("s1", "t1", "Java"));
        listingRepository.save(TestFixtures.listing("l1", "t1", "Java"));
        listingRepository.save(TestFixtures.listing("l2", "t1", "Go"));
    }

    @Test
    @DisplayName("Profile change is accepted and queues the student's pairs")
    void profileChange() throws Exception {
        mockMvc.perform(post("/api/match-engine/notifications/students/s1/profile"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.queued").value(2));
    }

    @Test
    @DisplayName("Listing change is accepted")
    void listingChange() throws Exception {
        mockMvc.perform(post("/api/match-engine/notifications/listings/l1"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.queued").value(1));
    }

    @Test
    @DisplayName("Student deletion removes cached scores")
    void studentDeleted() throws Exception {
        storeScore("s1", "l1", "t1", 70, LocalDateTime.now());

        mockMvc.perform(delete("/api/match-engine/notifications/students/s1"))
                .andExpect(status().isNoContent());

        assertEquals(0, scoreRepository.count());
    }

    @Test
    @DisplayName("Listing deletion removes cached scores")
    void listingDeleted() throws Exception {
        storeScore("s1", "l1", "t1", 70, LocalDateTime.now());
        storeScore("s1", "l2", "t1", 70, LocalDateTime.now());

        mockMvc.perform(delete("/api/match-engine/notifications/listings/l1"))
                .andExpect(status().isNoContent());

        assertEquals(1, scoreRepository.count());
    }
}
