package com.proveground.matchengine.service;

import com.proveground.matchengine.BaseIntegrationTest;
import com.proveground.matchengine.TestFixtures;
import com.proveground.matchengine.availability.AvailabilityLevel;
import com.proveground.matchengine.availability.AvailabilityWindow;
import com.proveground.matchengine.exception.BadRequestException;
import com.proveground.matchengine.exception.ResourceNotFoundException;
import com.proveground.matchengine.exception.ScheduleValidationException;
import com.proveground.matchengine.persistence.RecomputeQueueEntity;
import com.proveground.matchengine.persistence.SportSeasonEntity;
import com.proveground.matchengine.persistence.StudentScheduleEntity;
import com.proveground.matchengine.persistence.StudentScheduleEntity.ScheduleType;
import com.proveground.matchengine.web.dto.ScheduleRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for ScheduleService.
 */
@DisplayName("ScheduleService Tests")
class ScheduleServiceTest extends BaseIntegrationTest {

    @Autowired
    private ScheduleService scheduleService;

    private SportSeasonEntity soccer;

    @BeforeEach
    void setUp() {
        cleanDatabase();
        studentRepository.save(TestFixtures.student("s1", "t1", "Java"));
        listingRepository.save(TestFixtures.listing("l1", "t1", "Java"));
        soccer = sportSeasonRepository.save(TestFixtures.season("Soccer", 9, 11, 15, 5));
    }

    private static ScheduleRequest.Block block(DayOfWeek day, int fromHour, int toHour) {
        return ScheduleRequest.Block.builder()
                .day(day)
                .startTime(LocalTime.of(fromHour, 0))
                .endTime(LocalTime.of(toHour, 0))
                .build();
    }

    @Nested
    @DisplayName("Create and Delete")
    class CrudTests {

        @Test
        @DisplayName("Should store a sport schedule and queue the student's pairs")
        void shouldCreateSportSchedule() {
            ScheduleRequest request = ScheduleRequest.builder()
                    .scheduleType(ScheduleType.SPORT)
                    .sportSeasonId(soccer.getId())
                    .build();

            StudentScheduleEntity saved = scheduleService.createSchedule("s1", request);

            assertNotNull(saved.getId());
            assertTrue(saved.isActive());
            assertEquals("Soccer", saved.getSportSeason().getSportName());
            List<RecomputeQueueEntity> queued = queueRepository.findAll();
            assertEquals(1, queued.size());
            assertEquals(RecomputeQueueEntity.Reason.SCHEDULE_CHANGE, queued.get(0).getReason());
        }

        @Test
        @DisplayName("Should keep custom blocks in order")
        void shouldCreateCustomSchedule() {
            ScheduleRequest request = ScheduleRequest.builder()
                    .scheduleType(ScheduleType.CUSTOM)
                    .customBlocks(List.of(block(DayOfWeek.MONDAY, 9, 12), block(DayOfWeek.MONDAY, 13, 15)))
                    .build();

            scheduleService.createSchedule("s1", request);

            List<StudentScheduleEntity> schedules = scheduleService.listSchedules("s1");
            assertEquals(1, schedules.size());
            assertThat(schedules.get(0).getCustomBlocks())
                    .extracting(b -> b.getStartTime().getHour())
                    .containsExactly(9, 13);
        }

        @Test
        @DisplayName("Sport schedule without a season is rejected")
        void shouldRejectSportWithoutSeason() {
            ScheduleRequest request = ScheduleRequest.builder().scheduleType(ScheduleType.SPORT).build();

            assertThatThrownBy(() -> scheduleService.createSchedule("s1", request))
                    .isInstanceOf(ScheduleValidationException.class)
                    .hasMessageContaining("sportSeasonId");
            assertEquals(0, scheduleRepository.count());
        }

        @Test
        @DisplayName("Overlapping blocks are rejected")
        void shouldRejectOverlappingBlocks() {
            ScheduleRequest request = ScheduleRequest.builder()
                    .scheduleType(ScheduleType.CUSTOM)
                    .customBlocks(List.of(block(DayOfWeek.TUESDAY, 9, 12), block(DayOfWeek.TUESDAY, 11, 14)))
                    .build();

            assertThrows(ScheduleValidationException.class, () -> scheduleService.createSchedule("s1", request));
        }

        @Test
        @DisplayName("Block ending before it starts is rejected")
        void shouldRejectInvertedBlock() {
            ScheduleRequest request = ScheduleRequest.builder()
                    .scheduleType(ScheduleType.CUSTOM)
                    .customBlocks(List.of(block(DayOfWeek.FRIDAY, 15, 10)))
                    .build();

            assertThrows(ScheduleValidationException.class, () -> scheduleService.createSchedule("s1", request));
        }

        @Test
        @DisplayName("Inverted effective range is rejected")
        void shouldRejectInvertedEffectiveRange() {
            ScheduleRequest request = ScheduleRequest.builder()
                    .scheduleType(ScheduleType.WORK)
                    .availableHoursPerWeek(10)
                    .effectiveStart(LocalDate.of(2025, 10, 1))
                    .effectiveEnd(LocalDate.of(2025, 9, 1))
                    .build();

            assertThrows(ScheduleValidationException.class, () -> scheduleService.createSchedule("s1", request));
        }

        @Test
        @DisplayName("Deleting another student's schedule is not found")
        void shouldNotDeleteForeignSchedule() {
            StudentScheduleEntity saved = scheduleService.createSchedule("s1", ScheduleRequest.builder()
                    .scheduleType(ScheduleType.WORK)
                    .availableHoursPerWeek(10)
                    .build());

            assertThrows(ResourceNotFoundException.class, () -> scheduleService.deleteSchedule("s2", saved.getId()));

            scheduleService.deleteSchedule("s1", saved.getId());
            assertTrue(scheduleService.listSchedules("s1").isEmpty());
        }

        @Test
        @DisplayName("Sport seasons are listed by sport name")
        void shouldListSeasonsSorted() {
            sportSeasonRepository.save(TestFixtures.season("Basketball", 11, 3, 20, 6));

            assertThat(scheduleService.listSportSeasons())
                    .extracting(SportSeasonEntity::getSportName)
                    .containsExactly("Basketball", "Soccer");
        }
    }

    @Nested
    @DisplayName("Availability")
    class AvailabilityTests {

        @Test
        @DisplayName("Committed hours override reduces weekly availability")
        void shouldApplyCommittedHours() {
            scheduleService.createSchedule("s1", ScheduleRequest.builder()
                    .scheduleType(ScheduleType.WORK)
                    .availableHoursPerWeek(20)
                    .build());

            List<AvailabilityWindow> windows = scheduleService.availability("s1",
                    LocalDate.of(2025, 9, 15), LocalDate.of(2025, 9, 28));

            assertEquals(2, windows.size());
            assertEquals(20.0, windows.get(0).getAvailableHours());
            assertEquals(AvailabilityLevel.MEDIUM, windows.get(0).getOverallAvailability());
        }

        @Test
        @DisplayName("Inactive schedules are ignored")
        void shouldIgnoreInactiveSchedules() {
            scheduleService.createSchedule("s1", ScheduleRequest.builder()
                    .scheduleType(ScheduleType.WORK)
                    .availableHoursPerWeek(20)
                    .active(false)
                    .build());

            List<AvailabilityWindow> windows = scheduleService.availability("s1",
                    LocalDate.of(2025, 9, 15), LocalDate.of(2025, 9, 21));

            assertEquals(40.0, windows.get(0).getAvailableHours());
        }

        @Test
        @DisplayName("Default range covers the coming months")
        void shouldDefaultRange() {
            List<AvailabilityWindow> windows = scheduleService.availability("s1", null, null);

            assertThat(windows).hasSizeGreaterThanOrEqualTo(26);
        }

        @Test
        @DisplayName("End before start is rejected")
        void shouldRejectInvertedRange() {
            assertThrows(BadRequestException.class, () -> scheduleService.availability("s1",
                    LocalDate.of(2025, 10, 1), LocalDate.of(2025, 9, 1)));
        }

        @Test
        @DisplayName("Ranges longer than two years are rejected")
        void shouldRejectLongRange() {
            assertThrows(BadRequestException.class, () -> scheduleService.availability("s1",
                    LocalDate.of(2025, 1, 1), LocalDate.of(2028, 1, 1)));
        }
    }
}
