package com.proveground.matchengine.service;

import com.proveground.matchengine.availability.AvailabilityWindow;
import com.proveground.matchengine.availability.AvailabilityWindowBuilder;
import com.proveground.matchengine.exception.BadRequestException;
import com.proveground.matchengine.exception.ResourceNotFoundException;
import com.proveground.matchengine.exception.ScheduleValidationException;
import com.proveground.matchengine.persistence.RecomputeQueueEntity.Reason;
import com.proveground.matchengine.persistence.ScheduleBlock;
import com.proveground.matchengine.persistence.SportSeasonEntity;
import com.proveground.matchengine.persistence.SportSeasonRepository;
import com.proveground.matchengine.persistence.StudentScheduleEntity;
import com.proveground.matchengine.persistence.StudentScheduleEntity.ScheduleType;
import com.proveground.matchengine.persistence.StudentScheduleRepository;
import com.proveground.matchengine.persistence.TravelConflict;
import com.proveground.matchengine.web.dto.ScheduleRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Student-owned schedule entries and the availability derived from them.
 */
@Service
@Slf4j
public class ScheduleService {

    private final StudentScheduleRepository scheduleRepository;
    private final SportSeasonRepository sportSeasonRepository;
    private final AvailabilityWindowBuilder windowBuilder;
    private final StalenessTracker stalenessTracker;
    private final int defaultHorizonMonths;
    private final int maxRangeWeeks;

    public ScheduleService(StudentScheduleRepository scheduleRepository,
                           SportSeasonRepository sportSeasonRepository,
                           AvailabilityWindowBuilder windowBuilder,
                           StalenessTracker stalenessTracker,
                           @Value("${matchengine.availability.default-horizon-months:6}") int defaultHorizonMonths,
                           @Value("${matchengine.availability.max-range-weeks:104}") int maxRangeWeeks) {
        this.scheduleRepository = scheduleRepository;
        this.sportSeasonRepository = sportSeasonRepository;
        this.windowBuilder = windowBuilder;
        this.stalenessTracker = stalenessTracker;
        this.defaultHorizonMonths = defaultHorizonMonths;
        this.maxRangeWeeks = maxRangeWeeks;
    }

    public List<StudentScheduleEntity> listSchedules(String studentId) {
        return scheduleRepository.findByStudentIdOrderByIdAsc(studentId);
    }

    public List<SportSeasonEntity> listSportSeasons() {
        return sportSeasonRepository.findAllByOrderBySportNameAscStartMonthAsc();
    }

    /**
     * Validate and store a new entry, then queue the student's pairs.
     */
    @Transactional
    public StudentScheduleEntity createSchedule(String studentId, ScheduleRequest request) {
        SportSeasonEntity season = validate(request);

        List<ScheduleBlock> blocks = new ArrayList<>();
        for (ScheduleRequest.Block block : nullToEmpty(request.getCustomBlocks())) {
            blocks.add(ScheduleBlock.builder()
                    .dayOfWeek(block.getDay())
                    .startTime(block.getStartTime())
                    .endTime(block.getEndTime())
                    .label(block.getLabel())
                    .build());
        }
        List<TravelConflict> travel = new ArrayList<>();
        for (ScheduleRequest.Travel conflict : nullToEmpty(request.getTravelConflicts())) {
            travel.add(TravelConflict.builder()
                    .startDate(conflict.getStartDate())
                    .endDate(conflict.getEndDate())
                    .reason(conflict.getReason())
                    .build());
        }
        validateBlocks(blocks);
        validateTravel(travel);

        StudentScheduleEntity saved = scheduleRepository.save(StudentScheduleEntity.builder()
                .studentId(studentId)
                .scheduleType(request.getScheduleType())
                .sportSeason(season)
                .customBlocks(blocks)
                .travelConflicts(travel)
                .availableHoursPerWeek(request.getAvailableHoursPerWeek())
                .effectiveStart(request.getEffectiveStart())
                .effectiveEnd(request.getEffectiveEnd())
                .active(request.getActive() == null || request.getActive())
                .notes(request.getNotes())
                .build());

        log.info("Created {} schedule {} for student {}", saved.getScheduleType(), saved.getId(), studentId);
        stalenessTracker.onStudentChanged(studentId, Reason.SCHEDULE_CHANGE);
        return saved;
    }

    @Transactional
    public void deleteSchedule(String studentId, Long scheduleId) {
        StudentScheduleEntity schedule = scheduleRepository.findByIdAndStudentId(scheduleId, studentId)
                .orElseThrow(() -> new ResourceNotFoundException("Schedule " + scheduleId + " not found"));
        scheduleRepository.delete(schedule);

        log.info("Deleted schedule {} of student {}", scheduleId, studentId);
        stalenessTracker.onStudentChanged(studentId, Reason.SCHEDULE_CHANGE);
    }

    /**
     * Weekly availability over [startDate, endDate]; defaults to today plus
     * the configured horizon.
     */
    public List<AvailabilityWindow> availability(String studentId, LocalDate startDate, LocalDate endDate) {
        LocalDate start = startDate != null ? startDate : LocalDate.now();
        LocalDate end = endDate != null ? endDate : start.plusMonths(defaultHorizonMonths);
        if (end.isBefore(start)) {
            throw new BadRequestException("endDate must not be before startDate");
        }
        if (start.plusWeeks(maxRangeWeeks).isBefore(end)) {
            throw new BadRequestException("Date range exceeds " + maxRangeWeeks + " weeks");
        }
        return windowBuilder.build(scheduleRepository.findByStudentIdAndActiveTrue(studentId), start, end);
    }

    private SportSeasonEntity validate(ScheduleRequest request) {
        SportSeasonEntity season = null;
        if (request.getScheduleType() == ScheduleType.SPORT) {
            if (request.getSportSeasonId() == null) {
                throw new ScheduleValidationException("Sport schedules require a sportSeasonId");
            }
            season = sportSeasonRepository.findById(request.getSportSeasonId())
                    .orElseThrow(() -> new ScheduleValidationException(
                            "Unknown sport season " + request.getSportSeasonId()));
        }

        if (request.getEffectiveStart() != null && request.getEffectiveEnd() != null
                && request.getEffectiveEnd().isBefore(request.getEffectiveStart())) {
            throw new ScheduleValidationException("effectiveEnd must not be before effectiveStart");
        }

        return season;
    }

    private void validateBlocks(List<ScheduleBlock> blocks) {
        for (int i = 0; i < blocks.size(); i++) {
            ScheduleBlock block = blocks.get(i);
            if (!block.getEndTime().isAfter(block.getStartTime())) {
                throw new ScheduleValidationException("Block on " + block.getDayOfWeek() + " must end after it starts");
            }
            for (int j = 0; j < i; j++) {
                if (block.overlaps(blocks.get(j))) {
                    throw new ScheduleValidationException("Blocks overlap on " + block.getDayOfWeek());
                }
            }
        }
    }

    private void validateTravel(List<TravelConflict> travel) {
        for (TravelConflict conflict : travel) {
            if (conflict.getEndDate().isBefore(conflict.getStartDate())) {
                throw new ScheduleValidationException("Travel conflict ends before it starts");
            }
        }
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list != null ? list : List.of();
    }
}
