package com.proveground.matchengine.web;

import com.proveground.matchengine.availability.AvailabilityWindow;
import com.proveground.matchengine.persistence.SportSeasonEntity;
import com.proveground.matchengine.persistence.StudentScheduleEntity;
import com.proveground.matchengine.service.ScheduleService;
import com.proveground.matchengine.web.dto.ScheduleRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

/**
 * Schedule entries of the calling student. The gateway authenticates the
 * caller and passes the student id in {@value #USER_HEADER}.
 */
@RestController
@RequestMapping("/api/match-engine")
@RequiredArgsConstructor
public class ScheduleController {

    public static final String USER_HEADER = "X-User-Id";

    private final ScheduleService scheduleService;

    @GetMapping("/schedules")
    public ResponseEntity<List<StudentScheduleEntity>> list(@RequestHeader(USER_HEADER) String studentId) {
        return ResponseEntity.ok(scheduleService.listSchedules(studentId));
    }

    @PostMapping("/schedules")
    public ResponseEntity<StudentScheduleEntity> create(@RequestHeader(USER_HEADER) String studentId,
                                                        @Valid @RequestBody ScheduleRequest request) {
        return new ResponseEntity<>(scheduleService.createSchedule(studentId, request), HttpStatus.CREATED);
    }

    @DeleteMapping("/schedules/{id}")
    public ResponseEntity<Void> delete(@RequestHeader(USER_HEADER) String studentId, @PathVariable Long id) {
        scheduleService.deleteSchedule(studentId, id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/schedules/availability")
    public ResponseEntity<List<AvailabilityWindow>> availability(
            @RequestHeader(USER_HEADER) String studentId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        return ResponseEntity.ok(scheduleService.availability(studentId, startDate, endDate));
    }

    @GetMapping("/sport-seasons")
    public ResponseEntity<List<SportSeasonEntity>> sportSeasons() {
        return ResponseEntity.ok(scheduleService.listSportSeasons());
    }
}
