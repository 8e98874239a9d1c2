package com.proveground.matchengine.scoring;

import com.proveground.matchengine.persistence.AthleticSkillMappingEntity;
import com.proveground.matchengine.persistence.AthleticSkillMappingRepository;
import com.proveground.matchengine.persistence.EngagementRepository;
import com.proveground.matchengine.persistence.ListingEntity;
import com.proveground.matchengine.persistence.ListingRepository;
import com.proveground.matchengine.persistence.StudentEntity;
import com.proveground.matchengine.persistence.StudentRepository;
import com.proveground.matchengine.persistence.StudentScheduleEntity;
import com.proveground.matchengine.persistence.StudentScheduleRepository;
import com.proveground.matchengine.persistence.TenantPartnerAccessEntity;
import com.proveground.matchengine.persistence.TenantPartnerAccessRepository;
import com.proveground.matchengine.service.TenantConfigService;
import com.proveground.matchengine.signal.EvaluationContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reads the collaborator tables needed to score one pair.
 */
@Component
@RequiredArgsConstructor
public class EvaluationContextLoader {

    private final StudentRepository studentRepository;
    private final ListingRepository listingRepository;
    private final EngagementRepository engagementRepository;
    private final StudentScheduleRepository scheduleRepository;
    private final TenantPartnerAccessRepository partnerAccessRepository;
    private final AthleticSkillMappingRepository athleticSkillMappingRepository;
    private final TenantConfigService tenantConfigService;

    /**
     * @return empty when the student or the listing no longer exists
     */
    public Optional<EvaluationContext> load(String studentId, String listingId, LocalDate asOf) {
        Optional<StudentEntity> student = studentRepository.findById(studentId);
        Optional<ListingEntity> listing = listingRepository.findById(listingId);
        if (student.isEmpty() || listing.isEmpty()) {
            return Optional.empty();
        }

        TenantPartnerAccessEntity access = null;
        if (student.get().getTenantId() != null && listing.get().getAuthorId() != null) {
            access = partnerAccessRepository
                    .findFirstByTenantIdAndPartnerIdAndActiveTrue(student.get().getTenantId(), listing.get().getAuthorId())
                    .orElse(null);
        }

        List<StudentScheduleEntity> schedules = scheduleRepository.findByStudentIdAndActiveTrue(studentId);

        return Optional.of(EvaluationContext.builder()
                .student(student.get())
                .listing(listing.get())
                .engagements(engagementRepository.findByStudentId(studentId))
                .schedules(schedules)
                .athleticTransfers(athleticTransfers(student.get(), schedules))
                .partnerAccess(access)
                .asOf(asOf)
                .build());
    }

    private List<AthleticSkillMappingEntity> athleticTransfers(StudentEntity student,
                                                               List<StudentScheduleEntity> schedules) {
        Set<String> sports = new LinkedHashSet<>();
        for (StudentScheduleEntity schedule : schedules) {
            if (schedule.getSportSeason() != null) {
                sports.add(schedule.getSportSeason().getSportName());
            }
        }
        if (sports.isEmpty() || !tenantConfigService.isAthleticTransferEnabled(student.getTenantId())) {
            return List.of();
        }
        return athleticSkillMappingRepository.findBySportNameInOrderByTransferStrengthDesc(sports);
    }
}
