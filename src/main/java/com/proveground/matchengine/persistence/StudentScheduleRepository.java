package com.proveground.matchengine.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface StudentScheduleRepository extends JpaRepository<StudentScheduleEntity, Long> {

    List<StudentScheduleEntity> findByStudentIdOrderByIdAsc(String studentId);

    List<StudentScheduleEntity> findByStudentIdAndActiveTrue(String studentId);

    Optional<StudentScheduleEntity> findByIdAndStudentId(Long id, String studentId);
}
