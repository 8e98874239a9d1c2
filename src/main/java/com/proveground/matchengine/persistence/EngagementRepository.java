package com.proveground.matchengine.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface EngagementRepository extends JpaRepository<EngagementEntity, Long> {

    List<EngagementEntity> findByStudentId(String studentId);
}
