package com.proveground.matchengine.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MatchScoreHistoryRepository extends JpaRepository<MatchScoreHistoryEntity, Long> {

    List<MatchScoreHistoryEntity> findByStudentIdAndListingIdOrderByIdAsc(String studentId, String listingId);

    @Modifying
    @Query("DELETE FROM MatchScoreHistoryEntity h WHERE h.studentId = :studentId")
    int deleteByStudent(@Param("studentId") String studentId);

    @Modifying
    @Query("DELETE FROM MatchScoreHistoryEntity h WHERE h.listingId = :listingId")
    int deleteByListing(@Param("listingId") String listingId);
}
