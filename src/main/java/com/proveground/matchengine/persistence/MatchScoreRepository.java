package com.proveground.matchengine.persistence;

import com.proveground.matchengine.queue.MatchPair;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface MatchScoreRepository extends JpaRepository<MatchScoreEntity, Long> {

    String STATS_SELECT = "SELECT COUNT(m) AS totalScores, " +
            "SUM(CASE WHEN m.stale = true THEN 1 ELSE 0 END) AS staleScores, " +
            "AVG(m.compositeScore) AS avgScore, " +
            "MAX(m.compositeScore) AS maxScore, " +
            "MIN(m.compositeScore) AS minScore, " +
            "AVG(m.computationMs) AS avgComputationMs, " +
            "COUNT(DISTINCT m.studentId) AS uniqueStudents, " +
            "COUNT(DISTINCT m.listingId) AS uniqueListings " +
            "FROM MatchScoreEntity m";

    Optional<MatchScoreEntity> findByStudentIdAndListingId(String studentId, String listingId);

    @Query("SELECT m FROM MatchScoreEntity m WHERE m.listingId = :listingId AND m.compositeScore >= :minScore " +
            "ORDER BY m.compositeScore DESC, m.computedAt ASC, m.id ASC")
    List<MatchScoreEntity> findRankedForListing(@Param("listingId") String listingId,
                                                @Param("minScore") int minScore,
                                                Pageable pageable);

    @Query("SELECT m FROM MatchScoreEntity m WHERE m.studentId = :studentId AND m.compositeScore >= :minScore " +
            "ORDER BY m.compositeScore DESC, m.computedAt ASC, m.id ASC")
    List<MatchScoreEntity> findRankedForStudent(@Param("studentId") String studentId,
                                                @Param("minScore") int minScore,
                                                Pageable pageable);

    @Query("SELECT m.studentId FROM MatchScoreEntity m WHERE m.listingId = :listingId")
    List<String> findStudentIdsByListingId(@Param("listingId") String listingId);

    @Query("SELECT m.listingId FROM MatchScoreEntity m WHERE m.studentId = :studentId")
    List<String> findListingIdsByStudentId(@Param("studentId") String studentId);

    String PAIR_SELECT = "SELECT new com.proveground.matchengine.queue.MatchPair(m.studentId, m.listingId, m.tenantId) " +
            "FROM MatchScoreEntity m WHERE m.stale = true";

    @Query(PAIR_SELECT)
    List<MatchPair> findStalePairs();

    @Query(PAIR_SELECT + " AND m.tenantId = :tenantId")
    List<MatchPair> findStalePairsForTenant(@Param("tenantId") String tenantId);

    long countByStaleTrue();

    @Modifying(clearAutomatically = true)
    @Query("UPDATE MatchScoreEntity m SET m.stale = true WHERE m.studentId = :studentId AND m.stale = false")
    int markStaleByStudent(@Param("studentId") String studentId);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE MatchScoreEntity m SET m.stale = true WHERE m.listingId = :listingId AND m.stale = false")
    int markStaleByListing(@Param("listingId") String listingId);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE MatchScoreEntity m SET m.stale = true WHERE m.computedAt < :cutoff AND m.stale = false")
    int markStaleComputedBefore(@Param("cutoff") LocalDateTime cutoff);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE MatchScoreEntity m SET m.stale = true WHERE m.stale = false " +
            "AND (m.weightsVersion IS NULL OR m.weightsVersion <> :version)")
    int markStaleWithOtherVersion(@Param("version") String version);

    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM MatchScoreEntity m WHERE m.studentId = :studentId")
    int deleteByStudent(@Param("studentId") String studentId);

    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM MatchScoreEntity m WHERE m.listingId = :listingId")
    int deleteByListing(@Param("listingId") String listingId);

    @Query(STATS_SELECT)
    ScoreStatsView aggregateAll();

    @Query(STATS_SELECT + " WHERE m.tenantId = :tenantId")
    ScoreStatsView aggregateForTenant(@Param("tenantId") String tenantId);
}
