package com.proveground.matchengine.persistence;

/**
 * Aggregate figures over the score cache.
 */
public interface ScoreStatsView {

    Long getTotalScores();

    Long getStaleScores();

    Double getAvgScore();

    Integer getMaxScore();

    Integer getMinScore();

    Double getAvgComputationMs();

    Long getUniqueStudents();

    Long getUniqueListings();
}
