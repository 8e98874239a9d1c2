package com.proveground.matchengine.web.dto;

import com.proveground.matchengine.queue.QueueStats;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EngineStatsResponse {

    private ScoreStatsResponse scores;
    private QueueStats queue;
}
