package com.proveground.matchengine.queue;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueStats {

    // waiting or currently claimed
    private long pending;
    private long processed;
    private long failed;
    private long total;
}
