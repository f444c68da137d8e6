package com.example.publishing.worker.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 调度器状态查询响应
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchedulerStatusResponse {

    private boolean running;

    private boolean ticking;

    private long pollIntervalSeconds;

    private int batchSize;

    private long interRecipientDelayMs;

    private long interBatchDelayMs;

    /**
     * 最近一轮的执行结果，尚未执行过时为空
     */
    private TickReport lastTick;
}
