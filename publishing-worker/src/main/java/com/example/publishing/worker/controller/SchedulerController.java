package com.example.publishing.worker.controller;

import com.example.publishing.common.dto.ContentRef;
import com.example.publishing.common.service.PublishingQueryService;
import com.example.publishing.worker.config.PublishingProperties;
import com.example.publishing.worker.dto.SchedulerStatusResponse;
import com.example.publishing.worker.service.PublishingScheduler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 健康检查、调度状态和统计接口
 */
@Validated
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
@Tag(name = "系统管理", description = "健康检查、调度状态和统计信息")
public class SchedulerController {

    private final PublishingScheduler scheduler;
    private final PublishingQueryService queryService;
    private final PublishingProperties properties;
    private final Clock clock;

    /**
     * 健康检查
     */
    @GetMapping("/health")
    @Operation(summary = "健康检查", description = "检查服务是否正常运行")
    public Map<String, Object> health() {
        Map<String, Object> result = new HashMap<>();
        result.put("status", "UP");
        result.put("timestamp", LocalDateTime.now(clock));
        result.put("service", "publishing-worker");
        return result;
    }

    /**
     * 调度器状态
     */
    @GetMapping("/scheduler")
    @Operation(summary = "调度器状态", description = "查询调度器是否运行以及最近一轮的执行结果")
    public SchedulerStatusResponse schedulerStatus() {
        PublishingProperties.Dispatch dispatch = properties.getDispatch();
        return SchedulerStatusResponse.builder()
            .running(scheduler.isRunning())
            .ticking(scheduler.isTicking())
            .pollIntervalSeconds(properties.getScheduler().getPollInterval().toSeconds())
            .batchSize(dispatch.getBatchSize())
            .interRecipientDelayMs(dispatch.getInterRecipientDelay().toMillis())
            .interBatchDelayMs(dispatch.getInterBatchDelay().toMillis())
            .lastTick(scheduler.getLastTick())
            .build();
    }

    /**
     * 统计信息
     */
    @GetMapping("/stats")
    @Operation(summary = "统计信息", description = "按状态统计通知任务和内容")
    public Map<String, Object> stats() {
        Map<String, Object> result = new HashMap<>();
        result.put("notificationStats", queryService.notificationStats());
        result.put("contentStats", queryService.contentStats());
        result.put("timestamp", LocalDateTime.now(clock));
        return result;
    }

    /**
     * 即将发布的内容
     */
    @GetMapping("/contents/upcoming")
    @Operation(summary = "即将发布的内容", description = "按计划时间升序列出尚未到期的定时内容")
    public List<ContentRef> upcomingContent(
            @Parameter(description = "返回条数，1-100")
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int limit) {
        return queryService.getUpcomingContent(LocalDateTime.now(clock), limit);
    }
}
