package com.example.publishing.worker.service;

import com.example.publishing.common.dto.ContentRef;
import com.example.publishing.common.dto.DispatchSummary;
import com.example.publishing.common.entity.NotificationJob;
import com.example.publishing.worker.config.PublishingProperties;
import com.example.publishing.worker.dto.TickReport;
import com.example.publishing.worker.exception.DueItemResolutionException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 定时发布调度器
 *
 * 单线程按固定间隔轮询：每一轮先发布到期内容，再逐个投递到期通知。
 * 任何一步的异常都只记录日志，不会中止定时器；只有stop()会停止调度。
 *
 * 状态：已停止 -> start() -> 运行中(空闲) <-> 运行中(执行中) -> stop() -> 已停止
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PublishingScheduler {

    private final DueItemResolver resolver;
    private final PublicationTransitioner transitioner;
    private final RateLimitedDispatchQueue dispatchQueue;
    private final PublishingProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * 当前是否有一轮正在执行，只由调度线程修改
     */
    private volatile boolean ticking;

    /**
     * stop()已被调用，正在执行的一轮完成当前步骤后退出
     */
    private volatile boolean stopRequested;

    private volatile TickReport lastTick;

    private ScheduledExecutorService executor;
    private ScheduledFuture<?> trigger;

    @PostConstruct
    public void init() {
        if (properties.getScheduler().isEnabled()) {
            start();
        } else {
            log.info("定时发布调度器未启用");
        }
    }

    /**
     * 启动调度器：立即执行一轮，之后按轮询间隔执行。已在运行时不做任何事
     */
    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            log.info("定时发布调度器已在运行");
            return;
        }

        stopRequested = false;
        Duration interval = properties.getScheduler().getPollInterval();
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "publishing-scheduler");
            thread.setDaemon(true);
            return thread;
        });
        try {
            trigger = executor.scheduleWithFixedDelay(this::tick, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            log.error("定时发布调度器启动失败，轮询间隔: {}", interval, e);
            executor.shutdownNow();
            executor = null;
            running.set(false);
            throw e;
        }

        log.info("定时发布调度器已启动，轮询间隔: {}秒", interval.toSeconds());
    }

    /**
     * 停止调度器：取消定时器，并等待正在执行的一轮完成当前步骤。未运行时不做任何事
     */
    @PreDestroy
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            log.info("定时发布调度器未在运行");
            return;
        }

        log.info("正在停止定时发布调度器...");
        stopRequested = true;
        trigger.cancel(false);
        executor.shutdown();

        Duration timeout = properties.getScheduler().getShutdownTimeout();
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("等待当前轮次超时({}秒)，强制停止", timeout.toSeconds());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        executor = null;
        trigger = null;
        log.info("定时发布调度器已停止");
    }

    public boolean isRunning() {
        return running.get();
    }

    public boolean isTicking() {
        return ticking;
    }

    public TickReport getLastTick() {
        return lastTick;
    }

    /**
     * 执行一轮：内容发布 + 通知投递
     */
    TickReport tick() {
        if (ticking) {
            log.warn("上一轮仍在执行，跳过本轮");
            return null;
        }
        ticking = true;

        LocalDateTime now = LocalDateTime.now(clock);
        TickReport report = new TickReport(now);
        try {
            log.debug("开始检查到期内容和通知: now={}", now);
            runContentPass(now, report);

            if (!stopRequested) {
                runNotificationPass(now, report);
            } else {
                log.info("调度器正在停止，跳过本轮通知投递");
            }
        } catch (Exception e) {
            // 异常不能抛出到执行器，否则后续轮次不再执行
            log.error("调度轮次异常", e);
        } finally {
            report.finish(LocalDateTime.now(clock));
            lastTick = report;
            ticking = false;
        }

        logReport(report);
        return report;
    }

    private void runContentPass(LocalDateTime now, TickReport report) {
        List<ContentRef> dueContent;
        try {
            dueContent = resolver.resolveDueContent(now);
        } catch (DueItemResolutionException e) {
            log.error("查询到期内容失败，本轮跳过内容发布", e);
            return;
        }

        if (!dueContent.isEmpty()) {
            log.info("发现 {} 条到期内容待发布", dueContent.size());
        }
        report.contentPublished(transitioner.publishAll(dueContent));
    }

    private void runNotificationPass(LocalDateTime now, TickReport report) {
        List<NotificationJob> dueJobs;
        try {
            dueJobs = resolver.resolveDueNotifications(now);
        } catch (DueItemResolutionException e) {
            log.error("查询到期通知失败，本轮跳过通知投递", e);
            return;
        }

        report.notificationsResolved(dueJobs.size());
        if (!dueJobs.isEmpty()) {
            log.info("发现 {} 条到期通知待投递", dueJobs.size());
        }

        for (int i = 0; i < dueJobs.size(); i++) {
            if (stopRequested) {
                log.info("调度器正在停止，剩余 {} 条通知留待下次启动", dueJobs.size() - i);
                return;
            }

            NotificationJob job = dueJobs.get(i);
            try {
                DispatchSummary summary = dispatchQueue.dispatch(job);
                report.dispatched(summary);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                report.dispatchAborted();
                log.warn("投递被中断，任务保持SCHEDULED: jobId={}", job.getId());
                return;
            } catch (RuntimeException e) {
                report.dispatchAborted();
                log.error("投递通知异常: jobId={}", job.getId(), e);
            }
        }
    }

    private void logReport(TickReport report) {
        boolean idle = report.getContent().getAttempted() == 0 && report.getNotificationsDue() == 0;
        if (idle && report.isContentResolved() && report.isNotificationsResolved()) {
            log.debug("本轮无到期内容和通知");
            return;
        }
        log.info("本轮完成: 内容发布={}, 已发布跳过={}, 发布失败={}, 通知已发送={}, 待重试={}, 收件人成功={}, 收件人失败={}",
            report.getContent().getPublished(),
            report.getContent().getAlreadyPublished(),
            report.getContent().getFailed(),
            report.getNotificationsSent(),
            report.getNotificationsPendingRetry(),
            report.getRecipientsDelivered(),
            report.getRecipientsFailed());
    }
}
