package com.example.publishing.worker.dto;

import com.example.publishing.common.dto.DispatchSummary;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * 一轮调度的执行结果
 */
@Getter
@ToString
public class TickReport {

    private final LocalDateTime startedAt;

    private LocalDateTime finishedAt;

    /**
     * 到期内容查询是否成功
     */
    private boolean contentResolved;

    private PublicationReport content = new PublicationReport();

    /**
     * 到期通知查询是否成功
     */
    private boolean notificationsResolved;

    private int notificationsDue;

    private int notificationsSent;

    /**
     * 未写入最终状态、下一轮会重新投递的通知数
     */
    private int notificationsPendingRetry;

    private int recipientsDelivered;

    private int recipientsFailed;

    public TickReport(LocalDateTime startedAt) {
        this.startedAt = startedAt;
    }

    public void contentPublished(PublicationReport report) {
        this.contentResolved = true;
        this.content = report;
    }

    public void notificationsResolved(int due) {
        this.notificationsResolved = true;
        this.notificationsDue = due;
    }

    public void dispatched(DispatchSummary summary) {
        recipientsDelivered += summary.getDelivered();
        recipientsFailed += summary.getFailed();
        if (summary.isTerminalWritten()) {
            notificationsSent++;
        } else {
            notificationsPendingRetry++;
        }
    }

    public void dispatchAborted() {
        notificationsPendingRetry++;
    }

    public void finish(LocalDateTime finishedAt) {
        this.finishedAt = finishedAt;
    }
}
