package com.example.publishing.common.dto;

import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次通知投递的汇总
 *
 * 按收件人顺序累积投递结果，计数随最终状态一起写回
 */
@Getter
@ToString(exclude = "outcomes")
public class DispatchSummary {

    private final Long jobId;

    private final int totalRecipients;

    private final List<DeliveryOutcome> outcomes = new ArrayList<>();

    private int batches;

    private int delivered;

    private int failed;

    /**
     * 最终状态是否已写入
     */
    private boolean terminalWritten;

    public DispatchSummary(Long jobId, int totalRecipients) {
        this.jobId = jobId;
        this.totalRecipients = totalRecipients;
    }

    public void record(DeliveryOutcome outcome) {
        outcomes.add(outcome);
        if (outcome.isDelivered()) {
            delivered++;
        } else {
            failed++;
        }
    }

    public void batchStarted() {
        batches++;
    }

    public void markTerminalWritten() {
        this.terminalWritten = true;
    }

    public int getAttempted() {
        return outcomes.size();
    }

    public List<DeliveryOutcome> getOutcomes() {
        return Collections.unmodifiableList(outcomes);
    }

    public List<DeliveryOutcome> failures() {
        return outcomes.stream().filter(o -> !o.isDelivered()).toList();
    }
}
