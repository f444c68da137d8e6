package com.example.publishing.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单个收件人的投递结果（不持久化）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryOutcome {

    public enum Result {
        DELIVERED,
        FAILED
    }

    private String recipient;

    private Result result;

    /**
     * 失败原因，仅在FAILED时有值
     */
    private String failureReason;

    public static DeliveryOutcome delivered(String recipient) {
        return new DeliveryOutcome(recipient, Result.DELIVERED, null);
    }

    public static DeliveryOutcome failed(String recipient, String reason) {
        return new DeliveryOutcome(recipient, Result.FAILED, reason);
    }

    public boolean isDelivered() {
        return result == Result.DELIVERED;
    }
}
