package com.example.publishing.worker.transport;

import com.example.publishing.common.entity.NotificationPayload;
import com.example.publishing.common.entity.Recipient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mock投递通道
 *
 * 仅在mock模式下启用，按配置的失败率和延迟模拟邮件服务商
 */
@Slf4j
@Component
@Profile("mock")
public class MockDeliveryTransport implements DeliveryTransport {

    private final Random random = new Random();
    private final AtomicInteger requestCounter = new AtomicInteger(0);

    /**
     * 模拟失败率（0-100）
     */
    @Value("${mock.failure-rate:0}")
    private int failureRate;

    /**
     * 模拟延迟（毫秒）
     */
    @Value("${mock.delay-ms:0}")
    private int delayMs;

    @Override
    public void deliver(Recipient recipient, NotificationPayload payload) throws DeliveryException {
        int count = requestCounter.incrementAndGet();
        simulateDelay();

        if (recipient == null || recipient.getEmail() == null || recipient.getEmail().isBlank()) {
            throw new DeliveryException("收件人地址为空");
        }
        if (failureRate > 0 && random.nextInt(100) < failureRate) {
            log.info("Mock投递 #{} 失败: to={}", count, recipient.getEmail());
            throw new DeliveryException("模拟失败", 503, null);
        }
        log.info("Mock投递 #{} 成功: to={}, subject={}", count, recipient.getEmail(),
            payload != null ? payload.getSubject() : null);
    }

    public int getRequestCount() {
        return requestCounter.get();
    }

    private void simulateDelay() {
        if (delayMs > 0) {
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
