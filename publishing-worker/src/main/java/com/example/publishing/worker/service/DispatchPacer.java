package com.example.publishing.worker.service;

import java.time.Duration;

/**
 * 投递间隔控制
 *
 * 等待期间不占用CPU，被中断时抛出InterruptedException
 */
@FunctionalInterface
public interface DispatchPacer {

    void pause(Duration delay) throws InterruptedException;

    static DispatchPacer sleeping() {
        return delay -> {
            if (delay != null && !delay.isZero() && !delay.isNegative()) {
                Thread.sleep(delay.toMillis());
            }
        };
    }
}
