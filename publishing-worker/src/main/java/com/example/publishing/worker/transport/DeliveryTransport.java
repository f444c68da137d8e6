package com.example.publishing.worker.transport;

import com.example.publishing.common.entity.NotificationPayload;
import com.example.publishing.common.entity.Recipient;

/**
 * 投递通道：向一个收件人发送一条消息
 *
 * 实现方不负责限速，调用方保证串行调用并控制间隔
 */
public interface DeliveryTransport {

    void deliver(Recipient recipient, NotificationPayload payload) throws DeliveryException;
}
