package com.example.publishing.common.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 通知内容（主题 + 正文），对调度器不透明
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationPayload {

    @Column(length = 500)
    private String subject;

    @Column(columnDefinition = "TEXT")
    private String body;
}
