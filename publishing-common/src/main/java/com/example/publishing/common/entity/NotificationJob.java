package com.example.publishing.common.entity;

import com.example.publishing.common.enums.NotificationStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * 通知任务实体
 *
 * 一条逻辑消息对应多个收件人，状态为SENT后不再被调度
 */
@Entity
@Table(name = "notification_jobs", indexes = {
    @Index(name = "idx_job_status_schedule", columnList = "status, scheduledAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 255)
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private NotificationStatus status = NotificationStatus.DRAFT;

    /**
     * 计划发送时间（SCHEDULED状态下必填）
     */
    private LocalDateTime scheduledAt;

    @Embedded
    private NotificationPayload payload;

    /**
     * 收件人列表（有序）
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private List<Recipient> recipients = new ArrayList<>();

    /**
     * 发送完成时间
     */
    private LocalDateTime sentAt;

    /**
     * 投递成功的收件人数（仅供参考）
     */
    private Integer deliveredCount;

    /**
     * 投递失败的收件人数（仅供参考）
     */
    private Integer failedCount;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now(ZoneOffset.UTC);
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now(ZoneOffset.UTC);
    }

    public int recipientCount() {
        return recipients == null ? 0 : recipients.size();
    }
}
