package com.example.publishing.common.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * 定时发布内容实体
 *
 * published只会由false变为true一次，调度器不会重置已发布的内容
 */
@Entity
@Table(name = "posts", indexes = {
    @Index(name = "idx_post_published_schedule", columnList = "published, scheduledAt"),
    @Index(name = "idx_post_slug", columnList = "slug")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledContent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String title;

    @Column(length = 255)
    private String slug;

    /**
     * 计划发布时间（为空表示未排期）
     */
    private LocalDateTime scheduledAt;

    @Column(nullable = false)
    @Builder.Default
    private Boolean published = false;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now(ZoneOffset.UTC);
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    /**
     * 在给定时间是否到期待发布
     */
    public boolean isDueAt(LocalDateTime now) {
        return !Boolean.TRUE.equals(published) && scheduledAt != null && !scheduledAt.isAfter(now);
    }
}
