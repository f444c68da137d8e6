package com.example.publishing.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 待发布内容的引用
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentRef {

    private Long id;

    private String title;

    private String slug;

    private LocalDateTime scheduledAt;
}
