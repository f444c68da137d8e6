package com.example.publishing.common.service;

import com.example.publishing.common.dto.ContentRef;
import com.example.publishing.common.enums.NotificationStatus;
import com.example.publishing.common.repository.NotificationJobRepository;
import com.example.publishing.common.repository.ScheduledContentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 发布与通知状态的只读查询
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class PublishingQueryService {

    private final ScheduledContentRepository contentRepository;
    private final NotificationJobRepository jobRepository;

    /**
     * 查询即将发布的内容，按计划时间升序
     */
    public List<ContentRef> getUpcomingContent(LocalDateTime now, int limit) {
        return contentRepository.findUpcoming(now, PageRequest.of(0, limit));
    }

    /**
     * 按状态统计通知任务数量
     */
    public Map<String, Long> notificationStats() {
        Map<String, Long> stats = new LinkedHashMap<>();
        for (NotificationStatus status : NotificationStatus.values()) {
            stats.put(status.name(), jobRepository.countByStatus(status));
        }
        return stats;
    }

    /**
     * 统计已发布 / 未发布内容数量
     */
    public Map<String, Long> contentStats() {
        Map<String, Long> stats = new LinkedHashMap<>();
        stats.put("published", contentRepository.countByPublished(true));
        stats.put("unpublished", contentRepository.countByPublished(false));
        return stats;
    }
}
