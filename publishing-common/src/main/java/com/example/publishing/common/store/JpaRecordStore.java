package com.example.publishing.common.store;

import com.example.publishing.common.dto.ContentRef;
import com.example.publishing.common.dto.DispatchSummary;
import com.example.publishing.common.entity.NotificationJob;
import com.example.publishing.common.enums.NotificationStatus;
import com.example.publishing.common.repository.NotificationJobRepository;
import com.example.publishing.common.repository.ScheduledContentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 基于Spring Data JPA的记录存储
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaRecordStore implements RecordStore {

    private final ScheduledContentRepository contentRepository;
    private final NotificationJobRepository jobRepository;

    @Override
    @Transactional(readOnly = true)
    public List<ContentRef> queryDueContent(LocalDateTime now, long afterId, int limit) {
        return contentRepository.findDueContent(now, afterId, PageRequest.of(0, limit));
    }

    @Override
    @Transactional
    public boolean tryPublish(long id, LocalDateTime now) {
        int updated = contentRepository.publishIfUnpublished(id, now);
        return updated > 0;
    }

    @Override
    @Transactional(readOnly = true)
    public List<NotificationJob> queryDueNotifications(LocalDateTime now, long afterId, int limit) {
        return jobRepository.findDueJobs(NotificationStatus.SCHEDULED, now, afterId, PageRequest.of(0, limit));
    }

    @Override
    @Transactional
    public boolean markSent(long id, LocalDateTime now, DispatchSummary summary) {
        int updated = jobRepository.markTerminal(
            id,
            NotificationStatus.SENT,
            now,
            summary.getDelivered(),
            summary.getFailed()
        );
        if (updated == 0) {
            log.warn("写入最终状态时任务不存在: jobId={}", id);
        }
        return updated > 0;
    }
}
