package com.example.publishing.worker.service;

import com.example.publishing.common.dto.ContentRef;
import com.example.publishing.common.store.RecordStore;
import com.example.publishing.worker.dto.PublicationReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 内容发布状态转换
 *
 * 通过条件更新把published由false改为true；更新0行说明已被手动发布，直接跳过。
 * 单条失败只记录日志，内容保持未发布，下一轮会再次被查询到
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PublicationTransitioner {

    private final RecordStore recordStore;
    private final Clock clock;

    public PublicationReport publishAll(List<ContentRef> dueItems) {
        PublicationReport report = new PublicationReport();

        for (ContentRef item : dueItems) {
            try {
                if (recordStore.tryPublish(item.getId(), LocalDateTime.now(clock))) {
                    report.published();
                    log.info("定时内容已发布: id={}, title={}, scheduledAt={}",
                        item.getId(), item.getTitle(), item.getScheduledAt());
                } else {
                    report.alreadyPublished();
                    log.debug("内容已发布，跳过: id={}", item.getId());
                }
            } catch (RuntimeException e) {
                report.failed();
                log.error("发布内容失败，下一轮重试: id={}, title={}", item.getId(), item.getTitle(), e);
            }
        }

        return report;
    }
}
