package com.example.publishing.worker.service;

import com.example.publishing.common.dto.DispatchSummary;
import com.example.publishing.common.entity.NotificationJob;
import com.example.publishing.common.store.RecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 写回通知任务的最终状态
 *
 * 无论收件人是否全部成功都标记为SENT。写入失败时任务保持SCHEDULED，
 * 下一轮会重新投递全部收件人，已成功的收件人可能收到重复消息
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DispatchResultWriter {

    private final RecordStore recordStore;
    private final Clock clock;

    /**
     * @return 最终状态是否写入成功
     */
    public boolean writeTerminal(NotificationJob job, DispatchSummary summary) {
        try {
            if (recordStore.markSent(job.getId(), LocalDateTime.now(clock), summary)) {
                summary.markTerminalWritten();
                log.info("通知已发送: jobId={}, title={}, 成功={}, 失败={}, 总数={}",
                    job.getId(), job.getTitle(), summary.getDelivered(), summary.getFailed(),
                    summary.getTotalRecipients());
                return true;
            }
            log.warn("写入最终状态未更新任何记录: jobId={}", job.getId());
            return false;

        } catch (RuntimeException e) {
            log.error("写入最终状态失败，任务保持SCHEDULED，下一轮将重新投递全部收件人: jobId={}",
                job.getId(), e);
            return false;
        }
    }
}
