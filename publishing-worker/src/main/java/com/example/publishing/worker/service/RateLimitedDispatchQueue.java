package com.example.publishing.worker.service;

import com.example.publishing.common.dto.DeliveryOutcome;
import com.example.publishing.common.dto.DispatchSummary;
import com.example.publishing.common.entity.NotificationJob;
import com.example.publishing.common.entity.Recipient;
import com.example.publishing.worker.config.PublishingProperties;
import com.example.publishing.worker.transport.DeliveryException;
import com.example.publishing.worker.transport.DeliveryTransport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * 限速批量投递
 *
 * 收件人按batchSize分批，批内逐个投递并间隔interRecipientDelay，批与批之间等待interBatchDelay。
 * 单个收件人失败只计数，全部收件人尝试一次后写回最终状态。
 * 同一时间只处理一个通知任务
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RateLimitedDispatchQueue {

    private final DeliveryTransport transport;
    private final DispatchResultWriter resultWriter;
    private final DispatchPacer pacer;
    private final PublishingProperties properties;

    /**
     * 投递一个通知任务
     *
     * 只处理SCHEDULED状态的任务，其他状态直接返回空结果且不写状态
     *
     * @throws InterruptedException 等待间隔时线程被中断，此时不写最终状态
     */
    public synchronized DispatchSummary dispatch(NotificationJob job) throws InterruptedException {
        DispatchSummary summary = new DispatchSummary(job.getId(), job.recipientCount());
        if (job.getStatus() == null || !job.getStatus().canDispatch()) {
            log.warn("通知状态不可投递，跳过: jobId={}, status={}", job.getId(), job.getStatus());
            return summary;
        }

        List<Recipient> recipients = job.getRecipients() != null ? job.getRecipients() : List.of();
        if (recipients.isEmpty()) {
            log.warn("通知没有收件人，直接标记为已发送: jobId={}, title={}", job.getId(), job.getTitle());
        } else {
            int batchSize = properties.getDispatch().getBatchSize();
            log.info("开始投递通知: jobId={}, title={}, 收件人={}, 批次={}",
                job.getId(), job.getTitle(), recipients.size(), batchCount(recipients.size(), batchSize));
            deliverInBatches(job, recipients, batchSize, summary);
        }

        resultWriter.writeTerminal(job, summary);

        if (summary.getFailed() > 0) {
            log.warn("通知部分收件人投递失败: jobId={}, 失败={}/{}",
                job.getId(), summary.getFailed(), summary.getTotalRecipients());
        }
        return summary;
    }

    private void deliverInBatches(NotificationJob job, List<Recipient> recipients, int batchSize,
                                  DispatchSummary summary) throws InterruptedException {
        Duration interRecipientDelay = properties.getDispatch().getInterRecipientDelay();
        Duration interBatchDelay = properties.getDispatch().getInterBatchDelay();

        for (int start = 0; start < recipients.size(); start += batchSize) {
            if (start > 0) {
                log.debug("批次间等待 {}ms: jobId={}", interBatchDelay.toMillis(), job.getId());
                pacer.pause(interBatchDelay);
            }

            List<Recipient> batch = recipients.subList(start, Math.min(start + batchSize, recipients.size()));
            summary.batchStarted();
            log.debug("投递第{}批: jobId={}, 收件人={}", summary.getBatches(), job.getId(), batch.size());

            for (int i = 0; i < batch.size(); i++) {
                if (i > 0) {
                    pacer.pause(interRecipientDelay);
                }
                summary.record(deliverOne(job, batch.get(i)));
            }
        }
    }

    private DeliveryOutcome deliverOne(NotificationJob job, Recipient recipient) {
        String address = recipient != null ? recipient.getEmail() : null;
        try {
            transport.deliver(recipient, job.getPayload());
            log.debug("投递成功: jobId={}, to={}", job.getId(), address);
            return DeliveryOutcome.delivered(address);

        } catch (DeliveryException e) {
            log.warn("投递失败: jobId={}, to={}, httpStatus={}, error={}",
                job.getId(), address, e.getHttpStatus(), e.getMessage());
            return DeliveryOutcome.failed(address, e.getMessage());

        } catch (RuntimeException e) {
            log.warn("投递异常: jobId={}, to={}", job.getId(), address, e);
            return DeliveryOutcome.failed(address, "系统异常: " + e.getMessage());
        }
    }

    static int batchCount(int recipients, int batchSize) {
        return (recipients + batchSize - 1) / batchSize;
    }
}
