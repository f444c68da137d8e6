package com.example.publishing.worker.service;

import com.example.publishing.common.entity.NotificationJob;
import com.example.publishing.common.entity.NotificationPayload;
import com.example.publishing.common.entity.Recipient;
import com.example.publishing.common.entity.ScheduledContent;
import com.example.publishing.common.enums.NotificationStatus;
import com.example.publishing.common.repository.NotificationJobRepository;
import com.example.publishing.common.repository.ScheduledContentRepository;
import com.example.publishing.worker.dto.TickReport;
import com.example.publishing.worker.transport.MockDeliveryTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 调度轮次与数据库的集成测试
 */
@ActiveProfiles("mock")
@SpringBootTest(properties = {
    "spring.datasource.url=jdbc:h2:mem:publishing-scheduler-test;DB_CLOSE_DELAY=-1",
    "publishing.scheduler.enabled=false",
    "publishing.dispatch.batch-size=2",
    "publishing.dispatch.inter-recipient-delay=0ms",
    "publishing.dispatch.inter-batch-delay=0ms",
    "publishing.resolver.page-size=2",
    "mock.failure-rate=0",
    "mock.delay-ms=0"
})
class SchedulerIntegrationTest {

    @Autowired
    private PublishingScheduler scheduler;

    @Autowired
    private MockDeliveryTransport transport;

    @Autowired
    private ScheduledContentRepository contentRepository;

    @Autowired
    private NotificationJobRepository jobRepository;

    @BeforeEach
    void setUp() {
        contentRepository.deleteAll();
        jobRepository.deleteAll();
    }

    @Test
    void tickPublishesDueContentAndSendsDueJobs() {
        LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC);
        List<Long> dueIds = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            dueIds.add(contentRepository.save(content("due-" + i, now.minusMinutes(5))).getId());
        }
        Long futureId = contentRepository.save(content("future", now.plusDays(1))).getId();
        Long dueJobId = jobRepository.save(job(NotificationStatus.SCHEDULED, now.minusMinutes(1), 5)).getId();
        Long draftJobId = jobRepository.save(job(NotificationStatus.DRAFT, now.minusMinutes(1), 2)).getId();

        int requestsBefore = transport.getRequestCount();

        TickReport report = scheduler.tick();

        assertNotNull(report);
        assertEquals(5, transport.getRequestCount() - requestsBefore);
        assertEquals(3, report.getContent().getPublished());
        assertEquals(1, report.getNotificationsSent());
        assertEquals(5, report.getRecipientsDelivered());
        for (Long id : dueIds) {
            assertTrue(contentRepository.findById(id).orElseThrow().getPublished());
        }
        assertFalse(contentRepository.findById(futureId).orElseThrow().getPublished());

        NotificationJob sent = jobRepository.findById(dueJobId).orElseThrow();
        assertEquals(NotificationStatus.SENT, sent.getStatus());
        assertNotNull(sent.getSentAt());
        assertEquals(Integer.valueOf(5), sent.getDeliveredCount());
        assertEquals(Integer.valueOf(0), sent.getFailedCount());
        assertEquals(NotificationStatus.DRAFT, jobRepository.findById(draftJobId).orElseThrow().getStatus());
    }

    @Test
    void secondTickFindsNothingToDo() {
        LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC);
        contentRepository.save(content("due", now.minusMinutes(5)));
        jobRepository.save(job(NotificationStatus.SCHEDULED, now.minusMinutes(1), 1));

        scheduler.tick();
        TickReport second = scheduler.tick();

        assertEquals(0, second.getContent().getAttempted());
        assertEquals(0, second.getNotificationsDue());
    }

    private static ScheduledContent content(String title, LocalDateTime scheduledAt) {
        return ScheduledContent.builder()
            .title(title)
            .slug(title + "-" + System.nanoTime())
            .scheduledAt(scheduledAt)
            .build();
    }

    private static NotificationJob job(NotificationStatus status, LocalDateTime scheduledAt, int recipientCount) {
        List<Recipient> recipients = new ArrayList<>();
        for (int i = 1; i <= recipientCount; i++) {
            recipients.add(Recipient.of("reader" + i + "@example.com"));
        }
        return NotificationJob.builder()
            .title("weekly digest")
            .status(status)
            .scheduledAt(scheduledAt)
            .payload(NotificationPayload.builder().subject("本周精选").body("<p>hello</p>").build())
            .recipients(recipients)
            .build();
    }
}
