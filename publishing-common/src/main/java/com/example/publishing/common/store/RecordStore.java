package com.example.publishing.common.store;

import com.example.publishing.common.dto.ContentRef;
import com.example.publishing.common.dto.DispatchSummary;
import com.example.publishing.common.entity.NotificationJob;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 调度器使用的记录存储
 *
 * 查询方法按id升序返回afterId之后最多limit条记录，由调用方翻页直到取尽。
 * 存储访问失败以运行时异常（通常是{@link org.springframework.dao.DataAccessException}）抛出。
 */
public interface RecordStore {

    /**
     * 到期待发布的内容：published = false 且 scheduledAt 非空且不晚于now
     */
    List<ContentRef> queryDueContent(LocalDateTime now, long afterId, int limit);

    /**
     * 条件发布
     *
     * @return 是否有记录被更新；false表示内容已被发布
     */
    boolean tryPublish(long id, LocalDateTime now);

    /**
     * 到期的通知任务：status = SCHEDULED 且 scheduledAt 不晚于now
     */
    List<NotificationJob> queryDueNotifications(LocalDateTime now, long afterId, int limit);

    /**
     * 写入最终状态 SENT，并附带投递计数
     *
     * @return 是否有记录被更新
     */
    boolean markSent(long id, LocalDateTime now, DispatchSummary summary);
}
