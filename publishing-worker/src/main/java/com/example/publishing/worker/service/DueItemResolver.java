package com.example.publishing.worker.service;

import com.example.publishing.common.dto.ContentRef;
import com.example.publishing.common.entity.NotificationJob;
import com.example.publishing.common.store.RecordStore;
import com.example.publishing.worker.config.PublishingProperties;
import com.example.publishing.worker.exception.DueItemResolutionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.function.LongFunction;
import java.util.function.ToLongFunction;

/**
 * 到期记录查询
 *
 * 按页大小分批查询，并按id继续翻页直到取尽，保证调用时所有满足条件的记录都会返回
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DueItemResolver {

    static final String CONTENT = "内容";
    static final String NOTIFICATION = "通知";

    private final RecordStore recordStore;
    private final PublishingProperties properties;

    /**
     * 查询到期待发布的内容
     *
     * @throws DueItemResolutionException 存储查询失败
     */
    public List<ContentRef> resolveDueContent(LocalDateTime now) {
        int pageSize = properties.getResolver().getPageSize();
        try {
            List<ContentRef> due = drain(
                afterId -> recordStore.queryDueContent(now, afterId, pageSize),
                ContentRef::getId,
                pageSize
            );
            log.debug("到期内容: {} 条, now={}", due.size(), now);
            return due;
        } catch (RuntimeException e) {
            throw new DueItemResolutionException(CONTENT, e);
        }
    }

    /**
     * 查询到期的通知任务
     *
     * @throws DueItemResolutionException 存储查询失败
     */
    public List<NotificationJob> resolveDueNotifications(LocalDateTime now) {
        int pageSize = properties.getResolver().getPageSize();
        try {
            List<NotificationJob> due = drain(
                afterId -> recordStore.queryDueNotifications(now, afterId, pageSize),
                NotificationJob::getId,
                pageSize
            );
            log.debug("到期通知: {} 条, now={}", due.size(), now);
            return due;
        } catch (RuntimeException e) {
            throw new DueItemResolutionException(NOTIFICATION, e);
        }
    }

    private <T> List<T> drain(LongFunction<List<T>> pageQuery, ToLongFunction<T> idOf, int pageSize) {
        List<T> result = new ArrayList<>();
        long afterId = 0L;

        while (true) {
            List<T> page = pageQuery.apply(afterId);
            result.addAll(page);
            if (page.size() < pageSize) {
                return result;
            }

            long lastId = idOf.applyAsLong(page.get(page.size() - 1));
            if (lastId <= afterId) {
                // 存储未按id升序返回，继续翻页会重复读取同一页
                log.warn("分页游标未前进，停止翻页: afterId={}, lastId={}", afterId, lastId);
                return result;
            }
            afterId = lastId;
        }
    }
}
