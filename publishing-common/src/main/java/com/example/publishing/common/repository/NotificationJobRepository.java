package com.example.publishing.common.repository;

import com.example.publishing.common.entity.NotificationJob;
import com.example.publishing.common.enums.NotificationStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 通知任务数据访问层
 */
@Repository
public interface NotificationJobRepository extends JpaRepository<NotificationJob, Long> {

    /**
     * 查询到期的通知任务（按id分页，afterId之后的一页）
     */
    @Query("SELECT j FROM NotificationJob j WHERE j.status = :status " +
           "AND j.scheduledAt IS NOT NULL AND j.scheduledAt <= :now " +
           "AND j.id > :afterId ORDER BY j.id ASC")
    List<NotificationJob> findDueJobs(
        @Param("status") NotificationStatus status,
        @Param("now") LocalDateTime now,
        @Param("afterId") Long afterId,
        Pageable pageable
    );

    /**
     * 写入最终状态
     *
     * 无条件更新：任务在投递完成后只写一次
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE NotificationJob j SET j.status = :status, j.sentAt = :now, j.updatedAt = :now, " +
           "j.deliveredCount = :delivered, j.failedCount = :failed WHERE j.id = :id")
    int markTerminal(
        @Param("id") Long id,
        @Param("status") NotificationStatus status,
        @Param("now") LocalDateTime now,
        @Param("delivered") Integer delivered,
        @Param("failed") Integer failed
    );

    long countByStatus(NotificationStatus status);
}
