package com.example.publishing.common.repository;

import com.example.publishing.common.dto.ContentRef;
import com.example.publishing.common.entity.ScheduledContent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 定时发布内容数据访问层
 */
@Repository
public interface ScheduledContentRepository extends JpaRepository<ScheduledContent, Long> {

    /**
     * 查询到期未发布的内容（按id分页，afterId之后的一页）
     */
    @Query("SELECT new com.example.publishing.common.dto.ContentRef(c.id, c.title, c.slug, c.scheduledAt) " +
           "FROM ScheduledContent c WHERE c.published = false " +
           "AND c.scheduledAt IS NOT NULL AND c.scheduledAt <= :now " +
           "AND c.id > :afterId ORDER BY c.id ASC")
    List<ContentRef> findDueContent(
        @Param("now") LocalDateTime now,
        @Param("afterId") Long afterId,
        Pageable pageable
    );

    /**
     * 条件更新：仅当仍未发布时标记为已发布（防止与手动发布并发冲突）
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ScheduledContent c SET c.published = true, c.updatedAt = :now " +
           "WHERE c.id = :id AND c.published = false")
    int publishIfUnpublished(@Param("id") Long id, @Param("now") LocalDateTime now);

    /**
     * 查询即将发布的内容
     */
    @Query("SELECT new com.example.publishing.common.dto.ContentRef(c.id, c.title, c.slug, c.scheduledAt) " +
           "FROM ScheduledContent c WHERE c.published = false " +
           "AND c.scheduledAt IS NOT NULL AND c.scheduledAt > :now " +
           "ORDER BY c.scheduledAt ASC")
    List<ContentRef> findUpcoming(@Param("now") LocalDateTime now, Pageable pageable);

    long countByPublished(Boolean published);
}
