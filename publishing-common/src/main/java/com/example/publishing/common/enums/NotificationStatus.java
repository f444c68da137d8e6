package com.example.publishing.common.enums;

/**
 * 通知任务状态枚举
 *
 * 状态流转：
 * DRAFT -> SCHEDULED (作者设置发送时间，编辑流程负责)
 * SCHEDULED -> SENT (调度器尝试投递全部收件人后写入，最终状态)
 */
public enum NotificationStatus {

    /**
     * 草稿 - 调度器不会处理
     */
    DRAFT,

    /**
     * 已排期 - 到达scheduledAt后由调度器投递
     */
    SCHEDULED,

    /**
     * 已发送 - 全部收件人已尝试投递一次（最终状态，不会重新入队）
     */
    SENT;

    /**
     * 是否可以被调度器处理
     */
    public boolean canDispatch() {
        return this == SCHEDULED;
    }
}
