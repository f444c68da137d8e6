package com.example.publishing.worker.exception;

import lombok.Getter;

/**
 * 查询到期记录失败
 *
 * 只影响对应的记录类型，本轮的另一类处理照常进行
 */
@Getter
public class DueItemResolutionException extends RuntimeException {

    private final String itemType;

    public DueItemResolutionException(String itemType, Throwable cause) {
        super("查询到期" + itemType + "失败: " + cause.getMessage(), cause);
        this.itemType = itemType;
    }
}
