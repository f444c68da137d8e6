package com.example.publishing.worker.transport;

import lombok.Getter;

/**
 * 单个收件人投递失败
 */
@Getter
public class DeliveryException extends Exception {

    /**
     * 服务商返回的HTTP状态码，网络错误时为空
     */
    private final Integer httpStatus;

    public DeliveryException(String message) {
        this(message, null, null);
    }

    public DeliveryException(String message, Integer httpStatus, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
    }
}
