package com.example.publishing.common.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 收件人描述
 *
 * 以JSON形式内嵌在通知任务中，不是独立实体
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Recipient {

    private String email;

    /**
     * 可选的附加信息（例如姓名、订阅来源）
     */
    private Map<String, String> metadata;

    public static Recipient of(String email) {
        return Recipient.builder().email(email).build();
    }
}
