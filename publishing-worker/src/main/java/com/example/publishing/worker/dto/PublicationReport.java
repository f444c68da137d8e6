package com.example.publishing.worker.dto;

import lombok.Getter;
import lombok.ToString;

/**
 * 一轮内容发布的统计
 */
@Getter
@ToString
public class PublicationReport {

    private int published;

    private int alreadyPublished;

    private int failed;

    public void published() {
        published++;
    }

    public void alreadyPublished() {
        alreadyPublished++;
    }

    public void failed() {
        failed++;
    }

    public int getAttempted() {
        return published + alreadyPublished + failed;
    }
}
