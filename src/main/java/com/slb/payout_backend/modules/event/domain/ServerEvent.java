package com.slb.payout_backend.modules.event.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 推送给看板的轻量变更通知，只说明“哪类数据变了”，由前端自行重新拉取。
 * message 为空时也照常输出 "message":null。
 */
public record ServerEvent(
        @JsonProperty("type") String type,
        String message
) {

    public static final String PAYOUTS_UPDATED = "payouts-updated";
    public static final String TRADERS_UPDATED = "traders-updated";
    public static final String SETTINGS_UPDATED = "settings-updated";
    public static final String LIMITS_UPDATED = "limits-updated";

    public static ServerEvent payoutsUpdated(String source) {
        return new ServerEvent(PAYOUTS_UPDATED, "source=" + source);
    }

    public static ServerEvent tradersUpdated() {
        return new ServerEvent(TRADERS_UPDATED, null);
    }

    public static ServerEvent settingsUpdated() {
        return new ServerEvent(SETTINGS_UPDATED, null);
    }

    public static ServerEvent limitsUpdated() {
        return new ServerEvent(LIMITS_UPDATED, null);
    }
}
