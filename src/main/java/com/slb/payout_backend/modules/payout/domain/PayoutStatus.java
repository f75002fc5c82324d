package com.slb.payout_backend.modules.payout.domain;

import java.util.Locale;
import java.util.Set;

/**
 * 出款单状态中与分配、取消相关的取值；其余进行中状态按原样保存在字符串字段里。
 */
public enum PayoutStatus {
    CREATED,
    CANCELLED,
    COMPLETED,
    SUCCESS,
    FAILED;

    private static final Set<String> TERMINAL = Set.of(
            CANCELLED.name(), COMPLETED.name(), SUCCESS.name(), FAILED.name());

    /** 对外回调、接口返回时使用的取消状态文案 */
    public static final String CANCELED_LABEL = "CANCELED";

    public static boolean isTerminal(String status) {
        return status != null && TERMINAL.contains(status.trim().toUpperCase(Locale.ROOT));
    }

    public static boolean isCancelled(String status) {
        return status != null && CANCELLED.name().equalsIgnoreCase(status.trim());
    }
}
