package com.slb.payout_backend.modules.trader.service;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 交易员单笔出款上限（内存态，进程重启后清空）。
 * 没有登记的交易员视为不限额。
 */
@Component
public class TraderLimitRegistry {

    private final Map<String, BigDecimal> limits = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public BigDecimal get(String traderId) {
        lock.readLock().lock();
        try {
            return limits.get(traderId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<String, BigDecimal> snapshot() {
        lock.readLock().lock();
        try {
            return Map.copyOf(limits);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return 实际生效的限额；null 表示已清除（不限额）
     */
    public BigDecimal update(String traderId, BigDecimal maxAmount) {
        BigDecimal sanitized = sanitize(maxAmount);
        lock.writeLock().lock();
        try {
            if (sanitized == null) {
                limits.remove(traderId);
            } else {
                limits.put(traderId, sanitized);
            }
        } finally {
            lock.writeLock().unlock();
        }
        return sanitized;
    }

    /**
     * 小于等于 0 的限额按“清除限额”处理，而不是封顶为 0。
     */
    static BigDecimal sanitize(BigDecimal maxAmount) {
        if (maxAmount == null || maxAmount.signum() <= 0) {
            return null;
        }
        return maxAmount;
    }
}
