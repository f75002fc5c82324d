package com.slb.payout_backend.modules.distribution.service;

import com.slb.payout_backend.modules.distribution.config.DistributionProperties;
import com.slb.payout_backend.modules.distribution.domain.AutoDistributionConfig;
import com.slb.payout_backend.modules.event.domain.ServerEvent;
import com.slb.payout_backend.modules.event.service.ServerEventBus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 自动分配配置的唯一持有者：既回答“当前配置是什么”，也在配置变化时通知调度器。
 * 配置只在内存里，重启后回到 app.distribution 的默认值。
 */
@Component
@Slf4j
public class AutoDistributionSettings {

    private final ReentrantLock lock = new ReentrantLock();
    private final List<Runnable> changeListeners = new CopyOnWriteArrayList<>();
    private final ServerEventBus eventBus;

    private AutoDistributionConfig config;

    public AutoDistributionSettings(DistributionProperties properties, ServerEventBus eventBus) {
        this.eventBus = eventBus;
        this.config = new AutoDistributionConfig(properties.isEnabled(), properties.getIntervalSeconds());
    }

    public AutoDistributionConfig current() {
        lock.lock();
        try {
            return config;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 监听方收到通知后应自己读取 {@link #current()}，并发修改时以最后一次为准。
     */
    public void addChangeListener(Runnable listener) {
        changeListeners.add(listener);
    }

    /**
     * 整体替换配置并通知监听方。interval 小于 1 时按 1 秒处理。
     *
     * @return 实际生效的配置
     */
    public AutoDistributionConfig update(boolean enabled, long intervalSeconds) {
        AutoDistributionConfig updated = new AutoDistributionConfig(enabled, intervalSeconds);
        lock.lock();
        try {
            config = updated;
        } finally {
            lock.unlock();
        }
        log.info("[settings] Auto distribution {} with interval {} seconds",
                updated.enabled() ? "enabled" : "disabled", updated.intervalSeconds());
        for (Runnable listener : changeListeners) {
            listener.run();
        }
        eventBus.publish(ServerEvent.settingsUpdated());
        return updated;
    }
}
