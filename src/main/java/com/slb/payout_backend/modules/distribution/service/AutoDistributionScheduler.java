package com.slb.payout_backend.modules.distribution.service;

import com.slb.payout_backend.common.trace.TraceIdHolder;
import com.slb.payout_backend.modules.distribution.config.DistributionProperties;
import com.slb.payout_backend.modules.distribution.domain.AutoDistributionConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 自动分配调度。
 * <ul>
 *     <li>配置变更后立即跑一轮，之后每轮结束再隔 intervalSeconds 跑下一轮（fixed delay，不补跑）；</li>
 *     <li>配置变更不打断进行中的一轮，下一拍生效；</li>
 *     <li>停机时等当前这条配对提交完再退出。</li>
 * </ul>
 */
@Component
@Slf4j
public class AutoDistributionScheduler implements SmartLifecycle {

    private final AutoDistributionSettings settings;
    private final PayoutDistributionService distributionService;
    private final TaskScheduler taskScheduler;
    private final long shutdownTimeoutMs;
    /** 保证各轮不重叠，停机时用来等进行中的一轮 */
    private final ReentrantLock cycleLock = new ReentrantLock();

    private volatile boolean running;
    private boolean listening;
    private ScheduledFuture<?> scheduled;

    public AutoDistributionScheduler(AutoDistributionSettings settings,
                                     PayoutDistributionService distributionService,
                                     TaskScheduler taskScheduler,
                                     DistributionProperties properties) {
        this.settings = settings;
        this.distributionService = distributionService;
        this.taskScheduler = taskScheduler;
        this.shutdownTimeoutMs = Math.max(0L, properties.getShutdownTimeoutMs());
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        if (!listening) {
            settings.addChangeListener(this::reschedule);
            listening = true;
        }
        reschedule();
        log.info("Auto distribution scheduler started");
    }

    @Override
    public void stop() {
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            cancelScheduled();
        }
        try {
            if (cycleLock.tryLock(shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
                cycleLock.unlock();
            } else {
                log.warn("Auto distribution cycle still running after {} ms", shutdownTimeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Auto distribution scheduler stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * 按当前配置重建定时任务，停机后忽略。
     */
    synchronized void reschedule() {
        if (!running) {
            return;
        }
        cancelScheduled();
        AutoDistributionConfig config = settings.current();
        if (!config.enabled()) {
            log.info("[auto] Auto distribution is disabled, no cycle scheduled");
            return;
        }
        scheduled = taskScheduler.scheduleWithFixedDelay(this::runCycleSafely, Instant.now(),
                Duration.ofSeconds(config.intervalSeconds()));
        log.info("[auto] Cycle scheduled every {} seconds", config.intervalSeconds());
    }

    private void cancelScheduled() {
        if (scheduled != null) {
            // 不中断进行中的一轮
            scheduled.cancel(false);
            scheduled = null;
        }
    }

    void runCycleSafely() {
        cycleLock.lock();
        try {
            if (!running) {
                return;
            }
            TraceIdHolder.begin("auto");
            try {
                distributionService.runCycle(() -> running);
            } catch (Exception e) {
                // 异常若抛出去，fixed-delay 任务会被取消
                log.error("[auto] Distribution cycle failed", e);
            } finally {
                TraceIdHolder.clear();
            }
        } finally {
            cycleLock.unlock();
        }
    }
}
