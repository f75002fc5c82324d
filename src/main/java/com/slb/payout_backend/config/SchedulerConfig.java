package com.slb.payout_backend.config;

import com.slb.payout_backend.modules.distribution.config.DistributionProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * 启用 Spring 的定时任务功能
 */
@Configuration
@EnableScheduling
public class SchedulerConfig {

    /**
     * 单线程调度器：自动分配的各轮天然串行。
     */
    @Bean
    public ThreadPoolTaskScheduler taskScheduler(DistributionProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("auto-distribution-");
        scheduler.setDaemon(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationMillis(Math.max(0L, properties.getShutdownTimeoutMs()));
        // 比 AutoDistributionScheduler 晚停，进行中的一轮先收尾
        scheduler.setPhase(SmartLifecycle.DEFAULT_PHASE - 1);
        return scheduler;
    }
}
