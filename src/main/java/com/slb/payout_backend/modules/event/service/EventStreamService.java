package com.slb.payout_backend.modules.event.service;

import com.slb.payout_backend.modules.event.config.EventStreamProperties;
import com.slb.payout_backend.modules.event.domain.ServerEvent;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;

/**
 * 把 {@link ServerEventBus} 的订阅转成 SSE 长连接：每个连接占用转发线程池里的一个线程，
 * 慢连接只会拖慢自己的队列，不影响发布方。线程池满时拒绝新连接。
 */
@Service
@Slf4j
public class EventStreamService {

    private final ServerEventBus eventBus;
    private final Duration keepAlive;
    private final long emitterTimeoutMs;
    private final ThreadPoolTaskExecutor relayExecutor;

    public EventStreamService(ServerEventBus eventBus, EventStreamProperties properties) {
        this.eventBus = eventBus;
        this.keepAlive = Duration.ofSeconds(Math.max(1L, properties.getKeepAliveSeconds()));
        this.emitterTimeoutMs = Math.max(0L, properties.getEmitterTimeoutMs());
        int maxSubscribers = Math.max(1, properties.getMaxSubscribers());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(maxSubscribers);
        executor.setMaxPoolSize(maxSubscribers);
        executor.setAllowCoreThreadTimeOut(true);
        // 不排队：没有空闲线程就直接拒绝
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("sse-relay-");
        executor.setDaemon(true);
        executor.initialize();
        this.relayExecutor = executor;
    }

    public SseEmitter open() {
        SseEmitter emitter = new SseEmitter(emitterTimeoutMs);
        EventSubscription subscription = eventBus.subscribe();
        emitter.onCompletion(() -> eventBus.unsubscribe(subscription));
        emitter.onTimeout(() -> eventBus.unsubscribe(subscription));
        emitter.onError(ex -> eventBus.unsubscribe(subscription));
        try {
            relayExecutor.execute(() -> relay(subscription, emitter));
        } catch (RejectedExecutionException ex) {
            log.warn("SSE relay pool exhausted, rejecting subscriber: id={}", subscription.getId());
            eventBus.unsubscribe(subscription);
            emitter.completeWithError(ex);
        }
        return emitter;
    }

    void relay(EventSubscription subscription, SseEmitter emitter) {
        try {
            while (!subscription.isClosed()) {
                ServerEvent event = subscription.poll(keepAlive);
                if (subscription.isClosed()) {
                    break;
                }
                if (event == null) {
                    emitter.send(SseEmitter.event().comment("keep-alive"));
                } else {
                    emitter.send(SseEmitter.event().data(event, MediaType.APPLICATION_JSON));
                }
            }
        } catch (IOException | IllegalStateException ex) {
            // 客户端断开
            log.debug("SSE subscriber disconnected: id={}, reason={}", subscription.getId(), ex.getMessage());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        } finally {
            eventBus.unsubscribe(subscription);
            emitter.complete();
        }
    }

    @PreDestroy
    public void shutdown() {
        relayExecutor.shutdown();
    }
}
