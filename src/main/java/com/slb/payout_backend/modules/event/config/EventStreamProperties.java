package com.slb.payout_backend.modules.event.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app.events")
@Data
public class EventStreamProperties {
    /** 每个订阅者最多缓存的未发送事件数，超出后丢弃最旧的事件 */
    private int subscriberBuffer = 100;
    /** 无事件时发送 SSE 注释保活的间隔 */
    private long keepAliveSeconds = 15;
    /** SseEmitter 超时时间，0 表示不超时 */
    private long emitterTimeoutMs = 0;
    /** 同时在线的 SSE 连接上限（每个连接占一个转发线程） */
    private int maxSubscribers = 64;
}
