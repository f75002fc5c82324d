package com.slb.payout_backend.modules.event.service;

import com.slb.payout_backend.modules.event.domain.ServerEvent;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 单个订阅者的有界事件队列。发布方只做非阻塞 offer，队列满时挤掉最旧的一条。
 */
public class EventSubscription {

    private final String id;
    private final BlockingQueue<ServerEvent> queue;
    private final AtomicLong dropped = new AtomicLong();
    private volatile boolean closed;

    EventSubscription(String id, int capacity) {
        this.id = id;
        this.queue = new ArrayBlockingQueue<>(Math.max(1, capacity));
    }

    public String getId() {
        return id;
    }

    /**
     * @return true 表示为了放入本事件丢弃了旧事件（订阅者落后）
     */
    boolean offer(ServerEvent event) {
        if (closed) {
            return false;
        }
        boolean lagged = false;
        while (!queue.offer(event)) {
            if (queue.poll() != null) {
                dropped.incrementAndGet();
                lagged = true;
            }
        }
        return lagged;
    }

    /**
     * 等待下一条事件；超时或已关闭时返回 null。
     */
    public ServerEvent poll(Duration timeout) throws InterruptedException {
        if (closed) {
            return null;
        }
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public boolean isClosed() {
        return closed;
    }

    void close() {
        closed = true;
        queue.clear();
    }
}
