package com.slb.payout_backend.modules.event.service;

import com.slb.payout_backend.modules.event.config.EventStreamProperties;
import com.slb.payout_backend.modules.event.domain.ServerEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 进程内发布/订阅通道。publish 永远不会因为某个订阅者消费慢而阻塞。
 */
@Service
@Slf4j
public class ServerEventBus {

    private final List<EventSubscription> subscriptions = new CopyOnWriteArrayList<>();
    private final int subscriberBuffer;

    public ServerEventBus(EventStreamProperties properties) {
        this.subscriberBuffer = Math.max(1, properties.getSubscriberBuffer());
    }

    public EventSubscription subscribe() {
        EventSubscription subscription = new EventSubscription(UUID.randomUUID().toString(), subscriberBuffer);
        subscriptions.add(subscription);
        log.debug("Event subscriber added: id={}, total={}", subscription.getId(), subscriptions.size());
        return subscription;
    }

    public void unsubscribe(EventSubscription subscription) {
        if (subscription == null) {
            return;
        }
        subscription.close();
        if (subscriptions.remove(subscription)) {
            log.debug("Event subscriber removed: id={}, total={}", subscription.getId(), subscriptions.size());
        }
    }

    public void publish(ServerEvent event) {
        if (event == null) {
            return;
        }
        for (EventSubscription subscription : subscriptions) {
            if (subscription.offer(event)) {
                log.warn("Event subscriber lagged, oldest events dropped: id={}, droppedTotal={}",
                        subscription.getId(), subscription.getDroppedCount());
            }
        }
    }

    public int subscriberCount() {
        return subscriptions.size();
    }
}
