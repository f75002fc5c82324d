package com.slb.payout_backend.modules.event.service;

import com.slb.payout_backend.modules.event.config.EventStreamProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EventStreamServiceTest {

    private ServerEventBus eventBus;
    private EventStreamService streamService;

    @BeforeEach
    void setUp() {
        EventStreamProperties properties = new EventStreamProperties();
        properties.setMaxSubscribers(1);
        eventBus = new ServerEventBus(properties);
        streamService = new EventStreamService(eventBus, properties);
    }

    @AfterEach
    void tearDown() {
        streamService.shutdown();
    }

    @Test
    void connectionBeyondRelayCapIsRejectedAndReleased() {
        streamService.open();
        assertThat(eventBus.subscriberCount()).isEqualTo(1);

        streamService.open();

        // 第二个连接没有转发线程，订阅立即释放
        assertThat(eventBus.subscriberCount()).isEqualTo(1);
    }
}
