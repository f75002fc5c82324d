package com.slb.payout_backend.modules.event.controller;

import com.slb.payout_backend.modules.event.service.EventStreamService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/api/events")
@Tag(name = "实时事件", description = "看板刷新用的 SSE 事件流")
public class EventStreamController {

    private final EventStreamService eventStreamService;

    public EventStreamController(EventStreamService eventStreamService) {
        this.eventStreamService = eventStreamService;
    }

    @GetMapping(produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "订阅变更事件（payouts-updated / traders-updated / settings-updated / limits-updated）")
    public SseEmitter events() {
        return eventStreamService.open();
    }
}
