package com.contextbus.api;

import com.contextbus.observability.ObservabilityService;
import com.contextbus.observability.OrchestrationEvent;
import com.contextbus.observability.OrchestrationEventBus;
import com.contextbus.observability.SessionViews;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.function.Consumer;

/**
 * Read-only observability queries.
 *
 * GET /v1/sessions/{sessionId}
 * GET /v1/sessions/{sessionId}/context-flow
 * GET /v1/sessions/{sessionId}/conflicts
 * GET /v1/sessions/stream
 */
@RestController
@RequestMapping("/v1/sessions")
public class ObservabilityController {

    private final ObservabilityService observabilityService;
    private final OrchestrationEventBus eventBus;

    public ObservabilityController(ObservabilityService observabilityService, OrchestrationEventBus eventBus) {
        this.observabilityService = observabilityService;
        this.eventBus = eventBus;
    }

    @GetMapping("/{sessionId}")
    public SessionViews.StatusView status(@PathVariable String sessionId) {
        return observabilityService.status(sessionId);
    }

    @GetMapping("/{sessionId}/context-flow")
    public List<SessionViews.ContextVersionView> contextFlow(@PathVariable String sessionId) {
        return observabilityService.contextFlow(sessionId);
    }

    @GetMapping("/{sessionId}/conflicts")
    public List<SessionViews.ConflictView> conflicts(@PathVariable String sessionId) {
        return observabilityService.conflicts(sessionId);
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestParam(required = false) String sessionId,
                             @RequestParam(required = false) String eventType) {
        SseEmitter emitter = new SseEmitter(0L);
        Consumer<OrchestrationEvent> forward = event -> {
            if (eventType != null && !eventType.equals(event.eventType())) {
                return;
            }
            try {
                emitter.send(SseEmitter.event()
                    .name(event.eventType())
                    .data(event));
            } catch (IOException ex) {
                emitter.completeWithError(ex);
            }
        };
        OrchestrationEventBus.Subscription subscription = sessionId == null
            ? eventBus.subscribeAll(forward)
            : eventBus.subscribe(sessionId, forward);

        emitter.onCompletion(subscription::unsubscribe);
        emitter.onTimeout(subscription::unsubscribe);
        emitter.onError(ex -> subscription.unsubscribe());
        return emitter;
    }
}
