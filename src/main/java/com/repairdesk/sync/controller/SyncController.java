package com.repairdesk.sync.controller;

import com.repairdesk.sync.exception.SessionNotFoundException;
import com.repairdesk.sync.model.domain.EntityKind;
import com.repairdesk.sync.model.domain.TrackedEntity;
import com.repairdesk.sync.model.domain.ViewScope;
import com.repairdesk.sync.model.dto.QuoteUpdateRequest;
import com.repairdesk.sync.model.dto.SessionInfo;
import com.repairdesk.sync.model.dto.StartSessionRequest;
import com.repairdesk.sync.model.dto.StatusUpdateRequest;
import com.repairdesk.sync.model.dto.ViewSnapshot;
import com.repairdesk.sync.service.command.EntityCommandService;
import com.repairdesk.sync.service.session.NotificationStreamService;
import com.repairdesk.sync.service.session.ViewerSession;
import com.repairdesk.sync.service.session.ViewerSessionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;
import java.util.Optional;

/**
 * HTTP surface for the presentation layer: session lifecycle, view snapshots, unread
 * counters, the notification stream and the write operations.
 */
@Slf4j
@RestController
@RequestMapping("/api/sync")
@RequiredArgsConstructor
public class SyncController {

    private final ViewerSessionRegistry registry;
    private final EntityCommandService commandService;
    private final NotificationStreamService streamService;

    @PostMapping("/sessions")
    public ResponseEntity<SessionInfo> startSession(@RequestBody StartSessionRequest request) {
        if (request.getViewerId() == null || request.getViewerId().isBlank() || request.getRole() == null) {
            throw new IllegalArgumentException("viewerId and role are required");
        }
        log.info("🔄 Session requested for {} as {}", request.getViewerId(), request.getRole());
        Optional<Long> previousEpoch = registry.find(request.getViewerId()).map(ViewerSession::epoch);
        ViewerSession session = registry.start(new ViewScope(request.getRole(), request.getViewerId()));
        if (previousEpoch.isPresent() && previousEpoch.get() != session.epoch()) {
            streamService.complete(request.getViewerId());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(session.info());
    }

    @GetMapping("/sessions/{viewerId}")
    public SessionInfo getSession(@PathVariable String viewerId) {
        return registry.require(viewerId).info();
    }

    @DeleteMapping("/sessions/{viewerId}")
    public ResponseEntity<Void> stopSession(@PathVariable String viewerId) {
        if (!registry.stop(viewerId)) {
            throw new SessionNotFoundException(viewerId);
        }
        streamService.complete(viewerId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/sessions/{viewerId}/views/{kind}")
    public ViewSnapshot getView(@PathVariable String viewerId, @PathVariable String kind) {
        return registry.require(viewerId).getView(parseKind(kind));
    }

    @PostMapping("/sessions/{viewerId}/views/{kind}/refresh")
    public ResponseEntity<Map<String, Object>> refresh(@PathVariable String viewerId, @PathVariable String kind) {
        EntityKind entityKind = parseKind(kind);
        boolean accepted = registry.require(viewerId).refresh(entityKind);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("kind", entityKind.getTable(), "accepted", accepted));
    }

    @GetMapping("/sessions/{viewerId}/unread")
    public Map<String, Integer> getUnreadCounts(@PathVariable String viewerId) {
        return registry.require(viewerId).getUnreadCounts();
    }

    @GetMapping("/sessions/{viewerId}/unread/{conversationId}")
    public Map<String, Object> getUnreadCount(@PathVariable String viewerId, @PathVariable String conversationId) {
        int count = registry.require(viewerId).getUnreadCount(conversationId);
        return Map.of("conversationId", conversationId, "count", count);
    }

    @PostMapping("/sessions/{viewerId}/unread/{conversationId}/read")
    public Map<String, Object> markRead(@PathVariable String viewerId, @PathVariable String conversationId) {
        int count = registry.require(viewerId).markRead(conversationId);
        return Map.of("conversationId", conversationId, "count", count);
    }

    @GetMapping(path = "/sessions/{viewerId}/notifications", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter notifications(@PathVariable String viewerId) {
        return streamService.register(viewerId);
    }

    @PatchMapping("/sessions/{viewerId}/bookings/{bookingId}/status")
    public TrackedEntity updateBookingStatus(@PathVariable String viewerId, @PathVariable String bookingId,
                                             @RequestBody StatusUpdateRequest request) {
        return commandService.updateBookingStatus(viewerId, bookingId, request.getStatus());
    }

    @PatchMapping("/sessions/{viewerId}/quotes/{quoteId}")
    public TrackedEntity updateQuoteRequest(@PathVariable String viewerId, @PathVariable String quoteId,
                                            @RequestBody QuoteUpdateRequest request) {
        return commandService.updateQuoteRequest(viewerId, quoteId, request);
    }

    @PostMapping("/sessions/{viewerId}/quotes/{quoteId}/booking")
    public ResponseEntity<TrackedEntity> createBookingFromQuote(@PathVariable String viewerId, @PathVariable String quoteId) {
        TrackedEntity booking = commandService.createBookingFromQuote(viewerId, quoteId);
        return ResponseEntity.status(HttpStatus.CREATED).body(booking);
    }

    private static EntityKind parseKind(String segment) {
        EntityKind kind = EntityKind.fromPath(segment);
        if (kind == null) {
            throw new IllegalArgumentException("Unknown entity kind: " + segment);
        }
        return kind;
    }
}
