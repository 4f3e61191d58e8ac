package com.repairdesk.sync.service.session;

import com.repairdesk.sync.model.dto.Notification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Streams a session's notifications to browsers as Server-Sent Events named
 * {@code notification}.
 */
@Slf4j
@Service
public class NotificationStreamService {

    private final ViewerSessionRegistry registry;
    private final long emitterTimeoutMs;
    private final Map<String, List<Stream>> streams = new ConcurrentHashMap<>();

    public NotificationStreamService(ViewerSessionRegistry registry,
                                     @Value("${app.sync.sse.timeout:30m}") Duration emitterTimeout) {
        this.registry = registry;
        this.emitterTimeoutMs = emitterTimeout.toMillis();
    }

    public SseEmitter register(String viewerId) {
        ViewerSession session = registry.require(viewerId);
        SseEmitter emitter = new SseEmitter(emitterTimeoutMs);
        Stream stream = new Stream(viewerId, emitter);
        stream.unsubscribe = session.onNotification(notification -> send(stream, notification));
        streams.computeIfAbsent(viewerId, k -> new CopyOnWriteArrayList<>()).add(stream);

        emitter.onCompletion(() -> remove(stream));
        emitter.onTimeout(() -> remove(stream));
        emitter.onError(e -> remove(stream));

        try {
            emitter.send(SseEmitter.event().name("connected").data(Map.of("viewerId", viewerId, "epoch", session.epoch())));
        } catch (IOException e) {
            log.debug("[NOTIFY] Stream of {} closed before the greeting: {}", viewerId, e.getMessage());
            remove(stream);
        }
        log.info("[NOTIFY] {} opened a notification stream", viewerId);
        return emitter;
    }

    /**
     * Keep-alive for proxies that drop idle connections.
     */
    @Scheduled(fixedDelayString = "${app.sync.sse.heartbeat-ms:15000}")
    public void heartbeat() {
        for (List<Stream> list : streams.values()) {
            for (Stream stream : list) {
                try {
                    stream.emitter.send(SseEmitter.event().name("ping").data("keepalive"));
                } catch (IOException | IllegalStateException e) {
                    remove(stream);
                }
            }
        }
    }

    /**
     * Ends every stream of a viewer, e.g. when their session stops.
     */
    public void complete(String viewerId) {
        List<Stream> list = streams.remove(viewerId);
        if (list == null) {
            return;
        }
        for (Stream stream : list) {
            stream.detach();
            stream.emitter.complete();
        }
    }

    public int openStreams(String viewerId) {
        return streams.getOrDefault(viewerId, List.of()).size();
    }

    private void send(Stream stream, Notification notification) {
        try {
            stream.emitter.send(SseEmitter.event()
                    .name("notification")
                    .id(notification.entityId() + ":" + notification.key().newValue())
                    .data(notification));
        } catch (IOException | IllegalStateException e) {
            log.debug("[NOTIFY] Dropping stream of {}: {}", stream.viewerId, e.getMessage());
            remove(stream);
        }
    }

    private void remove(Stream stream) {
        stream.detach();
        List<Stream> list = streams.get(stream.viewerId);
        if (list != null) {
            list.remove(stream);
            if (list.isEmpty()) {
                streams.remove(stream.viewerId, list);
            }
        }
    }

    private static final class Stream {
        private final String viewerId;
        private final SseEmitter emitter;
        private volatile Runnable unsubscribe;

        private Stream(String viewerId, SseEmitter emitter) {
            this.viewerId = viewerId;
            this.emitter = emitter;
        }

        private void detach() {
            Runnable handle = unsubscribe;
            if (handle != null) {
                handle.run();
            }
        }
    }
}
