package io.malicki.transferpipeline.notification;

import io.malicki.transferpipeline.api.dto.TransferResponse;
import io.malicki.transferpipeline.config.TransferProperties;
import io.malicki.transferpipeline.domain.transfer.TransferStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Server-Sent Events implementation of {@link TransferNotifier}. A user may
 * hold several open streams (tabs, devices); every one of them gets the event.
 */
@Component
@Slf4j
public class SseTransferNotifier implements TransferNotifier {

    static final String PENDING_EVENT = "transfer_pending";
    static final String UPDATE_EVENT = "transfer_update";
    static final String CONNECTED_EVENT = "connected";

    private final Map<String, Set<SseEmitter>> emitters = new ConcurrentHashMap<>();
    private final TransferProperties properties;

    public SseTransferNotifier(TransferProperties properties) {
        this.properties = properties;
    }

    public SseEmitter subscribe(String userId) {
        SseEmitter emitter = new SseEmitter(properties.getPush().getEmitterTimeout().toMillis());
        emitters.computeIfAbsent(userId, id -> new CopyOnWriteArraySet<>()).add(emitter);

        emitter.onCompletion(() -> remove(userId, emitter));
        emitter.onTimeout(() -> {
            remove(userId, emitter);
            emitter.complete();
        });
        emitter.onError(error -> remove(userId, emitter));

        try {
            emitter.send(SseEmitter.event()
                    .name(CONNECTED_EVENT)
                    .data(Map.of("userId", userId, "timestamp", Instant.now().toString())));
        } catch (IOException e) {
            log.warn("⚠️ [NOTIFIER] Could not greet user {}: {}", userId, e.getMessage());
            remove(userId, emitter);
        }

        log.info("🔌 [NOTIFIER] User {} subscribed | Streams: {}", userId, emitters.getOrDefault(userId, Set.of()).size());
        return emitter;
    }

    @Override
    public void emitPending(String userId, TransferResponse transfer) {
        send(userId, PENDING_EVENT, new TransferPushEvent(
                transfer, "Your transfer has been submitted and is pending approval", Instant.now()));
    }

    @Override
    public void emitUpdate(String userId, TransferResponse transfer) {
        send(userId, UPDATE_EVENT, new TransferPushEvent(transfer, messageFor(transfer.getStatus()), Instant.now()));
    }

    @Override
    public boolean isUserConnected(String userId) {
        Set<SseEmitter> open = emitters.get(userId);
        return open != null && !open.isEmpty();
    }

    @Override
    public Set<String> connectedUsers() {
        return Set.copyOf(emitters.keySet());
    }

    private void send(String userId, String eventName, TransferPushEvent event) {
        Set<SseEmitter> open = emitters.get(userId);
        if (open == null || open.isEmpty()) {
            log.debug("📭 [NOTIFIER] User {} not connected, {} for {} left to polling",
                    userId, eventName, event.getTransaction().getId());
            return;
        }

        for (SseEmitter emitter : open) {
            try {
                emitter.send(SseEmitter.event().name(eventName).data(event));
            } catch (IOException | IllegalStateException e) {
                log.warn("⚠️ [NOTIFIER] Dropping dead stream for user {}: {}", userId, e.getMessage());
                remove(userId, emitter);
            }
        }

        log.info("🚀 [NOTIFIER] Emitted {} to user {} for transfer {}",
                eventName, userId, event.getTransaction().getId());
    }

    private void remove(String userId, SseEmitter emitter) {
        emitters.computeIfPresent(userId, (id, open) -> {
            open.remove(emitter);
            return open.isEmpty() ? null : open;
        });
    }

    static String messageFor(TransferStatus status) {
        if (status == null) {
            return "Your transfer status has been updated";
        }
        switch (status) {
            case PROCESSING:
                return "Your transfer has been approved and is being processed";
            case COMPLETED:
                return "Your transfer has been completed successfully";
            case REJECTED:
                return "Your transfer has been rejected";
            case FAILED:
                return "Your transfer failed to process";
            default:
                return "Your transfer status has been updated";
        }
    }
}
