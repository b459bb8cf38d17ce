package io.malicki.transferpipeline.kafka.outbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.malicki.transferpipeline.domain.outbox.OutboxEvent;
import io.malicki.transferpipeline.domain.outbox.OutboxRepository;
import io.malicki.transferpipeline.domain.transfer.TransferEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Drains the outbox in creation order. A row that keeps failing is retried on
 * every pass until {@link #MAX_RETRIES}, then left for manual replay.
 */
@Service
@Slf4j
public class OutboxProcessor {

    static final int MAX_RETRIES = 10;
    private static final long SEND_TIMEOUT_SECONDS = 10;

    private final OutboxRepository outboxRepository;
    private final KafkaTemplate<String, TransferEvent> kafkaTemplate;
    private final ObjectMapper objectMapper;

    public OutboxProcessor(
        OutboxRepository outboxRepository,
        KafkaTemplate<String, TransferEvent> kafkaTemplate,
        ObjectMapper objectMapper
    ) {
        this.outboxRepository = outboxRepository;
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
    }

    @Scheduled(fixedDelayString = "${transfers.outbox.poll-interval-ms:3000}")
    @Transactional
    public void processOutbox() {
        List<OutboxEvent> batch = outboxRepository
            .findTop100ByProcessedFalseAndRetryCountLessThanOrderByCreatedAtAsc(MAX_RETRIES);

        if (batch.isEmpty()) {
            return;
        }

        int published = 0;
        for (OutboxEvent event : batch) {
            try {
                publish(event);
                event.markPublished();
                published++;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("⚠️ [OUTBOX] Interrupted, {} of {} events published", published, batch.size());
                return;
            } catch (Exception e) {
                Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
                event.recordFailure(cause.getMessage());
                log.error("❌ [OUTBOX] {} for {} not published (attempt {}): {}",
                        event.getEventType(), event.getAggregateId(), event.getRetryCount(), cause.getMessage());
            }
            outboxRepository.save(event);
        }

        log.debug("📤 [OUTBOX] Published {} of {} events", published, batch.size());
    }

    private void publish(OutboxEvent event) throws Exception {
        TransferEvent payload = objectMapper.readValue(event.getPayload(), TransferEvent.class);

        // Block for the broker ack so the row is only marked once Kafka has it
        kafkaTemplate.send(event.getDestinationTopic(), event.getRoutingKey(), payload)
            .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    @Scheduled(fixedDelay = 60000)
    public void monitorOutbox() {
        long backlog = outboxRepository.countByProcessedFalse();
        long exhausted = outboxRepository.countByProcessedFalseAndRetryCountGreaterThanEqual(MAX_RETRIES);

        if (backlog > 0) {
            log.info("📊 [OUTBOX] Backlog: {} events", backlog);
        }
        if (exhausted > 0) {
            log.warn("⚠️ [OUTBOX] {} events stopped after {} attempts and need a manual replay",
                    exhausted, MAX_RETRIES);
        }
    }
}
