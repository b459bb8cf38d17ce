package io.malicki.transferpipeline.kafka.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.malicki.transferpipeline.config.TransferProperties;
import io.malicki.transferpipeline.domain.outbox.OutboxEvent;
import io.malicki.transferpipeline.domain.outbox.OutboxRepository;
import io.malicki.transferpipeline.domain.transfer.Transfer;
import io.malicki.transferpipeline.domain.transfer.TransferEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Records lifecycle events next to the ledger change that caused them.
 * {@link OutboxProcessor} ships them to Kafka afterwards.
 */
@Service
@Slf4j
public class OutboxService {

    private final OutboxRepository outboxRepository;
    private final ObjectMapper objectMapper;
    private final TransferProperties properties;

    public OutboxService(OutboxRepository outboxRepository, ObjectMapper objectMapper,
                         TransferProperties properties) {
        this.outboxRepository = outboxRepository;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    // Must join the caller's transaction, otherwise the event could outlive a rolled-back change
    @Transactional(propagation = Propagation.MANDATORY)
    public void record(Transfer transfer, String eventType) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(TransferEvent.from(transfer));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize " + eventType + " for " + transfer.getTransferId(), e);
        }

        outboxRepository.save(new OutboxEvent(
                transfer.getTransferId(),
                eventType,
                properties.getLifecycleTopic(),
                transfer.getUserId(),
                payload));

        log.debug("📝 [OUTBOX] Queued {} for transfer {} ({})",
                eventType, transfer.getTransferId(), transfer.getStatus());
    }
}
