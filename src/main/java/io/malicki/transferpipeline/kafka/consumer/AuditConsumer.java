package io.malicki.transferpipeline.kafka.consumer;

import io.malicki.transferpipeline.domain.transfer.TransferEvent;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Service;

/**
 * Writes every transfer lifecycle event to the audit log. Runs in its own
 * consumer group so it keeps independent offsets.
 */
@Service
@Slf4j
public class AuditConsumer {

    @KafkaListener(
        topics = "${transfers.lifecycle-topic:transfer-lifecycle}",
        groupId = "transfer-audit",
        containerFactory = "kafkaListenerContainerFactory",
        autoStartup = "${transfers.audit.auto-startup:true}"
    )
    public void auditEvent(ConsumerRecord<String, TransferEvent> record, Acknowledgment ack) {
        TransferEvent event = record.value();

        if (event == null) {
            log.warn("📋 [AUDIT] Skipping empty record | Partition: {} | Offset: {}",
                    record.partition(), record.offset());
            ack.acknowledge();
            return;
        }

        log.info("📋 [AUDIT] TransferID: {} | User: {} | Status: {} | Amount: {} {} | Reference: {} | Partition: {} | Offset: {}",
                event.getTransferId(),
                event.getUserId(),
                event.getStatus(),
                event.getAmount(),
                event.getCurrency(),
                event.getReference(),
                record.partition(),
                record.offset());

        ack.acknowledge();
    }
}
