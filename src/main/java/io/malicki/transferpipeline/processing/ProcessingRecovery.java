package io.malicki.transferpipeline.processing;

import io.malicki.transferpipeline.config.TransferProperties;
import io.malicki.transferpipeline.domain.transfer.TransactionType;
import io.malicki.transferpipeline.domain.transfer.Transfer;
import io.malicki.transferpipeline.domain.transfer.TransferRepository;
import io.malicki.transferpipeline.domain.transfer.TransferStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * The work queue lives in memory, so approved transfers whose settlement was
 * queued or running when the process stopped are still PROCESSING on the next
 * start. This re-queues them, oldest first. The transfer id is sent as the
 * gateway reference; a rail that already saw that reference must answer with
 * its recorded outcome instead of paying again. The simulated rail forgets its
 * outcomes on restart, so that guarantee has to come from the real integration.
 */
@Component
@Slf4j
public class ProcessingRecovery {

    private final TransferRepository transferRepository;
    private final TransferWorkQueue workQueue;
    private final SettlementProcessor settlementProcessor;
    private final TransferProperties properties;

    public ProcessingRecovery(
            TransferRepository transferRepository,
            TransferWorkQueue workQueue,
            SettlementProcessor settlementProcessor,
            TransferProperties properties
    ) {
        this.transferRepository = transferRepository;
        this.workQueue = workQueue;
        this.settlementProcessor = settlementProcessor;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void resumeProcessing() {
        if (!properties.getRecovery().isResumeProcessingOnStartup()) {
            log.info("🔁 [QUEUE] Startup recovery disabled");
            return;
        }

        List<Transfer> stuck = transferRepository.findByTypeAndStatus(
                TransactionType.EXTERNAL_TRANSFER, TransferStatus.PROCESSING);

        if (stuck.isEmpty()) {
            return;
        }

        log.warn("🔁 [QUEUE] Re-queueing {} transfers left in PROCESSING", stuck.size());

        stuck.stream()
                .sorted(Comparator.comparing(Transfer::getUpdatedAt))
                .map(Transfer::getTransferId)
                .forEach(transferId -> workQueue.enqueue(
                        "settle:" + transferId,
                        () -> settlementProcessor.settle(transferId)));
    }
}
