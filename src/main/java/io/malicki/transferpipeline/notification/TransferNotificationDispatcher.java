package io.malicki.transferpipeline.notification;

import io.malicki.transferpipeline.api.dto.TransferResponse;
import io.malicki.transferpipeline.domain.transfer.Transfer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Shields ledger operations from the push channel: anything the notifier
 * throws is logged here and goes no further.
 */
@Component
@Slf4j
public class TransferNotificationDispatcher {

    private final TransferNotifier notifier;

    public TransferNotificationDispatcher(TransferNotifier notifier) {
        this.notifier = notifier;
    }

    public void pending(Transfer transfer) {
        try {
            notifier.emitPending(transfer.getUserId(), TransferResponse.from(transfer));
        } catch (Exception e) {
            log.warn("⚠️ [NOTIFIER] transfer_pending for {} not delivered: {}",
                    transfer.getTransferId(), e.getMessage());
        }
    }

    public void update(Transfer transfer) {
        try {
            notifier.emitUpdate(transfer.getUserId(), TransferResponse.from(transfer));
        } catch (Exception e) {
            log.warn("⚠️ [NOTIFIER] transfer_update ({}) for {} not delivered: {}",
                    transfer.getStatus(), transfer.getTransferId(), e.getMessage());
        }
    }
}
