package io.malicki.transferpipeline.processing;

import io.malicki.transferpipeline.config.TransferProperties;
import io.malicki.transferpipeline.domain.transfer.SettlementFailureCategory;
import io.malicki.transferpipeline.domain.transfer.Transfer;
import io.malicki.transferpipeline.domain.transfer.TransferLedger;
import io.malicki.transferpipeline.gateway.SettlementGatewayClient;
import io.malicki.transferpipeline.gateway.SettlementRequest;
import io.malicki.transferpipeline.gateway.SettlementResult;
import io.malicki.transferpipeline.notification.TransferNotificationDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Worker-side settlement of one approved transfer. Runs on the transfer work
 * queue; every path ends with the transfer COMPLETED or FAILED.
 */
@Component
@Slf4j
public class SettlementProcessor {

    private final TransferLedger ledger;
    private final SettlementGatewayClient gateway;
    private final SettlementFailureClassifier classifier;
    private final TransferNotificationDispatcher notifications;
    private final TransferProperties properties;

    public SettlementProcessor(
            TransferLedger ledger,
            SettlementGatewayClient gateway,
            SettlementFailureClassifier classifier,
            TransferNotificationDispatcher notifications,
            TransferProperties properties
    ) {
        this.ledger = ledger;
        this.gateway = gateway;
        this.classifier = classifier;
        this.notifications = notifications;
        this.properties = properties;
    }

    public void settle(String transferId) throws InterruptedException {
        Optional<Transfer> processing = ledger.findProcessing(transferId);
        if (processing.isEmpty()) {
            log.info("⏭️ [SETTLEMENT] Transfer {} is no longer PROCESSING, nothing to do", transferId);
            return;
        }

        Transfer transfer = processing.get();
        log.info("💰 [SETTLEMENT] Settling {} | {} {} → {}",
                transferId, transfer.getAmount(), transfer.getCurrency(),
                transfer.getRecipientInfo().getAccountNumber());

        Optional<Transfer> resolved;
        try {
            resolved = resolve(transfer);
        } catch (InterruptedException e) {
            // Shutting down; the rail may already have the money, so leave it for recovery
            log.warn("⚠️ [SETTLEMENT] Interrupted while settling {}, left in PROCESSING", transferId);
            throw e;
        } catch (Exception e) {
            SettlementFailureCategory category = classifier.classify(e);
            log.error("❌ [SETTLEMENT] Transfer {} errored ({}): {}", transferId, category, e.getMessage(), e);
            resolved = fail(transferId, category, classifier.describe(e), null);
        }

        resolved.ifPresent(notifications::update);
    }

    private Optional<Transfer> resolve(Transfer transfer) throws Exception {
        String transferId = transfer.getTransferId();

        // Cheap early exit; the authoritative re-check happens under lock in complete()
        if (!ledger.hasFundsFor(transfer)) {
            log.warn("⚠️ [SETTLEMENT] Balance no longer covers {}, gateway not called", transferId);
            return ledger.fail(transferId, SettlementFailureCategory.INSUFFICIENT_FUNDS,
                    "Insufficient balance", null);
        }

        SettlementRequest request = new SettlementRequest(
                transfer.getAmount(),
                transfer.getCurrency(),
                transfer.getRecipientInfo(),
                transferId
        );

        SettlementResult result = gateway.submit(request)
                .get(properties.getSettlement().getTimeout().toMillis(), TimeUnit.MILLISECONDS);

        if (result.isSuccess()) {
            return ledger.complete(transferId, result);
        }

        log.warn("🏦 [SETTLEMENT] Gateway declined {}: {}", transferId, result.getError());
        return ledger.fail(transferId, SettlementFailureCategory.GATEWAY_DECLINED, result.getError(), null);
    }

    private Optional<Transfer> fail(String transferId, SettlementFailureCategory category,
                                    String reason, String bankReference) {
        try {
            return ledger.fail(transferId, category, reason, bankReference);
        } catch (Exception e) {
            // Left PROCESSING; recovery on next start picks it up again
            log.error("❌ [SETTLEMENT] Could not record failure of {}: {}", transferId, e.getMessage(), e);
            return Optional.empty();
        }
    }
}
