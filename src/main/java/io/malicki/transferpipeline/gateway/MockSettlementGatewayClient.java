package io.malicki.transferpipeline.gateway;

import io.malicki.transferpipeline.config.TransferProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Simulated banking rail. Answers after the configured delay; amounts above the
 * configured ceiling are declined. Replace with a real rail integration.
 * <p>
 * Outcomes are remembered per reference in memory only, up to
 * {@code transfers.settlement.remembered-outcomes} entries. A repeated
 * submission within one process replays the first outcome; after a restart
 * the memory is gone, so a real rail has to enforce reference idempotency
 * on its side.
 */
@Component
@Slf4j
public class MockSettlementGatewayClient implements SettlementGatewayClient {

    private final TransferProperties properties;

    // reference -> first outcome, insertion ordered so the oldest is evicted first
    private final Map<String, SettlementResult> outcomes;

    public MockSettlementGatewayClient(TransferProperties properties) {
        this.properties = properties;
        int capacity = properties.getSettlement().getRememberedOutcomes();
        this.outcomes = Collections.synchronizedMap(new LinkedHashMap<String, SettlementResult>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, SettlementResult> eldest) {
                return size() > capacity;
            }
        });
    }

    int rememberedOutcomes() {
        return outcomes.size();
    }

    @Override
    public CompletableFuture<SettlementResult> submit(SettlementRequest request) {
        SettlementResult previous = outcomes.get(request.getReference());
        if (previous != null) {
            log.info("🏦 [BANK] Reference {} already settled, replaying outcome (success: {})",
                    request.getReference(), previous.isSuccess());
            return CompletableFuture.completedFuture(previous);
        }

        long delayMs = properties.getSettlement().getGatewayDelay().toMillis();
        return CompletableFuture.supplyAsync(
                () -> outcomes.computeIfAbsent(request.getReference(), ref -> settle(request)),
                CompletableFuture.delayedExecutor(delayMs, TimeUnit.MILLISECONDS));
    }

    private SettlementResult settle(SettlementRequest request) {
        log.info("🏦 [BANK] Processing transfer: {} for {} {}",
                request.getReference(), request.getAmount(), request.getCurrency());

        if (request.getAmount().compareTo(properties.getSettlement().getCeiling()) > 0) {
            return SettlementResult.failed("Insufficient funds or bank processing error");
        }

        String bankReference = "BANK" + System.currentTimeMillis()
                + UUID.randomUUID().toString().substring(0, 5).toUpperCase();
        return SettlementResult.succeeded(bankReference, "Transfer processed successfully");
    }
}
