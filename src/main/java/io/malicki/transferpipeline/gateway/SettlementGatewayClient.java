package io.malicki.transferpipeline.gateway;

import java.util.concurrent.CompletableFuture;

/**
 * Submits a transfer to the external banking rail. This is the point of
 * irreversible external effect; its answer alone decides COMPLETED vs FAILED.
 * <p>
 * Implementations must treat {@link SettlementRequest#getReference()} as an
 * idempotency key: submitting the same reference twice returns the first outcome.
 */
public interface SettlementGatewayClient {

    CompletableFuture<SettlementResult> submit(SettlementRequest request);
}
