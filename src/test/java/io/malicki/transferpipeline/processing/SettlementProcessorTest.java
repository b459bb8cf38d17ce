package io.malicki.transferpipeline.processing;

import io.malicki.transferpipeline.config.TransferProperties;
import io.malicki.transferpipeline.domain.transfer.RecipientInfo;
import io.malicki.transferpipeline.domain.transfer.SettlementFailureCategory;
import io.malicki.transferpipeline.domain.transfer.Transfer;
import io.malicki.transferpipeline.domain.transfer.TransferLedger;
import io.malicki.transferpipeline.domain.transfer.TransferStatus;
import io.malicki.transferpipeline.gateway.SettlementGatewayClient;
import io.malicki.transferpipeline.gateway.SettlementRequest;
import io.malicki.transferpipeline.gateway.SettlementResult;
import io.malicki.transferpipeline.notification.TransferNotificationDispatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SettlementProcessor")
class SettlementProcessorTest {

    private static final String TRANSFER_ID = "t-1";

    @Mock
    private TransferLedger ledger;
    @Mock
    private SettlementGatewayClient gateway;
    @Mock
    private TransferNotificationDispatcher notifications;

    private SettlementProcessor processor;
    private Transfer transfer;

    @BeforeEach
    void setUp() {
        TransferProperties properties = new TransferProperties();
        properties.getSettlement().setTimeout(Duration.ofMillis(200));
        processor = new SettlementProcessor(
                ledger, gateway, new SettlementFailureClassifier(), notifications, properties);

        transfer = new Transfer();
        transfer.setTransferId(TRANSFER_ID);
        transfer.setUserId("user-1");
        transfer.setAmount(new BigDecimal("500.00"));
        transfer.setCurrency("NGN");
        transfer.setStatus(TransferStatus.PROCESSING);
        transfer.setRecipientInfo(new RecipientInfo("John Doe", "1234567890", "044"));
    }

    private Transfer withStatus(TransferStatus status) {
        Transfer resolved = new Transfer();
        resolved.setTransferId(TRANSFER_ID);
        resolved.setStatus(status);
        return resolved;
    }

    @Test
    @DisplayName("gateway success completes the transfer keyed by its id")
    void successCompletes() throws Exception {
        SettlementResult ok = SettlementResult.succeeded("BANK1", "Transfer processed successfully");
        Transfer completed = withStatus(TransferStatus.COMPLETED);
        when(ledger.findProcessing(TRANSFER_ID)).thenReturn(Optional.of(transfer));
        when(ledger.hasFundsFor(transfer)).thenReturn(true);
        when(gateway.submit(any())).thenReturn(CompletableFuture.completedFuture(ok));
        when(ledger.complete(TRANSFER_ID, ok)).thenReturn(Optional.of(completed));

        processor.settle(TRANSFER_ID);

        ArgumentCaptor<SettlementRequest> request = ArgumentCaptor.forClass(SettlementRequest.class);
        verify(gateway).submit(request.capture());
        assertThat(request.getValue().getReference()).isEqualTo(TRANSFER_ID);
        assertThat(request.getValue().getAmount()).isEqualByComparingTo("500.00");
        verify(notifications).update(completed);
        verify(ledger, never()).fail(anyString(), any(), any(), any());
    }

    @Test
    @DisplayName("gateway decline fails the transfer with the rail's message")
    void declineFails() throws Exception {
        Transfer failed = withStatus(TransferStatus.FAILED);
        when(ledger.findProcessing(TRANSFER_ID)).thenReturn(Optional.of(transfer));
        when(ledger.hasFundsFor(transfer)).thenReturn(true);
        when(gateway.submit(any())).thenReturn(CompletableFuture.completedFuture(
                SettlementResult.failed("Insufficient funds or bank processing error")));
        when(ledger.fail(TRANSFER_ID, SettlementFailureCategory.GATEWAY_DECLINED,
                "Insufficient funds or bank processing error", null)).thenReturn(Optional.of(failed));

        processor.settle(TRANSFER_ID);

        verify(ledger, never()).complete(anyString(), any());
        verify(notifications).update(failed);
    }

    @Test
    @DisplayName("a gateway that never answers is a timeout failure")
    void timeoutFails() throws Exception {
        when(ledger.findProcessing(TRANSFER_ID)).thenReturn(Optional.of(transfer));
        when(ledger.hasFundsFor(transfer)).thenReturn(true);
        when(gateway.submit(any())).thenReturn(new CompletableFuture<>());
        when(ledger.fail(eq(TRANSFER_ID), eq(SettlementFailureCategory.GATEWAY_TIMEOUT), anyString(), isNull()))
                .thenReturn(Optional.of(withStatus(TransferStatus.FAILED)));

        processor.settle(TRANSFER_ID);

        verify(ledger).fail(TRANSFER_ID, SettlementFailureCategory.GATEWAY_TIMEOUT,
                "Settlement gateway timed out", null);
    }

    @Test
    @DisplayName("an unexpected error is recorded as a system failure")
    void unexpectedErrorFails() throws Exception {
        when(ledger.findProcessing(TRANSFER_ID)).thenReturn(Optional.of(transfer));
        when(ledger.hasFundsFor(transfer)).thenReturn(true);
        when(gateway.submit(any())).thenThrow(new IllegalStateException("connection reset"));
        when(ledger.fail(TRANSFER_ID, SettlementFailureCategory.SYSTEM_ERROR, "connection reset", null))
                .thenReturn(Optional.of(withStatus(TransferStatus.FAILED)));

        processor.settle(TRANSFER_ID);

        verify(ledger).fail(TRANSFER_ID, SettlementFailureCategory.SYSTEM_ERROR, "connection reset", null);
    }

    @Test
    @DisplayName("short balance fails before the rail is contacted")
    void preCheckSkipsGateway() throws Exception {
        when(ledger.findProcessing(TRANSFER_ID)).thenReturn(Optional.of(transfer));
        when(ledger.hasFundsFor(transfer)).thenReturn(false);
        when(ledger.fail(TRANSFER_ID, SettlementFailureCategory.INSUFFICIENT_FUNDS, "Insufficient balance", null))
                .thenReturn(Optional.of(withStatus(TransferStatus.FAILED)));

        processor.settle(TRANSFER_ID);

        verifyNoInteractions(gateway);
    }

    @Test
    @DisplayName("a transfer no longer PROCESSING is left alone")
    void skipsResolvedTransfer() throws Exception {
        when(ledger.findProcessing(TRANSFER_ID)).thenReturn(Optional.empty());

        processor.settle(TRANSFER_ID);

        verifyNoInteractions(gateway, notifications);
    }

    @Test
    @DisplayName("a failing failure write does not escape the worker")
    void failureWriteErrorIsContained() throws Exception {
        when(ledger.findProcessing(TRANSFER_ID)).thenReturn(Optional.of(transfer));
        when(ledger.hasFundsFor(transfer)).thenReturn(true);
        when(gateway.submit(any())).thenThrow(new IllegalStateException("boom"));
        when(ledger.fail(anyString(), any(), any(), any())).thenThrow(new IllegalStateException("db down"));

        processor.settle(TRANSFER_ID);

        verifyNoInteractions(notifications);
    }
}
