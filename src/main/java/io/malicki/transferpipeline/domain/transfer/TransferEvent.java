package io.malicki.transferpipeline.domain.transfer;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * Lifecycle message published to Kafka through the outbox.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TransferEvent implements Serializable {

    private String transferId;
    private String userId;
    private BigDecimal amount;
    private String currency;
    private TransferStatus status;
    private String reference;
    private Instant timestamp;

    public static TransferEvent from(Transfer transfer) {
        return new TransferEvent(
            transfer.getTransferId(),
            transfer.getUserId(),
            transfer.getAmount(),
            transfer.getCurrency(),
            transfer.getStatus(),
            transfer.getReference(),
            transfer.getUpdatedAt()
        );
    }
}
