package io.malicki.transferpipeline.domain.transfer.audit;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
public class SettlementSucceededEvent extends TransferAuditEvent {

    private String bankReference;
    private String bankMessage;

    public SettlementSucceededEvent(Instant occurredAt, String bankReference, String bankMessage) {
        super(occurredAt);
        this.bankReference = bankReference;
        this.bankMessage = bankMessage;
    }

    @Override
    public void contributeTo(Map<String, Object> metadata) {
        metadata.put("completedAt", timestamp());
        metadata.put("bankReference", bankReference);
        metadata.put("bankMessage", bankMessage);
    }
}
