package io.malicki.transferpipeline.domain.transfer.audit;

import io.malicki.transferpipeline.domain.transfer.SettlementFailureCategory;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
public class SettlementFailedEvent extends TransferAuditEvent {

    private SettlementFailureCategory category;
    private String reason;

    // Set when the rail accepted the money but the debit could not be applied
    private String bankReference;

    public SettlementFailedEvent(Instant occurredAt, SettlementFailureCategory category,
                                 String reason, String bankReference) {
        super(occurredAt);
        this.category = category;
        this.reason = reason;
        this.bankReference = bankReference;
    }

    @Override
    public void contributeTo(Map<String, Object> metadata) {
        metadata.put("failedAt", timestamp());
        metadata.put("failureCategory", category != null ? category.name() : null);
        metadata.put(category != null && category.isSystemFault() ? "systemError" : "bankError", reason);
        if (bankReference != null) {
            metadata.put("bankReference", bankReference);
            metadata.put("requiresReconciliation", true);
        }
    }
}
