package io.malicki.transferpipeline.domain.transfer.audit;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.Map;

/**
 * One entry of a transfer's audit trail. Entries are only ever appended;
 * {@link #contributeTo(Map)} folds an entry into the flat metadata view
 * returned to clients.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "event")
@JsonSubTypes({
    @JsonSubTypes.Type(value = SubmittedEvent.class, name = "SUBMITTED"),
    @JsonSubTypes.Type(value = RecipientVerifiedEvent.class, name = "RECIPIENT_VERIFIED"),
    @JsonSubTypes.Type(value = ApprovedEvent.class, name = "APPROVED"),
    @JsonSubTypes.Type(value = RejectedEvent.class, name = "REJECTED"),
    @JsonSubTypes.Type(value = SettlementSucceededEvent.class, name = "SETTLEMENT_SUCCEEDED"),
    @JsonSubTypes.Type(value = SettlementFailedEvent.class, name = "SETTLEMENT_FAILED")
})
@Getter
@Setter
@NoArgsConstructor
public abstract class TransferAuditEvent {

    private Instant occurredAt;

    protected TransferAuditEvent(Instant occurredAt) {
        this.occurredAt = occurredAt;
    }

    public abstract void contributeTo(Map<String, Object> metadata);

    protected String timestamp() {
        return occurredAt != null ? occurredAt.toString() : null;
    }
}
