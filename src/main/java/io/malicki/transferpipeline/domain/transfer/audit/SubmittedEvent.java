package io.malicki.transferpipeline.domain.transfer.audit;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
public class SubmittedEvent extends TransferAuditEvent {

    private String submittedBy;

    public SubmittedEvent(Instant occurredAt, String submittedBy) {
        super(occurredAt);
        this.submittedBy = submittedBy;
    }

    @Override
    public void contributeTo(Map<String, Object> metadata) {
        metadata.put("submittedAt", timestamp());
        metadata.put("submittedBy", submittedBy);
        metadata.put("requiresApproval", true);
        metadata.put("verifiedRecipient", false);
    }
}
