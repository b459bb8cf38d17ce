package io.malicki.transferpipeline.domain.transfer.audit;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
public class RejectedEvent extends TransferAuditEvent {

    private String rejectedBy;
    private String reason;

    public RejectedEvent(Instant occurredAt, String rejectedBy, String reason) {
        super(occurredAt);
        this.rejectedBy = rejectedBy;
        this.reason = reason;
    }

    @Override
    public void contributeTo(Map<String, Object> metadata) {
        metadata.put("rejectedBy", rejectedBy);
        metadata.put("rejectedAt", timestamp());
        metadata.put("rejectionReason", reason);
    }
}
