package io.malicki.transferpipeline.domain.transfer.audit;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
public class ApprovedEvent extends TransferAuditEvent {

    private String approvedBy;
    private String notes;

    public ApprovedEvent(Instant occurredAt, String approvedBy, String notes) {
        super(occurredAt);
        this.approvedBy = approvedBy;
        this.notes = notes;
    }

    @Override
    public void contributeTo(Map<String, Object> metadata) {
        metadata.put("approvedBy", approvedBy);
        metadata.put("approvedAt", timestamp());
        if (notes != null) {
            metadata.put("adminNotes", notes);
        }
        metadata.put("processingStartedAt", timestamp());
    }
}
