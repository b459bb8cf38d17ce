package io.malicki.transferpipeline.domain.transfer.audit;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
public class RecipientVerifiedEvent extends TransferAuditEvent {

    private boolean valid;
    private String accountName;

    public RecipientVerifiedEvent(Instant occurredAt, boolean valid, String accountName) {
        super(occurredAt);
        this.valid = valid;
        this.accountName = accountName;
    }

    @Override
    public void contributeTo(Map<String, Object> metadata) {
        Map<String, Object> verification = new LinkedHashMap<>();
        verification.put("isValid", valid);
        verification.put("accountName", accountName);
        metadata.put("recipientVerification", verification);
        metadata.put("verifiedAt", timestamp());
        metadata.put("verifiedRecipient", valid);
    }
}
