package io.malicki.transferpipeline.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.malicki.transferpipeline.domain.transfer.RecipientInfo;
import io.malicki.transferpipeline.domain.transfer.TransactionType;
import io.malicki.transferpipeline.domain.transfer.Transfer;
import io.malicki.transferpipeline.domain.transfer.TransferStatus;
import io.malicki.transferpipeline.domain.transfer.audit.TransferAuditEvent;
import io.malicki.transferpipeline.domain.user.User;
import io.malicki.transferpipeline.domain.user.UserRole;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outward view of a transfer, used by HTTP responses and push events alike.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TransferResponse {

    private String id;
    private String userId;
    private TransactionType type;
    private BigDecimal amount;
    private String currency;
    private TransferStatus status;
    private String description;
    private RecipientInfo recipientInfo;
    private Map<String, Object> metadata;
    private List<TransferAuditEvent> auditTrail;
    private String reference;
    private Instant createdAt;
    private Instant updatedAt;
    private UserSummary user;   // admin listings only

    public static TransferResponse from(Transfer transfer) {
        return from(transfer, null);
    }

    public static TransferResponse from(Transfer transfer, User owner) {
        return new TransferResponse(
            transfer.getTransferId(),
            transfer.getUserId(),
            transfer.getType(),
            transfer.getAmount(),
            transfer.getCurrency(),
            transfer.getStatus(),
            transfer.getDescription(),
            transfer.getRecipientInfo(),
            transfer.metadata(),
            transfer.getAuditTrail(),
            transfer.getReference(),
            transfer.getCreatedAt(),
            transfer.getUpdatedAt(),
            owner != null ? UserSummary.from(owner) : null
        );
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UserSummary {
        private String id;
        private String email;
        private String name;
        private UserRole role;

        public static UserSummary from(User user) {
            return new UserSummary(user.getId(), user.getEmail(), user.getName(), user.getRole());
        }
    }
}
