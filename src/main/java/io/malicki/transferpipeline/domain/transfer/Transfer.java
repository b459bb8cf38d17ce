package io.malicki.transferpipeline.domain.transfer;

import io.malicki.transferpipeline.domain.transfer.audit.AuditTrailConverter;
import io.malicki.transferpipeline.domain.transfer.audit.TransferAuditEvent;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Entity
@Table(
    name = "transactions",
    indexes = {
        @Index(name = "idx_transfer_id", columnList = "transferId", unique = true),
        @Index(name = "idx_type_status", columnList = "type, status"),
        @Index(name = "idx_user_updated_at", columnList = "userId, updatedAt"),
        @Index(name = "idx_created_at", columnList = "createdAt")
    }
)
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Transfer {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 36, updatable = false)
    private String transferId;  // UUID - also the settlement idempotency key

    @Column(nullable = false, length = 36, updatable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30, updatable = false)
    private TransactionType type;

    @Column(nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal amount;

    @Column(nullable = false, length = 3, updatable = false)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TransferStatus status;

    @Embedded
    private RecipientInfo recipientInfo;

    @Column(length = 200)
    private String description;

    @Column(length = 64)
    private String reference;

    // Append-only; replace the list rather than mutating it so dirty checking sees the change
    @Convert(converter = AuditTrailConverter.class)
    @Column(name = "metadata", nullable = false, columnDefinition = "TEXT")
    private List<TransferAuditEvent> auditTrail = new ArrayList<>();

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
        if (status == null) {
            status = TransferStatus.PENDING;
        }
        if (type == null) {
            type = TransactionType.EXTERNAL_TRANSFER;
        }
    }

    public void recordAuditEvent(TransferAuditEvent event) {
        List<TransferAuditEvent> next = new ArrayList<>(auditTrail == null ? List.of() : auditTrail);
        next.add(event);
        this.auditTrail = next;
    }

    public List<TransferAuditEvent> getAuditTrail() {
        return auditTrail == null ? List.of() : Collections.unmodifiableList(auditTrail);
    }

    /**
     * Flat key/value view of the audit trail. Later events win on key collisions.
     */
    public Map<String, Object> metadata() {
        Map<String, Object> merged = new LinkedHashMap<>();
        getAuditTrail().forEach(event -> event.contributeTo(merged));
        return merged;
    }
}
