package io.malicki.transferpipeline.domain.transfer;

import io.malicki.transferpipeline.domain.transfer.audit.ApprovedEvent;
import io.malicki.transferpipeline.domain.transfer.audit.RecipientVerifiedEvent;
import io.malicki.transferpipeline.domain.transfer.audit.RejectedEvent;
import io.malicki.transferpipeline.domain.transfer.audit.SettlementFailedEvent;
import io.malicki.transferpipeline.domain.transfer.audit.SettlementSucceededEvent;
import io.malicki.transferpipeline.domain.user.User;
import io.malicki.transferpipeline.domain.user.UserRepository;
import io.malicki.transferpipeline.exception.InvalidTransferStateException;
import io.malicki.transferpipeline.exception.TransferNotFoundException;
import io.malicki.transferpipeline.gateway.SettlementResult;
import io.malicki.transferpipeline.gateway.VerificationResult;
import io.malicki.transferpipeline.kafka.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * Every write to a transfer row goes through here. Each method is one
 * transaction that changes the ledger and records the matching outbox event.
 * <p>
 * Status transitions out of PENDING use a conditional update on the status
 * column, so two admins racing on the same transfer cannot both win.
 * Settlement writes lock the transfer and user rows and only act while the
 * transfer is still PROCESSING.
 */
@Service
@Slf4j
public class TransferLedger {

    private final TransferRepository transferRepository;
    private final UserRepository userRepository;
    private final OutboxService outboxService;

    public TransferLedger(
            TransferRepository transferRepository,
            UserRepository userRepository,
            OutboxService outboxService
    ) {
        this.transferRepository = transferRepository;
        this.userRepository = userRepository;
        this.outboxService = outboxService;
    }

    @Transactional
    public Transfer createPending(Transfer transfer) {
        Transfer saved = transferRepository.save(transfer);
        outboxService.record(saved, "TransferCreated");

        log.info("✅ [TRANSFER] Saved {} as PENDING | User: {} | Amount: {} {}",
                saved.getTransferId(), saved.getUserId(), saved.getAmount(), saved.getCurrency());
        return saved;
    }

    /**
     * Appends the verification outcome. Ignored once the transfer is terminal.
     */
    @Transactional
    public Optional<Transfer> recordVerification(String transferId, VerificationResult result) {
        Transfer transfer = transferRepository.findByTransferIdWithLock(transferId)
                .orElseThrow(() -> new TransferNotFoundException(transferId));

        if (transfer.getStatus().isTerminal()) {
            log.info("🔎 [VERIFICATION] Transfer {} already {}, verification result not recorded",
                    transferId, transfer.getStatus());
            return Optional.empty();
        }

        transfer.recordAuditEvent(new RecipientVerifiedEvent(
                Instant.now(), result.isValid(), result.getAccountName()));
        transfer.setUpdatedAt(Instant.now());
        Transfer saved = transferRepository.save(transfer);
        outboxService.record(saved, "TransferVerified");

        return Optional.of(saved);
    }

    @Transactional
    public Transfer approve(String transferId, String adminId, String notes) {
        Transfer transfer = leavePending(transferId, TransferStatus.PROCESSING);

        transfer.recordAuditEvent(new ApprovedEvent(transfer.getUpdatedAt(), adminId, notes));
        Transfer saved = transferRepository.save(transfer);
        outboxService.record(saved, "TransferApproved");

        log.info("👍 [TRANSFER] {} approved by {} → PROCESSING", transferId, adminId);
        return saved;
    }

    @Transactional
    public Transfer reject(String transferId, String adminId, String reason) {
        Transfer transfer = leavePending(transferId, TransferStatus.REJECTED);

        transfer.recordAuditEvent(new RejectedEvent(transfer.getUpdatedAt(), adminId, reason));
        Transfer saved = transferRepository.save(transfer);
        outboxService.record(saved, "TransferRejected");

        log.info("👎 [TRANSFER] {} rejected by {} | Reason: {}", transferId, adminId, reason);
        return saved;
    }

    private Transfer leavePending(String transferId, TransferStatus next) {
        int moved = transferRepository.compareAndSetStatus(
                transferId, TransferStatus.PENDING, next, Instant.now());

        if (moved == 0) {
            Transfer current = transferRepository.findByTransferId(transferId)
                    .orElseThrow(() -> new TransferNotFoundException(transferId));
            throw new InvalidTransferStateException(transferId, current.getStatus(), TransferStatus.PENDING);
        }

        return transferRepository.findByTransferId(transferId)
                .orElseThrow(() -> new TransferNotFoundException(transferId));
    }

    @Transactional(readOnly = true)
    public Optional<Transfer> findProcessing(String transferId) {
        return transferRepository.findByTransferId(transferId)
                .filter(transfer -> transfer.getStatus() == TransferStatus.PROCESSING);
    }

    /**
     * Unlocked read used before the gateway call. {@link #complete} repeats the
     * check under the user row lock.
     */
    @Transactional(readOnly = true)
    public boolean hasFundsFor(Transfer transfer) {
        return userRepository.findById(transfer.getUserId())
                .map(user -> user.canCover(transfer.getAmount()))
                .orElse(false);
    }

    /**
     * Applies a successful settlement: debits the user and marks the transfer
     * COMPLETED in one transaction. If the balance no longer covers the amount
     * the transfer is marked FAILED instead and the bank reference is kept for
     * reconciliation.
     *
     * @return the updated transfer, or empty if it was no longer PROCESSING
     */
    @Transactional
    public Optional<Transfer> complete(String transferId, SettlementResult result) {
        Transfer transfer = transferRepository.findByTransferIdWithLock(transferId)
                .orElseThrow(() -> new TransferNotFoundException(transferId));

        if (!transfer.getStatus().canTransitionTo(TransferStatus.COMPLETED)) {
            log.warn("⚠️ [SETTLEMENT] Transfer {} is {}, skipping completion", transferId, transfer.getStatus());
            return Optional.empty();
        }

        Optional<User> owner = userRepository.findByIdWithLock(transfer.getUserId())
                .filter(User::isActive);
        if (owner.isEmpty()) {
            return Optional.of(markFailed(transfer, SettlementFailureCategory.SYSTEM_ERROR,
                    "User not found or inactive", result.getReference()));
        }

        User user = owner.get();
        if (!user.canCover(transfer.getAmount())) {
            log.error("❌ [SETTLEMENT] Balance dropped below {} for user {} before debit of {}",
                    transfer.getAmount(), user.getId(), transferId);
            return Optional.of(markFailed(transfer, SettlementFailureCategory.INSUFFICIENT_FUNDS,
                    "Insufficient balance", result.getReference()));
        }

        user.withdraw(transfer.getAmount());
        userRepository.save(user);

        Instant now = Instant.now();
        transfer.setStatus(TransferStatus.COMPLETED);
        transfer.setReference(result.getReference());
        transfer.setUpdatedAt(now);
        transfer.recordAuditEvent(new SettlementSucceededEvent(now, result.getReference(), result.getMessage()));
        Transfer saved = transferRepository.save(transfer);
        outboxService.record(saved, "TransferCompleted");

        log.info("💰 [SETTLEMENT] Transfer {} COMPLETED | Reference: {} | New balance: {}",
                transferId, result.getReference(), user.getBalance());
        return Optional.of(saved);
    }

    /**
     * Marks a PROCESSING transfer FAILED. The balance is not touched.
     *
     * @return the updated transfer, or empty if it was no longer PROCESSING
     */
    @Transactional
    public Optional<Transfer> fail(String transferId, SettlementFailureCategory category,
                                   String reason, String bankReference) {
        Transfer transfer = transferRepository.findByTransferIdWithLock(transferId)
                .orElseThrow(() -> new TransferNotFoundException(transferId));

        if (!transfer.getStatus().canTransitionTo(TransferStatus.FAILED)) {
            log.warn("⚠️ [SETTLEMENT] Transfer {} is {}, skipping failure", transferId, transfer.getStatus());
            return Optional.empty();
        }

        return Optional.of(markFailed(transfer, category, reason, bankReference));
    }

    private Transfer markFailed(Transfer transfer, SettlementFailureCategory category,
                                String reason, String bankReference) {
        Instant now = Instant.now();
        transfer.setStatus(TransferStatus.FAILED);
        transfer.setUpdatedAt(now);
        transfer.recordAuditEvent(new SettlementFailedEvent(now, category, reason, bankReference));
        Transfer saved = transferRepository.save(transfer);
        outboxService.record(saved, "TransferFailed");

        log.error("❌ [SETTLEMENT] Transfer {} FAILED | Category: {} | Reason: {}",
                transfer.getTransferId(), category, reason);
        return saved;
    }
}
