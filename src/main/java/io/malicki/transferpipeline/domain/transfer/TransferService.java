package io.malicki.transferpipeline.domain.transfer;

import io.malicki.transferpipeline.api.dto.CreateTransferRequest;
import io.malicki.transferpipeline.api.dto.PageResponse;
import io.malicki.transferpipeline.api.dto.TransferResponse;
import io.malicki.transferpipeline.config.TransferProperties;
import io.malicki.transferpipeline.domain.transfer.audit.SubmittedEvent;
import io.malicki.transferpipeline.domain.user.User;
import io.malicki.transferpipeline.domain.user.UserRepository;
import io.malicki.transferpipeline.exception.InsufficientFundsException;
import io.malicki.transferpipeline.exception.TransferNotFoundException;
import io.malicki.transferpipeline.exception.UserNotFoundException;
import io.malicki.transferpipeline.gateway.RecipientVerificationClient;
import io.malicki.transferpipeline.gateway.VerificationResult;
import io.malicki.transferpipeline.notification.TransferNotificationDispatcher;
import io.malicki.transferpipeline.processing.SettlementProcessor;
import io.malicki.transferpipeline.processing.TransferWorkQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Entry points of the external transfer lifecycle. HTTP-facing calls return as
 * soon as their ledger write is committed; verification and settlement run on
 * the {@link TransferWorkQueue}.
 */
@Service
@Slf4j
public class TransferService {

    private final TransferRepository transferRepository;
    private final UserRepository userRepository;
    private final TransferLedger ledger;
    private final TransferValidator validator;
    private final TransferWorkQueue workQueue;
    private final SettlementProcessor settlementProcessor;
    private final RecipientVerificationClient verificationClient;
    private final TransferNotificationDispatcher notifications;
    private final TransferProperties properties;

    public TransferService(
            TransferRepository transferRepository,
            UserRepository userRepository,
            TransferLedger ledger,
            TransferValidator validator,
            TransferWorkQueue workQueue,
            SettlementProcessor settlementProcessor,
            RecipientVerificationClient verificationClient,
            TransferNotificationDispatcher notifications,
            TransferProperties properties
    ) {
        this.transferRepository = transferRepository;
        this.userRepository = userRepository;
        this.ledger = ledger;
        this.validator = validator;
        this.workQueue = workQueue;
        this.settlementProcessor = settlementProcessor;
        this.verificationClient = verificationClient;
        this.notifications = notifications;
        this.properties = properties;
    }

    public Transfer createTransfer(String userId, CreateTransferRequest request) {
        BigDecimal amount = validator.validateAmount(request.getAmount());
        String currency = validator.validateCurrency(request.getCurrency());
        RecipientInfo recipient = validator.validateRecipient(request.getRecipientInfo());

        User user = userRepository.findById(userId)
                .filter(User::isActive)
                .orElseThrow(() -> new UserNotFoundException(userId));

        // Early check only; settlement re-checks under lock
        if (!user.canCover(amount)) {
            throw new InsufficientFundsException(userId, user.getBalance(), amount);
        }

        String transferId = UUID.randomUUID().toString();
        log.info("🏦 [TRANSFER] Creating {} | User: {} → {} ({}) | Amount: {} {}",
                transferId, userId, recipient.getAccountNumber(), recipient.getBankCode(), amount, currency);

        Transfer transfer = new Transfer();
        transfer.setTransferId(transferId);
        transfer.setUserId(userId);
        transfer.setType(TransactionType.EXTERNAL_TRANSFER);
        transfer.setAmount(amount);
        transfer.setCurrency(currency);
        transfer.setStatus(TransferStatus.PENDING);
        transfer.setRecipientInfo(recipient);
        transfer.setDescription(request.getDescription() != null && !request.getDescription().isBlank()
                ? request.getDescription().trim()
                : "Transfer to " + recipient.getName());
        transfer.recordAuditEvent(new SubmittedEvent(Instant.now(), userId));

        Transfer saved = ledger.createPending(transfer);

        notifications.pending(saved);
        workQueue.enqueue("verify:" + transferId, () -> verifyRecipient(transferId, recipient));

        return saved;
    }

    private void verifyRecipient(String transferId, RecipientInfo recipient) {
        try {
            VerificationResult result = verificationClient.verify(recipient)
                    .get(properties.getVerification().getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            ledger.recordVerification(transferId, result);

            log.info("🔎 [VERIFICATION] Transfer {} recipient {} | Name on account: {}",
                    transferId, result.isValid() ? "verified" : "not verified", result.getAccountName());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("⚠️ [VERIFICATION] Interrupted for transfer {}, transfer continues", transferId);
        } catch (Exception e) {
            log.warn("⚠️ [VERIFICATION] Failed for transfer {}, transfer continues: {}",
                    transferId, e.getMessage());
        }
    }

    /**
     * Poll fallback for the push channel. Never fails: store errors degrade
     * to an empty list.
     */
    public List<Transfer> listUpdates(String userId, Integer limit, Instant since) {
        try {
            PageRequest page = PageRequest.of(0, validator.pollingLimit(limit));
            if (since == null) {
                return transferRepository.findByUserIdAndTypeOrderByUpdatedAtDesc(
                        userId, TransactionType.EXTERNAL_TRANSFER, page);
            }
            return transferRepository.findByUserIdAndTypeAndUpdatedAtGreaterThanEqualOrderByUpdatedAtDesc(
                    userId, TransactionType.EXTERNAL_TRANSFER, since, page);
        } catch (Exception e) {
            log.warn("⚠️ [TRANSFER] Poll for user {} failed, returning no updates: {}", userId, e.getMessage());
            return List.of();
        }
    }

    /**
     * Full ledger history of the user, newest first.
     *
     * @param page one-based
     */
    @Transactional(readOnly = true)
    public PageResponse<TransferResponse> getTransactionHistory(String userId, Integer page, Integer limit) {
        int pageNumber = page == null || page < 1 ? 1 : page;
        int size = validator.historyPageSize(limit);

        Page<Transfer> history = transferRepository.findByUserIdOrderByCreatedAtDesc(
                userId, PageRequest.of(pageNumber - 1, size));

        log.debug("📜 [TRANSFER] History page {} for user {} ({} of {})",
                pageNumber, userId, history.getNumberOfElements(), history.getTotalElements());

        return PageResponse.of(history, pageNumber, transfer -> TransferResponse.from(transfer));
    }

    public Transfer getUserTransfer(String userId, String transferId) {
        return transferRepository.findByTransferIdAndUserId(transferId, userId)
                .orElseThrow(() -> new TransferNotFoundException(transferId));
    }

    public Transfer approve(String transferId, String adminId, String notes) {
        String trimmedNotes = notes != null && !notes.isBlank() ? notes.trim() : null;
        Transfer approved = ledger.approve(transferId, adminId, trimmedNotes);

        notifications.update(approved);
        workQueue.enqueue("settle:" + transferId, () -> settlementProcessor.settle(transferId));

        return approved;
    }

    public Transfer reject(String transferId, String adminId, String reason) {
        String validReason = validator.requireRejectionReason(reason);
        Transfer rejected = ledger.reject(transferId, adminId, validReason);

        notifications.update(rejected);
        return rejected;
    }
}
