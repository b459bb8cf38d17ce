package io.malicki.transferpipeline.domain.transfer;

import io.malicki.transferpipeline.api.dto.PageResponse;
import io.malicki.transferpipeline.api.dto.TransferResponse;
import io.malicki.transferpipeline.api.dto.TransferStatsResponse;
import io.malicki.transferpipeline.domain.user.User;
import io.malicki.transferpipeline.domain.user.UserRepository;
import io.malicki.transferpipeline.notification.TransferNotifier;
import io.malicki.transferpipeline.processing.TransferWorkQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read side of the admin console: the approval queue and aggregate counts.
 */
@Service
@Slf4j
public class TransferReviewService {

    private static final TransactionType EXTERNAL = TransactionType.EXTERNAL_TRANSFER;

    private final TransferRepository transferRepository;
    private final UserRepository userRepository;
    private final TransferValidator validator;
    private final TransferWorkQueue workQueue;
    private final TransferNotifier notifier;

    public TransferReviewService(
            TransferRepository transferRepository,
            UserRepository userRepository,
            TransferValidator validator,
            TransferWorkQueue workQueue,
            TransferNotifier notifier
    ) {
        this.transferRepository = transferRepository;
        this.userRepository = userRepository;
        this.validator = validator;
        this.workQueue = workQueue;
        this.notifier = notifier;
    }

    /**
     * PENDING transfers, oldest first, each with its owner attached.
     *
     * @param page one-based
     */
    @Transactional(readOnly = true)
    public PageResponse<TransferResponse> getPendingTransfers(Integer page, Integer limit) {
        int pageNumber = page == null || page < 1 ? 1 : page;
        int size = validator.adminPageSize(limit);

        Page<Transfer> pending = transferRepository.findByTypeAndStatusOrderByCreatedAtAsc(
                EXTERNAL, TransferStatus.PENDING, PageRequest.of(pageNumber - 1, size));

        Set<String> ownerIds = pending.getContent().stream()
                .map(Transfer::getUserId)
                .collect(Collectors.toSet());
        Map<String, User> owners = userRepository.findByIdIn(ownerIds).stream()
                .collect(Collectors.toMap(User::getId, Function.identity()));

        log.debug("📋 [TRANSFER] Pending page {} ({} of {})",
                pageNumber, pending.getNumberOfElements(), pending.getTotalElements());

        return PageResponse.of(pending, pageNumber,
                transfer -> TransferResponse.from(transfer, owners.get(transfer.getUserId())));
    }

    @Transactional(readOnly = true)
    public TransferStatsResponse getStats() {
        long pending = transferRepository.countByTypeAndStatus(EXTERNAL, TransferStatus.PENDING);
        long processing = transferRepository.countByTypeAndStatus(EXTERNAL, TransferStatus.PROCESSING);
        long completed = transferRepository.countByTypeAndStatus(EXTERNAL, TransferStatus.COMPLETED);
        long rejected = transferRepository.countByTypeAndStatus(EXTERNAL, TransferStatus.REJECTED);
        long failed = transferRepository.countByTypeAndStatus(EXTERNAL, TransferStatus.FAILED);

        BigDecimal volume = transferRepository.sumAmountByTypeAndStatus(EXTERNAL, TransferStatus.COMPLETED);

        TransferStatsResponse.Counts counts = new TransferStatsResponse.Counts(
                pending, processing, completed, rejected, failed,
                pending + processing + completed + rejected + failed);

        return new TransferStatsResponse(
                counts,
                volume != null ? volume : BigDecimal.ZERO,
                workQueue.getPendingJobs(),
                notifier.connectedUsers().size());
    }
}
