package io.malicki.transferpipeline.domain.transfer;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface TransferRepository extends JpaRepository<Transfer, Long> {

    Optional<Transfer> findByTransferId(String transferId);

    Optional<Transfer> findByTransferIdAndUserId(String transferId, String userId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM Transfer t WHERE t.transferId = :transferId")
    Optional<Transfer> findByTransferIdWithLock(@Param("transferId") String transferId);

    /**
     * Compare-and-set on the status column. Returns the number of rows moved,
     * so 0 means another request already took the transfer out of {@code expected}.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Transfer t SET t.status = :next, t.updatedAt = :now, t.version = t.version + 1 " +
           "WHERE t.transferId = :transferId AND t.status = :expected")
    int compareAndSetStatus(@Param("transferId") String transferId,
                            @Param("expected") TransferStatus expected,
                            @Param("next") TransferStatus next,
                            @Param("now") Instant now);

    List<Transfer> findByUserIdAndTypeOrderByUpdatedAtDesc(String userId, TransactionType type, Pageable pageable);

    List<Transfer> findByUserIdAndTypeAndUpdatedAtGreaterThanEqualOrderByUpdatedAtDesc(
            String userId, TransactionType type, Instant since, Pageable pageable);

    // Every ledger row of the user, not only external transfers
    Page<Transfer> findByUserIdOrderByCreatedAtDesc(String userId, Pageable pageable);

    Page<Transfer> findByTypeAndStatusOrderByCreatedAtAsc(TransactionType type, TransferStatus status, Pageable pageable);

    List<Transfer> findByTypeAndStatus(TransactionType type, TransferStatus status);

    long countByTypeAndStatus(TransactionType type, TransferStatus status);

    @Query("SELECT COALESCE(SUM(t.amount), 0) FROM Transfer t WHERE t.type = :type AND t.status = :status")
    BigDecimal sumAmountByTypeAndStatus(@Param("type") TransactionType type,
                                        @Param("status") TransferStatus status);
}
