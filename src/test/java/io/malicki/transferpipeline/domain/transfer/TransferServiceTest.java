package io.malicki.transferpipeline.domain.transfer;

import io.malicki.transferpipeline.api.dto.CreateTransferRequest;
import io.malicki.transferpipeline.api.dto.PageResponse;
import io.malicki.transferpipeline.api.dto.RecipientInfoRequest;
import io.malicki.transferpipeline.config.TransferProperties;
import io.malicki.transferpipeline.domain.user.User;
import io.malicki.transferpipeline.domain.user.UserRepository;
import io.malicki.transferpipeline.domain.user.UserRole;
import io.malicki.transferpipeline.exception.InsufficientFundsException;
import io.malicki.transferpipeline.exception.TransferValidationException;
import io.malicki.transferpipeline.exception.UserNotFoundException;
import io.malicki.transferpipeline.gateway.RecipientVerificationClient;
import io.malicki.transferpipeline.gateway.VerificationResult;
import io.malicki.transferpipeline.notification.TransferNotificationDispatcher;
import io.malicki.transferpipeline.processing.SettlementProcessor;
import io.malicki.transferpipeline.processing.TransferJob;
import io.malicki.transferpipeline.processing.TransferWorkQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("TransferService")
class TransferServiceTest {

    private static final String USER_ID = "user-1";
    private static final String ADMIN_ID = "admin-1";

    @Mock
    private TransferRepository transferRepository;
    @Mock
    private UserRepository userRepository;
    @Mock
    private TransferLedger ledger;
    @Mock
    private TransferWorkQueue workQueue;
    @Mock
    private SettlementProcessor settlementProcessor;
    @Mock
    private RecipientVerificationClient verificationClient;
    @Mock
    private TransferNotificationDispatcher notifications;

    private TransferService transferService;

    @BeforeEach
    void setUp() {
        TransferProperties properties = new TransferProperties();
        transferService = new TransferService(
                transferRepository,
                userRepository,
                ledger,
                new TransferValidator(properties),
                workQueue,
                settlementProcessor,
                verificationClient,
                notifications,
                properties
        );
    }

    private static User user(String balance, boolean active) {
        User user = new User();
        user.setId(USER_ID);
        user.setEmail("ada@example.com");
        user.setName("Ada");
        user.setRole(UserRole.USER);
        user.setBalance(new BigDecimal(balance));
        user.setActive(active);
        return user;
    }

    private static CreateTransferRequest request(String amount) {
        return new CreateTransferRequest(amount, null,
                new RecipientInfoRequest("John Doe", "1234567890", "044"), null);
    }

    private TransferJob capturedJob(String namePrefix) {
        ArgumentCaptor<TransferJob> job = ArgumentCaptor.forClass(TransferJob.class);
        verify(workQueue).enqueue(startsWith(namePrefix), job.capture());
        return job.getValue();
    }

    @Nested
    @DisplayName("createTransfer")
    class CreateTransfer {

        @Test
        @DisplayName("persists a PENDING transfer without touching the balance")
        void createsPending() {
            User user = user("1000", true);
            when(userRepository.findById(USER_ID)).thenReturn(Optional.of(user));
            when(ledger.createPending(any(Transfer.class))).thenAnswer(inv -> inv.getArgument(0));

            Transfer created = transferService.createTransfer(USER_ID, request("500"));

            assertThat(created.getStatus()).isEqualTo(TransferStatus.PENDING);
            assertThat(created.getType()).isEqualTo(TransactionType.EXTERNAL_TRANSFER);
            assertThat(created.getAmount()).isEqualByComparingTo("500");
            assertThat(created.getCurrency()).isEqualTo("NGN");
            assertThat(created.getDescription()).isEqualTo("Transfer to John Doe");
            assertThat(created.getTransferId()).isNotBlank();
            assertThat(created.metadata())
                    .containsEntry("submittedBy", USER_ID)
                    .containsKey("submittedAt");
            assertThat(user.getBalance()).isEqualByComparingTo("1000");

            verify(notifications).pending(created);
            verify(workQueue).enqueue(eq("verify:" + created.getTransferId()), any(TransferJob.class));
        }

        @Test
        @DisplayName("refuses when the balance is short and creates nothing")
        void insufficientBalance() {
            when(userRepository.findById(USER_ID)).thenReturn(Optional.of(user("100", true)));

            assertThatThrownBy(() -> transferService.createTransfer(USER_ID, request("500")))
                    .isInstanceOf(InsufficientFundsException.class)
                    .hasMessage("Insufficient balance");

            verifyNoInteractions(ledger, workQueue, notifications);
        }

        @Test
        @DisplayName("refuses inactive users")
        void inactiveUser() {
            when(userRepository.findById(USER_ID)).thenReturn(Optional.of(user("1000", false)));

            assertThatThrownBy(() -> transferService.createTransfer(USER_ID, request("500")))
                    .isInstanceOf(UserNotFoundException.class);
        }

        @Test
        @DisplayName("validates before looking the user up")
        void validatesFirst() {
            assertThatThrownBy(() -> transferService.createTransfer(USER_ID, request("12.345")))
                    .isInstanceOf(TransferValidationException.class);

            verifyNoInteractions(userRepository, ledger);
        }

        @Test
        @DisplayName("verification job records the result")
        void verificationRecorded() throws Exception {
            when(userRepository.findById(USER_ID)).thenReturn(Optional.of(user("1000", true)));
            when(ledger.createPending(any(Transfer.class))).thenAnswer(inv -> inv.getArgument(0));
            VerificationResult result = new VerificationResult(true, "JOHN DOE");
            when(verificationClient.verify(any())).thenReturn(CompletableFuture.completedFuture(result));

            Transfer created = transferService.createTransfer(USER_ID, request("500"));
            capturedJob("verify:").run();

            verify(ledger).recordVerification(created.getTransferId(), result);
        }

        @Test
        @DisplayName("verification failure is absorbed")
        void verificationFailureAbsorbed() {
            when(userRepository.findById(USER_ID)).thenReturn(Optional.of(user("1000", true)));
            when(ledger.createPending(any(Transfer.class))).thenAnswer(inv -> inv.getArgument(0));
            when(verificationClient.verify(any()))
                    .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("bank offline")));

            transferService.createTransfer(USER_ID, request("500"));
            TransferJob job = capturedJob("verify:");

            assertThatCode(job::run).doesNotThrowAnyException();
            verify(ledger, never()).recordVerification(anyString(), any());
        }
    }

    @Nested
    @DisplayName("admin decisions")
    class AdminDecisions {

        @Test
        @DisplayName("approve pushes the update and queues settlement")
        void approveQueuesSettlement() throws Exception {
            Transfer processing = new Transfer();
            processing.setTransferId("t-1");
            processing.setUserId(USER_ID);
            processing.setStatus(TransferStatus.PROCESSING);
            when(ledger.approve("t-1", ADMIN_ID, "ok")).thenReturn(processing);

            Transfer result = transferService.approve("t-1", ADMIN_ID, "  ok ");

            assertThat(result.getStatus()).isEqualTo(TransferStatus.PROCESSING);
            verify(notifications).update(processing);

            capturedJob("settle:").run();
            verify(settlementProcessor).settle("t-1");
        }

        @Test
        @DisplayName("reject without a reason never reaches the ledger")
        void rejectNeedsReason() {
            assertThatThrownBy(() -> transferService.reject("t-1", ADMIN_ID, " "))
                    .isInstanceOf(TransferValidationException.class)
                    .hasMessage("Rejection reason is required");

            verifyNoInteractions(ledger, notifications);
        }

        @Test
        @DisplayName("reject pushes the update and queues nothing")
        void rejectNotifies() {
            Transfer rejected = new Transfer();
            rejected.setTransferId("t-1");
            rejected.setStatus(TransferStatus.REJECTED);
            when(ledger.reject("t-1", ADMIN_ID, "Suspicious")).thenReturn(rejected);

            transferService.reject("t-1", ADMIN_ID, "Suspicious");

            verify(notifications).update(rejected);
            verifyNoInteractions(workQueue);
        }
    }

    @Nested
    @DisplayName("listUpdates")
    class ListUpdates {

        @Test
        @DisplayName("degrades to an empty list when the store fails")
        void neverThrows() {
            when(transferRepository.findByUserIdAndTypeOrderByUpdatedAtDesc(
                    eq(USER_ID), eq(TransactionType.EXTERNAL_TRANSFER), any(Pageable.class)))
                    .thenThrow(new DataAccessResourceFailureException("db down"));

            assertThat(transferService.listUpdates(USER_ID, null, null)).isEmpty();
        }

        @Test
        @DisplayName("filters by since and clamps the limit")
        void usesSince() {
            Instant since = Instant.parse("2024-05-01T10:00:00Z");
            ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
            when(transferRepository.findByUserIdAndTypeAndUpdatedAtGreaterThanEqualOrderByUpdatedAtDesc(
                    eq(USER_ID), eq(TransactionType.EXTERNAL_TRANSFER), eq(since), page.capture()))
                    .thenReturn(List.of(new Transfer()));

            assertThat(transferService.listUpdates(USER_ID, 1000, since)).hasSize(1);
            assertThat(page.getValue().getPageSize()).isEqualTo(100);
        }
    }

    @Nested
    @DisplayName("getTransactionHistory")
    class TransactionHistory {

        @Test
        @DisplayName("maps the one-based page onto the repository and echoes pagination")
        void pagesNewestFirst() {
            Transfer transfer = new Transfer();
            transfer.setTransferId("t-9");
            transfer.setUserId(USER_ID);
            ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
            when(transferRepository.findByUserIdOrderByCreatedAtDesc(eq(USER_ID), page.capture()))
                    .thenReturn(new PageImpl<>(List.of(transfer), PageRequest.of(1, 10), 11));

            PageResponse<?> history = transferService.getTransactionHistory(USER_ID, 2, 10);

            assertThat(page.getValue().getPageNumber()).isEqualTo(1);
            assertThat(page.getValue().getPageSize()).isEqualTo(10);
            assertThat(history.getItems()).hasSize(1);
            assertThat(history.getPagination().getPage()).isEqualTo(2);
            assertThat(history.getPagination().getTotal()).isEqualTo(11);
            assertThat(history.getPagination().getTotalPages()).isEqualTo(2);
            assertThat(history.getPagination().isHasPrev()).isTrue();
            assertThat(history.getPagination().isHasNext()).isFalse();
        }

        @Test
        @DisplayName("falls back to page 1 of 20 and caps the limit at 100")
        void defaultsAndCaps() {
            ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
            when(transferRepository.findByUserIdOrderByCreatedAtDesc(eq(USER_ID), page.capture()))
                    .thenReturn(new PageImpl<>(List.of()));

            transferService.getTransactionHistory(USER_ID, null, null);
            transferService.getTransactionHistory(USER_ID, -3, 5000);

            assertThat(page.getAllValues())
                    .extracting(Pageable::getPageNumber, Pageable::getPageSize)
                    .containsExactly(
                            tuple(0, 20),
                            tuple(0, 100));
        }
    }
}
