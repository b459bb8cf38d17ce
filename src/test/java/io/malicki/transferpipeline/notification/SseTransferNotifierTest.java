package io.malicki.transferpipeline.notification;

import io.malicki.transferpipeline.api.dto.TransferResponse;
import io.malicki.transferpipeline.config.TransferProperties;
import io.malicki.transferpipeline.domain.transfer.TransferStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

@DisplayName("SseTransferNotifier")
class SseTransferNotifierTest {

    private final SseTransferNotifier notifier = new SseTransferNotifier(new TransferProperties());

    private static TransferResponse transfer(TransferStatus status) {
        TransferResponse response = new TransferResponse();
        response.setId("t-1");
        response.setUserId("user-1");
        response.setStatus(status);
        return response;
    }

    @Test
    @DisplayName("emitting to a user without a stream is a quiet no-op")
    void offlineUser() {
        assertThat(notifier.isUserConnected("user-1")).isFalse();

        assertThatCode(() -> notifier.emitUpdate("user-1", transfer(TransferStatus.COMPLETED)))
                .doesNotThrowAnyException();
        assertThatCode(() -> notifier.emitPending("user-1", transfer(TransferStatus.PENDING)))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("subscribers are tracked per user until their stream completes")
    void tracksSubscribers() {
        notifier.subscribe("user-1");
        notifier.subscribe("user-2");

        assertThat(notifier.isUserConnected("user-1")).isTrue();
        assertThat(notifier.connectedUsers()).containsExactlyInAnyOrder("user-1", "user-2");
    }

    @Test
    @DisplayName("update messages follow the new status")
    void messages() {
        assertThat(SseTransferNotifier.messageFor(TransferStatus.PROCESSING))
                .isEqualTo("Your transfer has been approved and is being processed");
        assertThat(SseTransferNotifier.messageFor(TransferStatus.COMPLETED))
                .isEqualTo("Your transfer has been completed successfully");
        assertThat(SseTransferNotifier.messageFor(TransferStatus.REJECTED))
                .isEqualTo("Your transfer has been rejected");
        assertThat(SseTransferNotifier.messageFor(TransferStatus.FAILED))
                .isEqualTo("Your transfer failed to process");
    }
}
