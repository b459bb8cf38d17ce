package io.malicki.transferpipeline.notification;

import io.malicki.transferpipeline.api.dto.TransferResponse;

import java.util.Set;

/**
 * Best-effort push of transfer state changes to the owning user's open
 * sessions. Delivery is at most once; a user with no open session receives
 * nothing and falls back to polling.
 */
public interface TransferNotifier {

    void emitPending(String userId, TransferResponse transfer);

    void emitUpdate(String userId, TransferResponse transfer);

    boolean isUserConnected(String userId);

    Set<String> connectedUsers();
}
