package io.malicki.transferpipeline.domain.transfer;

import java.util.EnumSet;
import java.util.Set;

public enum TransferStatus {
    PENDING,        // Submitted, waiting for admin review
    PROCESSING,     // Approved, settlement running in the background
    COMPLETED,      // Settled, balance debited
    REJECTED,       // Declined by an admin
    FAILED;         // Settlement declined, timed out or errored

    private Set<TransferStatus> successors;

    static {
        PENDING.successors = EnumSet.of(PROCESSING, REJECTED);
        PROCESSING.successors = EnumSet.of(COMPLETED, FAILED);
        COMPLETED.successors = EnumSet.noneOf(TransferStatus.class);
        REJECTED.successors = EnumSet.noneOf(TransferStatus.class);
        FAILED.successors = EnumSet.noneOf(TransferStatus.class);
    }

    public boolean canTransitionTo(TransferStatus next) {
        return successors.contains(next);
    }

    public boolean isTerminal() {
        return successors.isEmpty();
    }
}
