package io.malicki.transferpipeline.exception;

import io.malicki.transferpipeline.domain.transfer.TransferStatus;
import lombok.Getter;

@Getter
public class InvalidTransferStateException extends RuntimeException {

    private final String transferId;
    private final TransferStatus currentStatus;
    private final TransferStatus requiredStatus;

    public InvalidTransferStateException(String transferId, TransferStatus currentStatus, TransferStatus requiredStatus) {
        super(String.format("Transfer is not in %s status (current: %s)",
                requiredStatus.name().toLowerCase(), currentStatus));
        this.transferId = transferId;
        this.currentStatus = currentStatus;
        this.requiredStatus = requiredStatus;
    }

}
