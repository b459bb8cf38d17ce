package io.malicki.transferpipeline.exception;

import lombok.Getter;

@Getter
public class TransferNotFoundException extends RuntimeException {

    private final String transferId;

    public TransferNotFoundException(String transferId) {
        super("Transfer not found");
        this.transferId = transferId;
    }

}
