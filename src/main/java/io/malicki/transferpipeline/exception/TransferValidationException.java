package io.malicki.transferpipeline.exception;

import lombok.Getter;

@Getter
public class TransferValidationException extends RuntimeException {

    private final String field;

    public TransferValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

}
