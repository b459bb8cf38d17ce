package io.malicki.transferpipeline.exception;

/**
 * Thrown when the upstream authentication layer did not supply a caller id.
 */
public class MissingUserIdException extends RuntimeException {

    public MissingUserIdException(String message) {
        super(message);
    }
}
