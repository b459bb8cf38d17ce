package io.malicki.transferpipeline.exception;

import lombok.Getter;

@Getter
public class AdminAccessDeniedException extends RuntimeException {

    private final String userId;

    public AdminAccessDeniedException(String userId) {
        super("Admin access required");
        this.userId = userId;
    }

}
