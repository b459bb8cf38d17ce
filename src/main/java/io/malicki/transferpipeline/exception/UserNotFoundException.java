package io.malicki.transferpipeline.exception;

import lombok.Getter;

@Getter
public class UserNotFoundException extends RuntimeException {

    private final String userId;

    public UserNotFoundException(String userId) {
        super("User not found or inactive");
        this.userId = userId;
    }

}
