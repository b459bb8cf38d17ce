package io.malicki.transferpipeline.domain.user;

public enum UserRole {
    USER,
    ADMIN
}
