package io.malicki.transferpipeline.exception;

import lombok.Getter;

import java.math.BigDecimal;

@Getter
public class InsufficientFundsException extends RuntimeException {

    private final String userId;
    private final BigDecimal currentBalance;
    private final BigDecimal requestedAmount;

    public InsufficientFundsException(
            String userId,
            BigDecimal currentBalance,
            BigDecimal requestedAmount
    ) {
        super("Insufficient balance");
        this.userId = userId;
        this.currentBalance = currentBalance;
        this.requestedAmount = requestedAmount;
    }

}
