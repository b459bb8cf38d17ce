package io.malicki.transferpipeline.processing;

import io.malicki.transferpipeline.domain.transfer.SettlementFailureCategory;
import io.malicki.transferpipeline.exception.InsufficientFundsException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.SocketTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

@Component
@Slf4j
public class SettlementFailureClassifier {

    public SettlementFailureCategory classify(Throwable failure) {
        Throwable cause = unwrap(failure);

        if (cause instanceof InsufficientFundsException) {
            return SettlementFailureCategory.INSUFFICIENT_FUNDS;
        }

        if (cause instanceof TimeoutException ||
            cause instanceof SocketTimeoutException ||
            (cause.getMessage() != null &&
                cause.getMessage().toLowerCase().contains("timeout"))) {

            log.debug("Classified as GATEWAY_TIMEOUT: {}", cause.getClass().getSimpleName());
            return SettlementFailureCategory.GATEWAY_TIMEOUT;
        }

        log.debug("Classified as SYSTEM_ERROR: {}", cause.getClass().getSimpleName());
        return SettlementFailureCategory.SYSTEM_ERROR;
    }

    public String describe(Throwable failure) {
        Throwable cause = unwrap(failure);
        if (cause instanceof TimeoutException) {
            return "Settlement gateway timed out";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
