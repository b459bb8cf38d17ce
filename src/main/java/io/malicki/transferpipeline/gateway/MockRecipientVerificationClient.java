package io.malicki.transferpipeline.gateway;

import io.malicki.transferpipeline.config.TransferProperties;
import io.malicki.transferpipeline.domain.transfer.RecipientInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Simulated name enquiry. Account numbers made of a single repeated digit are
 * reported as not found; everything else resolves to the supplied name.
 */
@Component
@Slf4j
public class MockRecipientVerificationClient implements RecipientVerificationClient {

    private final TransferProperties properties;

    public MockRecipientVerificationClient(TransferProperties properties) {
        this.properties = properties;
    }

    @Override
    public CompletableFuture<VerificationResult> verify(RecipientInfo recipientInfo) {
        long delayMs = properties.getVerification().getDelay().toMillis();
        return CompletableFuture.supplyAsync(
                () -> lookup(recipientInfo),
                CompletableFuture.delayedExecutor(delayMs, TimeUnit.MILLISECONDS));
    }

    private VerificationResult lookup(RecipientInfo recipientInfo) {
        String accountNumber = recipientInfo.getAccountNumber();
        boolean placeholder = accountNumber.chars().distinct().count() == 1;
        if (placeholder) {
            log.debug("[BANK] Name enquiry found no account {} at bank {}",
                    accountNumber, recipientInfo.getBankCode());
            return new VerificationResult(false, null);
        }
        return new VerificationResult(true, recipientInfo.getName().trim().toUpperCase(Locale.ROOT));
    }
}
