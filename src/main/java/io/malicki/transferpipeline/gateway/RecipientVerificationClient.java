package io.malicki.transferpipeline.gateway;

import io.malicki.transferpipeline.domain.transfer.RecipientInfo;

import java.util.concurrent.CompletableFuture;

/**
 * Advisory name/account lookup against the recipient's bank. Its answer is
 * recorded on the transfer but never blocks or reverses it.
 */
public interface RecipientVerificationClient {

    CompletableFuture<VerificationResult> verify(RecipientInfo recipientInfo);
}
