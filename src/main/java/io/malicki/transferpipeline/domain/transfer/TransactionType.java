package io.malicki.transferpipeline.domain.transfer;

/**
 * Discriminator for rows of the shared {@code transactions} ledger table.
 * The pipeline only reads and writes {@link #EXTERNAL_TRANSFER} rows.
 */
public enum TransactionType {
    CREDIT,
    DEBIT,
    EXTERNAL_TRANSFER
}
