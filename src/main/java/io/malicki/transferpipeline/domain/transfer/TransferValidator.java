package io.malicki.transferpipeline.domain.transfer;

import io.malicki.transferpipeline.api.dto.RecipientInfoRequest;
import io.malicki.transferpipeline.config.TransferProperties;
import io.malicki.transferpipeline.exception.TransferValidationException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Input checks for transfer requests. Each failure carries the field name and
 * a message fit to show the end user.
 */
@Component
public class TransferValidator {

    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-zA-Z\\s\\-'.]+$");
    private static final int NAME_MIN = 2;
    private static final int NAME_MAX = 100;

    private final TransferProperties properties;
    private final Pattern accountNumberPattern;
    private final Pattern bankCodePattern;

    public TransferValidator(TransferProperties properties) {
        this.properties = properties;
        this.accountNumberPattern = Pattern.compile(properties.getAccountNumberPattern());
        this.bankCodePattern = Pattern.compile(properties.getBankCodePattern());
    }

    public BigDecimal validateAmount(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new TransferValidationException("amount", "Amount is required");
        }

        BigDecimal amount;
        try {
            amount = new BigDecimal(raw.trim());
        } catch (NumberFormatException e) {
            throw new TransferValidationException("amount", "Invalid amount format");
        }

        if (amount.signum() <= 0) {
            throw new TransferValidationException("amount", "Amount must be greater than 0");
        }
        if (amount.compareTo(properties.getMaxAmount()) > 0) {
            throw new TransferValidationException("amount", "Amount exceeds maximum limit");
        }
        // 10.50 is fine, 10.505 is not
        if (amount.stripTrailingZeros().scale() > 2) {
            throw new TransferValidationException("amount", "Amount cannot have more than 2 decimal places");
        }

        return amount.setScale(2, RoundingMode.UNNECESSARY);
    }

    public String validateCurrency(String currency) {
        if (currency == null || currency.isBlank()) {
            return properties.getDefaultCurrency();
        }

        String normalized = currency.trim().toUpperCase(Locale.ROOT);
        if (!properties.getSupportedCurrencies().contains(normalized)) {
            throw new TransferValidationException("currency",
                    "Unsupported currency. Supported: " + String.join(", ", properties.getSupportedCurrencies()));
        }
        return normalized;
    }

    public RecipientInfo validateRecipient(RecipientInfoRequest recipient) {
        if (recipient == null) {
            throw new TransferValidationException("recipientInfo",
                    "Recipient name, account number, and bank code are required");
        }

        String name = recipient.getName() == null ? "" : recipient.getName().trim();
        if (name.isEmpty()) {
            throw new TransferValidationException("recipientInfo.name", "Recipient name is required");
        }
        if (name.length() < NAME_MIN) {
            throw new TransferValidationException("recipientInfo.name", "Recipient name must be at least 2 characters");
        }
        if (name.length() > NAME_MAX) {
            throw new TransferValidationException("recipientInfo.name", "Recipient name cannot exceed 100 characters");
        }
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new TransferValidationException("recipientInfo.name", "Recipient name contains invalid characters");
        }

        String accountNumber = recipient.getAccountNumber() == null ? "" : recipient.getAccountNumber().trim();
        if (accountNumber.isEmpty()) {
            throw new TransferValidationException("recipientInfo.accountNumber", "Account number is required");
        }
        if (!accountNumberPattern.matcher(accountNumber).matches()) {
            throw new TransferValidationException("recipientInfo.accountNumber",
                    "Invalid account number format (must be 10 digits)");
        }

        String bankCode = recipient.getBankCode() == null ? "" : recipient.getBankCode().trim();
        if (bankCode.isEmpty()) {
            throw new TransferValidationException("recipientInfo.bankCode", "Bank code is required");
        }
        if (!bankCodePattern.matcher(bankCode).matches()) {
            throw new TransferValidationException("recipientInfo.bankCode",
                    "Invalid bank code format (must be 3 digits)");
        }

        return new RecipientInfo(name, accountNumber, bankCode);
    }

    public String requireRejectionReason(String reason) {
        if (reason == null || reason.isBlank()) {
            throw new TransferValidationException("reason", "Rejection reason is required");
        }
        return reason.trim();
    }

    /**
     * Clamps a poll limit into 1..max, falling back to the default when absent.
     */
    public int pollingLimit(Integer requested) {
        TransferProperties.Polling polling = properties.getPolling();
        if (requested == null) {
            return polling.getDefaultLimit();
        }
        return Math.max(1, Math.min(requested, polling.getMaxLimit()));
    }

    public int adminPageSize(Integer requested) {
        TransferProperties.Admin admin = properties.getAdmin();
        if (requested == null) {
            return admin.getDefaultPageSize();
        }
        return Math.max(1, Math.min(requested, admin.getMaxPageSize()));
    }

    public int historyPageSize(Integer requested) {
        TransferProperties.History history = properties.getHistory();
        if (requested == null || requested < 1) {
            return history.getDefaultPageSize();
        }
        return Math.min(requested, history.getMaxPageSize());
    }

    /**
     * Accepts ISO-8601 instants with or without an offset ({@code 2024-01-01T10:00:00Z},
     * {@code 2024-01-01T10:00:00+01:00}). Blank means no filter.
     */
    public Instant parseSince(String since) {
        if (since == null || since.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(since.trim()).toInstant();
        } catch (DateTimeParseException e) {
            throw new TransferValidationException("since", "Invalid since date format, expected ISO-8601");
        }
    }
}
