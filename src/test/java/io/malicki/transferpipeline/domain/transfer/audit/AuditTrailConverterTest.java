package io.malicki.transferpipeline.domain.transfer.audit;

import io.malicki.transferpipeline.domain.transfer.SettlementFailureCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuditTrailConverterTest {

    private final AuditTrailConverter converter = new AuditTrailConverter();

    @Test
    @DisplayName("event kinds survive storage with their discriminator")
    void keepsEventTypes() {
        Instant at = Instant.parse("2024-05-01T10:00:00Z");
        List<TransferAuditEvent> trail = List.of(
                new SubmittedEvent(at, "user-1"),
                new SettlementFailedEvent(at, SettlementFailureCategory.INSUFFICIENT_FUNDS, "Insufficient balance", "BANK1"));

        String json = converter.convertToDatabaseColumn(trail);
        List<TransferAuditEvent> read = converter.convertToEntityAttribute(json);

        assertThat(json).contains("\"event\":\"SUBMITTED\"").contains("\"event\":\"SETTLEMENT_FAILED\"");
        assertThat(read).hasSize(2);
        assertThat(read.get(0)).isInstanceOf(SubmittedEvent.class);
        SettlementFailedEvent failed = (SettlementFailedEvent) read.get(1);
        assertThat(failed.getCategory()).isEqualTo(SettlementFailureCategory.INSUFFICIENT_FUNDS);
        assertThat(failed.getBankReference()).isEqualTo("BANK1");
        assertThat(failed.getOccurredAt()).isEqualTo(at);
    }

    @Test
    @DisplayName("empty column reads as an empty trail, garbage fails loudly")
    void emptyAndCorrupt() {
        assertThat(converter.convertToEntityAttribute(null)).isEmpty();
        assertThat(converter.convertToDatabaseColumn(null)).isEqualTo("[]");
        assertThatThrownBy(() -> converter.convertToEntityAttribute("{not json"))
                .isInstanceOf(IllegalStateException.class);
    }
}
