package io.malicki.transferpipeline.domain.transfer.audit;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

/**
 * Stores the audit trail as a JSON array so new event kinds need no migration.
 */
@Converter
public class AuditTrailConverter implements AttributeConverter<List<TransferAuditEvent>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final TypeReference<List<TransferAuditEvent>> TRAIL_TYPE = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(List<TransferAuditEvent> trail) {
        try {
            return MAPPER.writerFor(TRAIL_TYPE).writeValueAsString(trail == null ? List.of() : trail);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to serialize transfer audit trail", e);
        }
    }

    @Override
    public List<TransferAuditEvent> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(MAPPER.readValue(json, TRAIL_TYPE));
        } catch (Exception e) {
            throw new IllegalStateException("Failed to read transfer audit trail", e);
        }
    }
}
