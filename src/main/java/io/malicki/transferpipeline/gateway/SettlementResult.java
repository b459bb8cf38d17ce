package io.malicki.transferpipeline.gateway;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SettlementResult {

    private boolean success;
    private String reference;   // rail reference, set on success
    private String message;
    private String error;

    public static SettlementResult succeeded(String reference, String message) {
        return new SettlementResult(true, reference, message, null);
    }

    public static SettlementResult failed(String error) {
        return new SettlementResult(false, null, null, error);
    }
}
