package io.malicki.transferpipeline.domain.transfer;

public enum SettlementFailureCategory {

    GATEWAY_DECLINED("Settlement gateway declined the transfer"),

    GATEWAY_TIMEOUT("Settlement gateway did not answer in time"),

    INSUFFICIENT_FUNDS("Balance no longer covers the transfer amount"),

    SYSTEM_ERROR("Unexpected error while settling - needs investigation");

    private final String description;

    SettlementFailureCategory(String description) {
        this.description = description;
    }

    public String getDescription() { return description; }

    // Failures raised by our own code rather than reported by the rail
    public boolean isSystemFault() {
        return this == SYSTEM_ERROR;
    }
}
