package io.malicki.transferpipeline.gateway;

import io.malicki.transferpipeline.domain.transfer.RecipientInfo;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SettlementRequest {

    private BigDecimal amount;
    private String currency;
    private RecipientInfo recipientInfo;
    private String reference;  // our transfer id
}
