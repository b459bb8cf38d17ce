package io.malicki.transferpipeline.domain.transfer;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RecipientInfo {

    @Column(name = "recipient_name", length = 100)
    private String name;

    @Column(name = "recipient_account_number", length = 20)
    private String accountNumber;

    @Column(name = "recipient_bank_code", length = 10)
    private String bankCode;
}
