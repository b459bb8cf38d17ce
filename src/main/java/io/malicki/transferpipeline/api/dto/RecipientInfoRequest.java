package io.malicki.transferpipeline.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RecipientInfoRequest {

    @NotBlank(message = "Recipient name is required")
    private String name;

    @NotBlank(message = "Recipient account number is required")
    private String accountNumber;

    @NotBlank(message = "Recipient bank code is required")
    private String bankCode;
}
