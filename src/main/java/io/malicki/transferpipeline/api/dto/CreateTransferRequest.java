package io.malicki.transferpipeline.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateTransferRequest {

    // Kept as text so malformed numbers and extra decimals reach the validator intact
    private String amount;

    private String currency;

    @NotNull(message = "Recipient information is required")
    @Valid
    @JsonAlias("recipient")
    private RecipientInfoRequest recipientInfo;

    @Size(max = 200, message = "Description must be at most 200 characters")
    private String description;
}
