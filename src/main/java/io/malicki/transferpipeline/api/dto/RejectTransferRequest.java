package io.malicki.transferpipeline.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RejectTransferRequest {

    // Blank check happens in the service so the message matches the other entry points
    @JsonAlias("rejectionReason")
    @Size(max = 500, message = "Reason must be at most 500 characters")
    private String reason;
}
