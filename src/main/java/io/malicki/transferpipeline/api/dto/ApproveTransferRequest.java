package io.malicki.transferpipeline.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApproveTransferRequest {

    @JsonAlias("adminNotes")
    @Size(max = 500, message = "Notes must be at most 500 characters")
    private String notes;
}
