package io.malicki.transferpipeline.gateway;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VerificationResult {

    private boolean valid;
    private String accountName;
}
