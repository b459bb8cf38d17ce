package io.malicki.transferpipeline.notification;

import io.malicki.transferpipeline.api.dto.TransferResponse;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TransferPushEvent {

    private TransferResponse transaction;
    private String message;
    private Instant timestamp;
}
