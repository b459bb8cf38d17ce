package io.malicki.transferpipeline.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TransferUpdatesResponse {

    private List<TransferResponse> transfers;
    private int count;

    public static TransferUpdatesResponse of(List<TransferResponse> transfers) {
        return new TransferUpdatesResponse(transfers, transfers.size());
    }
}
