package io.malicki.transferpipeline.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TransactionHistoryResponse {

    private List<TransferResponse> transactions;
    private PageResponse.Pagination pagination;

    public static TransactionHistoryResponse of(PageResponse<TransferResponse> page) {
        return new TransactionHistoryResponse(page.getItems(), page.getPagination());
    }
}
