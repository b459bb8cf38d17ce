package io.malicki.transferpipeline.api;

import io.malicki.transferpipeline.api.dto.ApiResponse;
import io.malicki.transferpipeline.api.dto.ApproveTransferRequest;
import io.malicki.transferpipeline.api.dto.PageResponse;
import io.malicki.transferpipeline.api.dto.RejectTransferRequest;
import io.malicki.transferpipeline.api.dto.TransferResponse;
import io.malicki.transferpipeline.api.dto.TransferStatsResponse;
import io.malicki.transferpipeline.domain.transfer.Transfer;
import io.malicki.transferpipeline.domain.transfer.TransferReviewService;
import io.malicki.transferpipeline.domain.transfer.TransferService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/admin")
@Slf4j
public class AdminTransferController {

    private final TransferService transferService;
    private final TransferReviewService reviewService;

    public AdminTransferController(TransferService transferService, TransferReviewService reviewService) {
        this.transferService = transferService;
        this.reviewService = reviewService;
    }

    @GetMapping("/pending-transfers")
    public ResponseEntity<ApiResponse<PageResponse<TransferResponse>>> getPendingTransfers(
            @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userId,
            @RequestHeader(value = CallerHeaders.USER_ROLE, required = false) String role,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit
    ) {
        CallerHeaders.requireAdmin(userId, role);

        return ResponseEntity.ok(ApiResponse.ok(reviewService.getPendingTransfers(page, limit)));
    }

    @PostMapping("/transfer/{transferId}/approve")
    public ResponseEntity<ApiResponse<Map<String, TransferResponse>>> approve(
            @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userId,
            @RequestHeader(value = CallerHeaders.USER_ROLE, required = false) String role,
            @PathVariable String transferId,
            @Valid @RequestBody(required = false) ApproveTransferRequest request
    ) {
        String adminId = CallerHeaders.requireAdmin(userId, role);
        log.info("👍 POST /api/admin/transfer/{}/approve | Admin: {}", transferId, adminId);

        Transfer transfer = transferService.approve(
                transferId, adminId, request != null ? request.getNotes() : null);

        return ResponseEntity.ok(ApiResponse.ok(
                "Transfer approved and queued for processing",
                Map.of("transaction", TransferResponse.from(transfer))));
    }

    @PostMapping("/transfer/{transferId}/reject")
    public ResponseEntity<ApiResponse<Map<String, TransferResponse>>> reject(
            @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userId,
            @RequestHeader(value = CallerHeaders.USER_ROLE, required = false) String role,
            @PathVariable String transferId,
            @Valid @RequestBody(required = false) RejectTransferRequest request
    ) {
        String adminId = CallerHeaders.requireAdmin(userId, role);
        log.info("👎 POST /api/admin/transfer/{}/reject | Admin: {}", transferId, adminId);

        Transfer transfer = transferService.reject(
                transferId, adminId, request != null ? request.getReason() : null);

        return ResponseEntity.ok(ApiResponse.ok(
                "Transfer rejected",
                Map.of("transaction", TransferResponse.from(transfer))));
    }

    @GetMapping("/transfer-stats")
    public ResponseEntity<ApiResponse<TransferStatsResponse>> getStats(
            @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userId,
            @RequestHeader(value = CallerHeaders.USER_ROLE, required = false) String role
    ) {
        CallerHeaders.requireAdmin(userId, role);

        return ResponseEntity.ok(ApiResponse.ok(reviewService.getStats()));
    }
}
