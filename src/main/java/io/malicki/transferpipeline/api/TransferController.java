package io.malicki.transferpipeline.api;

import io.malicki.transferpipeline.api.dto.ApiResponse;
import io.malicki.transferpipeline.api.dto.CreateTransferRequest;
import io.malicki.transferpipeline.api.dto.TransactionHistoryResponse;
import io.malicki.transferpipeline.api.dto.TransferResponse;
import io.malicki.transferpipeline.api.dto.TransferUpdatesResponse;
import io.malicki.transferpipeline.domain.transfer.Transfer;
import io.malicki.transferpipeline.domain.transfer.TransferService;
import io.malicki.transferpipeline.domain.transfer.TransferValidator;
import io.malicki.transferpipeline.notification.SseTransferNotifier;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/user")
@Slf4j
public class TransferController {

    private final TransferService transferService;
    private final TransferValidator validator;
    private final SseTransferNotifier notifier;

    public TransferController(
            TransferService transferService,
            TransferValidator validator,
            SseTransferNotifier notifier
    ) {
        this.transferService = transferService;
        this.validator = validator;
        this.notifier = notifier;
    }

    @PostMapping("/transfer")
    public ResponseEntity<ApiResponse<Map<String, TransferResponse>>> createTransfer(
            @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userIdHeader,
            @Valid @RequestBody CreateTransferRequest request
    ) {
        String userId = CallerHeaders.requireUserId(userIdHeader);
        log.info("🏦 POST /api/user/transfer | User: {} | Amount: {} {}",
                userId, request.getAmount(), request.getCurrency());

        Transfer transfer = transferService.createTransfer(userId, request);

        return ResponseEntity
                .status(HttpStatus.CREATED)
                .body(ApiResponse.ok(
                        "External transfer submitted for approval. You will be notified once processed.",
                        Map.of("transaction", TransferResponse.from(transfer))));
    }

    @GetMapping("/transfer-updates")
    public ResponseEntity<ApiResponse<TransferUpdatesResponse>> getTransferUpdates(
            @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userIdHeader,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String since
    ) {
        String userId = CallerHeaders.requireUserId(userIdHeader);
        Instant sinceInstant = validator.parseSince(since);

        List<TransferResponse> transfers = transferService.listUpdates(userId, limit, sinceInstant).stream()
                .map(TransferResponse::from)
                .collect(Collectors.toList());

        return ResponseEntity.ok(ApiResponse.ok(TransferUpdatesResponse.of(transfers)));
    }

    @GetMapping("/transactions")
    public ResponseEntity<ApiResponse<TransactionHistoryResponse>> getTransactionHistory(
            @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userIdHeader,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit
    ) {
        String userId = CallerHeaders.requireUserId(userIdHeader);

        return ResponseEntity.ok(ApiResponse.ok(
                "Transaction history retrieved",
                TransactionHistoryResponse.of(transferService.getTransactionHistory(userId, page, limit))));
    }

    @GetMapping("/transfers/{transferId}")
    public ResponseEntity<ApiResponse<Map<String, TransferResponse>>> getTransfer(
            @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userIdHeader,
            @PathVariable String transferId
    ) {
        String userId = CallerHeaders.requireUserId(userIdHeader);
        Transfer transfer = transferService.getUserTransfer(userId, transferId);

        return ResponseEntity.ok(ApiResponse.ok(Map.of("transaction", TransferResponse.from(transfer))));
    }

    @GetMapping(value = "/transfer-stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamTransfers(
            @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userIdHeader
    ) {
        String userId = CallerHeaders.requireUserId(userIdHeader);
        log.info("🔌 GET /api/user/transfer-stream | User: {}", userId);

        return notifier.subscribe(userId);
    }
}
