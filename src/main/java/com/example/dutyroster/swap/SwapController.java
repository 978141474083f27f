package com.example.dutyroster.swap;

import com.example.dutyroster.common.ApiResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/swaps")
public class SwapController {

    private final SwapService swapService;

    public SwapController(SwapService swapService) {
        this.swapService = swapService;
    }

    /**
     * 交代申請を作成（交換する勤務は任意）
     */
    @PostMapping
    public ResponseEntity<ApiResponse<SwapView>> requestSwap(@RequestBody @Valid SwapRequestDto request) {
        SwapView created = swapService.requestSwap(
                request.requesterId(),
                request.allocationId(),
                request.substituteId(),
                request.reason(),
                request.counterAllocationId()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success("交代申請を作成しました", created));
    }

    @GetMapping("/{swapId}")
    public ResponseEntity<ApiResponse<SwapView>> getSwap(@PathVariable Long swapId) {
        return ResponseEntity.ok(ApiResponse.success(swapService.view(swapId)));
    }

    /**
     * 交代者による承諾・辞退
     */
    @PutMapping("/{swapId}/respond")
    public ResponseEntity<ApiResponse<SwapView>> respond(@PathVariable Long swapId,
                                                        @RequestBody @Valid RespondDto request) {
        SwapView view = swapService.respondToSwap(swapId, request.responderId(), request.action());
        String message = request.action() == SwapAction.ACCEPT ? "交代申請を承諾しました" : "交代申請を辞退しました";
        return ResponseEntity.ok(ApiResponse.success(message, view));
    }

    /**
     * 承諾済みの交代申請を承認
     */
    @PutMapping("/{swapId}/approve")
    public ResponseEntity<ApiResponse<SwapView>> approve(@PathVariable Long swapId,
                                                        @RequestBody @Valid SchedulerDecisionDto request) {
        return ResponseEntity.ok(ApiResponse.success("交代申請を承認しました",
                swapService.approveSwap(swapId, request.schedulerId())));
    }

    /**
     * 交代者の回答を待たずに承認
     */
    @PutMapping("/{swapId}/override-approve")
    public ResponseEntity<ApiResponse<SwapView>> overrideApprove(@PathVariable Long swapId,
                                                                @RequestBody @Valid SchedulerDecisionDto request) {
        return ResponseEntity.ok(ApiResponse.success("交代申請を承認しました",
                swapService.overrideApproveSwap(swapId, request.schedulerId())));
    }

    @PutMapping("/{swapId}/reject")
    public ResponseEntity<ApiResponse<SwapView>> reject(@PathVariable Long swapId,
                                                       @RequestBody @Valid SchedulerDecisionDto request) {
        return ResponseEntity.ok(ApiResponse.success("交代申請を却下しました",
                swapService.rejectSwap(swapId, request.schedulerId())));
    }

    @GetMapping("/substitute/{personId}")
    public ResponseEntity<ApiResponse<List<SwapView>>> pendingForSubstitute(@PathVariable Long personId) {
        return ResponseEntity.ok(ApiResponse.success(swapService.pendingForSubstitute(personId)));
    }

    @GetMapping("/awaiting")
    public ResponseEntity<ApiResponse<List<SwapView>>> awaitingScheduler() {
        return ResponseEntity.ok(ApiResponse.success(swapService.awaitingScheduler()));
    }

    @GetMapping("/debts/{personId}")
    public ResponseEntity<ApiResponse<List<SwapDebtView>>> debts(@PathVariable Long personId) {
        return ResponseEntity.ok(ApiResponse.success(swapService.openDebts(personId)));
    }

    public record SwapRequestDto(
            @NotNull(message = "申請者IDは必須です") Long requesterId,
            @NotNull(message = "割り当てIDは必須です") Long allocationId,
            @NotNull(message = "交代者IDは必須です") Long substituteId,
            @Size(max = 500, message = "理由は500文字以内で入力してください") String reason,
            Long counterAllocationId
    ) {}

    public record RespondDto(
            @NotNull(message = "回答者IDは必須です") Long responderId,
            @NotNull(message = "回答は必須です") SwapAction action
    ) {}

    public record SchedulerDecisionDto(
            @NotNull(message = "勤務担当者IDは必須です") Long schedulerId
    ) {}
}
