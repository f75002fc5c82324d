package com.slb.payout_backend.modules.payout.controller;

import com.slb.payout_backend.common.api.ApiResponse;
import com.slb.payout_backend.modules.payout.dto.AssignPayoutDto;
import com.slb.payout_backend.modules.payout.dto.CancelPayoutDto;
import com.slb.payout_backend.modules.payout.service.PayoutAssignmentService;
import com.slb.payout_backend.modules.payout.service.PayoutCancellationService;
import com.slb.payout_backend.modules.payout.vo.AssignPayoutVo;
import com.slb.payout_backend.modules.payout.vo.CancelPayoutVo;
import com.slb.payout_backend.modules.payout.vo.PayoutVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/payouts")
@Tag(name = "出款单", description = "待分配出款单、人工分配与取消")
public class PayoutController {

    private final PayoutAssignmentService assignmentService;
    private final PayoutCancellationService cancellationService;

    public PayoutController(PayoutAssignmentService assignmentService,
                            PayoutCancellationService cancellationService) {
        this.assignmentService = assignmentService;
        this.cancellationService = cancellationService;
    }

    @GetMapping
    @Operation(summary = "待分配出款单列表（按创建时间升序）")
    public ApiResponse<List<PayoutVo>> listUnassigned() {
        return ApiResponse.ok(assignmentService.listUnassignedPayouts());
    }

    @PostMapping("/{id}/assign")
    @Operation(summary = "人工分配出款单")
    public ApiResponse<AssignPayoutVo> assign(
            @Parameter(description = "出款单 ID", required = true) @PathVariable("id") String payoutId,
            @RequestBody AssignPayoutDto dto) {
        return ApiResponse.ok(assignmentService.assignManually(payoutId, dto.getTraderId()));
    }

    @PostMapping("/{id}/cancel")
    @Operation(summary = "取消出款单并回调商户")
    public ApiResponse<CancelPayoutVo> cancel(
            @Parameter(description = "出款单 ID", required = true) @PathVariable("id") String payoutId,
            @RequestBody(required = false) CancelPayoutDto dto) {
        CancelPayoutDto body = dto == null ? new CancelPayoutDto() : dto;
        return ApiResponse.ok(cancellationService.cancel(payoutId, body.getReason(), body.getReasonCode()));
    }
}
