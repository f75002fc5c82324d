package com.slb.payout_backend.modules.trader.controller;

import com.slb.payout_backend.common.api.ApiResponse;
import com.slb.payout_backend.modules.trader.dto.TraderLimitUpdateDto;
import com.slb.payout_backend.modules.trader.service.TraderService;
import com.slb.payout_backend.modules.trader.vo.TraderLimitVo;
import com.slb.payout_backend.modules.trader.vo.TraderVo;
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
@RequestMapping("/api/traders")
@Tag(name = "交易员", description = "可接单交易员与单笔限额")
public class TraderController {

    private final TraderService traderService;

    public TraderController(TraderService traderService) {
        this.traderService = traderService;
    }

    @GetMapping
    @Operation(summary = "可接单交易员列表（含当前限额）")
    public ApiResponse<List<TraderVo>> listTraders() {
        return ApiResponse.ok(traderService.listTraders());
    }

    @PostMapping("/{id}/limit")
    @Operation(summary = "设置/清除交易员单笔出款上限")
    public ApiResponse<TraderLimitVo> updateLimit(
            @Parameter(description = "交易员 ID", required = true)
            @PathVariable("id") String traderId,
            @RequestBody TraderLimitUpdateDto dto) {
        return ApiResponse.ok(traderService.updateLimit(traderId, dto.getMaxAmount()));
    }
}
