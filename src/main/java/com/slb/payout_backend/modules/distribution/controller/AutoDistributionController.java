package com.slb.payout_backend.modules.distribution.controller;

import com.slb.payout_backend.common.api.ApiResponse;
import com.slb.payout_backend.modules.distribution.dto.AutoDistributionUpdateDto;
import com.slb.payout_backend.modules.distribution.service.AutoDistributionSettings;
import com.slb.payout_backend.modules.distribution.vo.AutoDistributionConfigVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/settings/auto-distribution")
@Tag(name = "自动分配", description = "自动分配开关与间隔（运行期生效，不持久化）")
public class AutoDistributionController {

    private final AutoDistributionSettings settings;

    public AutoDistributionController(AutoDistributionSettings settings) {
        this.settings = settings;
    }

    @GetMapping
    @Operation(summary = "查询自动分配配置")
    public ApiResponse<AutoDistributionConfigVo> getConfig() {
        return ApiResponse.ok(AutoDistributionConfigVo.from(settings.current()));
    }

    @PostMapping
    @Operation(summary = "修改自动分配配置，立即触发一轮分配（开启时）")
    public ApiResponse<AutoDistributionConfigVo> updateConfig(@Valid @RequestBody AutoDistributionUpdateDto dto) {
        return ApiResponse.ok(AutoDistributionConfigVo.from(
                settings.update(dto.getEnabled(), dto.getIntervalSeconds())));
    }
}
