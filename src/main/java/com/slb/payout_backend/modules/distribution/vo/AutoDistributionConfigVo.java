package com.slb.payout_backend.modules.distribution.vo;

import com.slb.payout_backend.modules.distribution.domain.AutoDistributionConfig;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AutoDistributionConfigVo {
    private boolean enabled;
    private long intervalSeconds;

    public static AutoDistributionConfigVo from(AutoDistributionConfig config) {
        return new AutoDistributionConfigVo(config.enabled(), config.intervalSeconds());
    }
}
