package com.slb.payout_backend.modules.payout.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app.payout")
@Data
public class PayoutProperties {
    /**
     * 分配成功后写入 acceptanceTime 的接单宽限值（与系统其它接单窗口同一单位）。
     */
    private int acceptanceTime = 40;
}
