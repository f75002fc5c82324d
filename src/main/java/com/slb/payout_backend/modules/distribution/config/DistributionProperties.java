package com.slb.payout_backend.modules.distribution.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app.distribution")
@Data
public class DistributionProperties {
    /** 启动时是否开启自动分配（运行期可通过接口修改，不落库） */
    private boolean enabled = false;
    /** 启动时的自动分配间隔（秒），最小 1 */
    private long intervalSeconds = 30L;
    /** 停机时等待进行中的分配周期结束的最长时间 */
    private long shutdownTimeoutMs = 10_000L;
}
