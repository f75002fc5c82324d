package com.slb.payout_backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SwaggerConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("出款分配后端服务 API / Payout Distribution Backend API")
                        .version("1.0.0")
                        .description(
                                """
                                出款单（payout）分配给交易员（trader）的运营接口：
                                - 交易员列表与单笔限额设置；
                                - 未分配出款单列表、手动分配、取消（取消后回调商户）；
                                - 自动分配开关与周期；
                                - /api/events 实时事件流（SSE），用于看板刷新。
                                
                                统一返回结构 / Unified Response Envelope:
                                所有接口统一包裹在 ApiResponse<T> 中（code / message / data / traceId）。
                                业务异常使用 BizException 抛出，code 与 HTTP 状态码一致：
                                400 参数错误，404 记录不存在，409 不可分配或状态冲突，503 存储暂不可用。
                                """
                        )
                        .contact(new Contact()
                                .name("Hyperion")
                                .email("backend@slb.xyz")
                        )
                );
    }
}
