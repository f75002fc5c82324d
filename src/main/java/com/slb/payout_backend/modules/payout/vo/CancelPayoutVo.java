package com.slb.payout_backend.modules.payout.vo;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 取消结果。success 只表示取消已提交；商户是否收到回调看 callbackDispatched / callbackError。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CancelPayoutVo {
    private boolean success;
    private String status;
    private boolean callbackDispatched;
    private String callbackError;
}
