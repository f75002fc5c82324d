package com.slb.payout_backend.modules.payout.vo;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AssignPayoutVo {
    private boolean success;
}
