package com.slb.payout_backend.modules.trader.mapper;

import com.slb.payout_backend.modules.trader.entity.Trader;
import org.apache.ibatis.annotations.Mapper;

import java.util.List;

@Mapper
public interface TraderMapper {

    /**
     * 当前可接单的交易员，按 numericId 升序：
     * 开启接单、未封禁、可用余额 > 0，且与存在待分配出款单的商户建立了启用中的出款关系。
     */
    List<Trader> selectEligibleTraders();
}
