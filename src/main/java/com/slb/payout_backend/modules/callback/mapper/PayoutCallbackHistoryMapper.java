package com.slb.payout_backend.modules.callback.mapper;

import com.slb.payout_backend.modules.callback.entity.PayoutCallbackHistory;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface PayoutCallbackHistoryMapper {
    int insert(PayoutCallbackHistory history);
}
