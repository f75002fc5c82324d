package com.slb.payout_backend.modules.payout.mapper;

import com.slb.payout_backend.modules.payout.entity.Payout;
import com.slb.payout_backend.modules.payout.entity.PayoutDetails;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;
import java.util.Optional;

@Mapper
public interface PayoutMapper {

    /**
     * 待分配出款单：OUT 方向、CREATED、未分配、未接单、未被聚合通道占用，按创建时间升序。
     */
    List<Payout> selectUnassignedPayouts();

    /**
     * 单条条件更新完成“认领”：所有可分配条件都写在 WHERE 中，
     * 并发的两次认领只有一方能命中行，另一方返回 0。
     *
     * @return 受影响行数（0 或 1）
     */
    int claimPayout(@Param("payoutId") String payoutId,
                    @Param("traderId") String traderId,
                    @Param("acceptanceTime") int acceptanceTime);

    /**
     * SELECT ... FOR UPDATE，必须在事务内调用；行锁在事务结束时释放。
     */
    Optional<PayoutDetails> selectDetailsForUpdate(@Param("id") String id);

    /**
     * reason / reasonCode 为 null 时保留原值。
     */
    int markCancelled(@Param("id") String id,
                      @Param("reason") String reason,
                      @Param("reasonCode") String reasonCode);
}
