package com.nosota.msettle.api.response;

import com.nosota.msettle.api.dto.DepositorRefundDTO;
import com.nosota.msettle.api.model.SettlementState;

import java.util.List;

public record RefundResponse(
        Long settlementId,
        Long totalRefunded,
        List<DepositorRefundDTO> refunds,
        SettlementState state
) {
}
