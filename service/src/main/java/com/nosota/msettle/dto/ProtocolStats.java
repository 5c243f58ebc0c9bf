package com.nosota.msettle.dto;

import com.nosota.msettle.api.model.SettlementState;

import java.util.Map;

public record ProtocolStats(
        Map<SettlementState, Long> settlementsByState,
        long totalSettledVolume,
        long escrowBalance,
        long queueLength
) {
}
