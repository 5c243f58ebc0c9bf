package com.nosota.msettle.dto;

import com.nosota.msettle.model.Settlement;

import java.util.List;

public record RefundResult(Settlement settlement, List<DepositorRefund> refunds) {

    public long totalRefunded() {
        return refunds.stream().mapToLong(DepositorRefund::amount).sum();
    }
}
