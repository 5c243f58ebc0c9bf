package com.nosota.msettle.api.response;

import java.time.LocalDateTime;

public record RefundEligibilityResponse(
        Long settlementId,
        boolean eligible,
        LocalDateTime deadline
) {
}
