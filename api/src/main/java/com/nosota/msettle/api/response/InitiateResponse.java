package com.nosota.msettle.api.response;

public record InitiateResponse(
        Long settlementId,
        Long queuePosition
) {
}
