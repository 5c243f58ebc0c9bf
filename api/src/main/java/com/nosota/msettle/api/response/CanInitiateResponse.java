package com.nosota.msettle.api.response;

/**
 * Answer to "can this settlement be initiated now".
 *
 * @param allowed Whether all preconditions hold
 * @param reason  "Ready" or the first failed precondition
 */
public record CanInitiateResponse(
        boolean allowed,
        String reason
) {
}
