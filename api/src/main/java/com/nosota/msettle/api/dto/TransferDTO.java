package com.nosota.msettle.api.dto;

import java.time.LocalDateTime;

/**
 * One line item of a settlement.
 *
 * @param index      Position in the original transfer list (execution order)
 * @param from       Paying party
 * @param to         Receiving party
 * @param amount     Amount in smallest units
 * @param executed   Whether the transfer has been paid out
 * @param executedAt Payout timestamp, null while not executed
 */
public record TransferDTO(
        Integer index,
        String from,
        String to,
        Long amount,
        boolean executed,
        LocalDateTime executedAt
) {
}
