package com.nosota.msettle.dto;

import com.nosota.msettle.model.Settlement;

/**
 * Outcome of one execution batch.
 *
 * @param settlement    Settlement after the batch
 * @param executedDelta Transfers executed by this batch
 * @param amountPaid    Sum paid out by this batch
 */
public record ExecutionResult(Settlement settlement, int executedDelta, long amountPaid) {
}
