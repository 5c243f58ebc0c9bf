package com.nosota.msettle.api.response;

/**
 * Result of a deposit.
 *
 * @param settlementId   Settlement that received the funds
 * @param depositor      Depositing party
 * @param amount         Deposited amount
 * @param totalDeposited Updated total deposited
 * @param totalAmount    Amount required for full funding
 */
public record DepositResponse(
        Long settlementId,
        String depositor,
        Long amount,
        Long totalDeposited,
        Long totalAmount
) {
}
