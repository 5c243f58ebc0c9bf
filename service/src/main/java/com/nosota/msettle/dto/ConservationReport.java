package com.nosota.msettle.dto;

public record ConservationReport(
        boolean holds,
        long totalDeposits,
        long totalRefunds,
        long totalPayouts,
        long escrowBalance,
        String reason
) {
}
