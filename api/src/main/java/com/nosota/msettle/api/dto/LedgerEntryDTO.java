package com.nosota.msettle.api.dto;

import com.nosota.msettle.api.model.LedgerEntryType;

import java.time.LocalDateTime;

public record LedgerEntryDTO(
        Long id,
        Long settlementId,
        String party,
        LedgerEntryType type,
        Long amount,
        Integer transferIndex,
        LocalDateTime createdAt
) {
}
