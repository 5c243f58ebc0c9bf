package com.nosota.msettle.api.response;

import com.nosota.msettle.api.dto.TransferDTO;

import java.util.List;

public record SettlementDetailsResponse(
        SettlementResponse settlement,
        List<TransferDTO> transfers
) {
}
