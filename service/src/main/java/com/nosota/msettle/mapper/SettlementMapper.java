package com.nosota.msettle.mapper;

import com.nosota.msettle.api.dto.DepositorRefundDTO;
import com.nosota.msettle.api.dto.LedgerEntryDTO;
import com.nosota.msettle.api.dto.SettlementEventDTO;
import com.nosota.msettle.api.dto.TransferDTO;
import com.nosota.msettle.api.response.CanInitiateResponse;
import com.nosota.msettle.api.response.InvariantStatusResponse;
import com.nosota.msettle.api.response.SettlementResponse;
import com.nosota.msettle.dto.DepositorRefund;
import com.nosota.msettle.dto.InitiationCheck;
import com.nosota.msettle.dto.InvariantReport;
import com.nosota.msettle.model.LedgerEntry;
import com.nosota.msettle.model.Settlement;
import com.nosota.msettle.model.SettlementEventRecord;
import com.nosota.msettle.model.Transfer;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.factory.Mappers;

import java.util.List;

/**
 * MapStruct mapper from settlement entities and results to API records.
 */
@Mapper
public interface SettlementMapper {

    SettlementMapper INSTANCE = Mappers.getMapper(SettlementMapper.class);

    SettlementResponse toResponse(Settlement settlement);

    @Mapping(target = "index", source = "transferIndex")
    TransferDTO toDTO(Transfer transfer);

    List<TransferDTO> toTransferDTOList(List<Transfer> transfers);

    LedgerEntryDTO toDTO(LedgerEntry entry);

    List<LedgerEntryDTO> toLedgerEntryDTOList(List<LedgerEntry> entries);

    SettlementEventDTO toDTO(SettlementEventRecord event);

    List<SettlementEventDTO> toEventDTOList(List<SettlementEventRecord> events);

    DepositorRefundDTO toDTO(DepositorRefund refund);

    List<DepositorRefundDTO> toRefundDTOList(List<DepositorRefund> refunds);

    CanInitiateResponse toResponse(InitiationCheck check);

    InvariantStatusResponse toResponse(InvariantReport report);
}
