package com.nosota.msettle.mapper;

import com.nosota.msettle.api.response.ConservationResponse;
import com.nosota.msettle.api.response.ProtocolStatsResponse;
import com.nosota.msettle.api.response.SecuredPriceResponse;
import com.nosota.msettle.dto.ConservationReport;
import com.nosota.msettle.dto.ProtocolStats;
import com.nosota.msettle.price.SecuredPrice;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

@Mapper
public interface ProtocolMapper {

    ProtocolMapper INSTANCE = Mappers.getMapper(ProtocolMapper.class);

    ProtocolStatsResponse toResponse(ProtocolStats stats);

    ConservationResponse toResponse(ConservationReport report);

    SecuredPriceResponse toResponse(SecuredPrice price);
}
