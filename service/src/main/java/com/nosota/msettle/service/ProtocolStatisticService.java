package com.nosota.msettle.service;

import com.nosota.msettle.api.model.SettlementState;
import com.nosota.msettle.dto.ProtocolStats;
import com.nosota.msettle.repository.SettlementRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumMap;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class ProtocolStatisticService {

    private final SettlementRepository settlementRepository;
    private final FairOrderingQueue queue;

    /**
     * Counts settlements per state (every state present, zero when unused), the settled
     * volume of FINALIZED settlements, the escrow balance and the queue length.
     */
    @Transactional(readOnly = true)
    public ProtocolStats getStats() {
        Map<SettlementState, Long> byState = new EnumMap<>(SettlementState.class);
        for (SettlementState state : SettlementState.values()) {
            byState.put(state, 0L);
        }
        for (Object[] row : settlementRepository.countGroupedByState()) {
            byState.put((SettlementState) row[0], ((Number) row[1]).longValue());
        }

        Long settledVolume = settlementRepository.sumTotalAmountByState(SettlementState.FINALIZED);
        Long escrow = settlementRepository.sumEscrowBalance();

        return new ProtocolStats(
                byState,
                settledVolume != null ? settledVolume : 0L,
                escrow != null ? escrow : 0L,
                queue.queueLength());
    }
}
