package com.nosota.msettle.service;

import com.nosota.msettle.error.SettlementNotFoundException;
import com.nosota.msettle.model.LedgerEntry;
import com.nosota.msettle.model.Settlement;
import com.nosota.msettle.model.SettlementEventRecord;
import com.nosota.msettle.model.Transfer;
import com.nosota.msettle.repository.SettlementEventRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Read-only views of settlements: details, audit trail, ledger entries and initiator history.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class SettlementHistoryService {

    private final SettlementRegistry registry;
    private final FundLedger ledger;
    private final SettlementEventRepository settlementEventRepository;

    public Settlement getSettlement(Long id) throws SettlementNotFoundException {
        return registry.get(id);
    }

    public List<Transfer> getTransfers(Long id) throws SettlementNotFoundException {
        registry.get(id);
        return registry.getTransfers(id);
    }

    public List<SettlementEventRecord> getEvents(Long id) throws SettlementNotFoundException {
        registry.get(id);
        return settlementEventRepository.findBySettlementIdOrderByIdAsc(id);
    }

    public List<LedgerEntry> getLedgerEntries(Long id) throws SettlementNotFoundException {
        registry.get(id);
        return ledger.entries(id);
    }

    public Page<Settlement> getInitiatorHistory(String initiator, Pageable pageable) {
        return registry.getInitiatorHistory(initiator, pageable);
    }
}
