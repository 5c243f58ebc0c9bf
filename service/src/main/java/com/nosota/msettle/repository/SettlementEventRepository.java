package com.nosota.msettle.repository;

import com.nosota.msettle.api.model.SettlementEventType;
import com.nosota.msettle.model.SettlementEventRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SettlementEventRepository extends JpaRepository<SettlementEventRecord, Long> {

    List<SettlementEventRecord> findBySettlementIdOrderByIdAsc(Long settlementId);

    List<SettlementEventRecord> findByTypeOrderByIdAsc(SettlementEventType type);
}
