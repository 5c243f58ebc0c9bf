package com.nosota.msettle.repository;

import com.nosota.msettle.model.Transfer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TransferRepository extends JpaRepository<Transfer, Long> {

    List<Transfer> findBySettlementIdOrderByTransferIndexAsc(Long settlementId);

    /**
     * Finds the transfers of a settlement that have not been executed yet, in execution order.
     *
     * @param settlementId Settlement id
     * @return Unexecuted transfers ordered by transfer index
     */
    List<Transfer> findBySettlementIdAndExecutedFalseOrderByTransferIndexAsc(Long settlementId);

    long countBySettlementIdAndExecutedTrue(Long settlementId);
}
