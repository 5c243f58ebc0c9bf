package com.nosota.msettle.repository;

import com.nosota.msettle.api.model.LedgerEntryType;
import com.nosota.msettle.model.LedgerEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LedgerEntryRepository extends JpaRepository<LedgerEntry, Long> {

    /**
     * Returns the entries of a settlement in insertion order.
     */
    List<LedgerEntry> findBySettlementIdOrderByIdAsc(Long settlementId);

    @Query("SELECT COALESCE(SUM(e.amount), 0) FROM LedgerEntry e WHERE e.type = :type")
    Long sumAmountByType(@Param("type") LedgerEntryType type);

    @Query("SELECT COALESCE(SUM(e.amount), 0) FROM LedgerEntry e " +
            "WHERE e.settlementId = :settlementId AND e.type = :type")
    Long sumAmountBySettlementIdAndType(@Param("settlementId") Long settlementId,
                                        @Param("type") LedgerEntryType type);
}
