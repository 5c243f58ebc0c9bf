package com.nosota.msettle.repository;

import com.nosota.msettle.api.model.SettlementState;
import com.nosota.msettle.model.Settlement;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for {@link Settlement} entity operations.
 *
 * <p>Provides data access methods for:
 * <ul>
 *   <li>Locked reads for state transitions</li>
 *   <li>Execution queue lookups by queue position</li>
 *   <li>Paginated history by initiator</li>
 *   <li>Aggregates for statistics</li>
 * </ul>
 */
@Repository
public interface SettlementRepository extends JpaRepository<Settlement, Long> {

    /**
     * Retrieves a settlement and locks it for update.
     *
     * <p>Callers already hold the protocol-state lock; this lock protects the row against
     * writers that bypass it.
     *
     * @param id Settlement id
     * @return The locked settlement, if present
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Settlement s WHERE s.id = :id")
    Optional<Settlement> findForUpdate(@Param("id") Long id);

    /**
     * Finds the queued settlement with the lowest queue position.
     *
     * @param states Queued states (INITIATED, EXECUTING)
     * @return Queue head, if any
     */
    Optional<Settlement> findFirstByStateInOrderByQueuePositionAsc(Collection<SettlementState> states);

    long countByStateIn(Collection<SettlementState> states);

    /**
     * Checks whether a queued settlement that never went through a dispute ranks ahead of the given position.
     */
    boolean existsByStateInAndQueuePositionLessThanAndResolvedAtIsNull(Collection<SettlementState> states,
                                                                       Long queuePosition);

    Page<Settlement> findByInitiatorOrderByCreatedAtDesc(String initiator, Pageable pageable);

    @Query("SELECT s.state, COUNT(s) FROM Settlement s GROUP BY s.state")
    List<Object[]> countGroupedByState();

    @Query("SELECT COALESCE(SUM(s.totalAmount), 0) FROM Settlement s WHERE s.state = :state")
    Long sumTotalAmountByState(@Param("state") SettlementState state);

    @Query("SELECT COALESCE(SUM(s.totalDeposited - s.totalPaidOut), 0) FROM Settlement s")
    Long sumEscrowBalance();
}
