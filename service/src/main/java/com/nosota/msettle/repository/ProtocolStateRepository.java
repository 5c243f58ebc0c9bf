package com.nosota.msettle.repository;

import com.nosota.msettle.model.ProtocolState;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ProtocolStateRepository extends JpaRepository<ProtocolState, Integer> {
    /**
     * Retrieves the protocol state row and locks it for update.
     * <p>
     * Holding this <b>pessimistic write lock</b> is what linearizes settlement operations:
     * a second writer blocks here until the first transaction commits or rolls back.
     * Keep the surrounding transaction short.
     * </p>
     *
     * @param id The protocol state row id
     * @return The locked protocol state
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM ProtocolState p WHERE p.id = :id")
    Optional<ProtocolState> findForUpdate(@Param("id") Integer id);
}
