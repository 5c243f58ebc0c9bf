package com.nosota.msettle.repository;

import com.nosota.msettle.model.AuthorizedParty;
import com.nosota.msettle.model.PartyRole;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AuthorizedPartyRepository extends JpaRepository<AuthorizedParty, Long> {

    boolean existsByPartyAndRole(String party, PartyRole role);

    Optional<AuthorizedParty> findByPartyAndRole(String party, PartyRole role);
}
