package com.nosota.msettle.service;

import com.nosota.msettle.error.ProtocolPausedException;
import com.nosota.msettle.model.ProtocolState;
import com.nosota.msettle.repository.ProtocolStateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Access to the single protocol-state row.
 *
 * <p>Mutating operations call {@link #lockForUpdate()} before anything else, which linearizes them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProtocolStateService {

    private final ProtocolStateRepository protocolStateRepository;
    private final Clock clock;

    /**
     * Loads the protocol state under a pessimistic write lock, creating the row on first use.
     */
    public ProtocolState lockForUpdate() {
        return protocolStateRepository.findForUpdate(ProtocolState.SINGLETON_ID)
                .orElseGet(() -> {
                    log.warn("Protocol state row missing, creating initial state");
                    return protocolStateRepository.saveAndFlush(ProtocolState.initial());
                });
    }

    /**
     * Reads the protocol state without locking.
     */
    public ProtocolState current() {
        return protocolStateRepository.findById(ProtocolState.SINGLETON_ID)
                .orElseGet(ProtocolState::initial);
    }

    public void requireNotPaused(ProtocolState protocol) throws ProtocolPausedException {
        if (protocol.isPaused()) {
            throw new ProtocolPausedException("Protocol is paused");
        }
    }

    public ProtocolState save(ProtocolState protocol) {
        protocol.setUpdatedAt(LocalDateTime.now(clock));
        return protocolStateRepository.save(protocol);
    }
}
