package com.nosota.msettle.service;

import com.nosota.msettle.api.model.SettlementState;
import com.nosota.msettle.api.request.TransferRequest;
import com.nosota.msettle.error.InvalidBatchException;
import com.nosota.msettle.error.InvalidRequestException;
import com.nosota.msettle.error.SettlementNotFoundException;
import com.nosota.msettle.model.ProtocolState;
import com.nosota.msettle.model.Settlement;
import com.nosota.msettle.model.Transfer;
import com.nosota.msettle.repository.SettlementRepository;
import com.nosota.msettle.repository.TransferRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Owns settlement records and their transfer line items.
 *
 * <p>The registry validates and stores; it never decides whether a transition is allowed.
 * Ids come from the protocol-state counter, which the caller has locked.
 */
@Service
@Slf4j
public class SettlementRegistry {

    private final SettlementRepository settlementRepository;
    private final TransferRepository transferRepository;
    private final Clock clock;
    private final int maxTransfers;
    private final long defaultTimeoutSeconds;

    public SettlementRegistry(SettlementRepository settlementRepository,
                              TransferRepository transferRepository,
                              Clock clock,
                              @Value("${settlement.max-transfers:100}") int maxTransfers,
                              @Value("${settlement.default-timeout-seconds:3600}") long defaultTimeoutSeconds) {
        this.settlementRepository = settlementRepository;
        this.transferRepository = transferRepository;
        this.clock = clock;
        this.maxTransfers = maxTransfers;
        this.defaultTimeoutSeconds = defaultTimeoutSeconds;
    }

    /**
     * Validates the transfer list and stores a new PENDING settlement.
     *
     * @param protocol         Locked protocol state, source of the next id
     * @param initiator        Creating party
     * @param transfers        Transfer line items in execution order
     * @param timeoutSeconds   Seconds until refunds become possible; null or 0 selects the default
     * @param priceDenominated Whether initiation and execution require a secure price
     * @return The stored settlement
     * @throws InvalidRequestException if the transfer list or timeout is invalid
     */
    public Settlement create(ProtocolState protocol, String initiator, List<TransferRequest> transfers,
                             Long timeoutSeconds, boolean priceDenominated) throws InvalidRequestException {
        if (initiator == null || initiator.isBlank()) {
            throw new InvalidRequestException("Initiator is required");
        }
        if (initiator.length() > SettlementAuthorizer.MAX_PARTY_LENGTH) {
            throw new InvalidRequestException(String.format(
                    "Initiator exceeds %d characters", SettlementAuthorizer.MAX_PARTY_LENGTH));
        }
        if (transfers == null || transfers.isEmpty()) {
            throw new InvalidRequestException("Transfer list must not be empty");
        }
        if (transfers.size() > maxTransfers) {
            throw new InvalidRequestException(String.format(
                    "Transfer list has %d items, at most %d allowed", transfers.size(), maxTransfers));
        }

        long totalAmount = 0;
        for (int i = 0; i < transfers.size(); i++) {
            TransferRequest transfer = transfers.get(i);
            if (transfer == null) {
                throw new InvalidRequestException("Transfer " + i + " is missing");
            }
            if (transfer.from() == null || transfer.from().isBlank()
                    || transfer.to() == null || transfer.to().isBlank()) {
                throw new InvalidRequestException("Transfer " + i + " must name both parties");
            }
            if (transfer.from().length() > SettlementAuthorizer.MAX_PARTY_LENGTH
                    || transfer.to().length() > SettlementAuthorizer.MAX_PARTY_LENGTH) {
                throw new InvalidRequestException(String.format(
                        "Transfer %d party exceeds %d characters", i, SettlementAuthorizer.MAX_PARTY_LENGTH));
            }
            if (transfer.amount() == null || transfer.amount() <= 0) {
                throw new InvalidRequestException("Transfer " + i + " amount must be positive");
            }
            try {
                totalAmount = Math.addExact(totalAmount, transfer.amount());
            } catch (ArithmeticException e) {
                throw new InvalidRequestException("Total transfer amount overflows", e);
            }
        }

        long timeout = timeoutSeconds == null || timeoutSeconds == 0 ? defaultTimeoutSeconds : timeoutSeconds;
        if (timeout < 0) {
            throw new InvalidRequestException("Timeout must not be negative: " + timeout);
        }

        LocalDateTime createdAt = LocalDateTime.now(clock);
        LocalDateTime deadline;
        try {
            deadline = createdAt.plusSeconds(timeout);
        } catch (DateTimeException | ArithmeticException e) {
            throw new InvalidRequestException("Timeout is out of range: " + timeout, e);
        }

        Long id = protocol.getNextSettlementId();
        protocol.setNextSettlementId(Math.addExact(id, 1L));

        Settlement settlement = new Settlement();
        settlement.setId(id);
        settlement.setSettlementHash(hash(id, initiator, createdAt, transfers));
        settlement.setInitiator(initiator);
        settlement.setTotalAmount(totalAmount);
        settlement.setTotalDeposited(0L);
        settlement.setTotalPaidOut(0L);
        settlement.setState(SettlementState.PENDING);
        settlement.setCreatedAt(createdAt);
        settlement.setTimeoutSeconds(timeout);
        settlement.setDeadline(deadline);
        settlement.setTotalTransfers(transfers.size());
        settlement.setExecutedTransfers(0);
        settlement.setPriceDenominated(priceDenominated);
        settlement = settlementRepository.save(settlement);

        List<Transfer> items = new ArrayList<>(transfers.size());
        for (int i = 0; i < transfers.size(); i++) {
            TransferRequest request = transfers.get(i);
            items.add(new Transfer(null, id, i, request.from(), request.to(), request.amount(), false, null));
        }
        transferRepository.saveAll(items);

        log.info("Created settlement {}: initiator={}, transfers={}, totalAmount={}, deadline={}",
                id, initiator, transfers.size(), totalAmount, deadline);
        return settlement;
    }

    public Settlement get(Long id) throws SettlementNotFoundException {
        return settlementRepository.findById(id)
                .orElseThrow(() -> notFound(id));
    }

    /**
     * Loads a settlement under a pessimistic write lock.
     */
    public Settlement getForUpdate(Long id) throws SettlementNotFoundException {
        return settlementRepository.findForUpdate(id)
                .orElseThrow(() -> notFound(id));
    }

    public List<Transfer> getTransfers(Long id) {
        return transferRepository.findBySettlementIdOrderByTransferIndexAsc(id);
    }

    /**
     * Marks the next {@code count} unexecuted transfers as executed, in array order,
     * and advances {@code executedTransfers}.
     *
     * @param settlement Settlement being executed
     * @param count      Number of transfers to mark
     * @return The transfers marked by this call
     * @throws InvalidBatchException if count is below 1 or exceeds the remaining transfers
     */
    public List<Transfer> markExecuted(Settlement settlement, int count) throws InvalidBatchException {
        int remaining = settlement.remainingTransfers();
        if (count < 1 || count > remaining) {
            throw new InvalidBatchException(String.format(
                    "Batch of %d is invalid for settlement %d with %d remaining transfers",
                    count, settlement.getId(), remaining));
        }

        List<Transfer> pending = transferRepository.findBySettlementIdAndExecutedFalseOrderByTransferIndexAsc(
                settlement.getId());
        if (pending.size() != remaining) {
            throw new IllegalStateException(String.format(
                    "Settlement %d reports %d remaining transfers but %d are unexecuted",
                    settlement.getId(), remaining, pending.size()));
        }

        LocalDateTime now = LocalDateTime.now(clock);
        List<Transfer> batch = new ArrayList<>(pending.subList(0, count));
        for (Transfer transfer : batch) {
            transfer.setExecuted(true);
            transfer.setExecutedAt(now);
        }
        transferRepository.saveAll(batch);
        settlement.setExecutedTransfers(settlement.getExecutedTransfers() + count);

        return batch;
    }

    /**
     * Gets settlements of an initiator, newest first.
     */
    public Page<Settlement> getInitiatorHistory(String initiator, Pageable pageable) {
        return settlementRepository.findByInitiatorOrderByCreatedAtDesc(initiator, pageable);
    }

    public Settlement save(Settlement settlement) {
        return settlementRepository.save(settlement);
    }

    static String hash(Long id, String initiator, LocalDateTime createdAt, List<TransferRequest> transfers) {
        StringBuilder content = new StringBuilder()
                .append(id).append('|')
                .append(initiator).append('|')
                .append(createdAt);
        for (TransferRequest transfer : transfers) {
            content.append('|').append(transfer.from())
                    .append('>').append(transfer.to())
                    .append(':').append(transfer.amount());
        }

        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private static SettlementNotFoundException notFound(Long id) {
        return new SettlementNotFoundException("Settlement " + id + " not found");
    }
}
