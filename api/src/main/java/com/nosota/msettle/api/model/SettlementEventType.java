package com.nosota.msettle.api.model;

public enum SettlementEventType {
    SETTLEMENT_CREATED,
    DEPOSIT_RECEIVED,
    SETTLEMENT_INITIATED,
    SETTLEMENT_EXECUTED,
    SETTLEMENT_FINALIZED,
    SETTLEMENT_REFUNDED,
    DISPUTE_RAISED,
    DISPUTE_RESOLVED,
    PROTOCOL_PAUSED,
    PROTOCOL_UNPAUSED,
    DISPUTER_GRANTED,
    DISPUTER_REVOKED,
    MANUAL_PRICE_SET
}
