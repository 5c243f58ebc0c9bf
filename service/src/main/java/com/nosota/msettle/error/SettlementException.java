package com.nosota.msettle.error;

/**
 * Base class of all checked settlement errors.
 *
 * <p>Every operation that throws one of these leaves no partial mutation behind:
 * the surrounding transaction is rolled back.
 */
public abstract class SettlementException extends Exception {
    protected SettlementException(String message) {
        super(message);
    }

    protected SettlementException(String message, Throwable cause) {
        super(message, cause);
    }
}
