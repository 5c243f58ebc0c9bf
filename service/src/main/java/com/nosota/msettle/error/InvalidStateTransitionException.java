package com.nosota.msettle.error;

/**
 * The settlement is in a non-terminal state that does not allow the requested operation.
 */
public class InvalidStateTransitionException extends SettlementException {
    public InvalidStateTransitionException(String message) {
        super(message);
    }
}
