package com.nosota.msettle.error;

/**
 * The settlement is FINALIZED or FAILED and accepts no further mutation.
 */
public class AlreadyTerminalException extends SettlementException {
    public AlreadyTerminalException(String message) {
        super(message);
    }
}
