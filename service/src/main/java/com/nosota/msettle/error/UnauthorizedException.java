package com.nosota.msettle.error;

/**
 * Caller lacks the capability required by the requested transition.
 */
public class UnauthorizedException extends SettlementException {
    public UnauthorizedException(String message) {
        super(message);
    }
}
