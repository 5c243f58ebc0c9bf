package com.nosota.msettle.error;

/**
 * Malformed input: empty or oversized transfer list, non-positive amount, blank party or reason.
 */
public class InvalidRequestException extends SettlementException {
    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
