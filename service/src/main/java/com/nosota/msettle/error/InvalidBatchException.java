package com.nosota.msettle.error;

public class InvalidBatchException extends SettlementException {
    public InvalidBatchException(String message) {
        super(message);
    }
}
