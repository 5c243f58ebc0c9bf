package com.nosota.msettle.error;

public class TimeoutNotReachedException extends SettlementException {
    public TimeoutNotReachedException(String message) {
        super(message);
    }
}
