package com.nosota.msettle.error;

public class SettlementNotFoundException extends SettlementException {
    public SettlementNotFoundException(String message) {
        super(message);
    }
}
