package com.nosota.msettle.error;

public class ProtocolPausedException extends SettlementException {
    public ProtocolPausedException(String message) {
        super(message);
    }
}
