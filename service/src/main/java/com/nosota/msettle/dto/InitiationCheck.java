package com.nosota.msettle.dto;

public record InitiationCheck(boolean allowed, String reason) {

    public static final String READY = "Ready";

    public static InitiationCheck ready() {
        return new InitiationCheck(true, READY);
    }

    public static InitiationCheck blocked(String reason) {
        return new InitiationCheck(false, reason);
    }
}
