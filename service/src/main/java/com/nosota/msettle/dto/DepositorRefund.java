package com.nosota.msettle.dto;

public record DepositorRefund(String depositor, long amount) {
}
