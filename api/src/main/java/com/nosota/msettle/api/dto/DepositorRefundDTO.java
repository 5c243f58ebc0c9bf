package com.nosota.msettle.api.dto;

/**
 * Amount returned to a single depositor.
 */
public record DepositorRefundDTO(
        String depositor,
        Long amount
) {
}
