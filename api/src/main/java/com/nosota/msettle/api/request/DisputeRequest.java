package com.nosota.msettle.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record DisputeRequest(
        @NotBlank(message = "Dispute reason is required")
        @Size(max = 500, message = "Dispute reason must not exceed 500 characters")
        String reason
) {
}
