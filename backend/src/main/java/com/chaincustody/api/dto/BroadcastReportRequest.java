package com.chaincustody.api.dto;

import jakarta.validation.constraints.NotBlank;

public record BroadcastReportRequest(@NotBlank(message = "INVALID_HASH") String hash) {
}
