package com.avari.signaling.web.dto;

import java.time.Instant;

public record ApiError(String error, String message, Instant timestamp) {
}
