package com.warden.dispatch.api;

import java.time.Instant;

public record ErrorResponse(String error, int status, Instant timestamp) {}
