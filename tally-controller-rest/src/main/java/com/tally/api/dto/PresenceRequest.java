package com.tally.api.dto;

import java.time.Instant;

public record PresenceRequest(String status, Instant at) {}
