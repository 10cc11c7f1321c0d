package com.tally.api.dto;

import jakarta.validation.constraints.NotBlank;
import java.time.Instant;

public record NameRequest(@NotBlank String name, Instant at) {}
