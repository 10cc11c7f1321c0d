package com.tally.api.dto;

import jakarta.validation.constraints.NotBlank;
import java.time.Instant;

/** Avatar image; {@code data} is base64 encoded. */
public record AvatarRequest(@NotBlank String mimeFormat, @NotBlank String data, Instant at) {}
