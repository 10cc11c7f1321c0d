package com.tally.service.core.score;

import java.time.Instant;

/** Summed count of one day or month bucket. */
public record BucketCount(Instant bucket, long count) {}
