package com.tally.service.core.counter;

public record CounterDelta(FineCounterKey key, long delta) {}
