package com.tally.service.core.scheduler;

/** Work invoked on each firing with the arguments given at registration. */
@FunctionalInterface
public interface CronCallback {
    void invoke(Object... args) throws Exception;
}
