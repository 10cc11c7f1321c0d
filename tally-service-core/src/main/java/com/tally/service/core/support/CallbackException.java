package com.tally.service.core.support;

/** Wraps a failure raised by a scheduled job so it can be reported without stopping the schedule. */
public class CallbackException extends TallyException {

    private final String scheduleName;

    public CallbackException(String scheduleName, Throwable cause) {
        super("Scheduled job '" + scheduleName + "' failed: " + cause.getMessage(), cause);
        this.scheduleName = scheduleName;
    }

    public String scheduleName() {
        return scheduleName;
    }
}
