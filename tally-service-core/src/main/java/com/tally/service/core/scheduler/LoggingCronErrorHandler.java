package com.tally.service.core.scheduler;

import com.tally.service.core.support.CallbackException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.ErrorHandler;

/** Default error channel for cron callbacks. */
@Slf4j
public class LoggingCronErrorHandler implements ErrorHandler {

    @Override
    public void handleError(Throwable t) {
        if (t instanceof CallbackException callback) {
            log.error("Scheduled job '{}' failed", callback.scheduleName(), callback.getCause());
        } else {
            log.error("Scheduled job failed", t);
        }
    }
}
