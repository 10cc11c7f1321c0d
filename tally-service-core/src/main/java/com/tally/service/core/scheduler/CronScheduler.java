package com.tally.service.core.scheduler;

import com.tally.service.core.support.ConfigurationException;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.util.ErrorHandler;

/** Registry of cron schedules sharing one single-threaded timer. */
@Slf4j
@Component
public class CronScheduler {

    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final ErrorHandler errorHandler;
    private final Map<String, CronJob> jobs = new ConcurrentHashMap<>();

    public CronScheduler(
            @Qualifier("cronTaskScheduler") TaskScheduler taskScheduler,
            Clock clock,
            @Qualifier("cronErrorHandler") ErrorHandler errorHandler) {
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.errorHandler = errorHandler;
    }

    /**
     * Parses {@code spec} in {@code timezone} and registers the schedule under {@code name}.
     *
     * @param timezone any representation accepted by {@link CanonicalZone#of(Object)}
     * @throws ConfigurationException on a malformed spec, an unknown timezone or a duplicate name
     */
    public CronJob register(
            String name, String spec, CronCallback callback, Object[] args, boolean autostart, Object timezone) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Schedule name is required");
        }
        if (callback == null) {
            throw new ConfigurationException("Schedule '" + name + "' has no callback");
        }
        CronSpec cron = CronSpec.parse(spec, CanonicalZone.of(timezone));
        CronJob job = new CronJob(name, cron, callback, args, taskScheduler, clock, errorHandler);
        if (jobs.putIfAbsent(name, job) != null) {
            throw new ConfigurationException("Schedule '" + name + "' is already registered");
        }
        if (autostart) {
            job.start();
        }
        log.info("Registered schedule '{}' {} autostart={} next={}", name, cron, autostart, job.nextFireTime());
        return job;
    }

    public Optional<CronJob> find(String name) {
        return Optional.ofNullable(jobs.get(name));
    }

    public List<CronJob> jobs() {
        return jobs.values().stream().sorted(Comparator.comparing(CronJob::name)).toList();
    }

    /** Stops and forgets the schedule. */
    public boolean unregister(String name) {
        CronJob job = jobs.remove(name);
        if (job == null) {
            return false;
        }
        job.stop();
        return true;
    }

    @PreDestroy
    public void stopAll() {
        jobs.values().forEach(CronJob::stop);
    }
}
