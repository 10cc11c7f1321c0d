package com.tally.service.core.rollup;

import com.tally.service.core.config.TallyProperties;
import com.tally.service.core.scheduler.CronJob;
import com.tally.service.core.scheduler.CronScheduler;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Binds the monthly and yearly rollups to their cron schedules. */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "tally.rollup", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RollupJobs {

    public static final String MONTHLY_JOB = "rollup-month";
    public static final String YEARLY_JOB = "rollup-year";

    private final CronScheduler scheduler;
    private final RollupAggregator aggregator;
    private final TallyProperties properties;
    private final List<CronJob> registered = new ArrayList<>();

    @PostConstruct
    public void registerSchedules() {
        TallyProperties.Rollup rollup = properties.getRollup();
        registered.add(register(MONTHLY_JOB, rollup.getMonthlyCron(), RollupPeriod.MONTH, rollup.getTimezone()));
        registered.add(register(YEARLY_JOB, rollup.getYearlyCron(), RollupPeriod.YEAR, rollup.getTimezone()));
    }

    private CronJob register(String name, String cron, RollupPeriod period, String timezone) {
        return scheduler.register(
                name, cron, args -> aggregator.aggregate((String) args[0]), new Object[] {period.token()}, true, timezone);
    }

    List<CronJob> registered() {
        return List.copyOf(registered);
    }

    @PreDestroy
    public void stopSchedules() {
        registered.forEach(CronJob::stop);
        log.info("Stopped {} rollup schedules", registered.size());
    }
}
