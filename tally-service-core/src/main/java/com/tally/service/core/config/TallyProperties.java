package com.tally.service.core.config;

import com.tally.service.core.calendar.TallyCalendar;
import com.tally.service.core.retention.HistoryLogType;
import com.tally.service.core.retention.TieBreakPolicy;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "tally")
public class TallyProperties {
    private Calendar calendar = new Calendar();
    private Score score = new Score();
    private Retention retention = new Retention();
    private Rollup rollup = new Rollup();
    private Counters counters = new Counters();
    private Admin admin = new Admin();

    public Calendar getCalendar() {
        return calendar;
    }

    public void setCalendar(Calendar calendar) {
        this.calendar = calendar;
    }

    public Score getScore() {
        return score;
    }

    public void setScore(Score score) {
        this.score = score;
    }

    public Retention getRetention() {
        return retention;
    }

    public void setRetention(Retention retention) {
        this.retention = retention;
    }

    public Rollup getRollup() {
        return rollup;
    }

    public void setRollup(Rollup rollup) {
        this.rollup = rollup;
    }

    public Counters getCounters() {
        return counters;
    }

    public void setCounters(Counters counters) {
        this.counters = counters;
    }

    public Admin getAdmin() {
        return admin;
    }

    public void setAdmin(Admin admin) {
        this.admin = admin;
    }

    public static class Calendar {
        private Duration dayOffset = TallyCalendar.DEFAULT_DAY_OFFSET;

        public Duration getDayOffset() {
            return dayOffset;
        }

        public void setDayOffset(Duration dayOffset) {
            this.dayOffset = dayOffset;
        }
    }

    public static class Score {
        /** First instant counted by the all-time bucket. */
        private Instant epoch = Instant.parse("2018-01-01T00:00:00Z");

        public Instant getEpoch() {
            return epoch;
        }

        public void setEpoch(Instant epoch) {
            this.epoch = epoch;
        }
    }

    public static class Retention {
        private Map<HistoryLogType, Integer> caps = new EnumMap<>(HistoryLogType.class);
        private TieBreakPolicy tieBreak = TieBreakPolicy.NEWEST_INSERT_FIRST;

        public Map<HistoryLogType, Integer> getCaps() {
            return caps;
        }

        public void setCaps(Map<HistoryLogType, Integer> caps) {
            this.caps = caps;
        }

        public TieBreakPolicy getTieBreak() {
            return tieBreak;
        }

        public void setTieBreak(TieBreakPolicy tieBreak) {
            this.tieBreak = tieBreak;
        }

        public int capFor(HistoryLogType type) {
            Integer configured = caps != null ? caps.get(type) : null;
            return configured != null ? configured : type.defaultCap();
        }
    }

    public static class Rollup {
        private boolean enabled = true;
        private String monthlyCron = "5 8 1 * *";
        private String yearlyCron = "10 8 1 1 *";
        private String timezone = "UTC";
        private Duration transactionTimeout = Duration.ofSeconds(60);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getMonthlyCron() {
            return monthlyCron;
        }

        public void setMonthlyCron(String monthlyCron) {
            this.monthlyCron = monthlyCron;
        }

        public String getYearlyCron() {
            return yearlyCron;
        }

        public void setYearlyCron(String yearlyCron) {
            this.yearlyCron = yearlyCron;
        }

        public String getTimezone() {
            return timezone;
        }

        public void setTimezone(String timezone) {
            this.timezone = timezone;
        }

        public Duration getTransactionTimeout() {
            return transactionTimeout;
        }

        public void setTransactionTimeout(Duration transactionTimeout) {
            this.transactionTimeout = transactionTimeout;
        }
    }

    public static class Counters {
        private Flush flush = new Flush();

        public Flush getFlush() {
            return flush;
        }

        public void setFlush(Flush flush) {
            this.flush = flush;
        }
    }

    public static class Flush {
        private long rateMillis = 10_000L;
        private int maxBatchSize = 1000;

        public long getRateMillis() {
            return rateMillis;
        }

        public void setRateMillis(long rateMillis) {
            this.rateMillis = rateMillis;
        }

        public int getMaxBatchSize() {
            return maxBatchSize;
        }

        public void setMaxBatchSize(int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
        }
    }

    public static class Admin {
        private boolean enabled = false;
        private String schema = "tally";
        private boolean resetEnabled = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getSchema() {
            return schema;
        }

        public void setSchema(String schema) {
            this.schema = schema;
        }

        public boolean isResetEnabled() {
            return resetEnabled;
        }

        public void setResetEnabled(boolean resetEnabled) {
            this.resetEnabled = resetEnabled;
        }
    }
}
