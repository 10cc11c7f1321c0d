package com.tally.service.core.score;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/** Counts of one subject in one scope for each named bucket. */
public record Score(
        @JsonProperty("today") long today,
        @JsonProperty("yesterday") long yesterday,
        @JsonProperty("this_week") long thisWeek,
        @JsonProperty("last_week") long lastWeek,
        @JsonProperty("this_month") long thisMonth,
        @JsonProperty("last_month") long lastMonth,
        @JsonProperty("this_year") long thisYear,
        @JsonProperty("last_year") long lastYear,
        @JsonProperty("all_time") long allTime) {

    static Score of(Map<ScoreBucket, Long> counts) {
        return new Score(
                counts.getOrDefault(ScoreBucket.TODAY, 0L),
                counts.getOrDefault(ScoreBucket.YESTERDAY, 0L),
                counts.getOrDefault(ScoreBucket.THIS_WEEK, 0L),
                counts.getOrDefault(ScoreBucket.LAST_WEEK, 0L),
                counts.getOrDefault(ScoreBucket.THIS_MONTH, 0L),
                counts.getOrDefault(ScoreBucket.LAST_MONTH, 0L),
                counts.getOrDefault(ScoreBucket.THIS_YEAR, 0L),
                counts.getOrDefault(ScoreBucket.LAST_YEAR, 0L),
                counts.getOrDefault(ScoreBucket.ALL_TIME, 0L));
    }

    public long get(ScoreBucket bucket) {
        return switch (bucket) {
            case TODAY -> today;
            case YESTERDAY -> yesterday;
            case THIS_WEEK -> thisWeek;
            case LAST_WEEK -> lastWeek;
            case THIS_MONTH -> thisMonth;
            case LAST_MONTH -> lastMonth;
            case THIS_YEAR -> thisYear;
            case LAST_YEAR -> lastYear;
            case ALL_TIME -> allTime;
        };
    }
}
