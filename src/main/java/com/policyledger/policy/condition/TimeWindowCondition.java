package com.policyledger.policy.condition;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Day-of-week and hour windows evaluated against the request timestamp in
 * {@code timezone}. {@code startHour} is inclusive, {@code endHour} exclusive.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record TimeWindowCondition(String timezone, List<Window> windows, MatchType matchType) implements PolicyCondition {

    public static final String DEFAULT_TIMEZONE = "UTC";
    public static final List<String> DAY_NAMES = List.of("mon", "tue", "wed", "thu", "fri", "sat", "sun");

    public TimeWindowCondition {
        timezone = timezone == null || timezone.isBlank() ? DEFAULT_TIMEZONE : timezone;
        windows = windows == null ? List.of() : List.copyOf(windows);
        matchType = matchType == null ? MatchType.DURING : matchType;
    }

    @Override
    public ConditionType kind() {
        return ConditionType.TIME_WINDOW;
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record Window(List<String> days, Integer startHour, Integer endHour) {

        public Window {
            days = days == null ? List.of() : List.copyOf(days);
        }
    }

    public enum MatchType {
        @JsonProperty("during") DURING,
        @JsonProperty("outside") OUTSIDE
    }
}
