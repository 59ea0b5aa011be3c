package com.monitoring.customgraph.graph;

public enum StandardPeriod {
    ONE_HOUR(1, "period.hour"),
    TWO_HOURS(2, "period.hours", 2),
    THREE_HOURS(3, "period.hours", 3),
    SIX_HOURS(6, "period.hours", 6),
    TWELVE_HOURS(12, "period.hours", 12),
    ONE_DAY(24, "period.day"),
    TWO_DAYS(48, "period.days", 2),
    ONE_WEEK(360, "period.week"),
    ONE_MONTH(720, "period.month"),
    SIX_MONTHS(4320, "period.months", 6);

    private final int hours;
    private final String messageKey;
    private final Object[] messageArgs;

    StandardPeriod(int hours, String messageKey, Object... messageArgs) {
        this.hours = hours;
        this.messageKey = messageKey;
        this.messageArgs = messageArgs;
    }

    public int hours() {
        return hours;
    }

    public long seconds() {
        return hours * 3600L;
    }

    public String messageKey() {
        return messageKey;
    }

    public Object[] messageArgs() {
        return messageArgs.length == 0 ? null : messageArgs.clone();
    }
}
