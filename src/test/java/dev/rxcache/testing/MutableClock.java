package dev.rxcache.testing;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Clock whose instant is set by the test; used to control record retrieval dates.
 */
public class MutableClock extends Clock {
    private volatile Instant instant;
    private final ZoneId zone;

    public MutableClock(Instant initial, ZoneId zone) {
        this.instant = initial;
        this.zone = zone;
    }

    public static MutableClock onDate(int year, int month, int day) {
        return new MutableClock(LocalDate.of(year, month, day).atStartOfDay(ZoneOffset.UTC).toInstant(), ZoneOffset.UTC);
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new MutableClock(instant, zone);
    }

    @Override
    public Instant instant() {
        return instant;
    }

    public void advanceDays(long days) {
        if (days == 0) return;
        this.instant = this.instant.plusSeconds(days * 86_400L);
    }

    public void setDate(LocalDate date) {
        this.instant = date.atStartOfDay(zone).toInstant();
    }
}
