package com.papersim.backend.support;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

public class MutableClock extends Clock {

    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

    private volatile Instant instant;

    public MutableClock(Instant instant) {
        this.instant = instant;
    }

    public void set(Instant instant) {
        this.instant = instant;
    }

    /** Tuesday 2024-03-05 10:00 New York, inside the regular session. */
    public void setRegularSession() {
        set(ZonedDateTime.of(2024, 3, 5, 10, 0, 0, 0, NEW_YORK).toInstant());
    }

    /** Saturday 2024-03-09 12:00 New York. */
    public void setWeekend() {
        set(ZonedDateTime.of(2024, 3, 9, 12, 0, 0, 0, NEW_YORK).toInstant());
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return Clock.fixed(instant, zone);
    }

    @Override
    public Instant instant() {
        return instant;
    }
}
