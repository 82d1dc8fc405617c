package com.papersim.backend.service;

import com.papersim.backend.config.MarketHoursProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.MonthDay;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Set;
import java.util.stream.Collectors;

@Service
public class MarketSessionService {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");
    private static final DateTimeFormatter HOLIDAY_FORMAT = DateTimeFormatter.ofPattern("MM-dd");

    private final Clock clock;
    private final ZoneId zone;
    private final LocalTime preMarketStart;
    private final LocalTime regularStart;
    private final LocalTime regularEnd;
    private final LocalTime afterHoursEnd;
    private final Set<MonthDay> holidays;

    public MarketSessionService(MarketHoursProperties properties, Clock clock) {
        this.clock = clock;
        this.zone = ZoneId.of(properties.getTimezone());
        this.preMarketStart = LocalTime.parse(properties.getPreMarketStart(), TIME_FORMAT);
        this.regularStart = LocalTime.parse(properties.getRegularStart(), TIME_FORMAT);
        this.regularEnd = LocalTime.parse(properties.getRegularEnd(), TIME_FORMAT);
        this.afterHoursEnd = LocalTime.parse(properties.getAfterHoursEnd(), TIME_FORMAT);
        this.holidays = properties.getHolidays() == null ? Set.of() : properties.getHolidays().stream()
                .filter(value -> value != null && !value.isBlank())
                .map(value -> MonthDay.parse(value.trim(), HOLIDAY_FORMAT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public enum SessionStatus { PRE_MARKET, OPEN, AFTER_HOURS, CLOSED }

    public record MarketSession(boolean open, SessionStatus status, ZonedDateTime nextOpen, ZonedDateTime nextClose) {}

    public MarketSession getMarketSession() {
        return getMarketSession(clock.instant());
    }

    public MarketSession getMarketSession(Instant nowUtc) {
        ZonedDateTime now = nowUtc.atZone(zone);
        SessionStatus status = statusAt(now);
        boolean open = status == SessionStatus.OPEN;

        ZonedDateTime nextOpen = nextRegularOpen(now);
        ZonedDateTime nextClose = open
                ? now.toLocalDate().atTime(regularEnd).atZone(zone)
                : nextOpen.toLocalDate().atTime(regularEnd).atZone(zone);
        return new MarketSession(open, status, nextOpen, nextClose);
    }

    /**
     * True only inside the regular session, the one window that accepts market orders and cancels.
     */
    public boolean isRegularSessionOpen() {
        return isRegularSessionOpen(clock.instant());
    }

    public boolean isRegularSessionOpen(Instant nowUtc) {
        return statusAt(nowUtc.atZone(zone)) == SessionStatus.OPEN;
    }

    private SessionStatus statusAt(ZonedDateTime now) {
        if (!isTradingDay(now.toLocalDate())) {
            return SessionStatus.CLOSED;
        }
        LocalTime time = now.toLocalTime();
        if (isWithin(time, preMarketStart, regularStart)) {
            return SessionStatus.PRE_MARKET;
        }
        if (isWithin(time, regularStart, regularEnd)) {
            return SessionStatus.OPEN;
        }
        if (isWithin(time, regularEnd, afterHoursEnd)) {
            return SessionStatus.AFTER_HOURS;
        }
        return SessionStatus.CLOSED;
    }

    private ZonedDateTime nextRegularOpen(ZonedDateTime now) {
        LocalDate date = now.toLocalDate();
        if (!isTradingDay(date) || !now.toLocalTime().isBefore(regularStart)) {
            date = date.plusDays(1);
        }
        while (!isTradingDay(date)) {
            date = date.plusDays(1);
        }
        return date.atTime(regularStart).atZone(zone);
    }

    private boolean isTradingDay(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
            return false;
        }
        return !holidays.contains(MonthDay.from(date));
    }

    // Half-open [start, end)
    private boolean isWithin(LocalTime time, LocalTime start, LocalTime end) {
        return !time.isBefore(start) && time.isBefore(end);
    }
}
