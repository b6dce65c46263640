package uk.gegc.linguapractice.shared.util;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Date and time helpers bound to the application's Clock.
 * Calendar dates are resolved in the clock's zone.
 */
@Component
public class DateUtils {

    private final Clock clock;

    @Autowired
    public DateUtils(Clock clock) {
        this.clock = clock;
    }

    public Instant now() {
        return clock.instant();
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    public ZoneId getZone() {
        return clock.getZone();
    }

    /**
     * First instant of the given calendar day.
     */
    public Instant startOfDay(LocalDate date) {
        return date.atStartOfDay(clock.getZone()).toInstant();
    }

    /**
     * Last representable instant of the given calendar day (inclusive upper bound).
     */
    public Instant endOfDay(LocalDate date) {
        return startOfDay(date.plusDays(1)).minusNanos(1);
    }

    public LocalDate toLocalDate(Instant instant) {
        return instant.atZone(clock.getZone()).toLocalDate();
    }
}
