package io.github.hotbrkm.outreach.dispatcher.schedule;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Time-of-day range, {@code [startHour, endHour)} in the clock's zone, during which batches may be dispatched.
 */
public class ActiveWindow {

    private final Clock clock;
    private final int startHour;
    private final int endHour;

    public ActiveWindow(Clock clock, int startHour, int endHour) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (startHour < 0 || startHour > 23 || endHour < 1 || endHour > 24 || startHour >= endHour) {
            throw new IllegalArgumentException("Invalid active window: " + startHour + "-" + endHour);
        }
        this.startHour = startHour;
        this.endHour = endHour;
    }

    public boolean isOpen() {
        int hour = LocalDateTime.now(clock).getHour();
        return hour >= startHour && hour < endHour;
    }

    public boolean hasClosedToday() {
        return LocalDateTime.now(clock).getHour() >= endHour;
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    public int startHour() {
        return startHour;
    }

    public int endHour() {
        return endHour;
    }
}
