package org.jouca.darwin_feed.calculators;

import java.time.Duration;
import java.time.LocalTime;
import java.util.Optional;
import java.util.OptionalDouble;

import org.jouca.darwin_feed.parsers.TimeParser;
import org.jouca.darwin_feed.records.Event;
import org.jouca.darwin_feed.records.Location;

/**
 * Computes punctuality of a service at a single location.
 *
 * <p>A delay compares the actual time of an event with the best available scheduled time:
 * the public time when the location has one, otherwise the working time. The result is in
 * minutes, positive when late and negative when early.
 *
 * <p>When no delay can be computed (no event, no actual time, or no scheduled reference)
 * the result is empty, which callers must not confuse with a delay of {@code 0.0}.
 *
 * <p><b>Midnight handling:</b> times carry no date, so a raw difference larger than twelve
 * hours is taken to have crossed midnight and is folded back by one day. A train scheduled
 * at 23:58 that arrives at 00:02 is four minutes late, not 1436 minutes early.
 *
 * @author Jouca
 * @since 1.0
 *
 * @see TimeParser
 */
public final class DelayCalculator {

    private static final long SECONDS_PER_DAY = 24 * 60 * 60;

    /** Beyond this difference the two times are assumed to fall on either side of midnight */
    private static final long WRAPAROUND_THRESHOLD_SECONDS = 720 * 60;

    private DelayCalculator() {
    }

    /**
     * Computes the arrival delay at a location.
     *
     * @param location the location to evaluate
     * @return the delay in minutes, or empty when the location has no arrival event,
     *         no actual arrival time, or neither a public nor working arrival time
     * @throws org.jouca.darwin_feed.exceptions.TimeFormatException if a time value is malformed
     */
    public static OptionalDouble arrivalDelay(Location location) {
        return delay(location.arrival(), location.pta(), location.wta());
    }

    /**
     * Computes the departure delay at a location, using the public departure time and
     * falling back to the working departure time.
     *
     * @param location the location to evaluate
     * @return the delay in minutes, or empty when it cannot be computed
     * @throws org.jouca.darwin_feed.exceptions.TimeFormatException if a time value is malformed
     */
    public static OptionalDouble departureDelay(Location location) {
        return delay(location.departure(), location.ptd(), location.wtd());
    }

    private static OptionalDouble delay(Optional<Event> event, String publicTime, String workingTime) {
        if (event.isEmpty()) {
            return OptionalDouble.empty();
        }

        String actual = event.get().actual();
        if (actual.isEmpty()) {
            return OptionalDouble.empty();
        }

        String scheduled;
        if (!publicTime.isEmpty()) {
            scheduled = publicTime;
        } else if (!workingTime.isEmpty()) {
            scheduled = workingTime;
        } else {
            return OptionalDouble.empty();
        }

        return OptionalDouble.of(minutesBetween(TimeParser.parse(scheduled), TimeParser.parse(actual)));
    }

    /**
     * Returns the signed number of minutes from {@code scheduled} to {@code actual},
     * folding differences of more than twelve hours across midnight.
     */
    static double minutesBetween(LocalTime scheduled, LocalTime actual) {
        long seconds = Duration.between(scheduled, actual).getSeconds();

        if (seconds > WRAPAROUND_THRESHOLD_SECONDS) {
            seconds -= SECONDS_PER_DAY;
        } else if (seconds < -WRAPAROUND_THRESHOLD_SECONDS) {
            seconds += SECONDS_PER_DAY;
        }

        return seconds / 60.0;
    }
}
