package autopilot.config;

import autopilot.ValidationException;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * A daily wall-clock window in which the scheduler may run, at minute precision with
 * both ends inclusive. A slot whose start is after its end spans midnight:
 * {@code 22:00-06:00} contains 23:30 and 02:00 but not 12:00.
 */
public record TimeSlot(LocalTime start, LocalTime end, boolean enabled) {
  private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

  public TimeSlot {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    start = start.truncatedTo(ChronoUnit.MINUTES);
    end = end.truncatedTo(ChronoUnit.MINUTES);
  }

  /**
   * Parses {@code HH:mm} bounds.
   *
   * @throws ValidationException if either bound is malformed
   */
  public static TimeSlot of(String start, String end, boolean enabled) {
    return new TimeSlot(parse(start), parse(end), enabled);
  }

  public boolean wrapsMidnight() {
    return start.isAfter(end);
  }

  /**
   * Whether {@code time} falls inside the window, ignoring the enabled flag.
   */
  public boolean contains(LocalTime time) {
    LocalTime minute = time.truncatedTo(ChronoUnit.MINUTES);
    if (wrapsMidnight()) {
      return !minute.isBefore(start) || !minute.isAfter(end);
    }
    return !minute.isBefore(start) && !minute.isAfter(end);
  }

  public String startText() {
    return HH_MM.format(start);
  }

  public String endText() {
    return HH_MM.format(end);
  }

  private static LocalTime parse(String text) {
    if (text == null) {
      throw new ValidationException("time slot bound must not be null");
    }
    try {
      return LocalTime.parse(text, HH_MM);
    } catch (DateTimeParseException e) {
      throw new ValidationException("time slot bound must be HH:mm, got: " + text);
    }
  }
}
