package dev.openclaw.jobs.schedule;

import dev.openclaw.jobs.exceptions.InvalidScheduleException;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

/**
 * A five-field cron expression held as the sets of minutes, hours, days of month, months and days
 * of week it allows. Frequency questions ("how close together can two firings be?") are answered
 * from those sets; next-execution arithmetic in a timezone is delegated to cron-utils.
 */
public final class CronSpec {

  static final int MINUTES_PER_DAY = 24 * 60;

  private static final CronParser cronParser =
      new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

  private static final String[] MONTH_NAMES = {
    "JAN", "FEB", "MAR", "APR", "MAY", "JUN", "JUL", "AUG", "SEP", "OCT", "NOV", "DEC"
  };
  private static final String[] DAY_NAMES = {"SUN", "MON", "TUE", "WED", "THU", "FRI", "SAT"};

  private final String expression;
  private final ExecutionTime executionTime;
  private final BitSet minutes;
  private final BitSet hours;
  private final BitSet daysOfMonth;
  private final BitSet months;
  private final BitSet daysOfWeek;

  private CronSpec(String expression, Cron cron, BitSet[] fields) {
    this.expression = expression;
    this.executionTime = ExecutionTime.forCron(cron);
    this.minutes = fields[0];
    this.hours = fields[1];
    this.daysOfMonth = fields[2];
    this.months = fields[3];
    this.daysOfWeek = fields[4];
  }

  public static CronSpec parse(String expression) {
    if (expression == null || expression.isBlank()) {
      throw new InvalidScheduleException("cron_expression", "cron_expression is required");
    }
    var trimmed = expression.trim();
    var parts = trimmed.split("\\s+");
    if (parts.length != 5) {
      throw invalid(trimmed, "expected 5 fields but found " + parts.length);
    }

    Cron cron;
    try {
      cron = cronParser.parse(trimmed);
      cron.validate();
    } catch (IllegalArgumentException e) {
      throw invalid(trimmed, e.getMessage());
    }

    var fields = new BitSet[5];
    fields[0] = expand(trimmed, parts[0], 0, 59, null, 0);
    fields[1] = expand(trimmed, parts[1], 0, 23, null, 0);
    fields[2] = expand(trimmed, parts[2], 1, 31, null, 0);
    fields[3] = expand(trimmed, parts[3], 1, 12, MONTH_NAMES, 1);
    var dow = expand(trimmed, parts[4], 0, 7, DAY_NAMES, 0);
    if (dow.get(7)) {
      dow.clear(7);
      dow.set(0);
    }
    fields[4] = dow;
    return new CronSpec(trimmed, Objects.requireNonNull(cron), fields);
  }

  public String expression() {
    return expression;
  }

  public BitSet minutes() {
    return (BitSet) minutes.clone();
  }

  public BitSet hours() {
    return (BitSet) hours.clone();
  }

  public BitSet daysOfMonth() {
    return (BitSet) daysOfMonth.clone();
  }

  public BitSet months() {
    return (BitSet) months.clone();
  }

  public BitSet daysOfWeek() {
    return (BitSet) daysOfWeek.clone();
  }

  /** True when every minute of an hour is allowed, e.g. {@code * * * * *} or {@code * 9 * * *}. */
  public boolean firesEveryMinute() {
    return minutes.cardinality() == 60;
  }

  /**
   * Smallest number of minutes between two consecutive firings. Computed over the minute-of-day
   * firing set, with the gap from the last firing of one day to the first firing of the next
   * included, so it never exceeds one day. Day and month restrictions only widen gaps and are not
   * consulted.
   */
  public int minimumIntervalMinutes() {
    List<Integer> firings = new ArrayList<>();
    for (int h = hours.nextSetBit(0); h >= 0; h = hours.nextSetBit(h + 1)) {
      for (int m = minutes.nextSetBit(0); m >= 0; m = minutes.nextSetBit(m + 1)) {
        firings.add(h * 60 + m);
      }
    }

    int first = firings.get(0);
    int last = firings.get(firings.size() - 1);
    int shortest = MINUTES_PER_DAY - last + first;
    for (int i = 1; i < firings.size(); i++) {
      shortest = Math.min(shortest, firings.get(i) - firings.get(i - 1));
    }
    return shortest;
  }

  /**
   * False for expressions whose day and month fields no calendar date satisfies, such as {@code 0 0
   * 30 2 *}.
   */
  public boolean canFire() {
    return executionTime
        .nextExecution(ZonedDateTime.ofInstant(Instant.EPOCH, ZoneOffset.UTC))
        .isPresent();
  }

  /** Next firing strictly after the minute containing {@code after}, evaluated in {@code zone}. */
  public Instant nextExecution(Instant after, ZoneId zone) {
    var start = after.atZone(zone).truncatedTo(ChronoUnit.MINUTES);
    return executionTime
        .nextExecution(start)
        .map(t -> t.toInstant())
        .orElseThrow(
            () ->
                new IllegalStateException("Cron expression %s never fires".formatted(expression)));
  }

  @Override
  public String toString() {
    return expression;
  }

  private static BitSet expand(
      String expression, String field, int min, int max, String[] names, int nameOffset) {
    var result = new BitSet(max + 1);
    for (var part : field.split(",")) {
      var range = part;
      int step = 1;
      int slash = part.indexOf('/');
      if (slash >= 0) {
        range = part.substring(0, slash);
        step = number(expression, part.substring(slash + 1), null, 0);
        if (step <= 0) {
          throw invalid(expression, "step must be positive in '" + part + "'");
        }
      }

      int lo;
      int hi;
      if (range.equals("*")) {
        lo = min;
        hi = max;
      } else if (range.indexOf('-') > 0) {
        int dash = range.indexOf('-');
        lo = number(expression, range.substring(0, dash), names, nameOffset);
        hi = number(expression, range.substring(dash + 1), names, nameOffset);
      } else {
        lo = number(expression, range, names, nameOffset);
        hi = slash >= 0 ? max : lo;
      }

      if (lo < min || hi > max || lo > hi) {
        throw invalid(expression, "'" + part + "' is outside " + min + "-" + max);
      }
      for (int v = lo; v <= hi; v += step) {
        result.set(v);
      }
    }
    return result;
  }

  private static int number(String expression, String token, String[] names, int nameOffset) {
    if (names != null) {
      var upper = token.toUpperCase(Locale.ROOT);
      for (int i = 0; i < names.length; i++) {
        if (names[i].equals(upper)) {
          return i + nameOffset;
        }
      }
    }
    try {
      return Integer.parseInt(token);
    } catch (NumberFormatException e) {
      throw invalid(expression, "'" + token + "' is not a number");
    }
  }

  private static InvalidScheduleException invalid(String expression, String reason) {
    return new InvalidScheduleException(
        "cron_expression", "Invalid cron expression '%s': %s".formatted(expression, reason));
  }
}
