package au.org.ala.imagedate.dates;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.MonthDay;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalAdjusters;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Parses the English date phrases people type when captioning photos: relative phrases ("yesterday",
 * "2 months ago", "last friday"), holidays, month-name dates with or without a year and the usual numeric layouts.
 * <p/>
 * Ambiguous phrases resolve to the past: a date without a year is the most recent occurrence that isn't in the
 * future, and a bare weekday is the most recent such day (today included).
 */
public class NaturalLanguageDateParser implements DateParser {

    private static final Logger log = LoggerFactory.getLogger(NaturalLanguageDateParser.class);

    private static final Pattern AGO = Pattern.compile("^(\\d+|an?|one)\\s+(second|minute|hour|day|week|month|year)s?\\s+ago$");
    private static final Pattern LAST_UNIT = Pattern.compile("^last\\s+(week|month|year)$");
    private static final Pattern WEEKDAY = Pattern.compile("^(last\\s+)?(monday|tuesday|wednesday|thursday|friday|saturday|sunday)$");
    private static final Pattern HOLIDAY = Pattern.compile("^(christmas eve|christmas day|christmas|new year'?s eve|new year'?s day|new year'?s|new year)(?:\\s+(\\d{4}))?$");
    /** Years an EXIF {@code yyyy:MM:dd} stamp can hold. */
    public static final int MIN_YEAR = 1;
    public static final int MAX_YEAR = 9999;

    private static final Pattern ORDINAL = Pattern.compile("\\b(\\d{1,2})(st|nd|rd|th)\\b");

    private static final Map<String, ChronoUnit> UNITS = Map.of(
            "second", ChronoUnit.SECONDS,
            "minute", ChronoUnit.MINUTES,
            "hour", ChronoUnit.HOURS,
            "day", ChronoUnit.DAYS,
            "week", ChronoUnit.WEEKS,
            "month", ChronoUnit.MONTHS,
            "year", ChronoUnit.YEARS
    );

    private static final List<DateTimeFormatter> DATE_TIMES = formatters(
            "uuuu-MM-dd'T'HH:mm[:ss]",
            "uuuu-MM-dd HH:mm[:ss]",
            "uuuu:MM:dd HH:mm:ss",
            "M/d/uuuu H:mm[:ss]"
    );

    private static final List<DateTimeFormatter> DATES = formatters(
            "uuuu-MM-dd",
            "uuuu:MM:dd",
            "uuuu/MM/dd",
            "M/d/uuuu",
            "MMMM d, uuuu",
            "MMM d, uuuu",
            "MMMM d uuuu",
            "MMM d uuuu",
            "d MMMM uuuu",
            "d MMM uuuu",
            "d MMMM, uuuu",
            "d MMM, uuuu"
    );

    private static final List<DateTimeFormatter> MONTH_DAYS = formatters(
            "MMMM d",
            "MMM d",
            "d MMMM",
            "d MMM"
    );

    private static final List<DateTimeFormatter> YEAR_MONTHS = formatters(
            "MMMM uuuu",
            "MMM uuuu",
            "MMMM, uuuu",
            "MMM, uuuu"
    );

    private final Clock clock;

    public NaturalLanguageDateParser() {
        this(Clock.systemDefaultZone());
    }

    public NaturalLanguageDateParser(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<LocalDateTime> parse(String text) {
        if (StringUtils.isBlank(text)) {
            return Optional.empty();
        }
        String phrase = ORDINAL.matcher(StringUtils.normalizeSpace(text).toLowerCase(Locale.ENGLISH)).replaceAll("$1");
        LocalDateTime now = LocalDateTime.now(clock);

        Optional<LocalDateTime> result = parseKeyword(phrase, now);
        if (result.isEmpty()) result = parseRelative(phrase, now);
        if (result.isEmpty()) result = parseWeekday(phrase, now);
        if (result.isEmpty()) result = parseHoliday(phrase, now);
        if (result.isEmpty()) result = parseFormatted(phrase, now);

        if (result.isPresent() && (result.get().getYear() < MIN_YEAR || result.get().getYear() > MAX_YEAR)) {
            log.debug("Date '{}' resolves to {}, outside years {}..{}", text, result.get(), MIN_YEAR, MAX_YEAR);
            return Optional.empty();
        }
        if (result.isEmpty()) {
            log.debug("Could not understand date '{}'", text);
        }
        return result;
    }

    private Optional<LocalDateTime> parseKeyword(String phrase, LocalDateTime now) {
        switch (phrase) {
            case "now":
            case "today":
                return Optional.of(now);
            case "yesterday":
                return Optional.of(now.minusDays(1));
            case "day before yesterday":
            case "the day before yesterday":
                return Optional.of(now.minusDays(2));
            case "tomorrow":
                return Optional.of(now.plusDays(1));
            default:
                return Optional.empty();
        }
    }

    private Optional<LocalDateTime> parseRelative(String phrase, LocalDateTime now) {
        Matcher ago = AGO.matcher(phrase);
        if (ago.matches()) {
            String count = ago.group(1);
            try {
                long amount = StringUtils.isNumeric(count) ? Long.parseLong(count) : 1;
                return Optional.of(now.minus(amount, UNITS.get(ago.group(2))));
            } catch (NumberFormatException | DateTimeException | ArithmeticException e) {
                log.debug("'{}' is too far back", phrase, e);
                return Optional.empty();
            }
        }
        Matcher last = LAST_UNIT.matcher(phrase);
        if (last.matches()) {
            return Optional.of(now.minus(1, UNITS.get(last.group(1))));
        }
        return Optional.empty();
    }

    private Optional<LocalDateTime> parseWeekday(String phrase, LocalDateTime now) {
        Matcher m = WEEKDAY.matcher(phrase);
        if (!m.matches()) {
            return Optional.empty();
        }
        DayOfWeek day = DayOfWeek.valueOf(m.group(2).toUpperCase(Locale.ENGLISH));
        LocalDate date = m.group(1) != null
                ? now.toLocalDate().with(TemporalAdjusters.previous(day))
                : now.toLocalDate().with(TemporalAdjusters.previousOrSame(day));
        return Optional.of(date.atTime(now.toLocalTime()));
    }

    private Optional<LocalDateTime> parseHoliday(String phrase, LocalDateTime now) {
        Matcher m = HOLIDAY.matcher(phrase);
        if (!m.matches()) {
            return Optional.empty();
        }
        String name = m.group(1);
        MonthDay monthDay;
        if (name.startsWith("christmas")) {
            monthDay = name.equals("christmas eve") ? MonthDay.of(12, 24) : MonthDay.of(12, 25);
        } else {
            monthDay = name.endsWith("eve") ? MonthDay.of(12, 31) : MonthDay.of(1, 1);
        }
        if (m.group(2) != null) {
            return Optional.of(monthDay.atYear(Integer.parseInt(m.group(2))).atStartOfDay());
        }
        return Optional.of(mostRecent(monthDay, now.toLocalDate()).atStartOfDay());
    }

    private Optional<LocalDateTime> parseFormatted(String phrase, LocalDateTime now) {
        return firstMatch(DATE_TIMES, phrase, parsed -> LocalDateTime.of(LocalDate.from(parsed), LocalTime.from(parsed)))
                .or(() -> firstMatch(DATES, phrase, parsed -> LocalDate.from(parsed).atStartOfDay()))
                .or(() -> firstMatch(MONTH_DAYS, phrase, parsed -> mostRecent(MonthDay.from(parsed), now.toLocalDate()).atStartOfDay()))
                .or(() -> firstMatch(YEAR_MONTHS, phrase, parsed -> YearMonth.from(parsed).atDay(1).atStartOfDay()));
    }

    private static Optional<LocalDateTime> firstMatch(List<DateTimeFormatter> formatters, String phrase,
                                                      Function<TemporalAccessor, LocalDateTime> resolver) {
        for (DateTimeFormatter formatter : formatters) {
            try {
                return Optional.of(resolver.apply(formatter.parse(phrase)));
            } catch (DateTimeException e) {
                log.trace("'{}' does not match {}", phrase, formatter);
            }
        }
        return Optional.empty();
    }

    /**
     * The latest date on or before {@code today} that falls on {@code monthDay}.
     */
    static LocalDate mostRecent(MonthDay monthDay, LocalDate today) {
        LocalDate candidate = monthDay.atYear(today.getYear());
        return candidate.isAfter(today) ? monthDay.atYear(today.getYear() - 1) : candidate;
    }

    private static List<DateTimeFormatter> formatters(String... patterns) {
        return List.of(patterns).stream()
                .map(p -> new DateTimeFormatterBuilder()
                        .parseCaseInsensitive()
                        .appendPattern(p)
                        .toFormatter(Locale.ENGLISH)
                        .withResolverStyle(ResolverStyle.STRICT))
                .collect(Collectors.toList());
    }
}
