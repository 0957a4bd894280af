package dev.devanks.dominion.usage.transform;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Column headers of the usage sheets look like {@code "12:30 AM"} or {@code "12:30 AM kW"}.
 */
public final class TimeOfDayLabels {

    private static final Pattern LABEL_PATTERN = Pattern.compile("(\\d{1,2}:\\d{2} [AP]M)");
    private static final Pattern MERIDIEM_MARKER = Pattern.compile("(?<![A-Za-z])[AP]M(?![A-Za-z])");
    private static final DateTimeFormatter LABEL_FORMATTER = DateTimeFormatter.ofPattern("h:mm a", Locale.US);
    private static final String AFTERNOON_MARKER = " PM";

    private TimeOfDayLabels() {
    }

    public static Optional<String> extract(String header) {
        if (header == null) {
            return Optional.empty();
        }
        Matcher matcher = LABEL_PATTERN.matcher(header);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    /**
     * A header is a time column as soon as it carries an AM or PM marker, whether or not its label parses.
     */
    public static boolean isTimeColumn(String header) {
        return header != null && MERIDIEM_MARKER.matcher(header).find();
    }

    public static boolean isAfternoon(String header) {
        return extract(header).map(label -> label.endsWith(AFTERNOON_MARKER)).orElse(false);
    }

    /**
     * @throws java.time.format.DateTimeParseException if the label is not a valid 12-hour time
     */
    public static LocalTime parse(String label) {
        return LocalTime.parse(label, LABEL_FORMATTER);
    }
}
