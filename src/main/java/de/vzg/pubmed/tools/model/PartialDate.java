package de.vzg.pubmed.tools.model;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A calendar date of which only the year is guaranteed. Month and day are kept only when the source
 * supplied them, so a year-only value is never padded to an invented first of January.
 *
 * <p>The text form is {@code YYYY}, {@code YYYY-MM} or {@code YYYY-MM-DD}.</p>
 */
public record PartialDate(int year, Integer month, Integer day) implements Comparable<PartialDate> {

    private static final Pattern TEXT_PATTERN = Pattern.compile("^(\\d{4})(?:-(\\d{2})(?:-(\\d{2}))?)?$");

    public PartialDate {
        if (month == null && day != null) {
            throw new IllegalArgumentException("A day requires a month: " + year + "-?-" + day);
        }
        if (month != null && (month < 1 || month > 12)) {
            throw new IllegalArgumentException("Month out of range: " + month);
        }
        if (month != null && day != null) {
            // rejects 2021-02-30 and friends
            LocalDate.of(year, month, day);
        }
    }

    public static PartialDate of(int year, int month, int day) {
        return new PartialDate(year, month, day);
    }

    public static PartialDate ofYear(int year) {
        return new PartialDate(year, null, null);
    }

    public static PartialDate ofYearMonth(int year, int month) {
        return new PartialDate(year, month, null);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PartialDate parse(String text) {
        Matcher matcher = TEXT_PATTERN.matcher(text == null ? "" : text.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid partial date: '" + text + "'");
        }
        Integer month = matcher.group(2) == null ? null : Integer.valueOf(matcher.group(2));
        Integer day = matcher.group(3) == null ? null : Integer.valueOf(matcher.group(3));
        try {
            return new PartialDate(Integer.parseInt(matcher.group(1)), month, day);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid partial date: '" + text + "'", e);
        }
    }

    public boolean isComplete() {
        return month != null && day != null;
    }

    /**
     * @return the full calendar date, or empty if month or day is missing
     */
    public Optional<LocalDate> toLocalDate() {
        return isComplete() ? Optional.of(LocalDate.of(year, month, day)) : Optional.empty();
    }

    @Override
    public int compareTo(PartialDate o) {
        int result = Integer.compare(year, o.year);
        if (result == 0) {
            result = Integer.compare(month == null ? 0 : month, o.month == null ? 0 : o.month);
        }
        if (result == 0) {
            result = Integer.compare(day == null ? 0 : day, o.day == null ? 0 : o.day);
        }
        return result;
    }

    @JsonValue
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(String.format("%04d", year));
        if (month != null) {
            sb.append(String.format("-%02d", month));
            if (day != null) {
                sb.append(String.format("-%02d", day));
            }
        }
        return sb.toString();
    }
}
