package de.vzg.pubmed.tools.medline;

import java.time.DateTimeException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jdom2.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.vzg.pubmed.tools.model.PartialDate;

/**
 * Parses the {@code Year}/{@code Month}/{@code Day} date structures used throughout MEDLINE.
 */
public final class MedlineDates {

    private static final Logger log = LoggerFactory.getLogger(MedlineDates.class);

    private static final List<String> MONTH_ABBREVIATIONS = List.of(
        "jan", "feb", "mar", "apr", "may", "jun", "jul", "aug", "sep", "oct", "nov", "dec");

    // PubDate sometimes only carries free text like "1998 Dec-1999 Jan"
    private static final Pattern MEDLINE_DATE_YEAR = Pattern.compile("^\\s*(\\d{4})");

    private MedlineDates() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }

    /**
     * Parses a date element. A date is only returned if a year is present; month and day are kept
     * only when given, so a year-only element becomes a year-only {@link PartialDate}.
     *
     * @param dateElement e.g. {@code DateCompleted}, {@code PubDate} or {@code PubMedPubDate}, may be null
     * @return the date, or null if there is no usable year or the parts do not form a real date
     */
    public static PartialDate parse(Element dateElement) {
        if (dateElement == null) {
            return null;
        }
        String yearText = MedlineUtils.childTextOrNull(dateElement, "Year");
        if (yearText == null) {
            return parseMedlineDate(dateElement);
        }
        Integer year = parseInteger(yearText);
        if (year == null) {
            log.debug("Unparsable year '{}'", yearText);
            return null;
        }
        Integer month = parseMonth(MedlineUtils.childTextOrNull(dateElement, "Month"));
        Integer day = month == null ? null : parseInteger(MedlineUtils.childTextOrNull(dateElement, "Day"));
        try {
            return new PartialDate(year, month, day);
        } catch (DateTimeException | IllegalArgumentException e) {
            log.debug("Invalid date {}-{}-{}: {}", year, month, day, e.getMessage());
            return null;
        }
    }

    private static PartialDate parseMedlineDate(Element dateElement) {
        String medlineDate = MedlineUtils.childTextOrNull(dateElement, "MedlineDate");
        if (medlineDate == null) {
            return null;
        }
        Matcher matcher = MEDLINE_DATE_YEAR.matcher(medlineDate);
        if (matcher.find()) {
            return PartialDate.ofYear(Integer.parseInt(matcher.group(1)));
        }
        log.debug("No year in MedlineDate '{}'", medlineDate);
        return null;
    }

    /**
     * @param text a month number or an English month abbreviation, may be null
     * @return the month number, or null if the text is neither
     */
    static Integer parseMonth(String text) {
        if (text == null) {
            return null;
        }
        Integer month = parseInteger(text);
        if (month == null && text.length() >= 3) {
            int index = MONTH_ABBREVIATIONS.indexOf(text.substring(0, 3).toLowerCase(Locale.ROOT));
            month = index < 0 ? null : index + 1;
        }
        if (month == null) {
            log.debug("Unparsable month '{}'", text);
        }
        return month;
    }

    private static Integer parseInteger(String text) {
        if (text == null) {
            return null;
        }
        try {
            return Integer.valueOf(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
