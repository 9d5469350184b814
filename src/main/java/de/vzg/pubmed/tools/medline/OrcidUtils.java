package de.vzg.pubmed.tools.medline;

import java.util.List;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Repairs the ORCID identifiers found in author {@code Identifier} elements. Publishers submit them in
 * many broken shapes; the rules below are best effort and never throw.
 */
public final class OrcidUtils {

    private static final Logger log = LoggerFactory.getLogger(OrcidUtils.class);

    // longer variants first, so "https://orcid.org" never shadows "https://orcid.org/"
    private static final List<String> ORCID_PREFIXES = List.of(
        "https://orcid.org/",
        "http://orcid.org/",
        "https//orcid.org/",
        "https/orcid.org/",
        "http//orcid.org/",
        "http/orcid.org/",
        "https://www.orcid.org/",
        "orcid.org/",
        "https://orcid.org-",
        "https://orcid.org ",
        "https://orcid.org",
        "http://orcid/");

    private static final int WELL_FORMED_LENGTH = 19;

    private static final Pattern UNDASHED = Pattern.compile("^\\d{15}[\\dX]$");

    private static final Pattern UNDASHED_WITH_STRAY_PREFIX = Pattern.compile("^\\D\\d{15}[\\dX]$");

    private OrcidUtils() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }

    /**
     * Cleans a raw ORCID value.
     *
     * <ul>
     *   <li>known URL prefixes (including scheme typos, ignoring surrounding blanks) are stripped</li>
     *   <li>19 characters: already well formed</li>
     *   <li>18 characters: truncated, discarded</li>
     *   <li>16 digits: dashes are reinserted</li>
     *   <li>17 characters with one stray leading non-digit: the character is dropped, dashes reinserted</li>
     *   <li>20 characters: assumed to carry one injected character, returned unchanged</li>
     * </ul>
     *
     * <p>The length rules apply to the value as given, surrounding blanks count.</p>
     *
     * @param raw the identifier text, may be null
     * @return the ORCID in {@code 0000-0000-0000-0000} form, or null if it cannot be repaired
     */
    public static String clean(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        for (String prefix : ORCID_PREFIXES) {
            if (trimmed.startsWith(prefix)) {
                String stripped = trimmed.substring(prefix.length()).trim();
                return stripped.isEmpty() ? null : stripped;
            }
        }
        switch (raw.length()) {
            case WELL_FORMED_LENGTH:
                return raw;
            case 18:
                return null;
            case 16:
                if (UNDASHED.matcher(raw).matches()) {
                    return insertDashes(raw);
                }
                break;
            case 17:
                if (UNDASHED_WITH_STRAY_PREFIX.matcher(raw).matches()) {
                    return insertDashes(raw.substring(1));
                }
                break;
            case 20:
                // one injected character, kept
                return raw;
            default:
                break;
        }
        log.warn("unhandled ORCID: {}", raw);
        return null;
    }

    private static String insertDashes(String digits) {
        return digits.substring(0, 4) + "-" + digits.substring(4, 8) + "-" + digits.substring(8, 12) + "-"
            + digits.substring(12);
    }
}
