package com.contactline.phone;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;

/**
 * Canonicalizes human-entered Argentine phone numbers into the 13-digit
 * WhatsApp identifier {@code 54 9 AA NNNNNNNN}.
 *
 * <h2>Steps</h2>
 * <ol>
 *   <li>Drop separators ({@code space - ( ) +}) and any other non-digit.</li>
 *   <li>Strip the {@code 54} country code. A leading {@code 5} that is not
 *       followed by {@code 4} is read as a country code missing its second
 *       digit, so only the {@code 5} is consumed.</li>
 *   <li>Strip one leading mobile indicator {@code 9}.</li>
 *   <li>With 10 or more digits left, the first two are the area code;
 *       otherwise the area code defaults to {@code 11} (Buenos Aires).</li>
 *   <li>Fit the local number to 8 digits: keep the last 8, or left-pad with {@code 0}.</li>
 *   <li>Assemble {@code 54 + 9 + area + local}.</li>
 * </ol>
 *
 * <p>This class never throws. A rejected input yields an empty string, and
 * callers must check {@link #isCanonical(String)} before accepting a result.
 */
public final class PhoneNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(PhoneNormalizer.class);

    public static final String COUNTRY_CODE      = "54";
    public static final String MOBILE_PREFIX     = "9";
    public static final String DEFAULT_AREA_CODE = "11";

    public static final int CANONICAL_LENGTH    = 13;
    public static final int LOCAL_NUMBER_LENGTH = 8;
    public static final int AREA_CODE_LENGTH    = 2;

    /** Fewer cleaned digits than this is rejected instead of zero-padded. */
    public static final int MIN_DIGITS = 6;

    private static final int WITH_AREA_CODE_THRESHOLD = 10;

    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-()+]");
    private static final Pattern NON_DIGITS = Pattern.compile("\\D");
    private static final Pattern CANONICAL  = Pattern.compile("^\\d{13}$");

    private PhoneNormalizer() {}

    /**
     * Normalize a raw phone string.
     *
     * @param input any text, may be {@code null}
     * @return the 13-digit canonical number, or an empty string when the input
     *         holds fewer than {@link #MIN_DIGITS} digits
     */
    public static String normalize(final String input) {
        if (input == null) return "";

        final String cleaned = clean(input);
        if (cleaned.length() < MIN_DIGITS) {
            if (!cleaned.isEmpty()) {
                LOG.debug("Rejecting phone with only {} digits", cleaned.length());
            }
            return "";
        }

        String digits = stripCountryCode(cleaned);
        if (digits.startsWith(MOBILE_PREFIX)) {
            digits = digits.substring(MOBILE_PREFIX.length());
        }

        String areaCode    = DEFAULT_AREA_CODE;
        String localNumber = digits;
        if (digits.length() >= WITH_AREA_CODE_THRESHOLD) {
            areaCode    = digits.substring(0, AREA_CODE_LENGTH);
            localNumber = digits.substring(AREA_CODE_LENGTH);
        }

        final String normalized = COUNTRY_CODE + MOBILE_PREFIX + areaCode + fitLocalNumber(localNumber);
        if (normalized.length() != CANONICAL_LENGTH) {
            LOG.warn("Normalized phone has {} digits, expected {}: {}",
                    normalized.length(), CANONICAL_LENGTH, normalized);
        }
        return normalized;
    }

    /** True when {@code value} is exactly 13 ASCII digits. */
    public static boolean isCanonical(final String value) {
        return value != null && CANONICAL.matcher(value).matches();
    }

    static String clean(final String input) {
        final String withoutSeparators = SEPARATORS.matcher(input).replaceAll("");
        return NON_DIGITS.matcher(withoutSeparators).replaceAll("");
    }

    private static String stripCountryCode(final String digits) {
        if (digits.startsWith(COUNTRY_CODE)) {
            return digits.substring(COUNTRY_CODE.length());
        }
        // "5" without its "4": the truncated country code covers just the first digit
        if (digits.startsWith(COUNTRY_CODE.substring(0, 1))) {
            return digits.substring(1);
        }
        return digits;
    }

    private static String fitLocalNumber(final String localNumber) {
        if (localNumber.length() > LOCAL_NUMBER_LENGTH) {
            return localNumber.substring(localNumber.length() - LOCAL_NUMBER_LENGTH);
        }
        if (localNumber.length() < LOCAL_NUMBER_LENGTH) {
            return "0".repeat(LOCAL_NUMBER_LENGTH - localNumber.length()) + localNumber;
        }
        return localNumber;
    }
}
