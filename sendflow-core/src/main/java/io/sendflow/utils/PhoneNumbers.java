package io.sendflow.utils;

import com.google.i18n.phonenumbers.NumberParseException;
import com.google.i18n.phonenumbers.PhoneNumberUtil;
import com.google.i18n.phonenumbers.Phonenumber.PhoneNumber;
import io.sendflow.core.exception.InvalidInputException;

/**
 * Phone number normalization to the digits-only E.164 form WhatsApp providers expect.
 */
public final class PhoneNumbers {

    private static final PhoneNumberUtil UTIL = PhoneNumberUtil.getInstance();
    private static final String UNKNOWN_REGION = "ZZ";

    private PhoneNumbers() {
    }

    /**
     * Normalize {@code raw} to E.164 digits without the leading '+'.
     * <ul>
     *   <li>"+55 (11) 99999-9999" is parsed as international</li>
     *   <li>numbers without '+' are parsed as national numbers of the region that owns
     *       {@code defaultCountryCode}; if that fails they are retried as international</li>
     * </ul>
     * The parsed number must be valid for its region.
     *
     * @param defaultCountryCode calling code for national numbers, e.g. "55"; null accepts only
     *                           numbers that carry their country code
     * @throws InvalidInputException if the number cannot be parsed or is not a valid number
     */
    public static String normalize(String raw, String defaultCountryCode) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidInputException("phone", "Phone number cannot be empty");
        }
        String s = raw.trim();

        PhoneNumber parsed;
        if (s.startsWith("+")) {
            parsed = parse(s, UNKNOWN_REGION, raw);
        } else {
            try {
                parsed = UTIL.parse(s, regionFor(defaultCountryCode));
            } catch (NumberParseException e) {
                parsed = parse("+" + s, UNKNOWN_REGION, raw);
            }
        }

        if (!UTIL.isValidNumber(parsed)) {
            throw new InvalidInputException("phone", "Invalid phone number for region: " + raw);
        }
        return UTIL.format(parsed, PhoneNumberUtil.PhoneNumberFormat.E164).substring(1);
    }

    /**
     * Region code (e.g. "BR") owning a calling code (e.g. "55"); "ZZ" when unknown or null.
     */
    public static String regionFor(String callingCode) {
        if (callingCode == null || callingCode.isBlank()) {
            return UNKNOWN_REGION;
        }
        try {
            return UTIL.getRegionCodeForCountryCode(Integer.parseInt(callingCode.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("defaultCountryCode must be a numeric calling code: " + callingCode, e);
        }
    }

    /**
     * Log-safe form: "5511...9999".
     */
    public static String mask(String phone) {
        if (phone == null || phone.length() <= 8) {
            return "****";
        }
        return phone.substring(0, 4) + "..." + phone.substring(phone.length() - 4);
    }

    private static PhoneNumber parse(String number, String region, String raw) {
        try {
            return UTIL.parse(number, region);
        } catch (NumberParseException e) {
            throw new InvalidInputException("phone", "Invalid phone number: " + raw + " (" + e.getErrorType() + ")");
        }
    }
}
