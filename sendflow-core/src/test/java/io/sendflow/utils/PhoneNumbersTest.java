package io.sendflow.utils;

import io.sendflow.core.exception.ErrorKind;
import io.sendflow.core.exception.InvalidInputException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PhoneNumbersTest {

    @Test
    void normalizeShouldStripFormattingFromInternationalNumbers() {
        assertEquals("5511999999999", PhoneNumbers.normalize("+55 (11) 99999-9999", "55"));
        assertEquals("16502530000", PhoneNumbers.normalize("+1 650-253-0000", "55"));
    }

    @Test
    void normalizeShouldResolveNationalNumbersInDefaultRegion() {
        assertEquals("5511999999999", PhoneNumbers.normalize("11 99999-9999", "55"));
        assertEquals("551133334444", PhoneNumbers.normalize("(11) 3333-4444", "55"));
    }

    @Test
    void normalizeShouldAcceptDigitsThatAlreadyCarryCountryCode() {
        assertEquals("5511999999999", PhoneNumbers.normalize("5511999999999", "55"));
        assertEquals("5511999999999", PhoneNumbers.normalize("5511999999999", null));
    }

    @Test
    void normalizeShouldRejectInvalidNumbers() {
        InvalidInputException ex = assertThrows(InvalidInputException.class, () -> PhoneNumbers.normalize("12ab", "55"));
        assertEquals("phone", ex.getField());
        assertEquals(ErrorKind.INVALID_INPUT, ex.getKind());

        assertThrows(InvalidInputException.class, () -> PhoneNumbers.normalize("123", "55"));
        assertThrows(InvalidInputException.class, () -> PhoneNumbers.normalize("+1234567890123456", "55"));
        assertThrows(InvalidInputException.class, () -> PhoneNumbers.normalize("   ", "55"));
    }

    @Test
    void normalizeShouldRejectNumbersThatAreWellFormedButNotAssignable() {
        assertThrows(InvalidInputException.class, () -> PhoneNumbers.normalize("+999 1234 5678", "55"));
        assertThrows(InvalidInputException.class, () -> PhoneNumbers.normalize("12345678", "55"));
        assertThrows(InvalidInputException.class, () -> PhoneNumbers.normalize("+55 00 1234", "55"));
    }

    @Test
    void regionForShouldMapCallingCodes() {
        assertEquals("BR", PhoneNumbers.regionFor("55"));
        assertEquals("ZZ", PhoneNumbers.regionFor(null));
        assertThrows(IllegalArgumentException.class, () -> PhoneNumbers.regionFor("BR"));
    }

    @Test
    void maskShouldHideMiddleDigits() {
        assertEquals("5511...9999", PhoneNumbers.mask("5511999999999"));
        assertEquals("****", PhoneNumbers.mask("1234"));
    }
}
