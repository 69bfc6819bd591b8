package ru.aritmos.provisioningbroker.wizard;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TokenShapeTest {

    private final TokenShape shape = new TokenShape(List.of("pit-"), 20);

    @Test
    void matchesPrefixedTokenOfSufficientLength() {
        assertTrue(shape.matches("pit-0a1b2c3d-4e5f-6789-abcd"));
        assertFalse(shape.matches("pit-short"), "TEST_EXPECTED: короткое значение не считается токеном");
        assertFalse(shape.matches("abc-0a1b2c3d-4e5f-6789-abcd"), "TEST_EXPECTED: нужен известный префикс");
        assertFalse(shape.matches("pit-0a1b2c3d 4e5f-6789-abcd"));
    }

    @Test
    void findsTokenInsideSurroundingText() {
        assertEquals(Optional.of("pit-0a1b2c3d-4e5f-6789-abcd"),
                shape.find("Your API key: pit-0a1b2c3d-4e5f-6789-abcd (copy it now)"));
        assertEquals(Optional.of("pit-0a1b2c3d-4e5f-6789-abcd"),
                shape.find("copiedpit-0a1b2c3d-4e5f-6789-abcd"));
        assertTrue(shape.find("Create new integration").isEmpty());
    }

    @Test
    void emptyPrefixesAcceptAnyLongValue() {
        TokenShape any = new TokenShape(List.of(), 10);
        assertTrue(any.matches("abcdefghijkl"));
        assertEquals(Optional.of("abcdefghijkl"), any.find("x abcdefghijkl y"));
    }
}
