package io.nimbusio.webserver.api.ids;

import io.nimbusio.webserver.api.model.exceptions.InvalidIdentifierException;
import io.nimbusio.webserver.config.IdentifierKeysConfiguration;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class IdentifierTranslatorTest {

    private static final IdentifierTranslator TRANSLATOR = IdentifierTranslator.fromConfiguration(
            new IdentifierKeysConfiguration("2b7e151628aed2a6abf7158809cf4f3c", "00112233445566778899", 16));

    @Test
    void internalIdReversesPublicId() {
        final UnifiedIdFactory factory = new UnifiedIdFactory(1);
        for (int i = 0; i < 100; i++) {
            final UnifiedId id = factory.next();
            Assertions.assertEquals(id, TRANSLATOR.internalId(TRANSLATOR.publicId(id)));
        }
    }

    @Test
    void publicIdsAreOpaque() {
        final String publicId = TRANSLATOR.publicId(UnifiedId.of(42));
        Assertions.assertEquals(64, publicId.length());
        Assertions.assertNotEquals(publicId.substring(0, 32), TRANSLATOR.publicId(UnifiedId.of(43)).substring(0, 32));
    }

    /**
     * Identifiers minted with other keys fail verification.
     */
    @Test
    void identifiersFromOtherKeysAreRejected() {
        final IdentifierTranslator other = IdentifierTranslator.fromConfiguration(
                new IdentifierKeysConfiguration("000102030405060708090a0b0c0d0e0f", "00112233445566778899", 16));
        final String foreign = other.publicId(UnifiedId.of(42));
        Assertions.assertThrows(InvalidIdentifierException.class, () -> TRANSLATOR.internalId(foreign));
    }

    @Test
    void malformedIdentifiersAreRejected() {
        Assertions.assertThrows(InvalidIdentifierException.class, () -> TRANSLATOR.internalId("not-hex"));
        Assertions.assertThrows(InvalidIdentifierException.class, () -> TRANSLATOR.internalId("abcd"));

        final String valid = TRANSLATOR.publicId(UnifiedId.of(7));
        final char last = valid.charAt(valid.length() - 1);
        final String tampered = valid.substring(0, valid.length() - 1) + (last == '0' ? '1' : '0');
        Assertions.assertThrows(InvalidIdentifierException.class, () -> TRANSLATOR.internalId(tampered));
    }
}
