package org.operaton.rungrade.util;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.operaton.rungrade.exception.InvalidFitFileException;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FitFileValidator.
 */
class FitFileValidatorTest {

    private FitFileValidator validator;

    @BeforeEach
    void setUp() {
        validator = new FitFileValidator();
    }

    @Test
    @DisplayName("Should validate a valid FIT file header")
    void testValidateValidHeader() {
        assertDoesNotThrow(() -> validator.validate(fitHeader(14)));
        assertDoesNotThrow(() -> validator.validate(fitHeader(12)));
    }

    @Test
    @DisplayName("Should throw exception for empty or null file")
    void testValidateEmptyFile() {
        InvalidFitFileException exception = assertThrows(
            InvalidFitFileException.class,
            () -> validator.validate(new byte[0])
        );
        assertTrue(exception.getMessage().contains("empty"));

        assertThrows(InvalidFitFileException.class, () -> validator.validate(null));
    }

    @Test
    @DisplayName("Should throw exception for file that's too small")
    void testValidateTooSmallFile() {
        InvalidFitFileException exception = assertThrows(
            InvalidFitFileException.class,
            () -> validator.validate(new byte[10])
        );

        assertTrue(exception.getMessage().contains("too small"));
    }

    @Test
    @DisplayName("Should throw exception for invalid header size")
    void testValidateInvalidHeaderSize() {
        byte[] header = fitHeader(14);
        header[0] = 20;

        InvalidFitFileException exception = assertThrows(
            InvalidFitFileException.class,
            () -> validator.validate(header)
        );

        assertTrue(exception.getMessage().contains("header size"));
    }

    @Test
    @DisplayName("Should throw exception for invalid signature")
    void testValidateInvalidSignature() {
        byte[] header = fitHeader(14);
        header[8] = 'X';

        InvalidFitFileException exception = assertThrows(
            InvalidFitFileException.class,
            () -> validator.validate(header)
        );

        assertTrue(exception.getMessage().contains("signature"));
    }

    private static byte[] fitHeader(int headerSize) {
        ByteBuffer buffer = ByteBuffer.allocate(headerSize);
        buffer.order(ByteOrder.LITTLE_ENDIAN);
        buffer.put((byte) headerSize);
        buffer.put((byte) 0x20);         // protocol 2.0
        buffer.putShort((short) 2141);   // profile version
        buffer.putInt(0);                // data size
        buffer.put(".FIT".getBytes(StandardCharsets.US_ASCII));
        return buffer.array();
    }
}
