package com.docvalidator.core.util;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Best-effort text decoding: BOM detection, strict UTF-8, then UTF-8 with replacement.
 *
 * <p>Decoding never fails. When bytes had to be replaced the returned {@link DecodedText}
 * says so, and callers report it instead of aborting.</p>
 */
public final class TextDecodingUtils {

    private TextDecodingUtils() {
    }

    public static DecodedText decodeBestEffort(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return new DecodedText("", StandardCharsets.UTF_8.name(), false, false);
        }

        // UTF-8 BOM
        if (hasPrefix(bytes, (byte) 0xEF, (byte) 0xBB, (byte) 0xBF)) {
            return decodeFrom(bytes, 3, StandardCharsets.UTF_8, "UTF-8 (BOM)", true);
        }

        // UTF-16 BOM
        if (hasPrefix(bytes, (byte) 0xFF, (byte) 0xFE)) {
            return decodeFrom(bytes, 2, StandardCharsets.UTF_16LE, "UTF-16LE (BOM)", true);
        }
        if (hasPrefix(bytes, (byte) 0xFE, (byte) 0xFF)) {
            return decodeFrom(bytes, 2, StandardCharsets.UTF_16BE, "UTF-16BE (BOM)", true);
        }

        return decodeFrom(bytes, 0, StandardCharsets.UTF_8, StandardCharsets.UTF_8.name(), false);
    }

    private static DecodedText decodeFrom(byte[] bytes, int offset, Charset charset, String label, boolean hadBom) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes, offset, bytes.length - offset);
        String strict = tryStrictDecode(buffer.duplicate(), charset);
        if (strict != null) {
            return new DecodedText(strict, label, false, hadBom);
        }
        // Replacement decoding cannot fail
        return new DecodedText(charset.decode(buffer).toString(), label, true, hadBom);
    }

    private static String tryStrictDecode(ByteBuffer buffer, Charset charset) {
        CharsetDecoder decoder = charset.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(buffer).toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }

    private static boolean hasPrefix(byte[] bytes, byte... prefix) {
        if (bytes.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (bytes[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Result of a best-effort decode.
     *
     * @param text decoded text
     * @param charsetName charset that was used
     * @param replacedInvalidBytes whether invalid byte sequences were replaced
     * @param hadBom whether a byte order mark was stripped
     */
    public record DecodedText(String text, String charsetName, boolean replacedInvalidBytes, boolean hadBom) {

        /**
         * Builds a notice describing the recovery, or {@code null} if the text decoded cleanly.
         *
         * @param fileName file name for the message
         * @return notice or {@code null}
         */
        public String buildNotice(String fileName) {
            if (replacedInvalidBytes) {
                return fileName + " contains byte sequences that are not valid " + charsetName
                    + "; they were replaced with U+FFFD";
            }
            if (hadBom && !charsetName.startsWith("UTF-8")) {
                return fileName + " is encoded as " + charsetName + " and was decoded accordingly";
            }
            return null;
        }
    }
}
