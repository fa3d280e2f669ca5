package org.evmkit.cli.commands;

import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

/**
 * Hex conversions for command arguments and output.
 */
final class HexArgument {

    private HexArgument() {
    }

    /**
     * Decodes a hex argument with or without the {@code 0x} prefix. Whitespace is ignored.
     *
     * @param text The argument.
     * @return The decoded bytes.
     * @throws IllegalArgumentException if the text is not an even number of hex digits.
     */
    static byte[] decode(String text) {
        String digits = text.strip().replaceAll("\\s+", "");
        if (digits.startsWith("0x") || digits.startsWith("0X")) {
            digits = digits.substring(2);
        }
        if (digits.length() % 2 != 0) {
            throw new IllegalArgumentException("Odd number of hex digits: " + text);
        }
        try {
            return Hex.decode(digits);
        } catch (DecoderException e) {
            throw new IllegalArgumentException("Invalid hex: " + text, e);
        }
    }

    static String encode(byte[] data) {
        return "0x" + Hex.toHexString(data);
    }
}
