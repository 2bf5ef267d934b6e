/* Copyright (c) 2013 RelayRides
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */

package com.relayrides.pushjack.apns.util;

import java.util.regex.Pattern;

import com.relayrides.pushjack.InvalidTokenException;

/**
 * A utility class for processing APNs token strings.
 */
public class TokenUtil {

    /**
     * The length, in bytes, of a decoded APNs device token ({@value TOKEN_LENGTH}).
     */
    public static final int TOKEN_LENGTH = 32;

    private static final Pattern HEX_PATTERN = Pattern.compile("^[0-9a-fA-F]*$");

    private static final char[] HEX_DIGITS = "0123456789abcdef".toCharArray();

    // Prevent instantiation
    private TokenUtil() {}

    /**
     * Checks whether the given string is a hexadecimal representation of a {@value TOKEN_LENGTH}-byte device token.
     *
     * @param tokenString the token string to check; may be {@code null}
     *
     * @return {@code true} if the string decodes to a well-formed device token or {@code false} otherwise
     */
    public static boolean isValidToken(final String tokenString) {
        try {
            tokenStringToByteArray(tokenString);
            return true;
        } catch (final InvalidTokenException e) {
            return false;
        }
    }

    /**
     * Decodes a hexadecimal token string into the raw bytes sent on the wire.
     *
     * @param tokenString the hexadecimal token string to decode
     *
     * @return the decoded token bytes
     *
     * @throws InvalidTokenException if the string is {@code null}, contains non-hexadecimal characters or does not
     * decode to exactly {@value TOKEN_LENGTH} bytes
     */
    public static byte[] tokenStringToByteArray(final String tokenString) throws InvalidTokenException {
        if (tokenString == null) {
            throw new InvalidTokenException(null, "Invalid token format. Token must not be null.");
        }

        if (!HEX_PATTERN.matcher(tokenString).matches() || tokenString.length() % 2 != 0) {
            throw new InvalidTokenException(tokenString, "Invalid token format. Expected a hexadecimal string.");
        }

        if (tokenString.length() != TOKEN_LENGTH * 2) {
            throw new InvalidTokenException(tokenString, String.format(
                    "Invalid token format. Expected %d hexadecimal characters, but found %d.",
                    TOKEN_LENGTH * 2, tokenString.length()));
        }

        final byte[] tokenBytes = new byte[tokenString.length() / 2];

        for (int i = 0; i < tokenBytes.length; i++) {
            tokenBytes[i] = (byte) Integer.parseInt(tokenString.substring(i * 2, i * 2 + 2), 16);
        }

        return tokenBytes;
    }

    /**
     * Encodes raw token bytes as a lower-case hexadecimal string.
     *
     * @param tokenBytes the token bytes to encode; must not be {@code null}
     *
     * @return a hexadecimal representation of the given bytes
     */
    public static String tokenBytesToString(final byte[] tokenBytes) {
        if (tokenBytes == null) {
            throw new NullPointerException("Token bytes must not be null.");
        }

        final char[] hex = new char[tokenBytes.length * 2];

        for (int i = 0; i < tokenBytes.length; i++) {
            hex[i * 2] = HEX_DIGITS[(tokenBytes[i] >> 4) & 0x0F];
            hex[i * 2 + 1] = HEX_DIGITS[tokenBytes[i] & 0x0F];
        }

        return new String(hex);
    }
}
