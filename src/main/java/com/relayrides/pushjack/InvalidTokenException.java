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

package com.relayrides.pushjack;

/**
 * Signals that a device token could not be parsed as an APNs token, either because it is not a hexadecimal string or
 * because it does not decode to the expected number of bytes.
 */
public class InvalidTokenException extends NotificationException {

	private static final long serialVersionUID = 1L;

	private final String token;

	/**
	 * Constructs a new invalid token exception for the given token.
	 *
	 * @param token the offending token string; may be {@code null}
	 * @param message an explanation of why the token was rejected
	 */
	public InvalidTokenException(final String token, final String message) {
		super(message);
		this.token = token;
	}

	/**
	 * Returns the token string that failed validation.
	 *
	 * @return the token string that failed validation
	 */
	public String getToken() {
		return this.token;
	}
}
