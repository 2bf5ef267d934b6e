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
 * Signals that a serialized notification payload is longer than the vendor allows and could not be shortened.
 */
public class PayloadTooLargeException extends NotificationException {

	private static final long serialVersionUID = 1L;

	private final int payloadLength;
	private final int maximumLength;

	public PayloadTooLargeException(final int payloadLength, final int maximumLength) {
		this(String.format("Payload length is %d bytes (with a maximum of %d bytes).", payloadLength, maximumLength),
				payloadLength, maximumLength);
	}

	public PayloadTooLargeException(final String message, final int payloadLength, final int maximumLength) {
		super(message);

		this.payloadLength = payloadLength;
		this.maximumLength = maximumLength;
	}

	public int getPayloadLength() {
		return this.payloadLength;
	}

	public int getMaximumLength() {
		return this.maximumLength;
	}
}
