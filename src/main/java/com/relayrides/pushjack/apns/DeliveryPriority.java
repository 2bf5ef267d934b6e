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

package com.relayrides.pushjack.apns;

/**
 * An enumeration of delivery priorities for APNs push notifications.
 */
public enum DeliveryPriority {

	/**
	 * The push message is sent immediately. The notification must trigger an alert, sound, or badge on the device.
	 */
	IMMEDIATE((byte) 10),

	/**
	 * The push message is sent at a time that conserves power on the device receiving it.
	 */
	CONSERVE_POWER((byte) 5);

	private final byte code;

	private DeliveryPriority(final byte code) {
		this.code = code;
	}

	public byte getCode() {
		return this.code;
	}

	public static DeliveryPriority getFromCode(final int code) {
		for (final DeliveryPriority priority : DeliveryPriority.values()) {
			if (priority.getCode() == code) {
				return priority;
			}
		}

		throw new IllegalArgumentException(String.format("No delivery priority found with code %d", code));
	}
}
