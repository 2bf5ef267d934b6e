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

package com.relayrides.pushjack.gcm;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * An enumeration of the per-recipient errors reported by the GCM/FCM HTTP service. Codes the service reports that
 * are not listed here map to {@code UNKNOWN}.
 */
public enum GcmErrorCode {
	MISSING_REGISTRATION("MissingRegistration", "Missing registration ID"),
	INVALID_REGISTRATION("InvalidRegistration", "Invalid registration ID"),
	NOT_REGISTERED("NotRegistered", "Device not registered"),
	INVALID_PACKAGE_NAME("InvalidPackageName", "Invalid package name"),
	MISMATCH_SENDER_ID("MismatchSenderId", "Mismatched sender ID"),
	MESSAGE_TOO_BIG("MessageTooBig", "Message too big"),
	INVALID_DATA_KEY("InvalidDataKey", "Invalid data key"),
	INVALID_TTL("InvalidTtl", "Invalid time to live"),

	/**
	 * The server could not process the request in time; the request may be retried later.
	 */
	UNAVAILABLE("Unavailable", "Timeout"),

	INTERNAL_SERVER_ERROR("InternalServerError", "Internal server error"),
	DEVICE_MESSAGE_RATE_EXCEEDED("DeviceMessageRateExceeded", "Device message rate exceeded"),

	/**
	 * The server reported an unrecognized error, or the outcome for a recipient could not be determined.
	 */
	UNKNOWN(null, "Unknown error");

	private static final Map<String, GcmErrorCode> ERRORS_BY_CODE;

	static {
		final Map<String, GcmErrorCode> errorsByCode = new HashMap<String, GcmErrorCode>();

		for (final GcmErrorCode errorCode : GcmErrorCode.values()) {
			if (errorCode.code != null) {
				errorsByCode.put(errorCode.code, errorCode);
			}
		}

		ERRORS_BY_CODE = Collections.unmodifiableMap(errorsByCode);
	}

	private final String code;
	private final String description;

	private GcmErrorCode(final String code, final String description) {
		this.code = code;
		this.description = description;
	}

	/**
	 * Returns the error string the service uses for this error.
	 *
	 * @return the error string the service uses for this error, or {@code null} for {@code UNKNOWN}
	 */
	public String getCode() {
		return this.code;
	}

	public String getDescription() {
		return this.description;
	}

	public static GcmErrorCode fromCode(final String code) {
		final GcmErrorCode errorCode = code != null ? ERRORS_BY_CODE.get(code) : null;
		return errorCode != null ? errorCode : UNKNOWN;
	}
}
