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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * <p>An enumeration of reasons a push notification may fail. Most reasons carry the one-byte status code APNs reports
 * in an error response; {@code TIMEOUT} and {@code UNSENDABLE} are raised locally and never appear on the wire.</p>
 *
 * <p>A <em>fatal</em> reason means the failure is not specific to one device token. Every notification in a send
 * shares its payload and topic, so no notification after a fatal failure can succeed either and sending stops. After a
 * non-fatal failure, sending resumes with the next notification.</p>
 */
public enum RejectedNotificationReason {
	NO_ERROR(0, "No errors encountered", false),
	PROCESSING_ERROR(1, "Processing error", false),
	MISSING_TOKEN(2, "Missing token", false),
	MISSING_TOPIC(3, "Missing topic", true),
	MISSING_PAYLOAD(4, "Missing payload", true),
	INVALID_TOKEN_SIZE(5, "Invalid token size", false),
	INVALID_TOPIC_SIZE(6, "Invalid topic size", true),
	INVALID_PAYLOAD_SIZE(7, "Invalid payload size", true),
	INVALID_TOKEN(8, "Invalid token", false),

	/**
	 * <p>Indicates that the connection is being shut down for maintenance. According to Apple's documentation:</p>
	 *
	 * <blockquote>A status code of 10 indicates that the APNs server closed the connection (for example, to perform
	 * maintenance). The notification identifier in the error response indicates the last notification that was
	 * successfully sent. Any notifications you sent after it have been discarded and must be resent. When you receive
	 * this status code, stop using this connection and open a new connection.</blockquote>
	 */
	SHUTDOWN(10, "Shutdown", true),

	PROTOCOL_ERROR(128, "Protocol error", true),
	UNKNOWN(255, "Unknown", false),

	/**
	 * A notification could not be written to the gateway within the allowed number of attempts.
	 */
	TIMEOUT(-1, "Connection timeout", true),

	/**
	 * A notification was never attempted because an earlier notification in the same send failed fatally.
	 */
	UNSENDABLE(-1, "Unable to send due to previous fatal error", true);

	private static final Map<Integer, RejectedNotificationReason> REASONS_BY_CODE;

	static {
		final Map<Integer, RejectedNotificationReason> reasonsByCode = new HashMap<Integer, RejectedNotificationReason>();

		for (final RejectedNotificationReason reason : RejectedNotificationReason.values()) {
			if (reason.isReportedByGateway()) {
				reasonsByCode.put(reason.errorCode, reason);
			}
		}

		REASONS_BY_CODE = Collections.unmodifiableMap(reasonsByCode);
	}

	private final int errorCode;
	private final String description;
	private final boolean fatal;

	private RejectedNotificationReason(final int errorCode, final String description, final boolean fatal) {
		this.errorCode = errorCode;
		this.description = description;
		this.fatal = fatal;
	}

	/**
	 * Returns the one-byte status code associated with this reason, or {@code -1} for reasons raised locally.
	 *
	 * @return the status code associated with this reason
	 */
	public int getErrorCode() {
		return this.errorCode;
	}

	public String getDescription() {
		return this.description;
	}

	/**
	 * Indicates whether a failure for this reason prevents any later notification in the same send from succeeding.
	 *
	 * @return {@code true} if this reason is fatal or {@code false} if sending may resume after it
	 */
	public boolean isFatal() {
		return this.fatal;
	}

	/**
	 * Indicates whether this reason is reported by the APNs gateway, as opposed to being raised locally.
	 *
	 * @return {@code true} if this reason has a wire status code
	 */
	public boolean isReportedByGateway() {
		return this.errorCode >= 0;
	}

	/**
	 * Gets the rejection reason associated with the given status code. Unrecognized codes map to {@code UNKNOWN}.
	 *
	 * @param errorCode the status code (as an unsigned byte value) for which to retrieve a rejection reason
	 *
	 * @return the rejection reason associated with {@code errorCode}
	 */
	public static RejectedNotificationReason getByErrorCode(final int errorCode) {
		final RejectedNotificationReason reason = REASONS_BY_CODE.get(errorCode);
		return reason != null ? reason : UNKNOWN;
	}
}
