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
 * A failure attributed to a single notification in a send, identified by the notification's sequence identifier.
 * Failures are either reported by the APNs gateway in an error response or raised locally when a notification could
 * not be written or was abandoned after a fatal failure.
 */
public class RejectedNotification {
	private final int identifier;
	private final RejectedNotificationReason rejectionReason;

	/**
	 * Constructs a new rejected notification tuple with the given identifier and rejection reason.
	 *
	 * @param identifier the sequence identifier of the rejected notification
	 * @param rejectionReason the reason for the rejection; must not be {@code null}
	 */
	public RejectedNotification(final int identifier, final RejectedNotificationReason rejectionReason) {
		if (rejectionReason == null) {
			throw new NullPointerException("Rejection reason must not be null.");
		}

		this.identifier = identifier;
		this.rejectionReason = rejectionReason;
	}

	/**
	 * Returns the sequence identifier of the rejected notification.
	 *
	 * @return the sequence identifier of the rejected notification
	 */
	public int getIdentifier() {
		return this.identifier;
	}

	/**
	 * Returns the reason the notification was rejected.
	 *
	 * @return the reason the notification was rejected
	 */
	public RejectedNotificationReason getReason() {
		return this.rejectionReason;
	}

	public boolean isFatal() {
		return this.rejectionReason.isFatal();
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + identifier;
		result = prime * result + rejectionReason.hashCode();
		return result;
	}

	@Override
	public boolean equals(final Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		final RejectedNotification other = (RejectedNotification) obj;
		if (identifier != other.identifier)
			return false;
		if (rejectionReason != other.rejectionReason)
			return false;
		return true;
	}

	@Override
	public String toString() {
		return "RejectedNotification [identifier=" + identifier + ", reason=" + rejectionReason
				+ " (code=" + rejectionReason.getErrorCode() + "): " + rejectionReason.getDescription() + "]";
	}
}
