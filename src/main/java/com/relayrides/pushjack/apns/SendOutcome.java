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
 * The result of writing one unit of a bulk send and checking for an error response afterward.
 */
public class SendOutcome {

	public enum Kind {
		/**
		 * The unit was written and the gateway has not (yet) reported an error.
		 */
		SENT,

		/**
		 * The gateway rejected a notification; sending may resume after it unless the rejection is fatal.
		 */
		REJECTED,

		/**
		 * The unit could not be written even after reconnecting.
		 */
		WRITE_FAILED
	}

	private static final SendOutcome SENT = new SendOutcome(Kind.SENT, null);

	private final Kind kind;
	private final RejectedNotification rejectedNotification;

	private SendOutcome(final Kind kind, final RejectedNotification rejectedNotification) {
		this.kind = kind;
		this.rejectedNotification = rejectedNotification;
	}

	public static SendOutcome sent() {
		return SENT;
	}

	public static SendOutcome rejected(final RejectedNotification rejectedNotification) {
		return new SendOutcome(Kind.REJECTED, rejectedNotification);
	}

	public static SendOutcome writeFailed(final int identifier) {
		return new SendOutcome(Kind.WRITE_FAILED, new RejectedNotification(identifier, RejectedNotificationReason.TIMEOUT));
	}

	public Kind getKind() {
		return this.kind;
	}

	/**
	 * Returns the failure attributed to this outcome.
	 *
	 * @return the rejected notification for {@code REJECTED} and {@code WRITE_FAILED} outcomes, or {@code null} for
	 * {@code SENT}
	 */
	public RejectedNotification getRejectedNotification() {
		return this.rejectedNotification;
	}

	@Override
	public String toString() {
		return "SendOutcome [kind=" + kind + ", rejectedNotification=" + rejectedNotification + "]";
	}
}
