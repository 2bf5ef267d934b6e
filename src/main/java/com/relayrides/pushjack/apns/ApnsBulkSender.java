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

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.relayrides.pushjack.apns.ApnsNotificationStream.StreamUnit;

/**
 * <p>Drives an {@link ApnsNotificationStream} through an {@link ApnsConnection}, correlating the gateway's asynchronous
 * error responses with the notifications they describe.</p>
 *
 * <p>After every unit is written, the sender polls for an error response without waiting. Once the stream is
 * exhausted, it waits up to the error timeout for a last error response, since the gateway closes the connection
 * shortly after reporting an error and nothing else would prompt another check. When the gateway rejects a
 * notification, the stream is moved past it. Sending then resumes after a non-fatal rejection; after a fatal one, every
 * notification not yet sent is reported as {@link RejectedNotificationReason#UNSENDABLE} and the send stops.</p>
 *
 * <p>An error response that arrived just before a write failed or the gateway reset the connection is handled like
 * any other rejection.</p>
 *
 * <p>A unit that cannot be written is re-written on a fresh connection up to the configured number of retries. If it
 * still cannot be written, its first notification is reported as {@link RejectedNotificationReason#TIMEOUT} and the
 * send stops; notifications after it are not reported.</p>
 */
public class ApnsBulkSender {

	enum State {
		SENDING,
		CHECKING,
		RESUME,
		DONE,
		ABORTED
	}

	private final ApnsConnection connection;
	private final long writeTimeout;

	private static final Logger log = LoggerFactory.getLogger(ApnsBulkSender.class);

	/**
	 * Constructs a new bulk sender that writes through the given connection.
	 *
	 * @param connection the connection to the APNs gateway; connected lazily as needed
	 * @param writeTimeout the longest time, in milliseconds, to wait for a single unit to be written
	 */
	public ApnsBulkSender(final ApnsConnection connection, final long writeTimeout) {
		if (connection == null) {
			throw new NullPointerException("Connection must not be null.");
		}

		this.connection = connection;
		this.writeTimeout = writeTimeout;
	}

	/**
	 * Sends every notification in the given stream.
	 *
	 * @param stream the notifications to send
	 * @param retries the number of times a unit that could not be written is re-written before the send is abandoned
	 * @param errorTimeout the time, in milliseconds, to wait for an error response after the last unit is written
	 *
	 * @return every failure encountered, in the order encountered; empty if every notification was accepted
	 *
	 * @throws ApnsAuthException if the provider certificate is missing or unusable
	 */
	public List<RejectedNotification> send(final ApnsNotificationStream stream, final int retries, final long errorTimeout)
			throws ApnsAuthException {

		final List<RejectedNotification> errors = new ArrayList<RejectedNotification>();

		final RejectedNotification staleRejection = this.connection.takeBufferedRejection();

		if (staleRejection != null) {
			log.warn("Discarding rejection of notification {} ({}) left over from an earlier send.",
					staleRejection.getIdentifier(), staleRejection.getReason());
		}

		State state = stream.hasNext() ? State.SENDING : State.DONE;
		SendOutcome outcome = null;

		while (state != State.DONE && state != State.ABORTED) {
			switch (state) {
				case SENDING: {
					outcome = this.writeNextUnit(stream, retries);

					if (outcome.getKind() == SendOutcome.Kind.WRITE_FAILED) {
						errors.add(outcome.getRejectedNotification());
						this.connection.close();

						state = State.ABORTED;
					} else if (outcome.getKind() == SendOutcome.Kind.REJECTED) {
						state = State.RESUME;
					} else {
						state = State.CHECKING;
					}

					break;
				}

				case CHECKING: {
					outcome = this.checkForRejection(stream.isEof() ? errorTimeout : 0);

					if (outcome.getKind() == SendOutcome.Kind.REJECTED) {
						state = State.RESUME;
					} else {
						state = stream.isEof() ? State.DONE : State.SENDING;
					}

					break;
				}

				case RESUME: {
					final RejectedNotification rejectedNotification = outcome.getRejectedNotification();

					errors.add(rejectedNotification);
					stream.seek(rejectedNotification.getIdentifier());

					if (rejectedNotification.isFatal()) {
						final int firstUnsent = stream.position();
						final List<String> unsentTokens = stream.peek();

						for (int i = 0; i < unsentTokens.size(); i++) {
							errors.add(new RejectedNotification(firstUnsent + i, RejectedNotificationReason.UNSENDABLE));
						}

						log.debug("Fatal rejection ({}); {} notifications will not be sent.",
								rejectedNotification.getReason(), unsentTokens.size());

						state = State.ABORTED;
					} else {
						state = stream.isEof() ? State.DONE : State.SENDING;
					}

					break;
				}

				default: {
					throw new IllegalStateException("Unexpected state: " + state);
				}
			}
		}

		log.debug("Finished sending {} notifications with {} errors ({}).", stream.size(), errors.size(), state);

		return errors;
	}

	private SendOutcome writeNextUnit(final ApnsNotificationStream stream, final int retries) throws ApnsAuthException {
		final StreamUnit unit = stream.next();

		for (int attempt = 0; attempt <= retries; attempt++) {
			try {
				this.connection.connect();
				this.connection.write(unit.getBytes(), this.writeTimeout);

				log.trace("Wrote notifications {} through {}.", unit.getFirstIdentifier(), unit.getLastIdentifier());

				return SendOutcome.sent();
			} catch (final IOException e) {
				log.warn("Failed to write notifications {} through {} (attempt {} of {}).",
						unit.getFirstIdentifier(), unit.getLastIdentifier(), attempt + 1, retries + 1, e);

				this.connection.close();

				// The gateway may have reported an error before the write failed; notifications after the rejected
				// one were discarded and must be sent again from there.
				final RejectedNotification rejectedNotification = this.connection.takeBufferedRejection();

				if (rejectedNotification != null) {
					return SendOutcome.rejected(rejectedNotification);
				}
			}
		}

		return SendOutcome.writeFailed(unit.getFirstIdentifier());
	}

	private SendOutcome checkForRejection(final long timeout) {
		final RejectedNotification rejectedNotification;

		try {
			rejectedNotification = this.connection.checkError(timeout);
		} catch (final IOException e) {
			// The gateway's side of the connection is gone; the next write reconnects.
			log.warn("Failed to check for an error response.", e);
			this.connection.close();

			return SendOutcome.sent();
		}

		return rejectedNotification != null ? SendOutcome.rejected(rejectedNotification) : SendOutcome.sent();
	}
}
