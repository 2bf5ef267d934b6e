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

/**
 * <p>Retrieves the tokens the APNs feedback service has marked as expired. Apple's documentation describes the
 * feedback service as follows:</p>
 *
 * <blockquote>The Apple Push Notification Service includes a feedback service to give you information about failed
 * push notifications. When a push notification cannot be delivered because the intended app does not exist on the
 * device, the feedback service adds that device's token to its list.</blockquote>
 *
 * <p>The feedback service sends its list as soon as a connection is opened and then closes the connection. Each
 * token is reported only once, so callers should act on every token returned.</p>
 */
public class FeedbackServiceClient {

	private final ApnsConnection connection;
	private final long readTimeout;

	private static final Logger log = LoggerFactory.getLogger(FeedbackServiceClient.class);

	/**
	 * Constructs a new feedback service client.
	 *
	 * @param connection an unconnected connection to the feedback service
	 * @param readTimeout the longest time, in milliseconds, to wait for each record; the service is assumed to have
	 * sent everything it has if nothing arrives within this time
	 */
	public FeedbackServiceClient(final ApnsConnection connection, final long readTimeout) {
		if (connection == null) {
			throw new NullPointerException("Connection must not be null.");
		}

		this.connection = connection;
		this.readTimeout = readTimeout;
	}

	/**
	 * Connects to the feedback service and reads expired tokens until the service closes the connection or stops
	 * sending. The connection is always closed before this method returns.
	 *
	 * @return the expired tokens reported by the feedback service, in the order reported
	 *
	 * @throws ApnsAuthException if the provider certificate is missing or unusable
	 * @throws IOException if the connection could not be opened or failed while reading
	 */
	public synchronized List<ExpiredToken> getExpiredTokens() throws ApnsAuthException, IOException {
		final List<ExpiredToken> expiredTokens = new ArrayList<ExpiredToken>();

		try {
			this.connection.connect();

			while (true) {
				final byte[] header = this.connection.read(ApnsFrameCodec.FEEDBACK_HEADER_LENGTH, this.readTimeout);

				if (header.length < ApnsFrameCodec.FEEDBACK_HEADER_LENGTH) {
					if (header.length > 0) {
						log.warn("Feedback service sent a truncated record header ({} bytes).", header.length);
					}

					break;
				}

				final int tokenLength = ApnsFrameCodec.getFeedbackTokenLength(header);
				final byte[] tokenBytes = this.connection.read(tokenLength, this.readTimeout);

				if (tokenBytes.length < tokenLength) {
					log.warn("Feedback service sent a truncated token ({} of {} bytes).", tokenBytes.length, tokenLength);
					break;
				}

				final ExpiredToken expiredToken = ApnsFrameCodec.decodeExpiredToken(header, tokenBytes);
				log.trace("Received expired token {}.", expiredToken);

				expiredTokens.add(expiredToken);
			}
		} finally {
			this.connection.close();
		}

		log.debug("Received {} expired tokens from the feedback service.", expiredTokens.size());

		return expiredTokens;
	}
}
