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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>The complete accounting of one bulk send: the tokens that were sent to, the payload that was sent, and every
 * failure encountered. Each failure identifies a token by its position in the token list.</p>
 *
 * <p>Every token appears in exactly one of {@link #getSuccesses()} and {@link #getFailures()}. Responses are immutable;
 * their views are computed once at construction.</p>
 */
public class ApnsResponse {

	private final List<String> tokens;
	private final String payload;
	private final List<RejectedNotification> errors;

	private final List<String> successes;
	private final List<String> failures;
	private final Map<String, RejectedNotification> tokenErrors;

	private static final Logger log = LoggerFactory.getLogger(ApnsResponse.class);

	/**
	 * Constructs a new response.
	 *
	 * @param tokens every token in the send, in send order
	 * @param payload the payload sent to every token
	 * @param errors the failures encountered, in the order encountered; only the first failure for each identifier
	 * counts, and identifiers that do not correspond to a token are ignored
	 */
	public ApnsResponse(final List<String> tokens, final String payload, final List<RejectedNotification> errors) {
		if (tokens == null) {
			throw new NullPointerException("Tokens must not be null.");
		}

		if (errors == null) {
			throw new NullPointerException("Errors must not be null.");
		}

		this.tokens = Collections.unmodifiableList(new ArrayList<String>(tokens));
		this.payload = payload;
		this.errors = Collections.unmodifiableList(new ArrayList<RejectedNotification>(errors));

		final Map<Integer, RejectedNotification> errorsByPosition = new HashMap<Integer, RejectedNotification>();

		for (final RejectedNotification error : this.errors) {
			final int identifier = error.getIdentifier();

			if (identifier < 0 || identifier >= this.tokens.size()) {
				log.warn("Ignoring rejection of notification {}, which is not part of this send of {} notifications.",
						identifier, this.tokens.size());

				continue;
			}

			if (!errorsByPosition.containsKey(identifier)) {
				errorsByPosition.put(identifier, error);
			}
		}

		final List<String> successes = new ArrayList<String>();
		final List<String> failures = new ArrayList<String>();
		final Map<String, RejectedNotification> tokenErrors = new LinkedHashMap<String, RejectedNotification>();

		for (int i = 0; i < this.tokens.size(); i++) {
			final String token = this.tokens.get(i);
			final RejectedNotification error = errorsByPosition.get(i);

			if (error == null) {
				successes.add(token);
			} else {
				failures.add(token);

				if (!tokenErrors.containsKey(token)) {
					tokenErrors.put(token, error);
				}
			}
		}

		this.failures = Collections.unmodifiableList(failures);
		this.successes = Collections.unmodifiableList(successes);
		this.tokenErrors = Collections.unmodifiableMap(tokenErrors);
	}

	public List<String> getTokens() {
		return this.tokens;
	}

	public String getPayload() {
		return this.payload;
	}

	/**
	 * Returns every failure encountered during the send, in the order encountered.
	 *
	 * @return every failure encountered during the send
	 */
	public List<RejectedNotification> getErrors() {
		return this.errors;
	}

	/**
	 * Returns the tokens whose notifications were not rejected, in send order.
	 *
	 * @return the tokens whose notifications were not rejected
	 */
	public List<String> getSuccesses() {
		return this.successes;
	}

	/**
	 * Returns the tokens whose notifications failed, in send order.
	 *
	 * @return the tokens whose notifications failed
	 */
	public List<String> getFailures() {
		return this.failures;
	}

	/**
	 * Returns the failure for each failed token, in send order. If a token appears more than once in the send, the
	 * failure at its earliest failed position is kept.
	 *
	 * @return a map of failed tokens to their failures
	 */
	public Map<String, RejectedNotification> getTokenErrors() {
		return this.tokenErrors;
	}

	public boolean hasErrors() {
		return !this.failures.isEmpty();
	}

	@Override
	public String toString() {
		return "ApnsResponse [tokens=" + tokens.size() + ", successes=" + successes.size() + ", failures="
				+ failures.size() + "]";
	}
}
