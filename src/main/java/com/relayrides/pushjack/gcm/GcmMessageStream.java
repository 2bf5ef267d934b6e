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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Splits a GCM send into requests of at most {@code maxRecipients} registration IDs each. A request with several
 * recipients addresses them with {@code registration_ids}; a request with one recipient addresses it with {@code to}.
 */
public class GcmMessageStream implements Iterable<GcmRequest> {

	private static final Gson gson = new GsonBuilder().disableHtmlEscaping().create();

	private final List<String> registrationIds;
	private final GcmMessage message;
	private final int maxRecipients;

	private static final Logger log = LoggerFactory.getLogger(GcmMessageStream.class);

	public GcmMessageStream(final List<String> registrationIds, final GcmMessage message, final int maxRecipients) {
		if (registrationIds == null) {
			throw new NullPointerException("Registration IDs must not be null.");
		}

		if (message == null) {
			throw new NullPointerException("Message must not be null.");
		}

		if (maxRecipients < 1) {
			throw new IllegalArgumentException("Maximum recipients must be positive.");
		}

		this.registrationIds = Collections.unmodifiableList(new ArrayList<String>(registrationIds));
		this.message = message;
		this.maxRecipients = maxRecipients;
	}

	/**
	 * Returns the total number of recipients in this stream.
	 *
	 * @return the total number of recipients in this stream
	 */
	public int size() {
		return this.registrationIds.size();
	}

	public List<String> getRegistrationIds() {
		return this.registrationIds;
	}

	@Override
	public Iterator<GcmRequest> iterator() {
		final Map<String, Object> fields = this.message.toMap();

		return new Iterator<GcmRequest>() {
			private int position = 0;

			@Override
			public boolean hasNext() {
				return this.position < registrationIds.size();
			}

			@Override
			public GcmRequest next() {
				if (!this.hasNext()) {
					throw new NoSuchElementException();
				}

				final int end = Math.min(this.position + maxRecipients, registrationIds.size());
				final List<String> chunk = registrationIds.subList(this.position, end);
				this.position = end;

				fields.remove("registration_ids");
				fields.remove("to");

				if (chunk.size() > 1) {
					fields.put("registration_ids", chunk);
				} else {
					fields.put("to", chunk.get(0));
				}

				log.trace("Prepared GCM request for {} registration IDs.", chunk.size());

				return new GcmRequest(chunk, gson.toJson(fields));
			}

			@Override
			public void remove() {
				throw new UnsupportedOperationException();
			}
		};
	}
}
