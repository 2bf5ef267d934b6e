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

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Posts the requests of a {@link GcmMessageStream} to the GCM service one at a time, authenticated with an API key.
 */
public class GcmConnection {

	private final HttpTransport transport;
	private final String url;
	private final Map<String, String> headers;

	private static final Logger log = LoggerFactory.getLogger(GcmConnection.class);

	public GcmConnection(final HttpTransport transport, final String apiKey, final String url) {
		if (transport == null) {
			throw new NullPointerException("Transport must not be null.");
		}

		this.transport = transport;
		this.url = url;

		final Map<String, String> headers = new LinkedHashMap<String, String>();
		headers.put("Authorization", "key=" + apiKey);
		headers.put("Content-Type", "application/json");

		this.headers = headers;
	}

	/**
	 * Posts every request in the given stream. A request that gets no response is recorded as such rather than
	 * aborting the send.
	 *
	 * @param stream the requests to post
	 *
	 * @return the accounting of every recipient in the stream
	 */
	public GcmResponse send(final GcmMessageStream stream) {
		log.debug("Preparing to send {} notifications to GCM.", stream.size());

		final List<GcmRequest> requests = new ArrayList<GcmRequest>();
		final List<HttpResult> results = new ArrayList<HttpResult>();

		for (final GcmRequest request : stream) {
			requests.add(request);
			results.add(this.post(request));
		}

		final GcmResponse response = new GcmResponse(requests, results);

		log.debug("Sent {} notifications to GCM.", stream.size());

		if (response.hasErrors()) {
			log.debug("Encountered {} errors while sending to GCM.", response.getFailures().size());
		}

		return response;
	}

	private HttpResult post(final GcmRequest request) {
		log.debug("Sending GCM notification batch containing {} characters.", request.getBody().length());

		try {
			return this.transport.post(this.url, request.getBody(), this.headers);
		} catch (final IOException e) {
			log.warn("GCM request for {} registration IDs got no response.", request.getRegistrationIds().size(), e);
			return null;
		}
	}
}
