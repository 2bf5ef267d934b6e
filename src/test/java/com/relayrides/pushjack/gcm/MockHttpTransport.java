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
import java.util.LinkedList;
import java.util.List;
import java.util.Map;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

/**
 * Records every request posted through it. Queued results are returned in order; once the queue is empty, every
 * recipient of a request is reported as delivered.
 */
public class MockHttpTransport implements HttpTransport {

	public static class PostedRequest {
		private final String url;
		private final String body;
		private final Map<String, String> headers;

		PostedRequest(final String url, final String body, final Map<String, String> headers) {
			this.url = url;
			this.body = body;
			this.headers = headers;
		}

		public String getUrl() {
			return this.url;
		}

		public String getBody() {
			return this.body;
		}

		public JsonObject getJson() {
			return JsonParser.parseString(this.body).getAsJsonObject();
		}

		public Map<String, String> getHeaders() {
			return this.headers;
		}
	}

	private final List<PostedRequest> requests = new ArrayList<PostedRequest>();
	private final LinkedList<Object> queuedResults = new LinkedList<Object>();

	public synchronized void enqueueResult(final HttpResult result) {
		this.queuedResults.add(result);
	}

	public synchronized void enqueueFailure(final IOException failure) {
		this.queuedResults.add(failure);
	}

	public synchronized List<PostedRequest> getRequests() {
		return new ArrayList<PostedRequest>(this.requests);
	}

	@Override
	public synchronized HttpResult post(final String url, final String body, final Map<String, String> headers)
			throws IOException {

		final PostedRequest request = new PostedRequest(url, body, headers);
		this.requests.add(request);

		if (!this.queuedResults.isEmpty()) {
			final Object result = this.queuedResults.removeFirst();

			if (result instanceof IOException) {
				throw (IOException) result;
			}

			return (HttpResult) result;
		}

		return successFor(request.getJson());
	}

	private static HttpResult successFor(final JsonObject request) {
		final int recipients = request.has("to") ? 1 : request.getAsJsonArray("registration_ids").size();

		final JsonArray results = new JsonArray();

		for (int i = 0; i < recipients; i++) {
			final JsonObject result = new JsonObject();
			result.addProperty("message_id", "0:" + i);
			results.add(result);
		}

		final JsonObject response = new JsonObject();
		response.addProperty("multicast_id", 216);
		response.addProperty("success", recipients);
		response.addProperty("failure", 0);
		response.addProperty("canonical_ids", 0);
		response.add("results", results);

		return new HttpResult(200, response.toString());
	}

	public static List<String> generateRegistrationIds(final int count) {
		final List<String> registrationIds = new ArrayList<String>(count);

		for (int i = 0; i < count; i++) {
			registrationIds.add("registration-" + i);
		}

		return registrationIds;
	}

	static List<String> toStrings(final JsonArray array) {
		final List<String> strings = new ArrayList<String>();

		for (final JsonElement element : array) {
			strings.add(element.getAsString());
		}

		return strings;
	}
}
