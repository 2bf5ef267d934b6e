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

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.reflect.TypeToken;

/**
 * <p>The complete accounting of one GCM send, built from the HTTP result of each request.</p>
 *
 * <p>For a request answered with status 200, each entry of the response's {@code results} array describes the
 * recipient at the same position in the request. A request answered with status 500 fails for every recipient with
 * {@link GcmErrorCode#INTERNAL_SERVER_ERROR}. Recipients whose outcome cannot be determined (because the request got
 * no response, got any other status, or got a body that could not be parsed or had too few results) fail with
 * {@link GcmErrorCode#UNKNOWN}.</p>
 */
public class GcmResponse {

	private static final Gson gson = new Gson();
	private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

	private final List<GcmRequest> requests;
	private final List<HttpResult> results;

	private final List<String> registrationIds = new ArrayList<String>();
	private final List<Map<String, Object>> data = new ArrayList<Map<String, Object>>();
	private final List<String> successes = new ArrayList<String>();
	private final List<String> failures = new ArrayList<String>();
	private final List<GcmError> errors = new ArrayList<GcmError>();
	private final List<GcmCanonicalId> canonicalIds = new ArrayList<GcmCanonicalId>();

	private static final Logger log = LoggerFactory.getLogger(GcmResponse.class);

	/**
	 * Constructs a new response.
	 *
	 * @param requests the requests of the send, in the order they were made
	 * @param results the HTTP result of each request, at the same position as the request; {@code null} where a
	 * request got no response
	 */
	public GcmResponse(final List<GcmRequest> requests, final List<HttpResult> results) {
		if (requests.size() != results.size()) {
			throw new IllegalArgumentException(String.format("Got %d results for %d requests.",
					results.size(), requests.size()));
		}

		this.requests = Collections.unmodifiableList(new ArrayList<GcmRequest>(requests));
		this.results = Collections.unmodifiableList(new ArrayList<HttpResult>(results));

		for (int i = 0; i < this.requests.size(); i++) {
			this.parseResult(this.requests.get(i).getRegistrationIds(), this.results.get(i));
		}
	}

	private void parseResult(final List<String> registrationIds, final HttpResult result) {
		this.registrationIds.addAll(registrationIds);

		if (result == null) {
			this.addFailures(registrationIds, GcmErrorCode.UNKNOWN);
			return;
		}

		if (result.getStatus() == 500) {
			this.addFailures(registrationIds, GcmErrorCode.INTERNAL_SERVER_ERROR);
			return;
		}

		if (result.getStatus() != 200) {
			log.warn("GCM request for {} registration IDs failed with status {}.", registrationIds.size(), result.getStatus());
			this.addFailures(registrationIds, GcmErrorCode.UNKNOWN);
			return;
		}

		final JsonObject body;

		try {
			body = JsonParser.parseString(result.getBody() != null ? result.getBody() : "").getAsJsonObject();
		} catch (final JsonParseException | IllegalStateException e) {
			log.warn("Could not parse GCM response body: {}", result.getBody(), e);
			this.addFailures(registrationIds, GcmErrorCode.UNKNOWN);
			return;
		}

		this.data.add(Collections.unmodifiableMap(gson.<Map<String, Object>>fromJson(body, MAP_TYPE)));

		final JsonArray resultArray = body.has("results") && body.get("results").isJsonArray() ?
				body.getAsJsonArray("results") : new JsonArray();

		if (resultArray.size() != registrationIds.size()) {
			log.warn("GCM response has {} results for {} registration IDs.", resultArray.size(), registrationIds.size());
		}

		for (int i = 0; i < registrationIds.size(); i++) {
			final String registrationId = registrationIds.get(i);
			final JsonElement element = i < resultArray.size() ? resultArray.get(i) : null;

			if (element == null || !element.isJsonObject()) {
				this.addFailure(registrationId, GcmErrorCode.UNKNOWN);
				continue;
			}

			final JsonObject entry = element.getAsJsonObject();

			if (entry.has("error")) {
				final JsonElement error = entry.get("error");
				this.addFailure(registrationId, error.isJsonPrimitive() ?
						GcmErrorCode.fromCode(error.getAsString()) : GcmErrorCode.UNKNOWN);
			} else {
				this.successes.add(registrationId);
			}

			final JsonElement canonicalId = entry.get("registration_id");

			if (canonicalId != null && canonicalId.isJsonPrimitive()) {
				this.canonicalIds.add(new GcmCanonicalId(registrationId, canonicalId.getAsString()));
			} else if (canonicalId != null) {
				log.warn("Ignoring malformed canonical ID for {}: {}", registrationId, canonicalId);
			}
		}
	}

	private void addFailures(final List<String> registrationIds, final GcmErrorCode errorCode) {
		for (final String registrationId : registrationIds) {
			this.addFailure(registrationId, errorCode);
		}
	}

	private void addFailure(final String registrationId, final GcmErrorCode errorCode) {
		this.failures.add(registrationId);
		this.errors.add(new GcmError(registrationId, errorCode));
	}

	public List<GcmRequest> getRequests() {
		return this.requests;
	}

	/**
	 * Returns the raw HTTP result of each request.
	 *
	 * @return the HTTP result of each request; {@code null} where a request got no response
	 */
	public List<HttpResult> getResults() {
		return this.results;
	}

	/**
	 * Returns every recipient of the send, in request order.
	 *
	 * @return every recipient of the send
	 */
	public List<String> getRegistrationIds() {
		return Collections.unmodifiableList(this.registrationIds);
	}

	/**
	 * Returns the parsed body of each response with status 200.
	 *
	 * @return the parsed body of each successful response
	 */
	public List<Map<String, Object>> getData() {
		return Collections.unmodifiableList(this.data);
	}

	public List<String> getSuccesses() {
		return Collections.unmodifiableList(this.successes);
	}

	public List<String> getFailures() {
		return Collections.unmodifiableList(this.failures);
	}

	/**
	 * Returns one error for each failed recipient, in the same order as {@link #getFailures()}.
	 *
	 * @return the error for each failed recipient
	 */
	public List<GcmError> getErrors() {
		return Collections.unmodifiableList(this.errors);
	}

	/**
	 * Returns every registration ID the service has replaced, whether or not the message to it was delivered.
	 *
	 * @return every replaced registration ID paired with its replacement
	 */
	public List<GcmCanonicalId> getCanonicalIds() {
		return Collections.unmodifiableList(this.canonicalIds);
	}

	public boolean hasErrors() {
		return !this.failures.isEmpty();
	}

	@Override
	public String toString() {
		return "GcmResponse [requests=" + requests.size() + ", successes=" + successes.size() + ", failures="
				+ failures.size() + ", canonicalIds=" + canonicalIds.size() + "]";
	}
}
