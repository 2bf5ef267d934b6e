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

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * A set of user-configurable options that affect the behavior of a {@link GcmClient}.
 */
public class GcmConfiguration {

	public static final String DEFAULT_URL = "https://fcm.googleapis.com/fcm/send";

	/**
	 * The largest number of recipients the service accepts in a single request.
	 */
	public static final int MAX_RECIPIENTS = 1000;

	public static final long DEFAULT_REQUEST_TIMEOUT_MILLIS = TimeUnit.SECONDS.toMillis(10);

	private String apiKey;
	private String url = DEFAULT_URL;
	private int maxRecipients = MAX_RECIPIENTS;
	private long requestTimeout = DEFAULT_REQUEST_TIMEOUT_MILLIS;

	public GcmConfiguration() {}

	public GcmConfiguration(final String apiKey) {
		this.apiKey = apiKey;
	}

	public GcmConfiguration(final GcmConfiguration configuration) {
		this.apiKey = configuration.apiKey;
		this.url = configuration.url;
		this.maxRecipients = configuration.maxRecipients;
		this.requestTimeout = configuration.requestTimeout;
	}

	public String getApiKey() {
		return this.apiKey;
	}

	public void setApiKey(final String apiKey) {
		this.apiKey = apiKey;
	}

	public String getUrl() {
		return this.url;
	}

	/**
	 * Sets the URL to which requests are posted.
	 *
	 * @param url an absolute {@code http} or {@code https} URL
	 *
	 * @throws IllegalArgumentException if the URL is malformed, is not absolute or uses another scheme
	 */
	public void setUrl(final String url) {
		if (url == null) {
			throw new NullPointerException("URL must not be null.");
		}

		final URI uri;

		try {
			uri = new URI(url);
		} catch (final URISyntaxException e) {
			throw new IllegalArgumentException("Malformed URL: " + url, e);
		}

		final String scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase(Locale.ROOT) : null;

		if (!"http".equals(scheme) && !"https".equals(scheme)) {
			throw new IllegalArgumentException("URL must use http or https: " + url);
		}

		if (uri.getHost() == null) {
			throw new IllegalArgumentException("URL must name a host: " + url);
		}

		this.url = url;
	}

	public int getMaxRecipients() {
		return this.maxRecipients;
	}

	/**
	 * Sets the largest number of recipients addressed by a single request.
	 *
	 * @param maxRecipients the largest number of recipients per request; must be between 1 and
	 * {@value #MAX_RECIPIENTS}
	 */
	public void setMaxRecipients(final int maxRecipients) {
		if (maxRecipients < 1 || maxRecipients > MAX_RECIPIENTS) {
			throw new IllegalArgumentException(String.format("Maximum recipients must be between 1 and %d.", MAX_RECIPIENTS));
		}

		this.maxRecipients = maxRecipients;
	}

	/**
	 * Returns the longest time, in milliseconds, to wait for the response to each request.
	 *
	 * @return the request timeout, in milliseconds
	 */
	public long getRequestTimeout() {
		return this.requestTimeout;
	}

	public void setRequestTimeout(final long requestTimeout) {
		this.requestTimeout = requestTimeout;
	}
}
