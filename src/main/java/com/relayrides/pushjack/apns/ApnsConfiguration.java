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

import java.util.concurrent.TimeUnit;

import com.relayrides.pushjack.apns.util.ApnsPayloadBuilder;

/**
 * <p>A set of user-configurable options that affect the behavior of an {@link ApnsClient}. Configuration objects start
 * with documented defaults; callers override individual options with setters, or copy an existing configuration and
 * override the copy.</p>
 *
 * <p>All timeouts are expressed in milliseconds.</p>
 */
public class ApnsConfiguration {

	public static final long DEFAULT_ERROR_TIMEOUT_MILLIS = TimeUnit.SECONDS.toMillis(10);
	public static final long DEFAULT_EXPIRATION_OFFSET_SECONDS = TimeUnit.DAYS.toSeconds(30);
	public static final int DEFAULT_BATCH_SIZE = 100;
	public static final int DEFAULT_RETRIES = 5;
	public static final long DEFAULT_CONNECT_TIMEOUT_MILLIS = TimeUnit.SECONDS.toMillis(10);
	public static final long DEFAULT_WRITE_TIMEOUT_MILLIS = TimeUnit.SECONDS.toMillis(10);
	public static final long DEFAULT_FEEDBACK_READ_TIMEOUT_MILLIS = TimeUnit.SECONDS.toMillis(10);

	private String certificate;
	private String certificatePassword;
	private ApnsEnvironment environment = ApnsEnvironment.getProductionEnvironment();

	private long defaultErrorTimeout = DEFAULT_ERROR_TIMEOUT_MILLIS;
	private long defaultExpirationOffset = DEFAULT_EXPIRATION_OFFSET_SECONDS;
	private int defaultBatchSize = DEFAULT_BATCH_SIZE;
	private int defaultRetries = DEFAULT_RETRIES;
	private int maxNotificationSize = ApnsPayloadBuilder.DEFAULT_MAXIMUM_PAYLOAD_SIZE;

	private long connectTimeout = DEFAULT_CONNECT_TIMEOUT_MILLIS;
	private long writeTimeout = DEFAULT_WRITE_TIMEOUT_MILLIS;
	private long feedbackReadTimeout = DEFAULT_FEEDBACK_READ_TIMEOUT_MILLIS;

	/**
	 * Creates a new configuration object with all options set to their default values. The default environment is the
	 * production environment.
	 */
	public ApnsConfiguration() {}

	/**
	 * Creates a new configuration object with all options set to the values in the given configuration object.
	 *
	 * @param configuration the configuration object to copy
	 */
	public ApnsConfiguration(final ApnsConfiguration configuration) {
		this.certificate = configuration.certificate;
		this.certificatePassword = configuration.certificatePassword;
		this.environment = configuration.environment;
		this.defaultErrorTimeout = configuration.defaultErrorTimeout;
		this.defaultExpirationOffset = configuration.defaultExpirationOffset;
		this.defaultBatchSize = configuration.defaultBatchSize;
		this.defaultRetries = configuration.defaultRetries;
		this.maxNotificationSize = configuration.maxNotificationSize;
		this.connectTimeout = configuration.connectTimeout;
		this.writeTimeout = configuration.writeTimeout;
		this.feedbackReadTimeout = configuration.feedbackReadTimeout;
	}

	/**
	 * Returns a configuration with default values targeting Apple's production environment.
	 *
	 * @return a new production configuration
	 */
	public static ApnsConfiguration production() {
		return new ApnsConfiguration();
	}

	/**
	 * Returns a configuration with default values targeting Apple's sandbox environment.
	 *
	 * @return a new sandbox configuration
	 */
	public static ApnsConfiguration sandbox() {
		final ApnsConfiguration configuration = new ApnsConfiguration();
		configuration.setEnvironment(ApnsEnvironment.getSandboxEnvironment());

		return configuration;
	}

	/**
	 * Returns the path to the provider certificate, either a PKCS#12 file ({@code .p12} or {@code .pfx}) or a PEM file
	 * containing both the certificate and its PKCS#8 private key.
	 *
	 * @return the path to the provider certificate, or {@code null} if none has been set
	 */
	public String getCertificate() {
		return this.certificate;
	}

	public void setCertificate(final String certificate) {
		this.certificate = certificate;
	}

	public String getCertificatePassword() {
		return this.certificatePassword;
	}

	public void setCertificatePassword(final String certificatePassword) {
		this.certificatePassword = certificatePassword;
	}

	public ApnsEnvironment getEnvironment() {
		return this.environment;
	}

	public void setEnvironment(final ApnsEnvironment environment) {
		if (environment == null) {
			throw new NullPointerException("Environment must not be null.");
		}

		this.environment = environment;
	}

	/**
	 * Returns the time to wait for an error response after the last notification of a send has been written.
	 *
	 * @return the final error check timeout, in milliseconds
	 */
	public long getDefaultErrorTimeout() {
		return this.defaultErrorTimeout;
	}

	public void setDefaultErrorTimeout(final long defaultErrorTimeout) {
		this.defaultErrorTimeout = defaultErrorTimeout;
	}

	/**
	 * Returns the offset, in seconds from the time of sending, at which notifications expire when the caller does not
	 * give an explicit expiration.
	 *
	 * @return the default expiration offset, in seconds
	 */
	public long getDefaultExpirationOffset() {
		return this.defaultExpirationOffset;
	}

	public void setDefaultExpirationOffset(final long defaultExpirationOffset) {
		this.defaultExpirationOffset = defaultExpirationOffset;
	}

	/**
	 * Returns the number of notifications written to the gateway as a single unit.
	 *
	 * @return the default batch size
	 */
	public int getDefaultBatchSize() {
		return this.defaultBatchSize;
	}

	public void setDefaultBatchSize(final int defaultBatchSize) {
		if (defaultBatchSize < 1) {
			throw new IllegalArgumentException("Batch size must be positive.");
		}

		this.defaultBatchSize = defaultBatchSize;
	}

	/**
	 * Returns the number of times a unit that could not be written is re-written on a fresh connection before the send
	 * is abandoned.
	 *
	 * @return the default number of write retries
	 */
	public int getDefaultRetries() {
		return this.defaultRetries;
	}

	public void setDefaultRetries(final int defaultRetries) {
		if (defaultRetries < 0) {
			throw new IllegalArgumentException("Retry count must not be negative.");
		}

		this.defaultRetries = defaultRetries;
	}

	public int getMaxNotificationSize() {
		return this.maxNotificationSize;
	}

	public void setMaxNotificationSize(final int maxNotificationSize) {
		this.maxNotificationSize = maxNotificationSize;
	}

	public long getConnectTimeout() {
		return this.connectTimeout;
	}

	public void setConnectTimeout(final long connectTimeout) {
		this.connectTimeout = connectTimeout;
	}

	public long getWriteTimeout() {
		return this.writeTimeout;
	}

	public void setWriteTimeout(final long writeTimeout) {
		this.writeTimeout = writeTimeout;
	}

	/**
	 * Returns the longest time to wait for more data from the feedback service before assuming it has sent every
	 * expired token it has.
	 *
	 * @return the feedback read timeout, in milliseconds
	 */
	public long getFeedbackReadTimeout() {
		return this.feedbackReadTimeout;
	}

	public void setFeedbackReadTimeout(final long feedbackReadTimeout) {
		this.feedbackReadTimeout = feedbackReadTimeout;
	}
}
