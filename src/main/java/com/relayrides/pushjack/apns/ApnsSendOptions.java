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
 * Per-send overrides for an {@link ApnsClient}. Options left {@code null} take their values from the client's
 * {@link ApnsConfiguration}.
 */
public class ApnsSendOptions {

	private Integer expiration;
	private boolean lowPriority = false;
	private Integer batchSize;
	private Long errorTimeout;
	private Integer retries;
	private Integer maxPayloadLength;

	public ApnsSendOptions() {}

	public ApnsSendOptions(final ApnsSendOptions options) {
		this.expiration = options.expiration;
		this.lowPriority = options.lowPriority;
		this.batchSize = options.batchSize;
		this.errorTimeout = options.errorTimeout;
		this.retries = options.retries;
		this.maxPayloadLength = options.maxPayloadLength;
	}

	/**
	 * Returns the expiration time of the notifications in this send, in seconds since the epoch. Zero means the gateway
	 * should attempt delivery only once.
	 *
	 * @return the expiration time of the notifications in this send, or {@code null} to expire after the configured
	 * default offset
	 */
	public Integer getExpiration() {
		return this.expiration;
	}

	public ApnsSendOptions setExpiration(final Integer expiration) {
		this.expiration = expiration;
		return this;
	}

	public boolean isLowPriority() {
		return this.lowPriority;
	}

	/**
	 * Sets whether notifications should be delivered at a time that conserves power on the receiving device rather than
	 * immediately.
	 *
	 * @param lowPriority {@code true} to send with {@link DeliveryPriority#CONSERVE_POWER}, {@code false} (the default)
	 * to send with {@link DeliveryPriority#IMMEDIATE}
	 *
	 * @return a reference to this options object
	 */
	public ApnsSendOptions setLowPriority(final boolean lowPriority) {
		this.lowPriority = lowPriority;
		return this;
	}

	public DeliveryPriority getPriority() {
		return this.lowPriority ? DeliveryPriority.CONSERVE_POWER : DeliveryPriority.IMMEDIATE;
	}

	public Integer getBatchSize() {
		return this.batchSize;
	}

	public ApnsSendOptions setBatchSize(final Integer batchSize) {
		this.batchSize = batchSize;
		return this;
	}

	public Long getErrorTimeout() {
		return this.errorTimeout;
	}

	public ApnsSendOptions setErrorTimeout(final Long errorTimeout) {
		this.errorTimeout = errorTimeout;
		return this;
	}

	public Integer getRetries() {
		return this.retries;
	}

	public ApnsSendOptions setRetries(final Integer retries) {
		this.retries = retries;
		return this;
	}

	/**
	 * Returns the maximum length of the serialized payload. When set, an alert body that would make the payload longer
	 * is truncated to fit.
	 *
	 * @return the maximum payload length, or {@code null} if payloads should never be truncated
	 */
	public Integer getMaxPayloadLength() {
		return this.maxPayloadLength;
	}

	public ApnsSendOptions setMaxPayloadLength(final Integer maxPayloadLength) {
		this.maxPayloadLength = maxPayloadLength;
		return this;
	}
}
