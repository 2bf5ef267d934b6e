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

import java.util.Map;
import java.util.TreeMap;

/**
 * <p>The recipient-independent part of a GCM/FCM HTTP request: the data and notification payloads plus delivery
 * options. Options that are never set are omitted from the request entirely.</p>
 *
 * <p>A message constructed from a plain string carries that string as {@code data.message}. A message constructed
 * from a map carries the map as {@code data}, except that a {@code notification} entry in the map becomes the
 * message's notification payload.</p>
 */
public class GcmMessage {

	public static final String HIGH_PRIORITY = "high";

	private static final String MESSAGE_KEY = "message";
	private static final String NOTIFICATION_KEY = "notification";

	private final Map<String, Object> data = new TreeMap<String, Object>();
	private Map<String, Object> notification;

	private String collapseKey;
	private Boolean delayWhileIdle;
	private Integer timeToLive;
	private boolean lowPriority = false;
	private String restrictedPackageName;
	private boolean dryRun = false;

	/**
	 * Constructs a new message whose data payload is {@code {"message": message}}.
	 *
	 * @param message the message text
	 */
	public GcmMessage(final String message) {
		this.data.put(MESSAGE_KEY, message);
	}

	/**
	 * Constructs a new message from the given data payload.
	 *
	 * @param message the data payload; a {@code notification} entry, if present, is used as the notification payload
	 * rather than as data
	 */
	@SuppressWarnings("unchecked")
	public GcmMessage(final Map<String, ?> message) {
		if (message == null) {
			throw new NullPointerException("Message must not be null.");
		}

		for (final Map.Entry<String, ?> entry : message.entrySet()) {
			if (NOTIFICATION_KEY.equals(entry.getKey())) {
				if (entry.getValue() instanceof Map) {
					this.setNotification((Map<String, ?>) entry.getValue());
				}
			} else {
				this.data.put(entry.getKey(), entry.getValue());
			}
		}
	}

	public Map<String, Object> getData() {
		return new TreeMap<String, Object>(this.data);
	}

	public Map<String, Object> getNotification() {
		return this.notification != null ? new TreeMap<String, Object>(this.notification) : null;
	}

	/**
	 * Sets the notification payload displayed by the receiving device, typically with {@code title}, {@code body} and
	 * {@code icon} entries.
	 *
	 * @param notification the notification payload, or {@code null} to send none
	 *
	 * @return a reference to this message
	 */
	public GcmMessage setNotification(final Map<String, ?> notification) {
		this.notification = notification != null ? new TreeMap<String, Object>(notification) : null;
		return this;
	}

	/**
	 * Sets an identifier for a group of messages, of which only the most recent is delivered when delivery resumes.
	 *
	 * @param collapseKey the collapse key, or {@code null} for none
	 *
	 * @return a reference to this message
	 */
	public GcmMessage setCollapseKey(final String collapseKey) {
		this.collapseKey = collapseKey;
		return this;
	}

	public GcmMessage setDelayWhileIdle(final Boolean delayWhileIdle) {
		this.delayWhileIdle = delayWhileIdle;
		return this;
	}

	/**
	 * Sets how long, in seconds, the service keeps the message while the device is offline. The service's own default
	 * (four weeks) applies if this is not set.
	 *
	 * @param timeToLive the time to live in seconds, or {@code null} for the service's default
	 *
	 * @return a reference to this message
	 */
	public GcmMessage setTimeToLive(final Integer timeToLive) {
		this.timeToLive = timeToLive;
		return this;
	}

	/**
	 * Sets whether the message may be delivered with an unspecified delay to save battery. Messages are sent with
	 * {@value #HIGH_PRIORITY} priority unless this is set; low-priority messages leave the priority to the service.
	 *
	 * @param lowPriority {@code true} to send with low priority
	 *
	 * @return a reference to this message
	 */
	public GcmMessage setLowPriority(final boolean lowPriority) {
		this.lowPriority = lowPriority;
		return this;
	}

	public GcmMessage setRestrictedPackageName(final String restrictedPackageName) {
		this.restrictedPackageName = restrictedPackageName;
		return this;
	}

	/**
	 * Sets whether the service should validate the request without delivering the message.
	 *
	 * @param dryRun {@code true} to validate only
	 *
	 * @return a reference to this message
	 */
	public GcmMessage setDryRun(final boolean dryRun) {
		this.dryRun = dryRun;
		return this;
	}

	/**
	 * Returns the request fields of this message, excluding recipients, with absent options omitted.
	 *
	 * @return a sorted map of request fields
	 */
	public Map<String, Object> toMap() {
		final Map<String, Object> fields = new TreeMap<String, Object>();

		fields.put("data", new TreeMap<String, Object>(this.data));

		if (this.notification != null) {
			fields.put(NOTIFICATION_KEY, new TreeMap<String, Object>(this.notification));
		}

		if (this.collapseKey != null) {
			fields.put("collapse_key", this.collapseKey);
		}

		if (this.delayWhileIdle != null) {
			fields.put("delay_while_idle", this.delayWhileIdle);
		}

		if (this.timeToLive != null) {
			fields.put("time_to_live", this.timeToLive);
		}

		if (!this.lowPriority) {
			fields.put("priority", HIGH_PRIORITY);
		}

		if (this.restrictedPackageName != null) {
			fields.put("restricted_package_name", this.restrictedPackageName);
		}

		if (this.dryRun) {
			fields.put("dry_run", true);
		}

		return fields;
	}
}
