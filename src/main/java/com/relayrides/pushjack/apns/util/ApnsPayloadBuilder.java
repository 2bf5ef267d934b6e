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

package com.relayrides.pushjack.apns.util;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.relayrides.pushjack.PayloadTooLargeException;

/**
 * <p>A utility class for constructing JSON payloads suitable for inclusion in APNs push notifications. Payloads are
 * serialized deterministically: keys are sorted, no insignificant whitespace is emitted and absent fields never appear
 * as {@code null}. Because of this, a payload built once can be reused byte-for-byte for every recipient of a bulk
 * send.</p>
 *
 * <p>Payload builders are reusable, but are <em>not</em> thread-safe.</p>
 *
 * @see <a href=
 *      "https://developer.apple.com/library/ios/documentation/NetworkingInternet/Conceptual/RemoteNotificationsPG/Chapters/TheNotificationPayload.html#//apple_ref/doc/uid/TP40008194-CH107-SW1">
 *      Local and Push Notification Programming Guide - The Remote Notification Payload</a>
 */
public class ApnsPayloadBuilder {

    private String alertBody = null;
    private Map<String, Object> alertDictionary = null;
    private String alertTitle = null;
    private String localizedAlertTitleKey = null;
    private List<String> localizedAlertTitleArguments = null;
    private String localizedActionButtonKey = null;
    private String localizedAlertKey = null;
    private List<String> localizedAlertArguments = null;
    private String launchImageFileName = null;
    private Integer badgeNumber = null;
    private String soundFileName = null;
    private String categoryName = null;
    private boolean contentAvailable = false;

    private static final String APS_KEY = "aps";
    private static final String ALERT_KEY = "alert";
    private static final String BADGE_KEY = "badge";
    private static final String SOUND_KEY = "sound";
    private static final String CATEGORY_KEY = "category";
    private static final String CONTENT_AVAILABLE_KEY = "content-available";

    private static final String ALERT_TITLE_KEY = "title";
    private static final String ALERT_BODY_KEY = "body";
    private static final String ALERT_TITLE_LOC_KEY = "title-loc-key";
    private static final String ALERT_TITLE_ARGS_KEY = "title-loc-args";
    private static final String ACTION_LOC_KEY = "action-loc-key";
    private static final String ALERT_LOC_KEY = "loc-key";
    private static final String ALERT_ARGS_KEY = "loc-args";
    private static final String LAUNCH_IMAGE_KEY = "launch-image";

    private final TreeMap<String, Object> customProperties = new TreeMap<String, Object>();

    /**
     * The largest payload, in bytes, accepted by the APNs gateway ({@value DEFAULT_MAXIMUM_PAYLOAD_SIZE}).
     */
    public static final int DEFAULT_MAXIMUM_PAYLOAD_SIZE = 2048;

    /**
     * The marker appended to an alert body that had to be shortened to fit in a payload.
     */
    public static final String ABBREVIATION_SUBSTRING = "…";

    private static final Gson gson = new GsonBuilder().disableHtmlEscaping().create();

    /**
     * The name of the iOS default push notification sound ({@value DEFAULT_SOUND_FILENAME}).
     */
    public static final String DEFAULT_SOUND_FILENAME = "default";

    /**
     * <p>Sets the literal text of the alert message to be shown for the push notification. If no title, localization
     * or launch image fields are set, the alert is sent as a plain string; otherwise it becomes the {@code body} of an
     * alert dictionary.</p>
     *
     * @param alertBody the literal message to be shown for this push notification; may be {@code null}
     *
     * @return a reference to this payload builder
     */
    public ApnsPayloadBuilder setAlertBody(final String alertBody) {
        this.alertBody = alertBody;
        this.alertDictionary = null;

        return this;
    }

    /**
     * Sets a pre-built alert dictionary. The dictionary is sent as-is, with any title, localization or launch image
     * fields set on this builder added to it.
     *
     * @param alertDictionary the alert dictionary; may be {@code null}
     *
     * @return a reference to this payload builder
     */
    public ApnsPayloadBuilder setAlert(final Map<String, ?> alertDictionary) {
        this.alertDictionary = alertDictionary != null ? sortedCopy(alertDictionary) : null;
        this.alertBody = null;

        return this;
    }

    /**
     * Sets a short description of the notification purpose, shown as the alert title.
     *
     * @param alertTitle the title to be shown for this push notification
     *
     * @return a reference to this payload builder
     */
    public ApnsPayloadBuilder setAlertTitle(final String alertTitle) {
        this.alertTitle = alertTitle;
        return this;
    }

    /**
     * Sets the key of the title string in the receiving app's localized string list, together with the arguments that
     * populate its placeholders.
     *
     * @param localizedAlertTitleKey a key to a string in the receiving app's localized string list
     * @param alertTitleArguments arguments to populate placeholders in the localized title; may be {@code null}
     *
     * @return a reference to this payload builder
     */
    public ApnsPayloadBuilder setLocalizedAlertTitle(final String localizedAlertTitleKey,
            final List<String> alertTitleArguments) {
        this.localizedAlertTitleKey = localizedAlertTitleKey;
        this.localizedAlertTitleArguments = copyOf(alertTitleArguments);

        return this;
    }

    /**
     * Sets the key of a string in the receiving app's localized string list to be used as the label of the
     * &quot;action&quot; button.
     *
     * @param localizedActionButtonKey a key to a string in the receiving app's localized string list
     *
     * @return a reference to this payload builder
     */
    public ApnsPayloadBuilder setLocalizedActionButtonKey(final String localizedActionButtonKey) {
        this.localizedActionButtonKey = localizedActionButtonKey;
        return this;
    }

    /**
     * Sets the key of a message in the receiving app's localized string list to be shown for the push notification.
     *
     * @param localizedAlertKey a key to a string in the receiving app's localized string list
     * @param alertArguments arguments to populate placeholders in the localized alert string; may be {@code null}
     *
     * @return a reference to this payload builder
     */
    public ApnsPayloadBuilder setLocalizedAlertMessage(final String localizedAlertKey, final List<String> alertArguments) {
        this.localizedAlertKey = localizedAlertKey;
        this.localizedAlertArguments = copyOf(alertArguments);

        return this;
    }

    /**
     * Sets the filename of an image in the app bundle to be shown when the app launches from this notification.
     *
     * @param launchImageFileName the filename of an image file in the receiving app's bundle
     *
     * @return a reference to this payload builder
     */
    public ApnsPayloadBuilder setLaunchImageFileName(final String launchImageFileName) {
        this.launchImageFileName = launchImageFileName;
        return this;
    }

    /**
     * Sets the number to display as the badge of the receiving app's icon. If {@code null}, the badge is left in its
     * current state.
     *
     * @param badgeNumber the badge number or {@code null} to leave the badge unchanged
     *
     * @return a reference to this payload builder
     */
    public ApnsPayloadBuilder setBadgeNumber(final Integer badgeNumber) {
        this.badgeNumber = badgeNumber;
        return this;
    }

    public ApnsPayloadBuilder setCategoryName(final String categoryName) {
        this.categoryName = categoryName;
        return this;
    }

    /**
     * Sets the name of the sound file to play when the push notification is received.
     *
     * @param soundFileName the name of the sound file to play, or {@code null} to send no sound
     *
     * @return a reference to this payload builder
     *
     * @see ApnsPayloadBuilder#DEFAULT_SOUND_FILENAME
     */
    public ApnsPayloadBuilder setSoundFileName(final String soundFileName) {
        this.soundFileName = soundFileName;
        return this;
    }

    /**
     * Sets whether the payload should tell the receiving app that new content is available for background download.
     * The flag is sent as the integer {@code 1}, never as a boolean.
     *
     * @param contentAvailable {@code true} to include the content availability flag
     *
     * @return a reference to this payload builder
     */
    public ApnsPayloadBuilder setContentAvailable(final boolean contentAvailable) {
        this.contentAvailable = contentAvailable;
        return this;
    }

    /**
     * Adds a custom property to the payload, outside of the Apple-reserved {@code aps} namespace.
     *
     * @param key the key of the custom property in the payload object
     * @param value the value of the custom property
     *
     * @return a reference to this payload builder
     */
    public ApnsPayloadBuilder addCustomProperty(final String key, final Object value) {
        if (key == null) {
            throw new NullPointerException("Custom property key must not be null.");
        }

        this.customProperties.put(key, sorted(value));
        return this;
    }

    /**
     * Adds every entry of the given map as a custom property.
     *
     * @param properties the custom properties to add; may be {@code null}
     *
     * @return a reference to this payload builder
     */
    public ApnsPayloadBuilder addCustomProperties(final Map<String, ?> properties) {
        if (properties != null) {
            for (final Map.Entry<String, ?> entry : properties.entrySet()) {
                this.addCustomProperty(entry.getKey(), entry.getValue());
            }
        }

        return this;
    }

    /**
     * Returns a JSON representation of the payload under construction, refusing payloads longer than the APNs maximum
     * of {@value DEFAULT_MAXIMUM_PAYLOAD_SIZE} bytes.
     *
     * @return a JSON representation of the payload under construction
     *
     * @throws PayloadTooLargeException if the serialized payload is longer than the maximum
     */
    public String build() throws PayloadTooLargeException {
        return this.build(DEFAULT_MAXIMUM_PAYLOAD_SIZE);
    }

    /**
     * Returns a JSON representation of the payload under construction without shortening it.
     *
     * @param maximumPayloadSize the maximum length of the payload in bytes
     *
     * @return a JSON representation of the payload under construction
     *
     * @throws PayloadTooLargeException if the serialized payload is longer than {@code maximumPayloadSize} bytes
     */
    public String build(final int maximumPayloadSize) throws PayloadTooLargeException {
        final String payloadString = gson.toJson(this.createPayloadMap());
        final int payloadLength = getLength(payloadString);

        if (payloadLength > maximumPayloadSize) {
            throw new PayloadTooLargeException(payloadLength, maximumPayloadSize);
        }

        return payloadString;
    }

    /**
     * <p>Returns a JSON representation of the payload under construction. If the payload is longer than the given
     * maximum, the alert body is shortened to the longest prefix that fits once {@value ABBREVIATION_SUBSTRING} is
     * appended to it.</p>
     *
     * @param maximumPayloadSize the maximum length of the payload in bytes
     *
     * @return a JSON representation of the payload under construction (possibly with an abbreviated alert body)
     *
     * @throws PayloadTooLargeException if the payload has no alert body to shorten, or does not fit even when the
     * alert body is reduced to the abbreviation marker alone
     */
    public String buildWithMaximumLength(final int maximumPayloadSize) throws PayloadTooLargeException {
        final Map<String, Object> payload = this.createPayloadMap();

        final String payloadString = gson.toJson(payload);
        final int initialPayloadLength = getLength(payloadString);

        if (initialPayloadLength <= maximumPayloadSize) {
            return payloadString;
        }

        final String messageBody = getMessageBody(payload);

        if (messageBody == null) {
            throw new PayloadTooLargeException(String.format(
                    "Payload length is %d bytes (with a maximum of %d bytes) and cannot be shortened.",
                    initialPayloadLength, maximumPayloadSize), initialPayloadLength, maximumPayloadSize);
        }

        // Payload length grows monotonically with the length of the retained prefix, so the longest prefix that fits
        // can be found by binary search.
        int low = 0;
        int high = messageBody.length() - 1;
        String fittedMessageBody = null;

        while (low <= high) {
            final int middle = (low + high) >>> 1;
            final String candidate = abbreviateString(messageBody, middle);

            replaceMessageBody(payload, candidate);

            if (getLength(gson.toJson(payload)) <= maximumPayloadSize) {
                fittedMessageBody = candidate;
                low = middle + 1;
            } else {
                high = middle - 1;
            }
        }

        if (fittedMessageBody == null) {
            throw new PayloadTooLargeException(String.format(
                    "Payload exceeds maximum length of %d bytes even with an empty message body.", maximumPayloadSize),
                    initialPayloadLength, maximumPayloadSize);
        }

        replaceMessageBody(payload, fittedMessageBody);

        return gson.toJson(payload);
    }

    private Map<String, Object> createPayloadMap() {
        final TreeMap<String, Object> payload = new TreeMap<String, Object>();

        {
            final TreeMap<String, Object> aps = new TreeMap<String, Object>();

            final Object alertObject = this.createAlertObject();

            if (alertObject != null) {
                aps.put(ALERT_KEY, alertObject);
            }

            if (this.badgeNumber != null) {
                aps.put(BADGE_KEY, this.badgeNumber);
            }

            if (this.soundFileName != null) {
                aps.put(SOUND_KEY, this.soundFileName);
            }

            if (this.categoryName != null) {
                aps.put(CATEGORY_KEY, this.categoryName);
            }

            if (this.contentAvailable) {
                aps.put(CONTENT_AVAILABLE_KEY, 1);
            }

            payload.put(APS_KEY, aps);
        }

        // Custom properties live beside the aps dictionary and may replace it.
        payload.putAll(this.customProperties);

        return payload;
    }

    private Object createAlertObject() {
        if (!this.hasStructuredAlertFields()) {
            return this.alertDictionary != null ? sortedCopy(this.alertDictionary) : this.alertBody;
        }

        final TreeMap<String, Object> alert = this.alertDictionary != null ?
                sortedCopy(this.alertDictionary) : new TreeMap<String, Object>();

        if (this.alertBody != null && !this.alertBody.isEmpty()) {
            alert.put(ALERT_BODY_KEY, this.alertBody);
        }

        if (this.alertTitle != null) {
            alert.put(ALERT_TITLE_KEY, this.alertTitle);
        }

        if (this.localizedAlertTitleKey != null) {
            alert.put(ALERT_TITLE_LOC_KEY, this.localizedAlertTitleKey);
        }

        if (this.localizedAlertTitleArguments != null && !this.localizedAlertTitleArguments.isEmpty()) {
            alert.put(ALERT_TITLE_ARGS_KEY, this.localizedAlertTitleArguments);
        }

        if (this.localizedActionButtonKey != null) {
            alert.put(ACTION_LOC_KEY, this.localizedActionButtonKey);
        }

        if (this.localizedAlertKey != null) {
            alert.put(ALERT_LOC_KEY, this.localizedAlertKey);
        }

        if (this.localizedAlertArguments != null && !this.localizedAlertArguments.isEmpty()) {
            alert.put(ALERT_ARGS_KEY, this.localizedAlertArguments);
        }

        if (this.launchImageFileName != null) {
            alert.put(LAUNCH_IMAGE_KEY, this.launchImageFileName);
        }

        return alert;
    }

    /**
     * Checks whether the notification under construction needs an alert dictionary rather than a plain string.
     *
     * @return {@code true} if any title, localization or launch image field is present
     */
    private boolean hasStructuredAlertFields() {
        return this.alertTitle != null || this.localizedAlertTitleKey != null
                || (this.localizedAlertTitleArguments != null && !this.localizedAlertTitleArguments.isEmpty())
                || this.localizedActionButtonKey != null || this.localizedAlertKey != null
                || (this.localizedAlertArguments != null && !this.localizedAlertArguments.isEmpty())
                || this.launchImageFileName != null;
    }

    @SuppressWarnings("unchecked")
    private static String getMessageBody(final Map<String, Object> payload) {
        final Object aps = payload.get(APS_KEY);

        if (!(aps instanceof Map)) {
            return null;
        }

        final Object alert = ((Map<String, Object>) aps).get(ALERT_KEY);

        if (alert instanceof String) {
            return (String) alert;
        } else if (alert instanceof Map) {
            final Object body = ((Map<String, Object>) alert).get(ALERT_BODY_KEY);
            return body instanceof String ? (String) body : null;
        }

        return null;
    }

    @SuppressWarnings("unchecked")
    private static void replaceMessageBody(final Map<String, Object> payload, final String messageBody) {
        final Map<String, Object> aps = (Map<String, Object>) payload.get(APS_KEY);
        final Object alert = aps.get(ALERT_KEY);

        if (alert instanceof String) {
            aps.put(ALERT_KEY, messageBody);
        } else {
            ((Map<String, Object>) alert).put(ALERT_BODY_KEY, messageBody);
        }
    }

    private static String abbreviateString(final String string, final int retainedLength) {
        int end = retainedLength;

        // Never split a surrogate pair.
        if (end > 0 && Character.isHighSurrogate(string.charAt(end - 1))) {
            end--;
        }

        return string.substring(0, end) + ABBREVIATION_SUBSTRING;
    }

    private static int getLength(final String payloadString) {
        return payloadString.getBytes(StandardCharsets.UTF_8).length;
    }

    private static List<String> copyOf(final List<String> list) {
        return list != null ? new ArrayList<String>(list) : null;
    }

    private static TreeMap<String, Object> sortedCopy(final Map<String, ?> map) {
        final TreeMap<String, Object> copy = new TreeMap<String, Object>();

        for (final Map.Entry<String, ?> entry : map.entrySet()) {
            copy.put(entry.getKey(), sorted(entry.getValue()));
        }

        return copy;
    }

    @SuppressWarnings("unchecked")
    private static Object sorted(final Object value) {
        if (value instanceof Map) {
            return sortedCopy((Map<String, ?>) value);
        } else if (value instanceof List) {
            final List<Object> copy = new ArrayList<Object>();

            for (final Object element : (List<Object>) value) {
                copy.add(sorted(element));
            }

            return copy;
        }

        return value;
    }
}
