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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.junit.Test;

public class GcmMessageTest {

	@Test
	public void testStringMessage() {
		final Map<String, Object> fields = new GcmMessage("Hello").toMap();

		assertEquals(Collections.singletonMap("message", "Hello"), fields.get("data"));
		assertEquals(GcmMessage.HIGH_PRIORITY, fields.get("priority"));
		assertFalse(fields.containsKey("notification"));
		assertFalse(fields.containsKey("collapse_key"));
		assertFalse(fields.containsKey("delay_while_idle"));
		assertFalse(fields.containsKey("time_to_live"));
		assertFalse(fields.containsKey("restricted_package_name"));
		assertFalse(fields.containsKey("dry_run"));
	}

	@Test
	public void testMapMessageLiftsNotification() {
		final Map<String, Object> notification = new HashMap<String, Object>();
		notification.put("title", "Greetings");
		notification.put("body", "Hello");

		final Map<String, Object> message = new HashMap<String, Object>();
		message.put("notification", notification);
		message.put("score", "5x1");

		final GcmMessage gcmMessage = new GcmMessage(message);
		final Map<String, Object> fields = gcmMessage.toMap();

		assertEquals(Collections.singletonMap("score", "5x1"), fields.get("data"));
		assertEquals(notification, fields.get("notification"));
		assertEquals(notification, gcmMessage.getNotification());
		assertFalse(gcmMessage.getData().containsKey("notification"));
	}

	@Test
	public void testEmptyMapMessage() {
		final GcmMessage message = new GcmMessage(new HashMap<String, Object>());

		assertTrue(message.getData().isEmpty());
		assertNull(message.getNotification());
		assertTrue(message.toMap().containsKey("data"));
	}

	@Test
	public void testOptions() {
		final Map<String, Object> fields = new GcmMessage("Hello")
				.setCollapseKey("updates")
				.setDelayWhileIdle(true)
				.setTimeToLive(3600)
				.setLowPriority(true)
				.setRestrictedPackageName("com.example.app")
				.setDryRun(true)
				.toMap();

		assertEquals("updates", fields.get("collapse_key"));
		assertEquals(true, fields.get("delay_while_idle"));
		assertEquals(3600, fields.get("time_to_live"));
		assertEquals("com.example.app", fields.get("restricted_package_name"));
		assertEquals(true, fields.get("dry_run"));
		assertFalse(fields.containsKey("priority"));
	}

	@Test
	public void testFieldsAreSorted() {
		final Map<String, Object> fields = new GcmMessage("Hello").setCollapseKey("updates").setTimeToLive(60).toMap();

		assertEquals(Arrays.asList("collapse_key", "data", "priority", "time_to_live"),
				Arrays.asList(fields.keySet().toArray(new String[0])));
	}
}
