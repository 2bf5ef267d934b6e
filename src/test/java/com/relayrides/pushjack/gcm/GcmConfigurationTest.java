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

import org.junit.Test;

public class GcmConfigurationTest {

	@Test
	public void testDefaultUrl() {
		assertEquals(GcmConfiguration.DEFAULT_URL, new GcmConfiguration("key").getUrl());
	}

	@Test
	public void testSetUrl() {
		final GcmConfiguration configuration = new GcmConfiguration("key");

		configuration.setUrl("http://localhost:8080/send");
		assertEquals("http://localhost:8080/send", configuration.getUrl());

		configuration.setUrl("HTTPS://gcm-http.googleapis.com/gcm/send");
		assertEquals("HTTPS://gcm-http.googleapis.com/gcm/send", configuration.getUrl());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testSetUrlWithoutScheme() {
		new GcmConfiguration("key").setUrl("fcm.googleapis.com/fcm/send");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testSetUrlWithUnsupportedScheme() {
		new GcmConfiguration("key").setUrl("ftp://fcm.googleapis.com/fcm/send");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testSetUrlWithoutHost() {
		new GcmConfiguration("key").setUrl("http:///fcm/send");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testSetMalformedUrl() {
		new GcmConfiguration("key").setUrl("http://fcm googleapis com/fcm/send");
	}

	@Test(expected = NullPointerException.class)
	public void testSetNullUrl() {
		new GcmConfiguration("key").setUrl(null);
	}

	@Test
	public void testUrlSurvivesCopy() {
		final GcmConfiguration configuration = new GcmConfiguration("key");
		configuration.setUrl("http://localhost:8080/send");

		assertEquals("http://localhost:8080/send", new GcmConfiguration(configuration).getUrl());
	}
}
