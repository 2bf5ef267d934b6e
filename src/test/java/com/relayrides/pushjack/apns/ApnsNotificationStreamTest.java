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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;

import org.junit.Test;

import com.relayrides.pushjack.InvalidTokenException;
import com.relayrides.pushjack.apns.ApnsNotificationStream.StreamUnit;

public class ApnsNotificationStreamTest {

	private static final String PAYLOAD = "{\"aps\":{\"alert\":\"Hello\"}}";

	@Test
	public void testNextBatchesFrames() throws Exception {
		final List<String> tokens = TokenTestUtil.generateTokens(5);
		final ApnsNotificationStream stream =
				new ApnsNotificationStream(tokens, PAYLOAD, 30, DeliveryPriority.IMMEDIATE, 2);

		assertEquals(5, stream.size());

		final StreamUnit first = stream.next();
		assertEquals(0, first.getFirstIdentifier());
		assertEquals(2, first.getCount());
		assertEquals(2, stream.position());

		final StreamUnit second = stream.next();
		assertEquals(2, second.getFirstIdentifier());
		assertEquals(3, second.getLastIdentifier());

		final StreamUnit third = stream.next();
		assertEquals(4, third.getFirstIdentifier());
		assertEquals(1, third.getCount());

		assertTrue(stream.isEof());
		assertFalse(stream.hasNext());
	}

	@Test
	public void testUnitBytesAreConcatenatedFrames() throws Exception {
		final List<String> tokens = TokenTestUtil.generateTokens(2);
		final ApnsNotificationStream stream =
				new ApnsNotificationStream(tokens, PAYLOAD, 30, DeliveryPriority.CONSERVE_POWER, 10);

		final byte[] payloadBytes = PAYLOAD.getBytes(StandardCharsets.UTF_8);
		final byte[] firstFrame = ApnsFrameCodec.encodePushNotification(tokens.get(0), payloadBytes, 0, 30, (byte) 5);
		final byte[] secondFrame = ApnsFrameCodec.encodePushNotification(tokens.get(1), payloadBytes, 1, 30, (byte) 5);

		final byte[] expected = Arrays.copyOf(firstFrame, firstFrame.length + secondFrame.length);
		System.arraycopy(secondFrame, 0, expected, firstFrame.length, secondFrame.length);

		assertArrayEquals(expected, stream.next().getBytes());
	}

	@Test
	public void testSeek() throws Exception {
		final List<String> tokens = TokenTestUtil.generateTokens(10);
		final ApnsNotificationStream stream =
				new ApnsNotificationStream(tokens, PAYLOAD, 30, DeliveryPriority.IMMEDIATE, 100);

		stream.next();
		assertTrue(stream.isEof());

		stream.seek(3);

		assertEquals(4, stream.position());
		assertFalse(stream.isEof());
		assertEquals(tokens.subList(4, 10), stream.peek());

		// Peeking does not consume anything
		assertEquals(4, stream.position());

		final StreamUnit unit = stream.next();
		assertEquals(4, unit.getFirstIdentifier());
		assertEquals(6, unit.getCount());
	}

	@Test
	public void testSeekLastIdentifier() throws Exception {
		final ApnsNotificationStream stream =
				new ApnsNotificationStream(TokenTestUtil.generateTokens(3), PAYLOAD, 30, DeliveryPriority.IMMEDIATE, 1);

		stream.seek(2);

		assertTrue(stream.isEof());
		assertTrue(stream.peek().isEmpty());
	}

	@Test(expected = NoSuchElementException.class)
	public void testNextAfterEof() throws Exception {
		final ApnsNotificationStream stream =
				new ApnsNotificationStream(TokenTestUtil.generateTokens(1), PAYLOAD, 30, DeliveryPriority.IMMEDIATE, 1);

		stream.next();
		stream.next();
	}

	@Test(expected = InvalidTokenException.class)
	public void testInvalidToken() throws Exception {
		new ApnsNotificationStream(Arrays.asList(TokenTestUtil.generateRandomToken(), "bogus"), PAYLOAD, 30,
				DeliveryPriority.IMMEDIATE, 1);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testZeroBatchSize() throws Exception {
		new ApnsNotificationStream(TokenTestUtil.generateTokens(1), PAYLOAD, 30, DeliveryPriority.IMMEDIATE, 0);
	}
}
