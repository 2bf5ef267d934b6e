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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Date;

import org.junit.Test;

import com.relayrides.pushjack.InvalidTokenException;

public class ApnsFrameCodecTest {

	private static final String TOKEN = "1111111111111111111111111111111111111111111111111111111111111111";
	private static final String PAYLOAD = "{\"aps\":{\"alert\":\"sample\"},\"foo\":\"bar\"}";

	@Test
	public void testEncodePushNotification() throws Exception {
		final ByteArrayOutputStream expected = new ByteArrayOutputStream();

		expected.write(new byte[] { 0x02, 0x00, 0x00, 0x00, 0x5e });

		expected.write(new byte[] { 0x01, 0x00, 0x20 });
		for (int i = 0; i < 32; i++) {
			expected.write(0x11);
		}

		expected.write(new byte[] { 0x02, 0x00, 0x26 });
		expected.write(PAYLOAD.getBytes(StandardCharsets.UTF_8));

		expected.write(new byte[] { 0x03, 0x00, 0x04, 0x00, 0x00, 0x00, 0x00 });
		expected.write(new byte[] { 0x04, 0x00, 0x04, 0x00, 0x00, 0x00, 0x1e });
		expected.write(new byte[] { 0x05, 0x00, 0x01, 0x0a });

		final byte[] frame = ApnsFrameCodec.encodePushNotification(TOKEN, PAYLOAD.getBytes(StandardCharsets.UTF_8), 0, 30,
				DeliveryPriority.IMMEDIATE.getCode());

		assertArrayEquals(expected.toByteArray(), frame);
	}

	@Test
	public void testEncodePushNotificationLargeIdentifier() throws Exception {
		final byte[] frame = ApnsFrameCodec.encodePushNotification(TOKEN, new byte[0], 0x01020304, 0x7fffffff,
				DeliveryPriority.CONSERVE_POWER.getCode());

		// [cmd][len:4][1][2][token:32][2][2][][3][2]
		final int identifierOffset = 5 + 3 + 32 + 3 + 3;

		assertEquals(0x01, frame[identifierOffset]);
		assertEquals(0x02, frame[identifierOffset + 1]);
		assertEquals(0x03, frame[identifierOffset + 2]);
		assertEquals(0x04, frame[identifierOffset + 3]);
		assertEquals(0x05, frame[frame.length - 1]);
	}

	@Test(expected = InvalidTokenException.class)
	public void testEncodePushNotificationInvalidToken() throws Exception {
		ApnsFrameCodec.encodePushNotification("not a token", PAYLOAD.getBytes(StandardCharsets.UTF_8), 0, 30,
				DeliveryPriority.IMMEDIATE.getCode());
	}

	@Test
	public void testDecodeErrorResponse() throws Exception {
		final byte[] response = new byte[] { 0x08, 0x08, 0x00, 0x00, 0x01, 0x02 };

		assertEquals(new RejectedNotification(258, RejectedNotificationReason.INVALID_TOKEN),
				ApnsFrameCodec.decodeErrorResponse(response));
	}

	@Test
	public void testDecodeErrorResponseHighStatusCodes() throws Exception {
		assertEquals(RejectedNotificationReason.PROTOCOL_ERROR,
				ApnsFrameCodec.decodeErrorResponse(new byte[] { 0x08, (byte) 0x80, 0, 0, 0, 0 }).getReason());

		assertEquals(RejectedNotificationReason.UNKNOWN,
				ApnsFrameCodec.decodeErrorResponse(new byte[] { 0x08, (byte) 0xff, 0, 0, 0, 0 }).getReason());

		assertEquals(RejectedNotificationReason.UNKNOWN,
				ApnsFrameCodec.decodeErrorResponse(new byte[] { 0x08, 0x42, 0, 0, 0, 0 }).getReason());
	}

	@Test(expected = IOException.class)
	public void testDecodeErrorResponseWrongCommand() throws Exception {
		ApnsFrameCodec.decodeErrorResponse(new byte[] { 0x02, 0x08, 0x00, 0x00, 0x00, 0x01 });
	}

	@Test(expected = IOException.class)
	public void testDecodeErrorResponseTruncated() throws Exception {
		ApnsFrameCodec.decodeErrorResponse(new byte[] { 0x08, 0x08, 0x00 });
	}

	@Test
	public void testDecodeExpiredToken() {
		final byte[] header = new byte[] { 0x52, (byte) 0xa8, 0x6f, 0x00, 0x00, 0x20 };
		final byte[] tokenBytes = new byte[32];

		for (int i = 0; i < tokenBytes.length; i++) {
			tokenBytes[i] = 0x11;
		}

		assertEquals(32, ApnsFrameCodec.getFeedbackTokenLength(header));

		final ExpiredToken expiredToken = ApnsFrameCodec.decodeExpiredToken(header, tokenBytes);

		assertEquals(TOKEN, expiredToken.getToken());
		assertEquals(new Date(0x52a86f00L * 1000L), expiredToken.getExpiration());
	}

	@Test
	public void testDecodeExpiredTokenTimestampAfter2038() {
		final byte[] header = new byte[] { (byte) 0x90, 0x00, 0x00, 0x00, 0x00, 0x01 };
		final ExpiredToken expiredToken = ApnsFrameCodec.decodeExpiredToken(header, new byte[] { 0x01 });

		assertEquals(new Date(0x90000000L * 1000L), expiredToken.getExpiration());
	}
}
