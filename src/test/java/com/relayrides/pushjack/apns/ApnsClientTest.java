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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Date;
import java.util.List;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.relayrides.pushjack.InvalidTokenException;
import com.relayrides.pushjack.PayloadTooLargeException;
import com.relayrides.pushjack.apns.util.ApnsPayloadBuilder;
import com.relayrides.pushjack.apns.util.TokenUtil;

public class ApnsClientTest {

	private MockApnsGateway gateway;
	private MockApnsChannelFactory gatewayChannelFactory;
	private MockApnsChannelFactory feedbackChannelFactory;

	private ApnsConfiguration configuration;
	private ApnsClient client;

	private ExpiredToken expiredToken;

	@Before
	public void setUp() throws Exception {
		this.gateway = new MockApnsGateway();
		this.gatewayChannelFactory = new MockApnsChannelFactory(this.gateway);

		this.expiredToken = new ExpiredToken(TokenTestUtil.generateRandomToken(), new Date(1400000000000L));

		final byte[] tokenBytes = TokenUtil.tokenStringToByteArray(this.expiredToken.getToken());
		final ByteBuf record = Unpooled.buffer();
		record.writeInt(1400000000);
		record.writeShort(tokenBytes.length);
		record.writeBytes(tokenBytes);

		this.feedbackChannelFactory = new MockApnsChannelFactory(Collections.singletonList(record), true);

		this.configuration = ApnsConfiguration.sandbox();
		this.configuration.setDefaultErrorTimeout(10);
		this.configuration.setFeedbackReadTimeout(50);

		this.client = new ApnsClient(this.configuration, this.gatewayChannelFactory, this.feedbackChannelFactory);
	}

	@After
	public void tearDown() {
		this.client.close();
	}

	@Test
	public void testSend() throws Exception {
		final List<String> tokens = TokenTestUtil.generateTokens(250);

		final ApnsResponse response = this.client.send(tokens, new ApnsPayloadBuilder().setAlertBody("Hello"), null);

		assertEquals(tokens, response.getSuccesses());
		assertTrue(response.getFailures().isEmpty());
		assertFalse(response.hasErrors());
		assertEquals(250, this.gateway.getReceivedFrames().size());

		final long nowSeconds = System.currentTimeMillis() / 1000;

		for (final MockApnsGateway.ReceivedFrame frame : this.gateway.getReceivedFrames()) {
			assertEquals(response.getPayload(), frame.getPayload());
			assertEquals(DeliveryPriority.IMMEDIATE.getCode(), frame.getPriority());

			final long expirationOffset = frame.getExpiration() - nowSeconds;
			assertTrue(Math.abs(expirationOffset - ApnsConfiguration.DEFAULT_EXPIRATION_OFFSET_SECONDS) <= 60);
		}
	}

	@Test
	public void testSendSingleToken() throws Exception {
		final String token = TokenTestUtil.generateRandomToken();

		final ApnsResponse response = this.client.send(token, new ApnsPayloadBuilder().setAlertBody("Hello"), null);

		assertEquals(Collections.singletonList(token), response.getSuccesses());
		assertEquals(token, this.gateway.getReceivedFrames().get(0).getToken());
	}

	@Test
	public void testSendWithOptions() throws Exception {
		final List<String> tokens = TokenTestUtil.generateTokens(3);

		final ApnsSendOptions options = new ApnsSendOptions()
				.setLowPriority(true)
				.setExpiration(0)
				.setBatchSize(1);

		this.client.sendBulk(tokens, new ApnsPayloadBuilder().setContentAvailable(true), options);

		assertEquals(3, this.gateway.getReceivedFrames().size());

		for (final MockApnsGateway.ReceivedFrame frame : this.gateway.getReceivedFrames()) {
			assertEquals(DeliveryPriority.CONSERVE_POWER.getCode(), frame.getPriority());
			assertEquals(0, frame.getExpiration());
		}
	}

	@Test
	public void testSendWithRejection() throws Exception {
		final List<String> tokens = TokenTestUtil.generateTokens(10);

		this.gateway.rejectNotification(2, RejectedNotificationReason.INVALID_TOKEN);
		this.gateway.rejectNotification(6, RejectedNotificationReason.INVALID_PAYLOAD_SIZE);

		final ApnsResponse response = this.client.send(tokens, "{\"aps\":{\"alert\":\"Hello\"}}", null);

		assertTrue(response.hasErrors());
		assertEquals(Arrays.asList(tokens.get(0), tokens.get(1), tokens.get(3), tokens.get(4), tokens.get(5)),
				response.getSuccesses());

		final List<String> expectedFailures = new ArrayList<String>();
		expectedFailures.add(tokens.get(2));
		expectedFailures.addAll(tokens.subList(6, 10));

		assertEquals(expectedFailures, response.getFailures());

		assertEquals(RejectedNotificationReason.INVALID_TOKEN, response.getTokenErrors().get(tokens.get(2)).getReason());
		assertEquals(RejectedNotificationReason.UNSENDABLE, response.getTokenErrors().get(tokens.get(9)).getReason());
	}

	@Test
	public void testSendInvalidToken() throws Exception {
		final List<String> tokens = new ArrayList<String>(TokenTestUtil.generateTokens(3));
		tokens.add("not a token");

		try {
			this.client.send(tokens, new ApnsPayloadBuilder().setAlertBody("Hello"), null);
			fail("Expected an InvalidTokenException.");
		} catch (final InvalidTokenException e) {
			assertEquals("not a token", e.getToken());
		}

		assertEquals(0, this.gatewayChannelFactory.getConnectionAttempts());
	}

	@Test(expected = InvalidTokenException.class)
	public void testSendNoTokens() throws Exception {
		this.client.send(new ArrayList<String>(), new ApnsPayloadBuilder().setAlertBody("Hello"), null);
	}

	@Test
	public void testSendPayloadTooLarge() throws Exception {
		final ApnsPayloadBuilder payloadBuilder = new ApnsPayloadBuilder().setAlertBody(longString(4096));

		try {
			this.client.send(TokenTestUtil.generateTokens(1), payloadBuilder, null);
			fail("Expected a PayloadTooLargeException.");
		} catch (final PayloadTooLargeException e) {
			assertEquals(ApnsPayloadBuilder.DEFAULT_MAXIMUM_PAYLOAD_SIZE, e.getMaximumLength());
		}

		assertEquals(0, this.gatewayChannelFactory.getConnectionAttempts());
	}

	@Test(expected = PayloadTooLargeException.class)
	public void testSendPrebuiltPayloadTooLarge() throws Exception {
		this.configuration.setMaxNotificationSize(16);
		final ApnsClient smallClient =
				new ApnsClient(this.configuration, this.gatewayChannelFactory, this.feedbackChannelFactory);

		smallClient.send(TokenTestUtil.generateTokens(1), "{\"aps\":{\"alert\":\"Hello\"}}", null);
	}

	@Test
	public void testSendWithMaximumPayloadLength() throws Exception {
		final ApnsSendOptions options = new ApnsSendOptions().setMaxPayloadLength(128);

		final ApnsResponse response = this.client.send(TokenTestUtil.generateTokens(1),
				new ApnsPayloadBuilder().setAlertBody(longString(512)), options);

		final String payload = this.gateway.getReceivedFrames().get(0).getPayload();

		assertEquals(response.getPayload(), payload);
		assertTrue(payload.getBytes(StandardCharsets.UTF_8).length <= 128);
		assertTrue(payload.contains(ApnsPayloadBuilder.ABBREVIATION_SUBSTRING));
	}

	@Test
	public void testSendReusesConnection() throws Exception {
		this.client.send(TokenTestUtil.generateTokens(5), "{\"aps\":{\"alert\":\"Hello\"}}", null);
		this.client.send(TokenTestUtil.generateTokens(5), "{\"aps\":{\"alert\":\"Again\"}}", null);

		assertEquals(1, this.gatewayChannelFactory.getConnectionAttempts());
		assertEquals(10, this.gateway.getReceivedFrames().size());
	}

	@Test
	public void testGetExpiredTokens() throws Exception {
		assertEquals(Collections.singletonList(this.expiredToken), this.client.getExpiredTokens());
	}

	@Test
	public void testSendWithoutCertificate() throws Exception {
		final ApnsClient unauthenticatedClient = new ApnsClient(ApnsConfiguration.sandbox());

		try {
			unauthenticatedClient.send(TokenTestUtil.generateTokens(1), "{\"aps\":{\"alert\":\"Hello\"}}", null);
			fail("Expected an ApnsAuthException.");
		} catch (final ApnsAuthException e) {
			// Expected
		} finally {
			unauthenticatedClient.close();
		}
	}

	private static String longString(final int length) {
		final StringBuilder builder = new StringBuilder(length);

		for (int i = 0; i < length; i++) {
			builder.append((char) ('a' + (i % 26)));
		}

		return builder.toString();
	}
}
