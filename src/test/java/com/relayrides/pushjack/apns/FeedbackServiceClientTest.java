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
import static org.junit.Assert.assertTrue;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Date;
import java.util.List;

import org.junit.Test;

import com.relayrides.pushjack.apns.util.TokenUtil;

public class FeedbackServiceClientTest {

	private static final long READ_TIMEOUT = 50;

	@Test
	public void testGetExpiredTokens() throws Exception {
		final ExpiredToken first = new ExpiredToken(TokenTestUtil.generateRandomToken(), new Date(1400000000000L));
		final ExpiredToken second = new ExpiredToken(TokenTestUtil.generateRandomToken(), new Date(1400000123000L));

		final MockApnsChannelFactory channelFactory =
				new MockApnsChannelFactory(Arrays.asList(encode(first), encode(second)), true);

		final List<ExpiredToken> expiredTokens = this.newClient(channelFactory).getExpiredTokens();

		assertEquals(Arrays.asList(first, second), expiredTokens);
		assertEquals(1, channelFactory.getConnectionAttempts());
		assertTrue(!channelFactory.getChannels().get(0).isActive());
	}

	@Test
	public void testGetExpiredTokensAcrossReads() throws Exception {
		final ExpiredToken expiredToken = new ExpiredToken(TokenTestUtil.generateRandomToken(), new Date(1400000000000L));
		final ByteBuf record = encode(expiredToken);

		// Split the record mid-header
		final List<ByteBuf> fragments = Arrays.asList(record.copy(0, 3), record.copy(3, record.readableBytes() - 3));
		record.release();

		final List<ExpiredToken> expiredTokens =
				this.newClient(new MockApnsChannelFactory(fragments, true)).getExpiredTokens();

		assertEquals(Collections.singletonList(expiredToken), expiredTokens);
	}

	@Test
	public void testGetExpiredTokensWhenServiceStopsSending() throws Exception {
		final ExpiredToken expiredToken = new ExpiredToken(TokenTestUtil.generateRandomToken(), new Date(1400000000000L));

		final MockApnsChannelFactory channelFactory =
				new MockApnsChannelFactory(Collections.singletonList(encode(expiredToken)), false);

		final List<ExpiredToken> expiredTokens = this.newClient(channelFactory).getExpiredTokens();

		assertEquals(Collections.singletonList(expiredToken), expiredTokens);
		assertTrue(!channelFactory.getChannels().get(0).isActive());
	}

	@Test
	public void testGetExpiredTokensNoTokens() throws Exception {
		final MockApnsChannelFactory channelFactory = new MockApnsChannelFactory(new ArrayList<ByteBuf>(), true);
		assertTrue(this.newClient(channelFactory).getExpiredTokens().isEmpty());
	}

	@Test
	public void testGetExpiredTokensTruncatedRecord() throws Exception {
		final ExpiredToken expiredToken = new ExpiredToken(TokenTestUtil.generateRandomToken(), new Date(1400000000000L));

		final ByteBuf truncated = Unpooled.buffer();
		truncated.writeInt(1400000001);
		truncated.writeShort(TokenUtil.TOKEN_LENGTH);
		truncated.writeBytes(new byte[10]);

		final MockApnsChannelFactory channelFactory =
				new MockApnsChannelFactory(Arrays.asList(encode(expiredToken), truncated), true);

		assertEquals(Collections.singletonList(expiredToken), this.newClient(channelFactory).getExpiredTokens());
	}

	@Test
	public void testGetExpiredTokensRepeatedly() throws Exception {
		final ExpiredToken expiredToken = new ExpiredToken(TokenTestUtil.generateRandomToken(), new Date(1400000000000L));

		final MockApnsChannelFactory channelFactory =
				new MockApnsChannelFactory(Collections.singletonList(encode(expiredToken)), true);

		final FeedbackServiceClient feedbackServiceClient = this.newClient(channelFactory);

		assertEquals(Collections.singletonList(expiredToken), feedbackServiceClient.getExpiredTokens());
		assertEquals(Collections.singletonList(expiredToken), feedbackServiceClient.getExpiredTokens());
		assertEquals(2, channelFactory.getConnectionAttempts());
	}

	@Test(expected = java.io.IOException.class)
	public void testGetExpiredTokensConnectionFailure() throws Exception {
		final MockApnsChannelFactory channelFactory = new MockApnsChannelFactory(new ArrayList<ByteBuf>(), true);
		channelFactory.failNextConnections(1);

		this.newClient(channelFactory).getExpiredTokens();
	}

	private FeedbackServiceClient newClient(final MockApnsChannelFactory channelFactory) {
		return new FeedbackServiceClient(new ApnsConnection("TestFeedbackConnection", channelFactory, 1000), READ_TIMEOUT);
	}

	private static ByteBuf encode(final ExpiredToken expiredToken) throws Exception {
		final byte[] tokenBytes = TokenUtil.tokenStringToByteArray(expiredToken.getToken());

		final ByteBuf record = Unpooled.buffer();
		record.writeInt((int) (expiredToken.getExpiration().getTime() / 1000));
		record.writeShort(tokenBytes.length);
		record.writeBytes(tokenBytes);

		return record;
	}
}
