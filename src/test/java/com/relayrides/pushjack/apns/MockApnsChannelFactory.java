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

import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandler;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.ImmediateEventExecutor;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Opens in-memory channels. Channels are either wired to a {@link MockApnsGateway} or, for feedback service tests,
 * pre-loaded with inbound data.
 */
public class MockApnsChannelFactory implements ApnsChannelFactory {

	private final MockApnsGateway gateway;
	private final List<ByteBuf> inboundData = new ArrayList<ByteBuf>();
	private boolean closeAfterInboundData = true;

	private int connectionAttempts = 0;
	private int connectionsToFail = 0;

	private final List<EmbeddedChannel> channels = new ArrayList<EmbeddedChannel>();

	public MockApnsChannelFactory(final MockApnsGateway gateway) {
		this.gateway = gateway;
	}

	public MockApnsChannelFactory(final List<ByteBuf> inboundData, final boolean closeAfterInboundData) {
		this.gateway = null;
		this.inboundData.addAll(inboundData);
		this.closeAfterInboundData = closeAfterInboundData;
	}

	@Override
	public Future<Channel> connect(final ChannelHandler handler) {
		this.connectionAttempts++;

		if (this.connectionsToFail > 0) {
			this.connectionsToFail--;
			return ImmediateEventExecutor.INSTANCE.newFailedFuture(new IOException("Simulated connection failure."));
		}

		final EmbeddedChannel channel;

		if (this.gateway != null) {
			channel = new EmbeddedChannel(this.gateway.newHandler(), handler);
		} else {
			channel = new EmbeddedChannel(handler);

			for (final ByteBuf data : this.inboundData) {
				channel.writeInbound(data.retainedDuplicate());
			}

			if (this.closeAfterInboundData) {
				channel.close();
			}
		}

		this.channels.add(channel);

		return ImmediateEventExecutor.INSTANCE.<Channel>newSucceededFuture(channel);
	}

	public void failNextConnections(final int connectionsToFail) {
		this.connectionsToFail = connectionsToFail;
	}

	public int getConnectionAttempts() {
		return this.connectionAttempts;
	}

	public List<EmbeddedChannel> getChannels() {
		return this.channels;
	}
}
