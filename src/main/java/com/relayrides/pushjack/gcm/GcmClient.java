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

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;

import java.util.Collections;
import java.util.List;

/**
 * <p>Sends messages to Android and other devices through the GCM/FCM HTTP service.</p>
 *
 * <p>Recipients are split into requests of at most {@link GcmConfiguration#getMaxRecipients()} registration IDs,
 * which are posted one after another. Every send returns a {@link GcmResponse} that accounts for each recipient; the
 * service's per-recipient errors are reported in the response rather than thrown.</p>
 */
public class GcmClient {

	private final GcmConfiguration configuration;
	private final HttpTransport transport;

	private final EventLoopGroup eventLoopGroup;

	private GcmConnection connection;

	/**
	 * Constructs a new client with its own single-threaded event loop group.
	 *
	 * @param configuration the configuration for this client
	 */
	public GcmClient(final GcmConfiguration configuration) {
		this(configuration, new NioEventLoopGroup(1));
	}

	private GcmClient(final GcmConfiguration configuration, final EventLoopGroup eventLoopGroup) {
		this(configuration, new NettyHttpTransport(eventLoopGroup, configuration.getRequestTimeout()), eventLoopGroup);
	}

	/**
	 * Constructs a new client that posts requests through the given transport.
	 *
	 * @param configuration the configuration for this client
	 * @param transport the transport that carries this client's requests
	 */
	public GcmClient(final GcmConfiguration configuration, final HttpTransport transport) {
		this(configuration, transport, null);
	}

	private GcmClient(final GcmConfiguration configuration, final HttpTransport transport, final EventLoopGroup eventLoopGroup) {
		this.configuration = new GcmConfiguration(configuration);
		this.transport = transport;
		this.eventLoopGroup = eventLoopGroup;
	}

	/**
	 * Sends a message to a single recipient.
	 *
	 * @see #send(List, GcmMessage)
	 */
	public GcmResponse send(final String registrationId, final GcmMessage message) throws GcmAuthException {
		return this.send(Collections.singletonList(registrationId), message);
	}

	/**
	 * Sends a message to every given recipient.
	 *
	 * @param registrationIds the registration IDs of the recipients
	 * @param message the message to send
	 *
	 * @return the accounting of every recipient
	 *
	 * @throws GcmAuthException if no API key has been configured
	 */
	public synchronized GcmResponse send(final List<String> registrationIds, final GcmMessage message) throws GcmAuthException {
		if (this.configuration.getApiKey() == null || this.configuration.getApiKey().isEmpty()) {
			throw new GcmAuthException("Missing GCM API key.");
		}

		return this.getConnection().send(
				new GcmMessageStream(registrationIds, message, this.configuration.getMaxRecipients()));
	}

	/**
	 * Identical to {@link #send(List, GcmMessage)}.
	 */
	public GcmResponse sendBulk(final List<String> registrationIds, final GcmMessage message) throws GcmAuthException {
		return this.send(registrationIds, message);
	}

	private GcmConnection getConnection() {
		if (this.connection == null) {
			this.connection = new GcmConnection(this.transport, this.configuration.getApiKey(), this.configuration.getUrl());
		}

		return this.connection;
	}

	/**
	 * Shuts down the event loop group this client created, if any.
	 */
	public void close() {
		if (this.eventLoopGroup != null) {
			this.eventLoopGroup.shutdownGracefully().awaitUninterruptibly();
		}
	}
}
