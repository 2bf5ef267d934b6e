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

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslHandler;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.GenericFutureListener;
import io.netty.util.concurrent.Promise;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.relayrides.pushjack.apns.util.SslContextUtil;

/**
 * An {@link ApnsChannelFactory} that opens TLS-protected TCP channels with the provider certificate named in an
 * {@link ApnsConfiguration}. The certificate is loaded the first time a channel is requested.
 */
public class NettyApnsChannelFactory implements ApnsChannelFactory {

	private final String host;
	private final int port;

	private final String certificate;
	private final String certificatePassword;

	private final EventLoopGroup eventLoopGroup;
	private final long connectTimeout;

	private SslContext sslContext;

	private static final Logger log = LoggerFactory.getLogger(NettyApnsChannelFactory.class);

	/**
	 * Constructs a new channel factory for the given endpoint.
	 *
	 * @param host the host name of the endpoint
	 * @param port the TCP port of the endpoint
	 * @param configuration the configuration that names the provider certificate and connect timeout
	 * @param eventLoopGroup the event loop group that will carry the I/O of channels opened by this factory
	 */
	public NettyApnsChannelFactory(final String host, final int port, final ApnsConfiguration configuration,
			final EventLoopGroup eventLoopGroup) {

		this.host = host;
		this.port = port;

		this.certificate = configuration.getCertificate();
		this.certificatePassword = configuration.getCertificatePassword();

		this.eventLoopGroup = eventLoopGroup;
		this.connectTimeout = configuration.getConnectTimeout();
	}

	@Override
	public synchronized Future<Channel> connect(final ChannelHandler handler) throws ApnsAuthException {
		if (this.sslContext == null) {
			this.sslContext = SslContextUtil.createClientSslContext(this.certificate, this.certificatePassword);
		}

		final SslContext sslContext = this.sslContext;

		final Bootstrap bootstrap = new Bootstrap();
		bootstrap.group(this.eventLoopGroup);
		bootstrap.channel(NioSocketChannel.class);
		bootstrap.option(ChannelOption.SO_KEEPALIVE, true);
		bootstrap.option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, this.connectTimeout));

		bootstrap.handler(new ChannelInitializer<SocketChannel>() {

			@Override
			protected void initChannel(final SocketChannel channel) {
				final ChannelPipeline pipeline = channel.pipeline();

				pipeline.addLast("ssl", sslContext.newHandler(channel.alloc(), host, port));
				pipeline.addLast("handler", handler);
			}
		});

		final Promise<Channel> readyPromise = this.eventLoopGroup.next().newPromise();

		log.debug("Connecting to {}:{}.", this.host, this.port);

		bootstrap.connect(this.host, this.port).addListener(new GenericFutureListener<ChannelFuture>() {

			@Override
			public void operationComplete(final ChannelFuture connectFuture) {
				if (connectFuture.isSuccess()) {
					log.debug("Connected to {}:{}; waiting for TLS handshake.", host, port);

					final Channel channel = connectFuture.channel();
					final SslHandler sslHandler = channel.pipeline().get(SslHandler.class);

					sslHandler.handshakeFuture().addListener(new GenericFutureListener<Future<Channel>>() {

						@Override
						public void operationComplete(final Future<Channel> handshakeFuture) {
							if (handshakeFuture.isSuccess()) {
								log.debug("Completed TLS handshake with {}:{}.", host, port);
								readyPromise.trySuccess(channel);
							} else {
								log.debug("Failed to complete TLS handshake with {}:{}.", host, port, handshakeFuture.cause());

								channel.close();
								readyPromise.tryFailure(handshakeFuture.cause());
							}
						}
					});
				} else {
					log.debug("Failed to connect to {}:{}.", host, port, connectFuture.cause());
					readyPromise.tryFailure(connectFuture.cause());
				}
			}
		});

		return readyPromise;
	}

	@Override
	public String toString() {
		return "NettyApnsChannelFactory [host=" + host + ", port=" + port + "]";
	}
}
