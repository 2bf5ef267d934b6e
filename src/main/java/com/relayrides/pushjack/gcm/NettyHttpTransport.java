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

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.util.concurrent.Promise;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.relayrides.pushjack.ConnectionTimeoutException;

/**
 * An {@link HttpTransport} that opens a new Netty channel for every request and closes it once the response has been
 * received.
 */
public class NettyHttpTransport implements HttpTransport {

	private static final int MAX_CONTENT_LENGTH = 1024 * 1024;

	private final EventLoopGroup eventLoopGroup;
	private final long requestTimeout;

	private SslContext sslContext;

	private static final Logger log = LoggerFactory.getLogger(NettyHttpTransport.class);

	/**
	 * Constructs a new transport.
	 *
	 * @param eventLoopGroup the event loop group that carries this transport's I/O
	 * @param requestTimeout the longest time, in milliseconds, to wait for a complete response to each request
	 */
	public NettyHttpTransport(final EventLoopGroup eventLoopGroup, final long requestTimeout) {
		this.eventLoopGroup = eventLoopGroup;
		this.requestTimeout = requestTimeout;
	}

	@Override
	public HttpResult post(final String url, final String body, final Map<String, String> headers) throws IOException {
		final URI uri;

		try {
			uri = new URI(url);
		} catch (final URISyntaxException e) {
			throw new IOException("Malformed URL: " + url, e);
		}

		if (uri.getScheme() == null || uri.getHost() == null) {
			throw new IOException("URL must be absolute: " + url);
		}

		final boolean useTls = "https".equals(uri.getScheme().toLowerCase(Locale.ROOT));
		final String host = uri.getHost();
		final int port = uri.getPort() != -1 ? uri.getPort() : (useTls ? 443 : 80);
		final String path = (uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath()) +
				(uri.getRawQuery() != null ? "?" + uri.getRawQuery() : "");

		final SslContext sslContext = useTls ? this.getSslContext() : null;
		final Promise<HttpResult> resultPromise = this.eventLoopGroup.next().newPromise();

		final Bootstrap bootstrap = new Bootstrap();
		bootstrap.group(this.eventLoopGroup);
		bootstrap.channel(NioSocketChannel.class);
		bootstrap.option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, this.requestTimeout));

		bootstrap.handler(new ChannelInitializer<SocketChannel>() {

			@Override
			protected void initChannel(final SocketChannel channel) {
				final ChannelPipeline pipeline = channel.pipeline();

				if (sslContext != null) {
					pipeline.addLast("ssl", sslContext.newHandler(channel.alloc(), host, port));
				}

				pipeline.addLast("codec", new HttpClientCodec());
				pipeline.addLast("aggregator", new HttpObjectAggregator(MAX_CONTENT_LENGTH));
				pipeline.addLast("handler", new SimpleChannelInboundHandler<FullHttpResponse>() {

					@Override
					protected void channelRead0(final ChannelHandlerContext context, final FullHttpResponse response) {
						resultPromise.trySuccess(new HttpResult(response.status().code(),
								response.content().toString(StandardCharsets.UTF_8)));

						context.close();
					}

					@Override
					public void channelInactive(final ChannelHandlerContext context) throws Exception {
						resultPromise.tryFailure(new IOException("Connection closed before a response was received."));
						super.channelInactive(context);
					}

					@Override
					public void exceptionCaught(final ChannelHandlerContext context, final Throwable cause) {
						resultPromise.tryFailure(cause);
						context.close();
					}
				});
			}
		});

		log.debug("Posting {} bytes to {}.", body.length(), url);

		final ChannelFuture connectFuture = bootstrap.connect(host, port);

		connectFuture.addListener(new ChannelFutureListener() {

			@Override
			public void operationComplete(final ChannelFuture future) {
				if (!future.isSuccess()) {
					resultPromise.tryFailure(future.cause());
					return;
				}

				final ByteBuf content = Unpooled.copiedBuffer(body, StandardCharsets.UTF_8);
				final FullHttpRequest request =
						new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.POST, path, content);

				request.headers().set(HttpHeaderNames.HOST, host);
				request.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
				request.headers().set(HttpHeaderNames.CONTENT_LENGTH, content.readableBytes());

				for (final Map.Entry<String, String> header : headers.entrySet()) {
					request.headers().set(header.getKey(), header.getValue());
				}

				future.channel().writeAndFlush(request).addListener(new ChannelFutureListener() {

					@Override
					public void operationComplete(final ChannelFuture writeFuture) {
						if (!writeFuture.isSuccess()) {
							resultPromise.tryFailure(writeFuture.cause());
							writeFuture.channel().close();
						}
					}
				});
			}
		});

		try {
			if (!resultPromise.await(this.requestTimeout, TimeUnit.MILLISECONDS)) {
				connectFuture.channel().close();
				throw new ConnectionTimeoutException(String.format("No response from %s within %d milliseconds.",
						url, this.requestTimeout));
			}
		} catch (final InterruptedException e) {
			Thread.currentThread().interrupt();
			connectFuture.channel().close();
			throw new InterruptedIOException("Interrupted while waiting for a response from " + url);
		}

		if (!resultPromise.isSuccess()) {
			final Throwable cause = resultPromise.cause();
			throw cause instanceof IOException ? (IOException) cause : new IOException(cause);
		}

		return resultPromise.getNow();
	}

	private synchronized SslContext getSslContext() throws IOException {
		if (this.sslContext == null) {
			this.sslContext = SslContextBuilder.forClient().build();
		}

		return this.sslContext;
	}
}
