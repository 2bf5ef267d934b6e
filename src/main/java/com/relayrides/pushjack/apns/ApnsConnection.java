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
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.GenericFutureListener;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.relayrides.pushjack.ConnectionTimeoutException;

/**
 * <p>A blocking connection to an APNs endpoint. Every operation waits at most for the timeout it is given; the
 * underlying channel's I/O happens on a Netty event loop, which only moves bytes in and out of the connection's
 * buffers.</p>
 *
 * <p>Connections are lazy: nothing is opened until {@link #connect()} is called, and calling it again while connected
 * has no effect. After {@link #close()} (or after an error response has been read) the next call to
 * {@code connect()} opens a fresh channel.</p>
 *
 * <p>A connection belongs to one send at a time and is not safe for concurrent use.</p>
 */
public class ApnsConnection {

	/**
	 * The longest time to wait for the rest of an error response once its first byte has arrived.
	 */
	static final long ERROR_RESPONSE_READ_TIMEOUT_MILLIS = 1000;

	private final ApnsChannelFactory channelFactory;
	private final long connectTimeout;
	private final String name;

	private Channel channel;
	private InboundBufferHandler inboundHandler;

	// An error response left unread when the channel was closed
	private RejectedNotification bufferedRejection;

	private static final Logger log = LoggerFactory.getLogger(ApnsConnection.class);

	/**
	 * Collects the bytes received on one channel and wakes callers blocked in {@code readable}, {@code read} or
	 * {@code writable}. A new handler is created for every channel so that events from a closed channel never reach
	 * its successor.
	 */
	private static class InboundBufferHandler extends ChannelInboundHandlerAdapter {
		private final ReentrantLock lock = new ReentrantLock();
		private final Condition stateChanged = this.lock.newCondition();

		// All fields below are guarded by lock
		private final ByteBuf buffer = Unpooled.buffer();
		private boolean peerClosed = false;
		private boolean released = false;
		private Throwable cause;

		@Override
		public void channelRead(final ChannelHandlerContext context, final Object message) {
			final ByteBuf bytes = (ByteBuf) message;

			this.lock.lock();

			try {
				if (!this.released) {
					this.buffer.writeBytes(bytes);
				}

				this.stateChanged.signalAll();
			} finally {
				this.lock.unlock();
				bytes.release();
			}
		}

		@Override
		public void channelInactive(final ChannelHandlerContext context) throws Exception {
			this.lock.lock();

			try {
				this.peerClosed = true;
				this.stateChanged.signalAll();
			} finally {
				this.lock.unlock();
			}

			super.channelInactive(context);
		}

		@Override
		public void channelWritabilityChanged(final ChannelHandlerContext context) throws Exception {
			this.lock.lock();

			try {
				this.stateChanged.signalAll();
			} finally {
				this.lock.unlock();
			}

			super.channelWritabilityChanged(context);
		}

		@Override
		public void exceptionCaught(final ChannelHandlerContext context, final Throwable cause) {
			this.lock.lock();

			try {
				if (this.cause == null) {
					this.cause = cause;
				}

				this.stateChanged.signalAll();
			} finally {
				this.lock.unlock();
			}

			context.close();
		}

		private void release() {
			this.lock.lock();

			try {
				if (!this.released) {
					this.released = true;
					this.buffer.release();
				}

				this.stateChanged.signalAll();
			} finally {
				this.lock.unlock();
			}
		}
	}

	/**
	 * Constructs a new, unconnected connection.
	 *
	 * @param name a human-readable name for this connection, used in log messages
	 * @param channelFactory the factory that opens channels to the remote endpoint
	 * @param connectTimeout the longest time, in milliseconds, to wait for a channel to become ready
	 */
	public ApnsConnection(final String name, final ApnsChannelFactory channelFactory, final long connectTimeout) {
		if (channelFactory == null) {
			throw new NullPointerException("Channel factory must not be null.");
		}

		this.name = name;
		this.channelFactory = channelFactory;
		this.connectTimeout = connectTimeout;
	}

	/**
	 * Opens a channel to the remote endpoint unless this connection is already connected.
	 *
	 * @throws ApnsAuthException if the provider certificate is missing or unusable
	 * @throws ConnectionTimeoutException if the channel was not ready within the connect timeout
	 * @throws IOException if the channel could not be opened
	 */
	public void connect() throws ApnsAuthException, IOException {
		if (this.isConnected()) {
			return;
		}

		// A channel that closed on its own still needs its resources released.
		this.close();

		log.debug("{} beginning connection process.", this.name);

		final InboundBufferHandler handler = new InboundBufferHandler();
		final Future<Channel> readyFuture = this.channelFactory.connect(handler);

		if (!awaitFuture(readyFuture, this.connectTimeout)) {
			readyFuture.addListener(new GenericFutureListener<Future<Channel>>() {

				@Override
				public void operationComplete(final Future<Channel> future) {
					if (future.isSuccess()) {
						future.getNow().close();
					}
				}
			});

			handler.release();

			throw new ConnectionTimeoutException(String.format("%s could not connect within %d milliseconds.",
					this.name, this.connectTimeout));
		}

		if (!readyFuture.isSuccess()) {
			handler.release();
			throw new IOException(String.format("%s failed to connect.", this.name), readyFuture.cause());
		}

		this.channel = readyFuture.getNow();
		this.inboundHandler = handler;

		log.debug("{} connected.", this.name);
	}

	/**
	 * Indicates whether this connection currently holds an open channel.
	 *
	 * @return {@code true} if this connection is connected or {@code false} otherwise
	 */
	public boolean isConnected() {
		return this.channel != null && this.channel.isActive();
	}

	/**
	 * Closes this connection's channel, if any, and discards any unread data. Calling this method on a closed
	 * connection has no effect.
	 */
	public void close() {
		if (this.channel != null) {
			log.debug("{} closing.", this.name);
			this.channel.close().awaitUninterruptibly(this.connectTimeout);
		}

		if (this.inboundHandler != null) {
			this.retainBufferedRejection(this.inboundHandler);
			this.inboundHandler.release();
		}

		this.channel = null;
		this.inboundHandler = null;
	}

	/**
	 * Waits until this connection has data to read, or until the remote endpoint has closed the channel.
	 *
	 * @param timeout the longest time, in milliseconds, to wait; zero polls without waiting
	 *
	 * @return {@code true} if a subsequent read will return without waiting or {@code false} if nothing arrived within
	 * the timeout
	 *
	 * @throws IOException if the channel failed; the connection is closed before this exception is thrown
	 */
	public boolean readable(final long timeout) throws IOException {
		return this.awaitInbound(1, timeout);
	}

	/**
	 * Waits until this connection's channel will accept more outbound data.
	 *
	 * @param timeout the longest time, in milliseconds, to wait; zero polls without waiting
	 *
	 * @return {@code true} if the channel is writable or {@code false} if it did not become writable within the
	 * timeout or is not connected
	 *
	 * @throws IOException if the channel failed; the connection is closed before this exception is thrown
	 */
	public boolean writable(final long timeout) throws IOException {
		if (this.channel == null) {
			return false;
		}

		final InboundBufferHandler handler = this.inboundHandler;
		long remainingNanos = TimeUnit.MILLISECONDS.toNanos(timeout);

		handler.lock.lock();

		try {
			while (handler.cause == null && this.channel.isActive() && !this.channel.isWritable()) {
				if (remainingNanos <= 0) {
					return false;
				}

				remainingNanos = handler.stateChanged.awaitNanos(remainingNanos);
			}
		} catch (final InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new InterruptedIOException(String.format("%s was interrupted while waiting to write.", this.name));
		} finally {
			handler.lock.unlock();
		}

		this.throwIfFailed(handler);

		return this.channel.isActive();
	}

	/**
	 * Reads up to {@code size} bytes, waiting until that many bytes have arrived, the remote endpoint closes the
	 * channel or the timeout elapses.
	 *
	 * @param size the number of bytes to read
	 * @param timeout the longest time, in milliseconds, to wait
	 *
	 * @return the bytes read; fewer than {@code size} bytes (possibly none) if the channel closed or the timeout
	 * elapsed first
	 *
	 * @throws IOException if the channel failed; the connection is closed before this exception is thrown
	 */
	public byte[] read(final int size, final long timeout) throws IOException {
		if (this.inboundHandler == null) {
			return new byte[0];
		}

		this.awaitInbound(size, timeout);

		final InboundBufferHandler handler = this.inboundHandler;
		handler.lock.lock();

		try {
			if (handler.released) {
				return new byte[0];
			}

			final byte[] bytes = new byte[Math.min(size, handler.buffer.readableBytes())];
			handler.buffer.readBytes(bytes);
			handler.buffer.discardReadBytes();

			return bytes;
		} finally {
			handler.lock.unlock();
		}
	}

	/**
	 * Writes all of the given bytes to the remote endpoint, waiting until they have been flushed to the channel.
	 *
	 * @param data the bytes to write
	 * @param timeout the longest time, in milliseconds, to wait for the channel to become writable and, separately,
	 * for the write to complete
	 *
	 * @throws ConnectionTimeoutException if the channel did not become writable or the write did not complete within
	 * the timeout; the connection is closed before this exception is thrown
	 * @throws IOException if the write failed; the connection is closed before this exception is thrown
	 */
	public void write(final byte[] data, final long timeout) throws IOException {
		if (!this.writable(timeout)) {
			this.close();
			throw new ConnectionTimeoutException(String.format("%s was not writable within %d milliseconds.",
					this.name, timeout));
		}

		final ChannelFuture writeFuture = this.channel.writeAndFlush(Unpooled.wrappedBuffer(data));

		if (!awaitFuture(writeFuture, timeout)) {
			this.close();
			throw new ConnectionTimeoutException(String.format("%s could not write %d bytes within %d milliseconds.",
					this.name, data.length, timeout));
		}

		if (!writeFuture.isSuccess()) {
			this.close();
			throw new IOException(String.format("%s failed to write %d bytes.", this.name, data.length),
					writeFuture.cause());
		}

		log.trace("{} wrote {} bytes.", this.name, data.length);
	}

	/**
	 * <p>Checks whether the APNs gateway has reported a rejected notification. If nothing has arrived within the
	 * timeout, this connection assumes no error occurred and returns {@code null}.</p>
	 *
	 * <p>If data has arrived, a complete error response is read and decoded, and the connection is closed, since the
	 * gateway closes its side of the connection after every error response. A complete error response that arrived
	 * before the channel failed or was closed is returned rather than lost.</p>
	 *
	 * @param timeout the longest time, in milliseconds, to wait for an error response; zero polls without waiting
	 *
	 * @return the rejection reported by the gateway, or {@code null} if the gateway reported nothing
	 *
	 * @throws IOException if the channel failed before a complete error response arrived, or the gateway sent
	 * something other than an error response
	 */
	public RejectedNotification checkError(final long timeout) throws IOException {
		final RejectedNotification earlierRejection = this.takeBufferedRejection();

		if (earlierRejection != null) {
			return earlierRejection;
		}

		final byte[] response;

		try {
			if (!this.readable(timeout)) {
				return null;
			}

			response = this.read(ApnsFrameCodec.ERROR_RESPONSE_LENGTH,
					Math.max(timeout, ERROR_RESPONSE_READ_TIMEOUT_MILLIS));
		} catch (final IOException e) {
			// The gateway may reset the connection right after sending an error response.
			final RejectedNotification rejectedNotification = this.takeBufferedRejection();

			if (rejectedNotification != null) {
				return rejectedNotification;
			}

			throw e;
		}

		this.close();

		if (response.length < ApnsFrameCodec.ERROR_RESPONSE_LENGTH) {
			log.warn("{} was closed by the remote endpoint after {} bytes of an error response.",
					this.name, response.length);

			return null;
		}

		final RejectedNotification rejectedNotification = ApnsFrameCodec.decodeErrorResponse(response);

		if (rejectedNotification.getReason() == RejectedNotificationReason.UNKNOWN) {
			log.warn("{} received an error response with an unrecognized status code (0x{}).",
					this.name, Integer.toHexString(response[1] & 0xFF));
		}

		log.debug("APNs gateway rejected notification with sequence number {} from {} ({}).",
				rejectedNotification.getIdentifier(), this.name, rejectedNotification.getReason());

		return rejectedNotification;
	}

	/**
	 * Returns the error response that was complete but unread when this connection's last channel was closed, for
	 * example because a write failed after the gateway had already reported an error. The response is returned only
	 * once.
	 *
	 * @return the rejection reported before the channel closed, or {@code null} if there was none
	 */
	public RejectedNotification takeBufferedRejection() {
		final RejectedNotification rejectedNotification = this.bufferedRejection;
		this.bufferedRejection = null;

		return rejectedNotification;
	}

	private void retainBufferedRejection(final InboundBufferHandler handler) {
		final byte[] response;

		handler.lock.lock();

		try {
			if (handler.released || handler.buffer.readableBytes() < ApnsFrameCodec.ERROR_RESPONSE_LENGTH ||
					handler.buffer.getByte(handler.buffer.readerIndex()) != ApnsFrameCodec.ERROR_RESPONSE_COMMAND) {

				return;
			}

			response = new byte[ApnsFrameCodec.ERROR_RESPONSE_LENGTH];
			handler.buffer.readBytes(response);
		} finally {
			handler.lock.unlock();
		}

		try {
			this.bufferedRejection = ApnsFrameCodec.decodeErrorResponse(response);

			log.debug("{} kept an unread error response for notification {} ({}) from its closed channel.",
					this.name, this.bufferedRejection.getIdentifier(), this.bufferedRejection.getReason());
		} catch (final IOException e) {
			log.warn("{} discarded an unreadable error response.", this.name, e);
		}
	}

	private boolean awaitInbound(final int size, final long timeout) throws IOException {
		final InboundBufferHandler handler = this.inboundHandler;

		if (handler == null) {
			return false;
		}

		long remainingNanos = TimeUnit.MILLISECONDS.toNanos(timeout);
		final boolean ready;

		handler.lock.lock();

		try {
			while (!handler.released && handler.cause == null && !handler.peerClosed
					&& handler.buffer.readableBytes() < size) {

				if (remainingNanos <= 0) {
					break;
				}

				remainingNanos = handler.stateChanged.awaitNanos(remainingNanos);
			}

			ready = !handler.released && (handler.peerClosed || handler.buffer.readableBytes() >= size);
		} catch (final InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new InterruptedIOException(String.format("%s was interrupted while waiting to read.", this.name));
		} finally {
			handler.lock.unlock();
		}

		this.throwIfFailed(handler);

		return ready;
	}

	private void throwIfFailed(final InboundBufferHandler handler) throws IOException {
		final Throwable cause;

		handler.lock.lock();

		try {
			cause = handler.cause;
		} finally {
			handler.lock.unlock();
		}

		if (cause != null) {
			this.close();
			throw new IOException(String.format("%s failed.", this.name), cause);
		}
	}

	private static boolean awaitFuture(final Future<?> future, final long timeout) throws InterruptedIOException {
		try {
			return future.await(timeout, TimeUnit.MILLISECONDS);
		} catch (final InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new InterruptedIOException("Interrupted while waiting for channel operation.");
		}
	}

	@Override
	public String toString() {
		return "ApnsConnection [name=" + name + "]";
	}
}
