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

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.relayrides.pushjack.InvalidTokenException;
import com.relayrides.pushjack.PayloadTooLargeException;
import com.relayrides.pushjack.apns.util.ApnsPayloadBuilder;
import com.relayrides.pushjack.apns.util.TokenUtil;

/**
 * <p>Sends push notifications to the APNs gateway and retrieves expired tokens from the feedback service using the
 * legacy binary protocol.</p>
 *
 * <p>A client keeps one persistent connection to the gateway, opened the first time it is needed. Sends are
 * serialized; every send returns an {@link ApnsResponse} that accounts for each token, even when some or all
 * notifications failed. Exceptions are thrown only for problems detected before anything is sent: invalid tokens, an
 * oversized payload or an unusable certificate.</p>
 *
 * <p>Callers must {@link #close()} clients when finished with them.</p>
 */
public class ApnsClient {

	private final ApnsConfiguration configuration;

	private final EventLoopGroup eventLoopGroup;
	private final boolean shouldShutDownEventLoopGroup;

	private final ApnsConnection gatewayConnection;
	private final ApnsBulkSender bulkSender;
	private final FeedbackServiceClient feedbackServiceClient;

	private static final Logger log = LoggerFactory.getLogger(ApnsClient.class);

	/**
	 * Constructs a new client with its own single-threaded event loop group.
	 *
	 * @param configuration the configuration for this client
	 */
	public ApnsClient(final ApnsConfiguration configuration) {
		this(configuration, new NioEventLoopGroup(1), true);
	}

	/**
	 * Constructs a new client that performs I/O on the given event loop group. The group is not shut down when the
	 * client is closed.
	 *
	 * @param configuration the configuration for this client
	 * @param eventLoopGroup the event loop group that carries this client's I/O
	 */
	public ApnsClient(final ApnsConfiguration configuration, final EventLoopGroup eventLoopGroup) {
		this(configuration, eventLoopGroup, false);
	}

	private ApnsClient(final ApnsConfiguration configuration, final EventLoopGroup eventLoopGroup,
			final boolean shouldShutDownEventLoopGroup) {

		this(configuration,
				new NettyApnsChannelFactory(configuration.getEnvironment().getApnsGatewayHost(),
						configuration.getEnvironment().getApnsGatewayPort(), configuration, eventLoopGroup),
				new NettyApnsChannelFactory(configuration.getEnvironment().getFeedbackHost(),
						configuration.getEnvironment().getFeedbackPort(), configuration, eventLoopGroup),
				eventLoopGroup, shouldShutDownEventLoopGroup);
	}

	ApnsClient(final ApnsConfiguration configuration, final ApnsChannelFactory gatewayChannelFactory,
			final ApnsChannelFactory feedbackChannelFactory) {

		this(configuration, gatewayChannelFactory, feedbackChannelFactory, null, false);
	}

	private ApnsClient(final ApnsConfiguration configuration, final ApnsChannelFactory gatewayChannelFactory,
			final ApnsChannelFactory feedbackChannelFactory, final EventLoopGroup eventLoopGroup,
			final boolean shouldShutDownEventLoopGroup) {

		this.configuration = new ApnsConfiguration(configuration);

		this.eventLoopGroup = eventLoopGroup;
		this.shouldShutDownEventLoopGroup = shouldShutDownEventLoopGroup;

		final ApnsEnvironment environment = this.configuration.getEnvironment();

		this.gatewayConnection = new ApnsConnection(
				String.format("ApnsConnection-%s:%d", environment.getApnsGatewayHost(), environment.getApnsGatewayPort()),
				gatewayChannelFactory, this.configuration.getConnectTimeout());

		this.bulkSender = new ApnsBulkSender(this.gatewayConnection, this.configuration.getWriteTimeout());

		this.feedbackServiceClient = new FeedbackServiceClient(
				new ApnsConnection(
						String.format("FeedbackConnection-%s:%d", environment.getFeedbackHost(), environment.getFeedbackPort()),
						feedbackChannelFactory, this.configuration.getConnectTimeout()),
				this.configuration.getFeedbackReadTimeout());
	}

	public ApnsConfiguration getConfiguration() {
		return new ApnsConfiguration(this.configuration);
	}

	/**
	 * Sends a notification to a single device.
	 *
	 * @see #send(List, String, ApnsSendOptions)
	 */
	public ApnsResponse send(final String token, final ApnsPayloadBuilder payloadBuilder, final ApnsSendOptions options)
			throws InvalidTokenException, PayloadTooLargeException, ApnsAuthException {

		return this.send(Collections.singletonList(token), payloadBuilder, options);
	}

	/**
	 * Builds the given payload and sends it to every given device. If the options set a maximum payload length, the
	 * payload's alert body is shortened to fit it; otherwise the payload must fit the configured maximum notification
	 * size.
	 *
	 * @see #send(List, String, ApnsSendOptions)
	 */
	public ApnsResponse send(final List<String> tokens, final ApnsPayloadBuilder payloadBuilder, final ApnsSendOptions options)
			throws InvalidTokenException, PayloadTooLargeException, ApnsAuthException {

		final ApnsSendOptions effectiveOptions = options != null ? options : new ApnsSendOptions();

		// Tokens are checked before the payload so that an invalid token is reported regardless of payload size.
		validateTokens(tokens);

		final String payload = effectiveOptions.getMaxPayloadLength() != null ?
				payloadBuilder.buildWithMaximumLength(effectiveOptions.getMaxPayloadLength()) :
				payloadBuilder.build(this.configuration.getMaxNotificationSize());

		return this.send(tokens, payload, effectiveOptions);
	}

	/**
	 * <p>Sends a pre-built payload to every given device.</p>
	 *
	 * <p>Every token and the payload's length are checked before anything is sent. Once they pass, this method always
	 * returns a response; notifications rejected by the gateway, or that could not be written, are reported as
	 * failures in the response.</p>
	 *
	 * @param tokens the hexadecimal device tokens to which to send the payload
	 * @param payload the serialized payload
	 * @param options per-send overrides of this client's configuration; may be {@code null}
	 *
	 * @return an accounting of every token in the send
	 *
	 * @throws InvalidTokenException if the token list is empty or any token is not a well-formed device token
	 * @throws PayloadTooLargeException if the payload is longer than the configured maximum notification size
	 * @throws ApnsAuthException if the provider certificate is missing or unusable
	 */
	public synchronized ApnsResponse send(final List<String> tokens, final String payload, final ApnsSendOptions options)
			throws InvalidTokenException, PayloadTooLargeException, ApnsAuthException {

		final ApnsSendOptions effectiveOptions = options != null ? options : new ApnsSendOptions();

		validateTokens(tokens);

		final int payloadLength = payload.getBytes(StandardCharsets.UTF_8).length;

		if (payloadLength > this.configuration.getMaxNotificationSize()) {
			throw new PayloadTooLargeException(payloadLength, this.configuration.getMaxNotificationSize());
		}

		final int expiration = effectiveOptions.getExpiration() != null ?
				effectiveOptions.getExpiration() :
				(int) (System.currentTimeMillis() / 1000 + this.configuration.getDefaultExpirationOffset());

		final int batchSize = effectiveOptions.getBatchSize() != null ?
				effectiveOptions.getBatchSize() : this.configuration.getDefaultBatchSize();

		final int retries = effectiveOptions.getRetries() != null ?
				effectiveOptions.getRetries() : this.configuration.getDefaultRetries();

		final long errorTimeout = effectiveOptions.getErrorTimeout() != null ?
				effectiveOptions.getErrorTimeout() : this.configuration.getDefaultErrorTimeout();

		final ApnsNotificationStream stream = new ApnsNotificationStream(tokens, payload, expiration,
				effectiveOptions.getPriority(), batchSize);

		log.debug("Sending {} notifications in batches of {}.", tokens.size(), batchSize);

		final List<RejectedNotification> errors = this.bulkSender.send(stream, retries, errorTimeout);

		return new ApnsResponse(tokens, payload, errors);
	}

	/**
	 * Identical to {@link #send(List, ApnsPayloadBuilder, ApnsSendOptions)}.
	 */
	public ApnsResponse sendBulk(final List<String> tokens, final ApnsPayloadBuilder payloadBuilder, final ApnsSendOptions options)
			throws InvalidTokenException, PayloadTooLargeException, ApnsAuthException {

		return this.send(tokens, payloadBuilder, options);
	}

	/**
	 * Retrieves the tokens the feedback service has marked as expired since the last time it was asked.
	 *
	 * @return the expired tokens reported by the feedback service
	 *
	 * @throws ApnsAuthException if the provider certificate is missing or unusable
	 * @throws IOException if the feedback service could not be reached
	 */
	public List<ExpiredToken> getExpiredTokens() throws ApnsAuthException, IOException {
		return this.feedbackServiceClient.getExpiredTokens();
	}

	/**
	 * Closes the gateway connection and, if this client created its own event loop group, shuts the group down.
	 */
	public synchronized void close() {
		this.gatewayConnection.close();

		if (this.shouldShutDownEventLoopGroup && this.eventLoopGroup != null) {
			this.eventLoopGroup.shutdownGracefully().awaitUninterruptibly();
		}
	}

	private static void validateTokens(final List<String> tokens) throws InvalidTokenException {
		if (tokens == null || tokens.isEmpty()) {
			throw new InvalidTokenException(null, "At least one token is required.");
		}

		for (final String token : tokens) {
			TokenUtil.tokenStringToByteArray(token);
		}
	}
}
