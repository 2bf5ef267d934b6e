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

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;

import com.relayrides.pushjack.InvalidTokenException;
import com.relayrides.pushjack.apns.util.TokenUtil;

/**
 * <p>A resumable iterator over the frames of one bulk send. Each token is assigned a sequence identifier equal to its
 * position in the token list; each call to {@link #next()} yields a {@link StreamUnit} of up to {@code batchSize}
 * consecutive frames.</p>
 *
 * <p>After the gateway rejects a notification, {@link #seek(int)} moves the cursor past the rejected notification so
 * sending can resume with the one after it. The payload is encoded once and shared by every frame.</p>
 *
 * <p>Streams are not thread-safe.</p>
 */
public class ApnsNotificationStream {

	private final List<String> tokens;
	private final byte[] payloadBytes;
	private final int expiration;
	private final DeliveryPriority priority;
	private final int batchSize;

	private int nextIdentifier = 0;

	/**
	 * A group of consecutive encoded frames, written to the gateway as a single unit.
	 */
	public static class StreamUnit {
		private final int firstIdentifier;
		private final int count;
		private final byte[] bytes;

		StreamUnit(final int firstIdentifier, final int count, final byte[] bytes) {
			this.firstIdentifier = firstIdentifier;
			this.count = count;
			this.bytes = bytes;
		}

		/**
		 * Returns the sequence identifier of the first frame in this unit.
		 *
		 * @return the sequence identifier of the first frame in this unit
		 */
		public int getFirstIdentifier() {
			return this.firstIdentifier;
		}

		/**
		 * Returns the sequence identifier of the last frame in this unit.
		 *
		 * @return the sequence identifier of the last frame in this unit
		 */
		public int getLastIdentifier() {
			return this.firstIdentifier + this.count - 1;
		}

		public int getCount() {
			return this.count;
		}

		public byte[] getBytes() {
			return this.bytes;
		}

		@Override
		public String toString() {
			return "StreamUnit [firstIdentifier=" + firstIdentifier + ", count=" + count + ", length=" + bytes.length + "]";
		}
	}

	/**
	 * Constructs a new stream over the given tokens. All tokens are validated up front.
	 *
	 * @param tokens the hexadecimal device tokens to which the payload will be sent, in send order
	 * @param payload the serialized payload shared by every notification
	 * @param expiration the expiration time, in seconds since the epoch, of every notification
	 * @param priority the delivery priority of every notification
	 * @param batchSize the largest number of frames in a single unit
	 *
	 * @throws InvalidTokenException if any token is not a well-formed device token
	 */
	public ApnsNotificationStream(final List<String> tokens, final String payload, final int expiration,
			final DeliveryPriority priority, final int batchSize) throws InvalidTokenException {

		if (tokens == null) {
			throw new NullPointerException("Tokens must not be null.");
		}

		if (payload == null) {
			throw new NullPointerException("Payload must not be null.");
		}

		if (priority == null) {
			throw new NullPointerException("Priority must not be null.");
		}

		if (batchSize < 1) {
			throw new IllegalArgumentException("Batch size must be positive.");
		}

		for (final String token : tokens) {
			TokenUtil.tokenStringToByteArray(token);
		}

		this.tokens = Collections.unmodifiableList(new ArrayList<String>(tokens));
		this.payloadBytes = payload.getBytes(StandardCharsets.UTF_8);
		this.expiration = expiration;
		this.priority = priority;
		this.batchSize = batchSize;
	}

	/**
	 * Returns the total number of notifications in this stream, regardless of the cursor position.
	 *
	 * @return the total number of notifications in this stream
	 */
	public int size() {
		return this.tokens.size();
	}

	public boolean hasNext() {
		return !this.isEof();
	}

	/**
	 * Encodes the next unit of frames and advances the cursor past it.
	 *
	 * @return the next unit of frames
	 *
	 * @throws NoSuchElementException if every notification in the stream has been consumed
	 */
	public StreamUnit next() {
		if (this.isEof()) {
			throw new NoSuchElementException();
		}

		final int firstIdentifier = this.nextIdentifier;
		final int count = Math.min(this.batchSize, this.tokens.size() - firstIdentifier);

		final ByteArrayOutputStream out = new ByteArrayOutputStream();

		for (int identifier = firstIdentifier; identifier < firstIdentifier + count; identifier++) {
			final byte[] frame;

			try {
				frame = ApnsFrameCodec.encodePushNotification(this.tokens.get(identifier), this.payloadBytes,
						identifier, this.expiration, (byte) this.priority.getCode());
			} catch (final InvalidTokenException e) {
				// Tokens are validated at construction.
				throw new IllegalStateException(e);
			}

			out.write(frame, 0, frame.length);
		}

		this.nextIdentifier = firstIdentifier + count;

		return new StreamUnit(firstIdentifier, count, out.toByteArray());
	}

	/**
	 * Moves the cursor to the notification after the one with the given identifier.
	 *
	 * @param identifier the sequence identifier of the last notification that should not be sent again
	 */
	public void seek(final int identifier) {
		this.nextIdentifier = Math.max(0, Math.min(identifier + 1, this.tokens.size()));
	}

	/**
	 * Indicates whether every notification in this stream has been consumed.
	 *
	 * @return {@code true} if the cursor has passed the last notification
	 */
	public boolean isEof() {
		return this.nextIdentifier >= this.tokens.size();
	}

	/**
	 * Returns the sequence identifier of the next notification to be encoded.
	 *
	 * @return the sequence identifier of the next notification to be encoded
	 */
	public int position() {
		return this.nextIdentifier;
	}

	/**
	 * Returns the tokens that have not yet been consumed, without moving the cursor.
	 *
	 * @return the tokens from the cursor to the end of the stream
	 */
	public List<String> peek() {
		return this.tokens.subList(this.nextIdentifier, this.tokens.size());
	}

	public List<String> getTokens() {
		return this.tokens;
	}

	public byte[] getPayloadBytes() {
		return this.payloadBytes.clone();
	}
}
