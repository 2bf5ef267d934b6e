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

import java.io.IOException;
import java.util.Date;

import com.relayrides.pushjack.InvalidTokenException;
import com.relayrides.pushjack.apns.util.TokenUtil;

/**
 * <p>Encodes and decodes the binary structures of the legacy APNs protocol. All integers are big-endian.</p>
 *
 * <pre>
 * push frame:      [cmd=2:1][frame length:4]{[item id:1][item length:2][item data]} x 5
 * error response:  [cmd=8:1][status:1][identifier:4]
 * feedback record: [timestamp:4][token length:2][token]
 * </pre>
 */
public class ApnsFrameCodec {

	public static final byte PUSH_NOTIFICATION_COMMAND = 2;
	public static final byte ERROR_RESPONSE_COMMAND = 8;

	/**
	 * The length of an error response sent by the APNs gateway.
	 */
	public static final int ERROR_RESPONSE_LENGTH = 6;

	/**
	 * The length of the fixed header preceding each token sent by the feedback service.
	 */
	public static final int FEEDBACK_HEADER_LENGTH = 6;

	private static final int FRAME_ITEM_ID_SIZE = 1;
	private static final int FRAME_ITEM_LENGTH_SIZE = 2;

	private static final short IDENTIFIER_SIZE = 4;
	private static final short EXPIRATION_SIZE = 4;
	private static final short PRIORITY_SIZE = 1;

	private ApnsFrameCodec() {}

	/**
	 * Packs a single push notification into a frame.
	 *
	 * @param token the hexadecimal device token
	 * @param payload the serialized payload
	 * @param identifier the notification's sequence identifier
	 * @param expiration the expiration time in seconds since the epoch, or 0 to expire immediately
	 * @param priority the delivery priority code
	 *
	 * @return the encoded frame
	 *
	 * @throws InvalidTokenException if the token is not a well-formed hexadecimal device token
	 */
	public static byte[] encodePushNotification(final String token, final byte[] payload, final int identifier,
			final int expiration, final byte priority) throws InvalidTokenException {

		return encodePushNotification(TokenUtil.tokenStringToByteArray(token), payload, identifier, expiration, priority);
	}

	/**
	 * Packs a single push notification with an already-decoded token into a frame.
	 *
	 * @param tokenBytes the raw device token
	 * @param payload the serialized payload
	 * @param identifier the notification's sequence identifier
	 * @param expiration the expiration time in seconds since the epoch, or 0 to expire immediately
	 * @param priority the delivery priority code
	 *
	 * @return the encoded frame
	 */
	public static byte[] encodePushNotification(final byte[] tokenBytes, final byte[] payload, final int identifier,
			final int expiration, final byte priority) {

		final int frameLength = getFrameLength(tokenBytes, payload);
		final ByteBuf out = Unpooled.buffer(1 + 4 + frameLength);

		try {
			out.writeByte(PUSH_NOTIFICATION_COMMAND);
			out.writeInt(frameLength);

			out.writeByte(ApnsFrameItem.DEVICE_TOKEN.getCode());
			out.writeShort(tokenBytes.length);
			out.writeBytes(tokenBytes);

			out.writeByte(ApnsFrameItem.PAYLOAD.getCode());
			out.writeShort(payload.length);
			out.writeBytes(payload);

			out.writeByte(ApnsFrameItem.IDENTIFIER.getCode());
			out.writeShort(IDENTIFIER_SIZE);
			out.writeInt(identifier);

			out.writeByte(ApnsFrameItem.EXPIRATION.getCode());
			out.writeShort(EXPIRATION_SIZE);
			out.writeInt(expiration);

			out.writeByte(ApnsFrameItem.PRIORITY.getCode());
			out.writeShort(PRIORITY_SIZE);
			out.writeByte(priority);

			final byte[] frame = new byte[out.readableBytes()];
			out.readBytes(frame);

			return frame;
		} finally {
			out.release();
		}
	}

	private static int getFrameLength(final byte[] tokenBytes, final byte[] payload) {
		return ApnsFrameItem.values().length * (FRAME_ITEM_ID_SIZE + FRAME_ITEM_LENGTH_SIZE) +
				tokenBytes.length +
				payload.length +
				IDENTIFIER_SIZE +
				EXPIRATION_SIZE +
				PRIORITY_SIZE;
	}

	/**
	 * Decodes an error response sent by the APNs gateway.
	 *
	 * @param response the {@value #ERROR_RESPONSE_LENGTH}-byte error response
	 *
	 * @return the rejection described by the response
	 *
	 * @throws IOException if the response is truncated or does not start with the error response command
	 */
	public static RejectedNotification decodeErrorResponse(final byte[] response) throws IOException {
		if (response.length < ERROR_RESPONSE_LENGTH) {
			throw new IOException(String.format("Error response must be %d bytes, but only %d were received.",
					ERROR_RESPONSE_LENGTH, response.length));
		}

		final ByteBuf in = Unpooled.wrappedBuffer(response);

		try {
			final byte command = in.readByte();

			if (command != ERROR_RESPONSE_COMMAND) {
				throw new IOException(String.format("Error response command must be %d. Found: %d",
						ERROR_RESPONSE_COMMAND, command));
			}

			final int status = in.readUnsignedByte();
			final int identifier = in.readInt();

			return new RejectedNotification(identifier, RejectedNotificationReason.getByErrorCode(status));
		} finally {
			in.release();
		}
	}

	/**
	 * Extracts the length of the token that follows a feedback record header.
	 *
	 * @param header the {@value #FEEDBACK_HEADER_LENGTH}-byte feedback record header
	 *
	 * @return the length, in bytes, of the token that follows the header
	 */
	public static int getFeedbackTokenLength(final byte[] header) {
		return ((header[4] & 0xFF) << 8) | (header[5] & 0xFF);
	}

	/**
	 * Decodes a feedback record from its header and token bytes.
	 *
	 * @param header the {@value #FEEDBACK_HEADER_LENGTH}-byte feedback record header
	 * @param tokenBytes the raw token that followed the header
	 *
	 * @return the expired token described by the record
	 */
	public static ExpiredToken decodeExpiredToken(final byte[] header, final byte[] tokenBytes) {
		final ByteBuf in = Unpooled.wrappedBuffer(header);

		try {
			final long timestamp = in.readUnsignedInt() * 1000L;
			return new ExpiredToken(TokenUtil.tokenBytesToString(tokenBytes), new Date(timestamp));
		} finally {
			in.release();
		}
	}
}
