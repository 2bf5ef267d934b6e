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

import io.netty.channel.Channel;
import io.netty.channel.ChannelHandler;
import io.netty.util.concurrent.Future;

/**
 * Opens channels to an APNs endpoint on behalf of an {@link ApnsConnection}.
 */
public interface ApnsChannelFactory {

	/**
	 * Begins opening a new channel to the endpoint served by this factory. The given handler must be installed as the
	 * last handler of the new channel's pipeline so that it receives the decrypted bytes sent by the endpoint.
	 *
	 * @param handler the handler that receives inbound data from the new channel
	 *
	 * @return a future that completes with the new channel once it is ready to carry notification data (i.e. once any
	 * TLS handshake has finished), or fails if the channel could not be opened
	 *
	 * @throws ApnsAuthException if the credentials needed to open a channel are missing or unusable; in this case no
	 * connection attempt is made
	 */
	Future<Channel> connect(ChannelHandler handler) throws ApnsAuthException;
}
