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

/**
 * <p>An APNs environment is a pair of servers that provide push notification services: a gateway that accepts push
 * notifications and a feedback service that reports tokens that are no longer valid. Apple provides one production
 * environment and one &quot;sandbox&quot; environment. Custom environments may be created for development and
 * testing purposes.</p>
 */
public class ApnsEnvironment {
	private final String apnsGatewayHost;
	private final int apnsGatewayPort;

	private final String feedbackHost;
	private final int feedbackPort;

	/**
	 * Constructs a new APNs environment with the given host names and ports.
	 *
	 * @param apnsGatewayHost the host name of the APNs gateway
	 * @param apnsGatewayPort the TCP port for the APNs gateway
	 * @param feedbackHost the host name of the APNs feedback service
	 * @param feedbackPort the TCP port for the APNs feedback service
	 */
	public ApnsEnvironment(final String apnsGatewayHost, final int apnsGatewayPort, final String feedbackHost, final int feedbackPort) {
		if (apnsGatewayHost == null) {
			throw new NullPointerException("Gateway host must not be null.");
		}

		if (feedbackHost == null) {
			throw new NullPointerException("Feedback host must not be null.");
		}

		this.apnsGatewayHost = apnsGatewayHost;
		this.apnsGatewayPort = apnsGatewayPort;

		this.feedbackHost = feedbackHost;
		this.feedbackPort = feedbackPort;
	}

	public String getApnsGatewayHost() {
		return this.apnsGatewayHost;
	}

	public int getApnsGatewayPort() {
		return this.apnsGatewayPort;
	}

	public String getFeedbackHost() {
		return this.feedbackHost;
	}

	public int getFeedbackPort() {
		return this.feedbackPort;
	}

	/**
	 * Returns an APNs environment for connecting to Apple's production servers.
	 *
	 * @return an APNs environment for connecting to Apple's production servers
	 */
	public static ApnsEnvironment getProductionEnvironment() {
		return new ApnsEnvironment("gateway.push.apple.com", 2195, "feedback.push.apple.com", 2196);
	}

	/**
	 * Returns an APNs environment for connecting to Apple's development servers.
	 *
	 * @return an APNs environment for connecting to Apple's development servers
	 */
	public static ApnsEnvironment getSandboxEnvironment() {
		return new ApnsEnvironment("gateway.sandbox.push.apple.com", 2195, "feedback.sandbox.push.apple.com", 2196);
	}

	@Override
	public String toString() {
		return "ApnsEnvironment [apnsGatewayHost=" + apnsGatewayHost + ", apnsGatewayPort=" + apnsGatewayPort
				+ ", feedbackHost=" + feedbackHost + ", feedbackPort=" + feedbackPort + "]";
	}
}
