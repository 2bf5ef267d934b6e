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

import java.util.Date;

/**
 * A device token reported by the APNs feedback service as no longer valid, together with the time at which APNs
 * determined that the receiving app was no longer installed.
 */
public class ExpiredToken {
	private final String token;
	private final Date expiration;

	public ExpiredToken(final String token, final Date expiration) {
		if (token == null) {
			throw new NullPointerException("Token must not be null.");
		}

		if (expiration == null) {
			throw new NullPointerException("Expiration must not be null.");
		}

		this.token = token;
		this.expiration = new Date(expiration.getTime());
	}

	/**
	 * Returns the token APNs has reported as expired, as a lower-case hexadecimal string.
	 *
	 * @return the expired token
	 */
	public String getToken() {
		return this.token;
	}

	/**
	 * Returns the time, rounded to the nearest second, when APNs determined that the application no longer exists on
	 * the device.
	 *
	 * @return the time when APNs determined that the application no longer exists on the device
	 */
	public Date getExpiration() {
		return new Date(this.expiration.getTime());
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + expiration.hashCode();
		result = prime * result + token.hashCode();
		return result;
	}

	@Override
	public boolean equals(final Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		final ExpiredToken other = (ExpiredToken) obj;
		if (!expiration.equals(other.expiration))
			return false;
		if (!token.equals(other.token))
			return false;
		return true;
	}

	@Override
	public String toString() {
		return "ExpiredToken [token=" + token + ", expiration=" + expiration + "]";
	}
}
