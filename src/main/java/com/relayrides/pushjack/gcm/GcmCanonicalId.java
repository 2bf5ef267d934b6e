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

/**
 * Indicates that the GCM service has replaced a registration ID with a new one. Callers should replace the old ID with
 * the new one in their own records.
 */
public class GcmCanonicalId {
	private final String oldId;
	private final String newId;

	public GcmCanonicalId(final String oldId, final String newId) {
		this.oldId = oldId;
		this.newId = newId;
	}

	/**
	 * Returns the registration ID to which the message was sent.
	 *
	 * @return the registration ID to which the message was sent
	 */
	public String getOldId() {
		return this.oldId;
	}

	/**
	 * Returns the registration ID that should replace the old one.
	 *
	 * @return the registration ID that should replace the old one
	 */
	public String getNewId() {
		return this.newId;
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((newId == null) ? 0 : newId.hashCode());
		result = prime * result + ((oldId == null) ? 0 : oldId.hashCode());
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
		final GcmCanonicalId other = (GcmCanonicalId) obj;
		if (newId == null) {
			if (other.newId != null)
				return false;
		} else if (!newId.equals(other.newId))
			return false;
		if (oldId == null) {
			if (other.oldId != null)
				return false;
		} else if (!oldId.equals(other.oldId))
			return false;
		return true;
	}

	@Override
	public String toString() {
		return "GcmCanonicalId [oldId=" + oldId + ", newId=" + newId + "]";
	}
}
