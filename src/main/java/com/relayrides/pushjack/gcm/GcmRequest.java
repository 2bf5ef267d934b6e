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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One HTTP request of a GCM send: a chunk of registration IDs and the serialized request body addressed to them.
 */
public class GcmRequest {
	private final List<String> registrationIds;
	private final String body;

	public GcmRequest(final List<String> registrationIds, final String body) {
		this.registrationIds = Collections.unmodifiableList(new ArrayList<String>(registrationIds));
		this.body = body;
	}

	public List<String> getRegistrationIds() {
		return this.registrationIds;
	}

	public String getBody() {
		return this.body;
	}

	@Override
	public String toString() {
		return "GcmRequest [registrationIds=" + registrationIds.size() + ", body=" + body + "]";
	}
}
