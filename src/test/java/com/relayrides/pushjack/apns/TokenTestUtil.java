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

import java.util.ArrayList;
import java.util.List;

public class TokenTestUtil {

	public static String generateRandomToken() {
		final StringBuilder tokenBuilder = new StringBuilder();

		for (int i = 0; i < 64; i++) {
			tokenBuilder.append(Integer.toHexString((int) (Math.random() * 16)));
		}

		return tokenBuilder.toString();
	}

	/**
	 * Generates distinct, valid tokens whose values encode their position in the list.
	 */
	public static List<String> generateTokens(final int count) {
		final List<String> tokens = new ArrayList<String>(count);

		for (int i = 0; i < count; i++) {
			tokens.add(String.format("%064x", i + 1));
		}

		return tokens;
	}
}
