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

package com.relayrides.pushjack.apns.util;

import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.util.Locale;

import javax.net.ssl.KeyManagerFactory;

import com.relayrides.pushjack.apns.ApnsAuthException;

/**
 * A utility class for creating client SSL contexts from APNs provider certificates. Certificates may be supplied as
 * PKCS#12 files (with a {@code .p12} or {@code .pfx} extension) or as PEM files containing both the X.509 certificate
 * and its PKCS#8 private key.
 */
public class SslContextUtil {

	private static final String PKCS12 = "PKCS12";

	private SslContextUtil() {}

	/**
	 * Creates a new client SSL context that identifies itself with the certificate at the given path. The file is
	 * read in full before any connection is attempted.
	 *
	 * @param certificatePath the path to the provider certificate
	 * @param password the password protecting the certificate's private key; may be {@code null}
	 *
	 * @return an SSL context suitable for communicating with the APNs gateway and feedback service
	 *
	 * @throws ApnsAuthException if no path was given, or if the file is missing, unreadable, empty or cannot be parsed
	 */
	public static SslContext createClientSslContext(final String certificatePath, final String password) throws ApnsAuthException {
		final byte[] certificateBytes = readCertificate(certificatePath);

		try {
			if (isPkcs12(certificatePath)) {
				final char[] passwordCharacters = password != null ? password.toCharArray() : new char[0];

				final KeyStore keyStore = KeyStore.getInstance(PKCS12);
				keyStore.load(new ByteArrayInputStream(certificateBytes), passwordCharacters);

				final KeyManagerFactory keyManagerFactory =
						KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
				keyManagerFactory.init(keyStore, passwordCharacters);

				return SslContextBuilder.forClient().keyManager(keyManagerFactory).build();
			} else {
				// A combined PEM file holds both the certificate chain and the key; each reader picks out its own part.
				return SslContextBuilder.forClient()
						.keyManager(new ByteArrayInputStream(certificateBytes), new ByteArrayInputStream(certificateBytes), password)
						.build();
			}
		} catch (final GeneralSecurityException | IOException | IllegalArgumentException e) {
			throw new ApnsAuthException(String.format("The certificate at %s could not be loaded: %s",
					certificatePath, e.getMessage()), e);
		}
	}

	/**
	 * Reads the certificate at the given path, verifying that it exists and is readable.
	 *
	 * @param certificatePath the path to the provider certificate
	 *
	 * @return the contents of the certificate file
	 *
	 * @throws ApnsAuthException if no path was given, or if the file is missing, unreadable or empty
	 */
	public static byte[] readCertificate(final String certificatePath) throws ApnsAuthException {
		if (certificatePath == null || certificatePath.isEmpty()) {
			throw new ApnsAuthException("Missing certificate. Cannot send notifications.");
		}

		final File certificateFile = new File(certificatePath);

		if (!certificateFile.isFile() || !certificateFile.canRead()) {
			throw new ApnsAuthException(String.format("The certificate at %s is not readable.", certificatePath));
		}

		final byte[] certificateBytes;

		try {
			certificateBytes = Files.readAllBytes(certificateFile.toPath());
		} catch (final IOException e) {
			throw new ApnsAuthException(String.format("The certificate at %s is not readable: %s",
					certificatePath, e.getMessage()), e);
		}

		if (certificateBytes.length == 0) {
			throw new ApnsAuthException(String.format("The certificate at %s is empty.", certificatePath));
		}

		return certificateBytes;
	}

	private static boolean isPkcs12(final String certificatePath) {
		final String lowerCasePath = certificatePath.toLowerCase(Locale.ROOT);
		return lowerCasePath.endsWith(".p12") || lowerCasePath.endsWith(".pfx");
	}
}
