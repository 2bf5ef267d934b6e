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

import static org.junit.Assert.assertArrayEquals;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.relayrides.pushjack.apns.ApnsAuthException;

public class SslContextUtilTest {

	@Rule
	public TemporaryFolder temporaryFolder = new TemporaryFolder();

	@Test(expected = ApnsAuthException.class)
	public void testCreateClientSslContextNullPath() throws Exception {
		SslContextUtil.createClientSslContext(null, null);
	}

	@Test(expected = ApnsAuthException.class)
	public void testCreateClientSslContextMissingFile() throws Exception {
		final File missingFile = new File(this.temporaryFolder.getRoot(), "missing.p12");
		SslContextUtil.createClientSslContext(missingFile.getAbsolutePath(), "pushjack-test");
	}

	@Test(expected = ApnsAuthException.class)
	public void testCreateClientSslContextEmptyFile() throws Exception {
		final File emptyFile = this.temporaryFolder.newFile("empty.pem");
		SslContextUtil.createClientSslContext(emptyFile.getAbsolutePath(), null);
	}

	@Test(expected = ApnsAuthException.class)
	public void testCreateClientSslContextDirectory() throws Exception {
		SslContextUtil.createClientSslContext(this.temporaryFolder.newFolder("certificates").getAbsolutePath(), null);
	}

	@Test(expected = ApnsAuthException.class)
	public void testCreateClientSslContextCorruptPkcs12() throws Exception {
		final File corruptFile = this.temporaryFolder.newFile("corrupt.p12");
		Files.write(corruptFile.toPath(), "This is not a key store.".getBytes(StandardCharsets.UTF_8));

		SslContextUtil.createClientSslContext(corruptFile.getAbsolutePath(), "pushjack-test");
	}

	@Test(expected = ApnsAuthException.class)
	public void testCreateClientSslContextCorruptPem() throws Exception {
		final File corruptFile = this.temporaryFolder.newFile("corrupt.pem");
		Files.write(corruptFile.toPath(), "This is not a certificate.".getBytes(StandardCharsets.UTF_8));

		SslContextUtil.createClientSslContext(corruptFile.getAbsolutePath(), null);
	}

	@Test
	public void testReadCertificate() throws Exception {
		final byte[] contents = "-----BEGIN CERTIFICATE-----".getBytes(StandardCharsets.UTF_8);
		final File certificateFile = this.temporaryFolder.newFile("certificate.pem");
		Files.write(certificateFile.toPath(), contents);

		assertArrayEquals(contents, SslContextUtil.readCertificate(certificateFile.getAbsolutePath()));
	}
}
