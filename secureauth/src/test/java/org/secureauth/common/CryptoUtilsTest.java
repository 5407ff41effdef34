package org.secureauth.common;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class CryptoUtilsTest {

	private static String ascii(byte[] b) {
		return new String(b, StandardCharsets.US_ASCII);
	}

	@Test
	void decodesCanonicalSecret() {
		byte[] b = CryptoUtils.decodeBase32("JBSWY3DPEHPK3PXP");

		assertEquals("48656c6c6f21deadbeef", CryptoUtils.toHex(b));
	}

	@Test
	void decodesRfc6238Secret() {
		assertEquals("12345678901234567890", ascii(CryptoUtils.decodeBase32("GEZDGNBVGY3TQOJQGEZDGNBVGY3TQOJQ")));
	}

	@Test
	void ignoresCaseWhitespaceAndPadding() {
		assertEquals("Hello", ascii(CryptoUtils.decodeBase32("jbsw y3dp")));
		assertEquals("Hello", ascii(CryptoUtils.decodeBase32(" JBSW\tY3DP\n")));
		assertEquals("foo", ascii(CryptoUtils.decodeBase32("MZXW6===")));
		assertEquals("f", ascii(CryptoUtils.decodeBase32("MY======")));
	}

	@Test
	void stripsUnicodeWhitespace() {
		assertEquals("JBSWY3DP", CryptoUtils.stripWhitespace("JBSW\u00A0Y3\u3000DP\u2028"));
		assertEquals("Hello", ascii(CryptoUtils.decodeBase32("JBSW\u00A0Y3DP")));
	}

	@Test
	void skipsCharactersOutsideTheAlphabet() {
		assertEquals("Hello", ascii(CryptoUtils.decodeBase32("JBSW-Y3DP")));
		assertEquals("Hello", ascii(CryptoUtils.decodeBase32("JBSW1Y3DP8")));
	}

	@Test
	void sparseValidCharactersYieldOnlyEmittedBytes() {
		String noisy = "J!!B@@S##W$$Y%%3^^D&&P**((--__++";

		byte[] b = CryptoUtils.decodeBase32(noisy);

		// capacity hint would be 20 bytes, only 5 are real
		assertEquals(5, b.length);
		assertEquals("Hello", ascii(b));
	}

	@Test
	void nothingDecodableGivesEmptyArray() {
		assertEquals(0, CryptoUtils.decodeBase32("").length);
		assertEquals(0, CryptoUtils.decodeBase32("====").length);
		assertEquals(0, CryptoUtils.decodeBase32("   ").length);
		assertEquals(0, CryptoUtils.decodeBase32("-!-18").length);
		assertEquals(0, CryptoUtils.decodeBase32(null).length);
		// 5 bits are not enough for a byte
		assertEquals(0, CryptoUtils.decodeBase32("A").length);
	}

	@Test
	void counterIsFullEightByteBigEndian() {
		assertArrayEquals(new byte[] { 0, 0, 0, 0, 0, 0, 0, 1 }, CryptoUtils.counterBytes(1));
		assertArrayEquals(new byte[] { 0, 0, 0, 0, 0x02, 0x35, 0x23, (byte) 0xEC },
				CryptoUtils.counterBytes(37037036L));
		assertArrayEquals(new byte[] { 0, 0, 0, 1, 0, 0, 0, 0 }, CryptoUtils.counterBytes(0x1_0000_0000L));
	}

	@Test
	void hmacSha1MatchesRfc2202() {
		byte[] mac = CryptoUtils.hmacSha1("Jefe".getBytes(StandardCharsets.US_ASCII),
				"what do ya want for nothing?".getBytes(StandardCharsets.US_ASCII));

		assertEquals(20, mac.length);
		assertEquals("effcdf6ae5eb2fa2d27416d5f184df9c259a7c79", CryptoUtils.toHex(mac));
	}
}
