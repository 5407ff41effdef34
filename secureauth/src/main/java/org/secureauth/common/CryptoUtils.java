package org.secureauth.common;

import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Byte-level helpers for TOTP: lenient Base32 decoding (RFC 4648), counter
 * packing and HMAC-SHA1.
 */
public final class CryptoUtils {
	public static final String BASE32_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ234567";
	public static final int COUNTER_LEN = 8;
	/** Unicode whitespace, no-break and ideographic spaces included, plus the BOM. */
	public static final Pattern WHITESPACE = Pattern.compile("[\\s\\uFEFF]", Pattern.UNICODE_CHARACTER_CLASS);

	private CryptoUtils() {
	}

	/**
	 * Decodes a human-entered Base32 string. Case, whitespace and trailing
	 * padding are ignored; any other character outside the alphabet is skipped
	 * without error. Returns an empty array when nothing decodable is left.
	 */
	public static byte[] decodeBase32(String s) {
		if (s == null)
			return new byte[0];
		String clean = stripWhitespace(s.toUpperCase(Locale.ROOT)).replaceAll("=+$", "");

		// capacity hint only, the loop decides how many bytes are real
		byte[] out = new byte[clean.length() * 5 / 8];
		int written = 0;
		int value = 0;
		int bits = 0;
		for (int i = 0; i < clean.length(); i++) {
			int idx = BASE32_ALPHABET.indexOf(clean.charAt(i));
			if (idx < 0)
				continue;
			value = (value << 5) | idx;
			bits += 5;
			if (bits >= 8) {
				out[written++] = (byte) ((value >>> (bits - 8)) & 0xFF);
				bits -= 8;
			}
		}
		return written == out.length ? out : Arrays.copyOf(out, written);
	}

	public static String stripWhitespace(String s) {
		return WHITESPACE.matcher(s).replaceAll("");
	}

	/** Time-step counter as the 8-byte big-endian message RFC 6238 signs. */
	public static byte[] counterBytes(long counter) {
		return ByteBuffer.allocate(COUNTER_LEN).putLong(counter).array();
	}

	/**
	 * HMAC-SHA1 over {@code message}. Failures of the underlying primitive
	 * surface as unchecked exceptions from commons-codec.
	 */
	public static byte[] hmacSha1(byte[] key, byte[] message) {
		return new HmacUtils(HmacAlgorithms.HMAC_SHA_1, key).hmac(message);
	}

	public static String toHex(byte[] data) {
		return Hex.encodeHexString(data);
	}
}
