package org.secureauth.common;

import java.util.regex.Pattern;

/**
 * Strict acceptance check for Base32 secrets. Unlike
 * {@link CryptoUtils#decodeBase32(String)}, a single character outside the
 * alphabet makes the whole secret invalid.
 */
public final class SecretValidator {
	private static final Pattern BASE32_PATTERN = Pattern.compile("^[A-Z2-7]+=*$", Pattern.CASE_INSENSITIVE);

	private SecretValidator() {
	}

	public static boolean isValidBase32(String secret) {
		if (secret == null || secret.isEmpty())
			return false;
		return BASE32_PATTERN.matcher(CryptoUtils.stripWhitespace(secret)).matches();
	}
}
