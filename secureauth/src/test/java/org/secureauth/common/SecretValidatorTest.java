package org.secureauth.common;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SecretValidatorTest {

	@Test
	void acceptsBase32WithOptionalPadding() {
		assertTrue(SecretValidator.isValidBase32("JBSWY3DPEHPK3PXP"));
		assertTrue(SecretValidator.isValidBase32("MZXW6==="));
		assertTrue(SecretValidator.isValidBase32("jbswy3dpehpk3pxp"));
		assertTrue(SecretValidator.isValidBase32("JBSW Y3DP EHPK 3PXP"));
	}

	@Test
	void acceptsUnicodeSpacesFromCopyPaste() {
		assertTrue(SecretValidator.isValidBase32("JBSW\u00A0Y3DP"));
		assertTrue(SecretValidator.isValidBase32("\uFEFFJBSW\u2007Y3DP\u202F EHPK\u3000 3PXP"));
		assertFalse(SecretValidator.isValidBase32("\u00A0\u3000"));
	}

	@Test
	void rejectsAnyCharacterOutsideTheAlphabet() {
		assertFalse(SecretValidator.isValidBase32("JBSW-Y3DP"));
		assertFalse(SecretValidator.isValidBase32("JBSWY3DP1"));
		assertFalse(SecretValidator.isValidBase32("ä"));
	}

	@Test
	void strictWhereTheDecoderIsLenient() {
		String secret = "JBSW-Y3DP";

		assertFalse(SecretValidator.isValidBase32(secret));
		assertEquals(5, CryptoUtils.decodeBase32(secret).length);
	}

	@Test
	void paddingOnlyAtTheEnd() {
		assertFalse(SecretValidator.isValidBase32("MZ=XW6"));
		assertFalse(SecretValidator.isValidBase32("===="));
	}

	@Test
	void nullOrEmptyIsInvalid() {
		assertFalse(SecretValidator.isValidBase32(null));
		assertFalse(SecretValidator.isValidBase32(""));
		assertFalse(SecretValidator.isValidBase32("   "));
	}
}
