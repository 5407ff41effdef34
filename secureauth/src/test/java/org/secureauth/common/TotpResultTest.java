package org.secureauth.common;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TotpResultTest {

	@Test
	void rendersSentinelsPerStatus() {
		assertEquals("287082", TotpResult.ok("287082").render());
		assertEquals("INVALID", TotpResult.emptyKey().render());
		assertEquals("ERROR", TotpResult.hashFailure().render());
	}

	@Test
	void displayGroupsDigits() {
		assertEquals("287 082", TotpResult.ok("287082").display());
		assertEquals("--- ---", TotpResult.emptyKey().display());
		assertEquals("--- ---", TotpResult.hashFailure().display());
	}

	@Test
	void failuresCarryNoCode() {
		assertNull(new TotpResult(TotpResult.Status.EMPTY_KEY, "123456").code());
		assertThrows(IllegalArgumentException.class, () -> new TotpResult(TotpResult.Status.OK, null));
	}
}
