package org.secureauth.common;

import java.util.Objects;

/**
 * Outcome of one code generation. The code is present only for {@link Status#OK}.
 */
public record TotpResult(Status status, String code) {
	public static final String INVALID = "INVALID";
	public static final String ERROR = "ERROR";
	public static final String PLACEHOLDER = "--- ---";

	public enum Status {
		OK, EMPTY_KEY, HASH_FAILURE
	}

	public TotpResult {
		Objects.requireNonNull(status, "status");
		if (status == Status.OK && code == null)
			throw new IllegalArgumentException("OK result needs a code");
		if (status != Status.OK)
			code = null;
	}

	public static TotpResult ok(String code) {
		return new TotpResult(Status.OK, code);
	}

	public static TotpResult emptyKey() {
		return new TotpResult(Status.EMPTY_KEY, null);
	}

	public static TotpResult hashFailure() {
		return new TotpResult(Status.HASH_FAILURE, null);
	}

	public boolean isOk() {
		return status == Status.OK;
	}

	/** In-band form: the code itself, or the INVALID / ERROR sentinel. */
	public String render() {
		return switch (status) {
		case OK -> code;
		case EMPTY_KEY -> INVALID;
		case HASH_FAILURE -> ERROR;
		};
	}

	/** Code grouped as "123 456" for reading aloud; a placeholder otherwise. */
	public String display() {
		if (!isOk() || code.length() != 6)
			return PLACEHOLDER;
		return code.substring(0, 3) + " " + code.substring(3);
	}
}
