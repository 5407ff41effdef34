package org.secureauth.server;

import org.secureauth.common.CryptoUtils;
import org.secureauth.common.SecretValidator;

import java.time.Clock;
import java.util.*;

/**
 * Accounts whose codes are tracked. Held in memory only; nothing is persisted.
 */
public final class AccountRegistry {
	public static final String DEFAULT_ACCOUNT_NAME = "User";

	public record Account(String id, String issuer, String accountName, String secret, long addedAt) {
	}

	private final Map<String, Account> accounts = new LinkedHashMap<>();
	private final Clock clock;

	public AccountRegistry(Clock clock) {
		this.clock = clock;
	}

	/**
	 * Registers a secret under {@code issuer}. The secret is stored without
	 * whitespace and uppercased.
	 *
	 * @throws IllegalArgumentException if the issuer is blank or the secret is not Base32
	 */
	public synchronized Account add(String issuer, String secret) {
		if (issuer == null || issuer.isBlank())
			throw new IllegalArgumentException("issuer is required (e.g. Google, GitHub)");
		String clean = normalizeSecret(secret);
		if (clean.isEmpty() || !SecretValidator.isValidBase32(clean))
			throw new IllegalArgumentException("secret is not a valid Base32 string");
		Account a = new Account(UUID.randomUUID().toString(), issuer.trim(), DEFAULT_ACCOUNT_NAME, clean,
				clock.millis());
		accounts.put(a.id(), a);
		return a;
	}

	public synchronized boolean remove(String id) {
		return id != null && accounts.remove(id) != null;
	}

	public synchronized Account get(String id) {
		return accounts.get(id);
	}

	public synchronized List<Account> list() {
		return List.copyOf(accounts.values());
	}

	public synchronized int size() {
		return accounts.size();
	}

	static String normalizeSecret(String secret) {
		if (secret == null)
			return "";
		return CryptoUtils.stripWhitespace(secret).toUpperCase(Locale.ROOT);
	}
}
