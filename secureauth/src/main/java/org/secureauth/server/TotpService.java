package org.secureauth.server;

import org.secureauth.common.CryptoUtils;
import org.secureauth.common.TotpResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;

/**
 * TOTP engine (RFC 6238, HMAC-SHA1, 6 digits). Stateless apart from reading
 * the clock, so one instance can be shared across threads.
 */
public final class TotpService {
	private static final Logger log = LoggerFactory.getLogger(TotpService.class);

	public static final int DEFAULT_WINDOW = 30;
	public static final int DIGITS = 6;
	private static final int MODULUS = 1_000_000;
	private static final int SHA1_LEN = 20;

	/** Keyed digest over the counter message. */
	@FunctionalInterface
	interface Signer {
		byte[] sign(byte[] key, byte[] message);
	}

	private final Clock clock;
	private final int windowSeconds;
	private final Signer signer;

	public TotpService() {
		this(Clock.systemUTC(), DEFAULT_WINDOW);
	}

	public TotpService(Clock clock, int windowSeconds) {
		this(clock, windowSeconds, CryptoUtils::hmacSha1);
	}

	TotpService(Clock clock, int windowSeconds, Signer signer) {
		if (windowSeconds < 1)
			throw new IllegalArgumentException("window must be at least 1 second: " + windowSeconds);
		this.clock = clock;
		this.windowSeconds = windowSeconds;
		this.signer = signer;
	}

	public int windowSeconds() {
		return windowSeconds;
	}

	public TotpResult generate(String secretBase32) {
		return generate(secretBase32, clock.instant());
	}

	public TotpResult generate(String secretBase32, Instant at) {
		byte[] key = CryptoUtils.decodeBase32(secretBase32);
		if (key.length == 0)
			return TotpResult.emptyKey();

		long counter = counter(epochSeconds(at), windowSeconds);
		byte[] digest;
		try {
			digest = signer.sign(key, CryptoUtils.counterBytes(counter));
			if (digest == null || digest.length != SHA1_LEN)
				throw new IllegalStateException("unexpected digest length " + (digest == null ? 0 : digest.length));
		} catch (RuntimeException e) {
			log.warn("HMAC-SHA1 failed for counter {}: {}", counter, e.toString());
			return TotpResult.hashFailure();
		}
		return TotpResult.ok(format(truncate(digest) % MODULUS));
	}

	/** Same as {@link #generate(String)} but rendered with the INVALID / ERROR sentinels. */
	public String generateCode(String secretBase32) {
		return generate(secretBase32).render();
	}

	/** Seconds left in the current window, in {@code [1, windowSeconds]}. */
	public int timeRemaining() {
		return timeRemaining(clock.instant());
	}

	public int timeRemaining(Instant at) {
		return windowSeconds - (int) Math.floorMod(epochSeconds(at), (long) windowSeconds);
	}

	/** Time-step counter the given instant falls into. */
	public long counter(Instant at) {
		return counter(epochSeconds(at), windowSeconds);
	}

	Instant now() {
		return clock.instant();
	}

	/** Unix seconds rounded half-up to the nearest whole second. */
	static long epochSeconds(Instant at) {
		return Math.floorDiv(at.toEpochMilli() + 500, 1000L);
	}

	static long counter(long epochSeconds, int windowSeconds) {
		return Math.floorDiv(epochSeconds, (long) windowSeconds);
	}

	/** Dynamic truncation, RFC 4226 section 5.3. */
	static int truncate(byte[] digest) {
		int offset = digest[digest.length - 1] & 0x0F;
		return ((digest[offset] & 0x7F) << 24)
				| ((digest[offset + 1] & 0xFF) << 16)
				| ((digest[offset + 2] & 0xFF) << 8)
				| (digest[offset + 3] & 0xFF);
	}

	static String format(int otp) {
		return String.format(Locale.ROOT, "%0" + DIGITS + "d", otp);
	}
}
