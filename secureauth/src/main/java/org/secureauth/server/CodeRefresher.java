package org.secureauth.server;

import org.secureauth.common.TotpResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Keeps one current code per tracked account. Ticks once a second and
 * regenerates every code when a new window starts.
 */
public final class CodeRefresher implements AutoCloseable {
	private static final Logger log = LoggerFactory.getLogger(CodeRefresher.class);

	private final AccountRegistry registry;
	private final TotpService totp;
	private final List<Consumer<Map<String, TotpResult>>> listeners = new CopyOnWriteArrayList<>();

	private volatile Map<String, TotpResult> codes = Map.of();
	private volatile int timeRemaining;
	private volatile long lastCounter = Long.MIN_VALUE;
	private ScheduledExecutorService ticker;

	public CodeRefresher(AccountRegistry registry, TotpService totp) {
		this.registry = registry;
		this.totp = totp;
		this.timeRemaining = totp.windowSeconds();
	}

	public synchronized void start() {
		if (ticker != null)
			return;
		ticker = Executors.newSingleThreadScheduledExecutor(r -> {
			Thread t = new Thread(r, "totp-refresher");
			t.setDaemon(true);
			return t;
		});
		ticker.scheduleAtFixedRate(this::tickSafely, 0, 1, TimeUnit.SECONDS);
		log.info("Code refresher started, window {}s", totp.windowSeconds());
	}

	@Override
	public synchronized void close() {
		if (ticker != null) {
			ticker.shutdownNow();
			ticker = null;
		}
	}

	public void addListener(Consumer<Map<String, TotpResult>> l) {
		listeners.add(l);
	}

	/** Codes by account id, as of the last refresh. */
	public Map<String, TotpResult> codes() {
		return codes;
	}

	public int timeRemaining() {
		return timeRemaining;
	}

	/**
	 * One clock reading. Returns true when the codes were regenerated, which
	 * happens on the first tick and whenever the time-step counter moves on,
	 * even if the tick that would have seen the window start was skipped.
	 */
	boolean tick() {
		Instant now = totp.now();
		timeRemaining = totp.timeRemaining(now);
		if (totp.counter(now) == lastCounter)
			return false;
		refresh(now);
		return true;
	}

	/** Regenerates every tracked account's code right away. */
	public void refreshNow() {
		refresh(totp.now());
	}

	private synchronized void refresh(Instant now) {
		Map<String, TotpResult> next = new LinkedHashMap<>();
		for (AccountRegistry.Account a : registry.list()) {
			TotpResult r = totp.generate(a.secret(), now);
			if (!r.isOk())
				log.warn("No code for account {} ({}): {}", a.id(), a.issuer(), r.status());
			next.put(a.id(), r);
		}
		codes = Collections.unmodifiableMap(next);
		timeRemaining = totp.timeRemaining(now);
		lastCounter = totp.counter(now);
		log.debug("Refreshed {} code(s), {}s left", next.size(), timeRemaining);
		for (Consumer<Map<String, TotpResult>> l : listeners) {
			try {
				l.accept(codes);
			} catch (RuntimeException e) {
				log.error("Code listener failed", e);
			}
		}
	}

	private void tickSafely() {
		// an exception would cancel the schedule
		try {
			tick();
		} catch (RuntimeException e) {
			log.error("Refresher tick failed", e);
		}
	}
}
