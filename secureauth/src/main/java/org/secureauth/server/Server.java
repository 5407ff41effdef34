package org.secureauth.server;

import org.secureauth.common.ApiModels.*;
import org.secureauth.common.SecretValidator;
import org.secureauth.common.TotpResult;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import com.sun.net.httpserver.*;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.net.*;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.*;

/**
 * JSON API over the TOTP engine and the in-memory account list.
 */
public final class Server {
	private static final Logger log = LoggerFactory.getLogger(Server.class);
	private static final Gson gson = new Gson();

	private final int port;
	private final TotpService totp;
	private final AccountRegistry accounts;
	private final CodeRefresher refresher;
	private HttpServer http;

	public Server(int port, TotpService totp, AccountRegistry accounts, CodeRefresher refresher) {
		this.port = port;
		this.totp = totp;
		this.accounts = accounts;
		this.refresher = refresher;
	}

	public static void main(String[] args) throws Exception {
		int port = Integer.getInteger("port", 8080);
		int window = Integer.getInteger("totp.window", TotpService.DEFAULT_WINDOW);
		Clock clock = Clock.systemUTC();
		TotpService totp = new TotpService(clock, window);
		AccountRegistry accounts = new AccountRegistry(clock);
		CodeRefresher refresher = new CodeRefresher(accounts, totp);

		Server s = new Server(port, totp, accounts, refresher);
		Runtime.getRuntime().addShutdownHook(new Thread(s::stop, "server-shutdown"));
		s.start();
	}

	/** Binds and starts serving; returns the bound port (useful with port 0). */
	public synchronized int start() throws IOException {
		http = HttpServer.create(new InetSocketAddress(port), 0);
		http.createContext("/code", j("POST", this::doCode));
		http.createContext("/validate", j("POST", this::doValidate));
		http.createContext("/accounts/delete", j("POST", this::doDelete));
		http.createContext("/accounts", j(null, this::doAccounts));
		http.setExecutor(null);
		http.start();
		refresher.start();
		int bound = http.getAddress().getPort();
		log.info("Server listening on port {} (window {}s)", bound, totp.windowSeconds());
		return bound;
	}

	public synchronized void stop() {
		refresher.close();
		if (http != null) {
			http.stop(0);
			http = null;
			log.info("Server stopped");
		}
	}

	private void doCode(HttpExchange ex) throws IOException {
		SecretReq req = read(ex, SecretReq.class);
		TotpResult r = totp.generate(req.secret());
		send(ex, 200, gson.toJson(new CodeResp(r.status().name(), r.render(), r.display(),
				totp.timeRemaining(), totp.windowSeconds())));
	}

	private void doValidate(HttpExchange ex) throws IOException {
		SecretReq req = read(ex, SecretReq.class);
		send(ex, 200, gson.toJson(new ValidateResp(SecretValidator.isValidBase32(req.secret()))));
	}

	private void doAccounts(HttpExchange ex) throws IOException {
		// the context matches any path under /accounts
		if (!"/accounts".equals(ex.getRequestURI().getPath())) {
			send(ex, 404, gson.toJson(new ErrorResp("not found")));
			return;
		}
		switch (ex.getRequestMethod()) {
		case "GET" -> listAccounts(ex);
		case "POST" -> addAccount(ex);
		default -> send(ex, 405, gson.toJson(new ErrorResp("method not allowed")));
		}
	}

	private void listAccounts(HttpExchange ex) throws IOException {
		Map<String, TotpResult> codes = refresher.codes();
		List<AccountView> views = new ArrayList<>();
		for (AccountRegistry.Account a : accounts.list())
			views.add(view(a, codes.get(a.id())));
		send(ex, 200, gson.toJson(new AccountsResp(refresher.timeRemaining(), totp.windowSeconds(), views)));
	}

	private void addAccount(HttpExchange ex) throws IOException {
		AddAccountReq req = read(ex, AddAccountReq.class);
		AccountRegistry.Account a;
		try {
			a = accounts.add(req.issuer(), req.secret());
		} catch (IllegalArgumentException e) {
			send(ex, 400, gson.toJson(new ErrorResp(e.getMessage())));
			return;
		}
		log.info("Account added: {} ({})", a.issuer(), a.id());
		refresher.refreshNow();
		send(ex, 200, gson.toJson(view(a, refresher.codes().get(a.id()))));
	}

	private void doDelete(HttpExchange ex) throws IOException {
		DeleteAccountReq req = read(ex, DeleteAccountReq.class);
		if (!accounts.remove(req.id())) {
			send(ex, 404, gson.toJson(new ErrorResp("account not found")));
			return;
		}
		log.info("Account removed: {}", req.id());
		refresher.refreshNow();
		send(ex, 200, gson.toJson(new OkResp(true)));
	}

	private static AccountView view(AccountRegistry.Account a, TotpResult r) {
		// account added after the last refresh
		if (r == null)
			return new AccountView(a.id(), a.issuer(), a.accountName(), null, TotpResult.PLACEHOLDER, a.addedAt());
		return new AccountView(a.id(), a.issuer(), a.accountName(), r.render(), r.display(), a.addedAt());
	}

	// util
	private static <T> T read(HttpExchange ex, Class<T> cls) throws IOException {
		try (Reader r = new InputStreamReader(ex.getRequestBody(), StandardCharsets.UTF_8)) {
			T body = gson.fromJson(r, cls);
			if (body == null)
				throw new BadRequest("request body is required");
			return body;
		} catch (JsonParseException e) {
			throw new BadRequest("malformed JSON: " + e.getMessage());
		}
	}

	private static void send(HttpExchange ex, int code, String body) throws IOException {
		ex.getResponseHeaders().add("Content-Type", "application/json; charset=utf-8");
		byte[] b = body.getBytes(StandardCharsets.UTF_8);
		ex.sendResponseHeaders(code, b.length);
		try (OutputStream os = ex.getResponseBody()) {
			os.write(b);
		}
	}

	private static HttpHandler j(String method, ThrowingHandler h) {
		return ex -> {
			try {
				if (method != null && !method.equals(ex.getRequestMethod())) {
					send(ex, 405, gson.toJson(new ErrorResp("method not allowed")));
					return;
				}
				h.handle(ex);
			} catch (BadRequest e) {
				send(ex, 400, gson.toJson(new ErrorResp(e.getMessage())));
			} catch (Exception e) {
				log.error("Request {} {} failed", ex.getRequestMethod(), ex.getRequestURI(), e);
				send(ex, 500, gson.toJson(new ErrorResp(e.getClass().getSimpleName() + ": " + e.getMessage())));
			}
		};
	}

	@FunctionalInterface private interface ThrowingHandler {
		void handle(HttpExchange ex) throws Exception;
	}

	private static final class BadRequest extends IOException {
		BadRequest(String message) {
			super(message);
		}
	}
}
