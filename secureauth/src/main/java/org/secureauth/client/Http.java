package org.secureauth.client;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.secureauth.common.ApiModels.ErrorResp;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * Thin JSON client for the TOTP server. Non-2xx answers become IOExceptions
 * carrying the server's error message.
 */
public final class Http {
	private static final Gson gson = new Gson();
	private final HttpClient hc;
	private final String base;

	public Http(String base) {
		this(base, HttpClient.newHttpClient());
	}

	Http(String base, HttpClient hc) {
		this.base = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
		this.hc = hc;
	}

	public String base() {
		return base;
	}

	public <T> T post(String path, Object body, Class<T> respType) throws IOException, InterruptedException {
		HttpRequest r = HttpRequest.newBuilder(URI.create(base + path))
				.header("Content-Type", "application/json")
				.POST(HttpRequest.BodyPublishers.ofString(gson.toJson(body)))
				.build();
		return exchange(r, respType);
	}

	public <T> T get(String path, Class<T> respType) throws IOException, InterruptedException {
		return exchange(HttpRequest.newBuilder(URI.create(base + path)).GET().build(), respType);
	}

	private <T> T exchange(HttpRequest req, Class<T> respType) throws IOException, InterruptedException {
		HttpResponse<String> r = hc.send(req, HttpResponse.BodyHandlers.ofString());
		if (r.statusCode() >= 200 && r.statusCode() < 300)
			return gson.fromJson(r.body(), respType);
		throw new IOException("HTTP " + r.statusCode() + ": " + errorMessage(r.body()));
	}

	private static String errorMessage(String body) {
		try {
			ErrorResp e = gson.fromJson(body, ErrorResp.class);
			if (e != null && e.error() != null)
				return e.error();
		} catch (JsonParseException ignored) {
			// not JSON, fall through to the raw body
		}
		return body;
	}
}
