package org.secureauth.common;

import java.util.List;

public final class ApiModels {
	// Requests
	public record SecretReq(String secret) {
	}

	public record AddAccountReq(String issuer, String secret) {
	}

	public record DeleteAccountReq(String id) {
	}

	// Responses
	public record CodeResp(String status, String code, String display, int timeRemaining, int period) {
	}

	public record ValidateResp(boolean valid) {
	}

	public record AccountView(String id, String issuer, String accountName, String code, String display,
							  long addedAt) {
	}

	public record AccountsResp(int timeRemaining, int period, List<AccountView> accounts) {
	}

	public record OkResp(boolean ok) {
	}

	public record ErrorResp(String error) {
	}
}
