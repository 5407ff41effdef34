package org.secureauth.client;

import org.secureauth.common.ApiModels.*;
import org.secureauth.common.SecretValidator;

import java.util.*;

public final class Client {
	private static final Scanner in = new Scanner(System.in);

	public static void main(String[] args) throws Exception {
		String base = System.getProperty("server", "http://localhost:8080");
		Http http = new Http(base);
		System.out.println("Connected to: " + http.base());

		while (true) {
			System.out.println("\n[1] Add account [2] List codes [3] Remove account [4] Code for secret"
					+ " [5] Validate secret [0] Exit");
			System.out.print("> ");
			if (!in.hasNextLine())
				return;
			String op = in.nextLine().trim();
			try {
				switch (op) {
				case "1" -> addAccount(http);
				case "2" -> listCodes(http);
				case "3" -> removeAccount(http);
				case "4" -> codeForSecret(http);
				case "5" -> validate(http);
				case "0" -> {
					return;
				}
				default -> System.out.println("Invalid option");
				}
			} catch (Exception e) {
				System.out.println("Error: " + e.getMessage());
			}
		}
	}

	private static void addAccount(Http http) throws Exception {
		System.out.print("Issuer (e.g. Google, GitHub): ");
		String issuer = in.nextLine();
		System.out.print("Secret (Base32, e.g. JBSWY3DPEHPK3PXP): ");
		String secret = in.nextLine();
		// fail fast before the round trip; the server checks again
		if (!SecretValidator.isValidBase32(secret)) {
			System.out.println("Secret is not a valid Base32 string");
			return;
		}
		AccountView a = http.post("/accounts", new AddAccountReq(issuer, secret), AccountView.class);
		System.out.println("Added " + a.issuer() + " -> " + a.display());
	}

	private static void listCodes(Http http) throws Exception {
		AccountsResp r = http.get("/accounts", AccountsResp.class);
		if (r.accounts().isEmpty()) {
			System.out.println("No accounts yet. Use [1] to add one.");
			return;
		}
		for (AccountView a : r.accounts())
			System.out.printf("%-20s %s   (%s)%n", a.issuer(), a.display(), a.id());
		System.out.println("Refreshes in " + r.timeRemaining() + "s (every " + r.period() + "s)");
	}

	private static void removeAccount(Http http) throws Exception {
		System.out.print("Account id: ");
		String id = in.nextLine().trim();
		http.post("/accounts/delete", new DeleteAccountReq(id), OkResp.class);
		System.out.println("Removed.");
	}

	private static void codeForSecret(Http http) throws Exception {
		System.out.print("Secret: ");
		CodeResp r = http.post("/code", new SecretReq(in.nextLine()), CodeResp.class);
		switch (r.status()) {
		case "OK" -> System.out.println("Code: " + r.display() + " (" + r.timeRemaining() + "s left)");
		case "EMPTY_KEY" -> System.out.println("Nothing decodable in that secret (" + r.code() + ")");
		default -> System.out.println("Could not compute a code (" + r.code() + ")");
		}
	}

	private static void validate(Http http) throws Exception {
		System.out.print("Secret: ");
		ValidateResp r = http.post("/validate", new SecretReq(in.nextLine()), ValidateResp.class);
		System.out.println(r.valid() ? "Valid Base32 secret" : "Not a valid Base32 secret");
	}
}
