package com.github.mangstadt.projectchat.server;

import java.net.URI;
import java.nio.charset.StandardCharsets;

import org.apache.http.client.utils.URLEncodedUtils;

/**
 * Reads bearer credentials from handshake and request data.
 */
final class BearerToken {
	private static final String PREFIX = "Bearer ";

	/**
	 * Reads the credential from an "Authorization" header value.
	 * @param header the header value (may be null or empty)
	 * @return the credential or null if the header is not a bearer credential
	 */
	static String fromHeader(String header) {
		if (header == null || !header.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
			return null;
		}

		var token = header.substring(PREFIX.length()).trim();
		return token.isEmpty() ? null : token;
	}

	/**
	 * Reads the credential from the "token" query parameter of a request URI.
	 * @param requestUri the request URI (e.g. "/chat?token=abc")
	 * @return the credential or null if there is no such parameter
	 */
	static String fromQuery(String requestUri) {
		if (requestUri == null) {
			return null;
		}

		URI uri;
		try {
			uri = URI.create(requestUri);
		} catch (IllegalArgumentException e) {
			return null;
		}

		//@formatter:off
		return URLEncodedUtils.parse(uri, StandardCharsets.UTF_8).stream()
			.filter(param -> "token".equals(param.getName()))
			.map(param -> param.getValue())
			.filter(value -> value != null && !value.isEmpty())
		.findFirst().orElse(null);
		//@formatter:on
	}

	private BearerToken() {
		//hide constructor
	}
}
