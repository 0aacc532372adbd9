/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpremote.util;

import java.net.URI;
import java.net.URISyntaxException;

import reactor.util.annotation.Nullable;

/**
 * Miscellaneous utility methods.
 *
 * @author Christian Tzolov
 */
public final class Utils {

	private Utils() {
	}

	/**
	 * Check whether the given {@code String} contains actual <em>text</em>.
	 * <p>
	 * More specifically, this method returns {@code true} if the {@code String} is not
	 * {@code null}, its length is greater than 0, and it contains at least one
	 * non-whitespace character.
	 * @param str the {@code String} to check (may be {@code null})
	 * @return {@code true} if the {@code String} is not {@code null}, its length is
	 * greater than 0, and it does not contain whitespace only
	 * @see Character#isWhitespace
	 */
	public static boolean hasText(@Nullable String str) {
		return (str != null && !str.isBlank());
	}

	/**
	 * Resolves the given endpoint against the base URI. Absolute endpoints are returned
	 * unchanged, endpoints starting with {@code /} replace the path of the base URI.
	 * @param baseUri the base URI
	 * @param endpoint the endpoint to resolve, absolute or relative
	 * @return the resolved URI
	 */
	public static URI resolveUri(URI baseUri, String endpoint) {
		URI endpointUri = URI.create(endpoint);
		if (endpointUri.isAbsolute()) {
			return endpointUri;
		}
		if (baseUri.getRawPath() == null || baseUri.getRawPath().isEmpty()) {
			// URI#resolve drops the separator when the base has no path
			baseUri = baseUri.resolve("/");
		}
		return baseUri.resolve(endpointUri);
	}

	/**
	 * Extracts the value of the {@code sessionId} query parameter from a URL or a
	 * relative reference such as {@code /messages?sessionId=abc}.
	 * @param urlStr the URL or relative reference
	 * @return the session id, or {@code null} when absent or not parseable
	 */
	@Nullable
	public static String getSessionIdFromUrl(String urlStr) {
		URI uri;
		try {
			uri = new URI(urlStr);
		}
		catch (URISyntaxException e) {
			return null;
		}
		String query = uri.getQuery();
		if (query == null) {
			return null;
		}
		for (String pair : query.split("&")) {
			int idx = pair.indexOf('=');
			String key = (idx > 0) ? pair.substring(0, idx) : pair;
			if ("sessionId".equals(key) && idx > 0 && pair.length() > idx + 1) {
				return pair.substring(idx + 1);
			}
		}
		return null;
	}

}
