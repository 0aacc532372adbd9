/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpremote.client.transport;

import java.time.Duration;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpremote.spec.McpCredentialRejectedException;
import io.mcpremote.spec.McpHttpStatusException;
import io.mcpremote.spec.McpInvalidTokenException;
import io.mcpremote.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.util.annotation.Nullable;

/**
 * Turns a non-successful HTTP response into the matching exception.
 * <ul>
 * <li>401 with {@code error=invalid_token} and a description mentioning an invalid token
 * format: {@link McpInvalidTokenException}</li>
 * <li>any other 401: {@link McpCredentialRejectedException}</li>
 * <li>429: retryable, honouring {@code Retry-After} (60 seconds when absent)</li>
 * <li>anything else: {@link McpHttpStatusException}</li>
 * </ul>
 */
public class McpHttpErrorClassifier {

	private static final Logger logger = LoggerFactory.getLogger(McpHttpErrorClassifier.class);

	public static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(60);

	static final String INVALID_TOKEN_ERROR = "invalid_token";

	static final String INVALID_TOKEN_FORMAT = "Invalid token format";

	private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
	};

	private final ObjectMapper objectMapper;

	public McpHttpErrorClassifier(ObjectMapper objectMapper) {
		Assert.notNull(objectMapper, "objectMapper must not be null");
		this.objectMapper = objectMapper;
	}

	/**
	 * @param statusCode the HTTP status, not 2xx
	 * @param body the response body, possibly empty
	 * @param retryAfterHeader the raw {@code Retry-After} header value
	 * @return the exception describing the failure
	 */
	public McpHttpStatusException classify(int statusCode, String body, @Nullable String retryAfterHeader) {
		String responseBody = (body != null) ? body : "";
		if (statusCode == 401) {
			return classifyUnauthorized(responseBody);
		}
		if (statusCode == 429) {
			Duration retryAfter = parseRetryAfter(retryAfterHeader);
			return new McpHttpStatusException("Rate limit exceeded, retry after " + retryAfter.toSeconds() + "s", 429,
					responseBody, retryAfter);
		}
		if (statusCode == 403) {
			return new McpHttpStatusException(
					"Access forbidden (quota exceeded or insufficient scopes): " + responseBody, 403, responseBody,
					null);
		}
		if (statusCode >= 500) {
			return new McpHttpStatusException("Server error " + statusCode + ": " + responseBody, statusCode,
					responseBody, null);
		}
		return new McpHttpStatusException(statusCode, responseBody);
	}

	private McpHttpStatusException classifyUnauthorized(String body) {
		Map<String, Object> error = parseErrorBody(body);
		Object code = error.get("error");
		Object description = error.get("error_description");
		if (INVALID_TOKEN_ERROR.equals(code) && description instanceof String text
				&& text.contains(INVALID_TOKEN_FORMAT)) {
			return new McpInvalidTokenException(body);
		}
		return new McpCredentialRejectedException(body);
	}

	private Map<String, Object> parseErrorBody(String body) {
		if (body.isBlank()) {
			return Map.of();
		}
		try {
			Map<String, Object> parsed = this.objectMapper.readValue(body, MAP_TYPE_REF);
			return (parsed != null) ? parsed : Map.of();
		}
		catch (JsonProcessingException e) {
			logger.debug("401 body is not a JSON error object: {}", body);
			return Map.of();
		}
	}

	/**
	 * Parses a {@code Retry-After} value given in seconds.
	 * @param header the header value, may be {@code null}
	 * @return the delay, {@link #DEFAULT_RETRY_AFTER} when absent or not a number
	 */
	static Duration parseRetryAfter(@Nullable String header) {
		if (header == null || header.isBlank()) {
			return DEFAULT_RETRY_AFTER;
		}
		try {
			long seconds = Long.parseLong(header.trim());
			return (seconds >= 0) ? Duration.ofSeconds(seconds) : DEFAULT_RETRY_AFTER;
		}
		catch (NumberFormatException e) {
			logger.debug("Unsupported Retry-After value '{}', using the default", header);
			return DEFAULT_RETRY_AFTER;
		}
	}

}
