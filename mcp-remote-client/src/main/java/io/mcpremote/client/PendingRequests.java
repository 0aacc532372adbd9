/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpremote.client;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

import io.mcpremote.spec.McpError;
import io.mcpremote.spec.McpRequestTimeoutException;
import io.mcpremote.spec.McpSchema.JSONRPCResponse;
import io.mcpremote.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.util.annotation.Nullable;

/**
 * Correlates replies with outstanding requests.
 * <p>
 * Identifiers increase monotonically for the lifetime of the instance and are never
 * reused, reconnects included. An entry leaves the map exactly once: when its reply
 * arrives, when its timeout elapses, when its caller cancels, or when it is rejected. A
 * reply whose id has no entry is counted and dropped.
 */
public class PendingRequests {

	private static final Logger logger = LoggerFactory.getLogger(PendingRequests.class);

	private final AtomicLong nextId = new AtomicLong(1);

	private final Map<Long, PendingRequest> pending = new ConcurrentHashMap<>();

	private final AtomicLong unmatchedResponses = new AtomicLong();

	/**
	 * An outstanding request. Completed at most once.
	 */
	public static final class PendingRequest {

		private final long id;

		private final String method;

		private final Instant createdAt = Instant.now();

		private final Sinks.One<JSONRPCResponse> sink = Sinks.one();

		private PendingRequest(long id, String method) {
			this.id = id;
			this.method = method;
		}

		public long id() {
			return this.id;
		}

		public String method() {
			return this.method;
		}

		public Instant createdAt() {
			return this.createdAt;
		}

	}

	/**
	 * Allocates the next identifier and registers an entry for it.
	 * @param method the request method, kept for diagnostics
	 * @return the registered entry
	 */
	public PendingRequest register(String method) {
		Assert.hasText(method, "method must not be empty");
		PendingRequest request = new PendingRequest(this.nextId.getAndIncrement(), method);
		this.pending.put(request.id(), request);
		return request;
	}

	/**
	 * Waits for the reply to a registered request.
	 * @param request the entry returned by {@link #register(String)}
	 * @param timeout how long to wait
	 * @return the successful response; an {@link McpError} if the server replied with an
	 * error, an {@link McpRequestTimeoutException} if no reply arrived in time
	 */
	public Mono<JSONRPCResponse> await(PendingRequest request, Duration timeout) {
		return request.sink.asMono()
			.timeout(timeout)
			.onErrorMap(TimeoutException.class, e -> {
				this.pending.remove(request.id(), request);
				logger.warn("Request {} ({}) timed out after {}ms", request.id(), request.method(),
						timeout.toMillis());
				return new McpRequestTimeoutException(request.id(), request.method(), timeout);
			})
			.doOnCancel(() -> this.pending.remove(request.id(), request));
	}

	/**
	 * Settles the entry matching the response id.
	 * @param response a response received from the server
	 * @return {@code true} if a pending entry matched
	 */
	public boolean complete(JSONRPCResponse response) {
		Long id = normalizeId(response.id());
		PendingRequest request = (id != null) ? this.pending.remove(id) : null;
		if (request == null) {
			long count = this.unmatchedResponses.incrementAndGet();
			logger.warn("Dropping response with unknown id {} ({} unmatched so far)", response.id(), count);
			return false;
		}
		logger.debug("Completing request {} ({})", request.id(), request.method());
		if (response.error() != null) {
			request.sink.tryEmitError(new McpError(response.error()));
		}
		else {
			request.sink.tryEmitValue(response);
		}
		return true;
	}

	/**
	 * Rejects a single entry, if still pending.
	 * @return {@code true} if the entry was pending
	 */
	public boolean reject(long id, Throwable error) {
		PendingRequest request = this.pending.remove(id);
		if (request == null) {
			return false;
		}
		request.sink.tryEmitError(error);
		return true;
	}

	/**
	 * Rejects every entry pending at the time of the call.
	 * @param error the error each entry fails with
	 * @return the number of rejected entries
	 */
	public int rejectAll(Throwable error) {
		int rejected = 0;
		for (Long id : this.pending.keySet()) {
			if (reject(id, error)) {
				rejected++;
			}
		}
		return rejected;
	}

	public boolean isPending(long id) {
		return this.pending.containsKey(id);
	}

	public int size() {
		return this.pending.size();
	}

	public long unmatchedResponseCount() {
		return this.unmatchedResponses.get();
	}

	/**
	 * Maps a reply id onto a request id. Only integral values match: a fractional id
	 * such as {@code 1.9} matches nothing.
	 */
	@Nullable
	static Long normalizeId(@Nullable Object id) {
		if (id instanceof Integer || id instanceof Long || id instanceof Short || id instanceof Byte) {
			return ((Number) id).longValue();
		}
		if (id instanceof BigInteger big) {
			return (big.bitLength() < Long.SIZE) ? big.longValue() : null;
		}
		if (id instanceof BigDecimal decimal) {
			try {
				return decimal.longValueExact();
			}
			catch (ArithmeticException e) {
				return null;
			}
		}
		if (id instanceof Number number) {
			double value = number.doubleValue();
			return (value == Math.rint(value) && !Double.isInfinite(value)) ? (long) value : null;
		}
		if (id instanceof String text) {
			try {
				return Long.parseLong(text.trim());
			}
			catch (NumberFormatException e) {
				return null;
			}
		}
		return null;
	}

}
