/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpremote.client;

import java.time.Duration;

import io.mcpremote.util.Assert;

/**
 * Exponential backoff: the delay before attempt {@code n} (counting from zero) is
 * {@code min(maxDelay, minDelay * multiplier^n)}. Delays never decrease with the attempt
 * number and never exceed {@code maxDelay}.
 */
public final class ReconnectBackoff {

	private final Duration minDelay;

	private final double multiplier;

	private final Duration maxDelay;

	public ReconnectBackoff(Duration minDelay, double multiplier, Duration maxDelay) {
		Assert.notNull(minDelay, "minDelay must not be null");
		Assert.notNull(maxDelay, "maxDelay must not be null");
		Assert.isTrue(multiplier >= 1.0, "multiplier must be at least 1");
		Assert.isTrue(maxDelay.compareTo(minDelay) >= 0, "maxDelay must not be smaller than minDelay");
		this.minDelay = minDelay;
		this.multiplier = multiplier;
		this.maxDelay = maxDelay;
	}

	public Duration delayFor(int attempt) {
		Assert.isTrue(attempt >= 0, "attempt must not be negative");
		double millis = this.minDelay.toMillis() * Math.pow(this.multiplier, attempt);
		if (Double.isInfinite(millis) || millis >= this.maxDelay.toMillis()) {
			return this.maxDelay;
		}
		return Duration.ofMillis((long) millis);
	}

}
