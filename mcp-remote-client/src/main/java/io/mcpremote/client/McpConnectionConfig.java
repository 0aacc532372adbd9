/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpremote.client;

import java.time.Duration;

import io.mcpremote.spec.HttpHeaders;
import io.mcpremote.spec.McpSchema;
import io.mcpremote.spec.ProtocolVersions;
import io.mcpremote.util.Assert;

/**
 * Tunable timeouts, backoff parameters and protocol identity of a remote connection.
 * Instances are immutable; use {@link #builder()} to derive one from the defaults.
 */
public final class McpConnectionConfig {

	private static final McpConnectionConfig DEFAULTS = builder().build();

	private final Duration requestTimeout;

	private final Duration initializationTimeout;

	private final Duration endpointDiscoveryTimeout;

	private final Duration reconnectMinDelay;

	private final double reconnectMultiplier;

	private final Duration reconnectMaxDelay;

	private final int maxReconnectAttempts;

	private final String protocolVersion;

	private final String legacyProtocolVersion;

	private final McpSchema.Implementation clientInfo;

	private final String sessionHeaderName;

	private McpConnectionConfig(Builder builder) {
		this.requestTimeout = builder.requestTimeout;
		this.initializationTimeout = builder.initializationTimeout;
		this.endpointDiscoveryTimeout = builder.endpointDiscoveryTimeout;
		this.reconnectMinDelay = builder.reconnectMinDelay;
		this.reconnectMultiplier = builder.reconnectMultiplier;
		this.reconnectMaxDelay = builder.reconnectMaxDelay;
		this.maxReconnectAttempts = builder.maxReconnectAttempts;
		this.protocolVersion = builder.protocolVersion;
		this.legacyProtocolVersion = builder.legacyProtocolVersion;
		this.clientInfo = builder.clientInfo;
		this.sessionHeaderName = builder.sessionHeaderName;
	}

	public static McpConnectionConfig defaults() {
		return DEFAULTS;
	}

	public static Builder builder() {
		return new Builder();
	}

	public Duration requestTimeout() {
		return this.requestTimeout;
	}

	public Duration initializationTimeout() {
		return this.initializationTimeout;
	}

	public Duration endpointDiscoveryTimeout() {
		return this.endpointDiscoveryTimeout;
	}

	public Duration reconnectMinDelay() {
		return this.reconnectMinDelay;
	}

	public double reconnectMultiplier() {
		return this.reconnectMultiplier;
	}

	public Duration reconnectMaxDelay() {
		return this.reconnectMaxDelay;
	}

	public int maxReconnectAttempts() {
		return this.maxReconnectAttempts;
	}

	public String protocolVersion() {
		return this.protocolVersion;
	}

	public String legacyProtocolVersion() {
		return this.legacyProtocolVersion;
	}

	public McpSchema.Implementation clientInfo() {
		return this.clientInfo;
	}

	public String sessionHeaderName() {
		return this.sessionHeaderName;
	}

	public ReconnectBackoff backoff() {
		return new ReconnectBackoff(this.reconnectMinDelay, this.reconnectMultiplier, this.reconnectMaxDelay);
	}

	public static final class Builder {

		private Duration requestTimeout = Duration.ofSeconds(30);

		private Duration initializationTimeout = Duration.ofSeconds(10);

		private Duration endpointDiscoveryTimeout = Duration.ofSeconds(10);

		private Duration reconnectMinDelay = Duration.ofMillis(500);

		private double reconnectMultiplier = 2.0;

		private Duration reconnectMaxDelay = Duration.ofSeconds(30);

		private int maxReconnectAttempts = 5;

		private String protocolVersion = ProtocolVersions.MCP_2025_06_18;

		private String legacyProtocolVersion = ProtocolVersions.MCP_2024_11_05;

		private McpSchema.Implementation clientInfo = new McpSchema.Implementation("mcp-remote-client", "0.1.0");

		private String sessionHeaderName = HttpHeaders.MCP_SESSION_ID;

		private Builder() {
		}

		/**
		 * How long a request waits for its reply.
		 */
		public Builder requestTimeout(Duration requestTimeout) {
			Assert.isTrue(isPositive(requestTimeout), "requestTimeout must be positive");
			this.requestTimeout = requestTimeout;
			return this;
		}

		/**
		 * How long the handshake waits for the {@code initialize} reply.
		 */
		public Builder initializationTimeout(Duration initializationTimeout) {
			Assert.isTrue(isPositive(initializationTimeout), "initializationTimeout must be positive");
			this.initializationTimeout = initializationTimeout;
			return this;
		}

		/**
		 * How long the legacy transport waits for the {@code endpoint} event.
		 */
		public Builder endpointDiscoveryTimeout(Duration endpointDiscoveryTimeout) {
			Assert.isTrue(isPositive(endpointDiscoveryTimeout), "endpointDiscoveryTimeout must be positive");
			this.endpointDiscoveryTimeout = endpointDiscoveryTimeout;
			return this;
		}

		public Builder reconnectMinDelay(Duration reconnectMinDelay) {
			Assert.isTrue(isPositive(reconnectMinDelay), "reconnectMinDelay must be positive");
			this.reconnectMinDelay = reconnectMinDelay;
			return this;
		}

		public Builder reconnectMultiplier(double reconnectMultiplier) {
			Assert.isTrue(reconnectMultiplier >= 1.0, "reconnectMultiplier must be at least 1");
			this.reconnectMultiplier = reconnectMultiplier;
			return this;
		}

		public Builder reconnectMaxDelay(Duration reconnectMaxDelay) {
			Assert.isTrue(isPositive(reconnectMaxDelay), "reconnectMaxDelay must be positive");
			this.reconnectMaxDelay = reconnectMaxDelay;
			return this;
		}

		/**
		 * Consecutive failed attempts after which reconnection stops. Zero disables
		 * automatic reconnection.
		 */
		public Builder maxReconnectAttempts(int maxReconnectAttempts) {
			Assert.isTrue(maxReconnectAttempts >= 0, "maxReconnectAttempts must not be negative");
			this.maxReconnectAttempts = maxReconnectAttempts;
			return this;
		}

		public Builder protocolVersion(String protocolVersion) {
			Assert.hasText(protocolVersion, "protocolVersion must not be empty");
			this.protocolVersion = protocolVersion;
			return this;
		}

		public Builder legacyProtocolVersion(String legacyProtocolVersion) {
			Assert.hasText(legacyProtocolVersion, "legacyProtocolVersion must not be empty");
			this.legacyProtocolVersion = legacyProtocolVersion;
			return this;
		}

		public Builder clientInfo(McpSchema.Implementation clientInfo) {
			Assert.notNull(clientInfo, "clientInfo must not be null");
			this.clientInfo = clientInfo;
			return this;
		}

		/**
		 * Name of the header carrying the Streamable session id.
		 */
		public Builder sessionHeaderName(String sessionHeaderName) {
			Assert.hasText(sessionHeaderName, "sessionHeaderName must not be empty");
			this.sessionHeaderName = sessionHeaderName;
			return this;
		}

		public McpConnectionConfig build() {
			Assert.isTrue(this.reconnectMaxDelay.compareTo(this.reconnectMinDelay) >= 0,
					"reconnectMaxDelay must not be smaller than reconnectMinDelay");
			return new McpConnectionConfig(this);
		}

		private static boolean isPositive(Duration duration) {
			return duration != null && !duration.isNegative() && !duration.isZero();
		}

	}

}
