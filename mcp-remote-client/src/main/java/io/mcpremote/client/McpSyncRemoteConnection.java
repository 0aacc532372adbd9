/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpremote.client;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;
import io.mcpremote.spec.McpSchema.CallToolResult;
import io.mcpremote.spec.McpSchema.InitializeResult;
import io.mcpremote.spec.McpSchema.Tool;
import io.mcpremote.spec.McpServerStatus;
import io.mcpremote.spec.NegotiatedTransport;
import io.mcpremote.util.Assert;
import reactor.util.annotation.Nullable;

/**
 * A blocking facade over {@link McpRemoteConnection}. Each call blocks until the
 * underlying operation completes and rethrows its failure unchanged.
 */
public class McpSyncRemoteConnection implements AutoCloseable {

	private final McpRemoteConnection delegate;

	public McpSyncRemoteConnection(McpRemoteConnection delegate) {
		Assert.notNull(delegate, "delegate must not be null");
		this.delegate = delegate;
	}

	public void connect() {
		this.delegate.connect().block();
	}

	public void disconnect() {
		this.delegate.disconnect();
	}

	@Override
	public void close() {
		disconnect();
	}

	@Nullable
	public Object sendRequest(String method, @Nullable Object params) {
		return this.delegate.sendRequest(method, params).block();
	}

	@Nullable
	public <T> T sendRequest(String method, @Nullable Object params, TypeReference<T> resultType) {
		return this.delegate.sendRequest(method, params, resultType).block();
	}

	public void sendNotification(String method, @Nullable Object params) {
		this.delegate.sendNotification(method, params).block();
	}

	public CallToolResult callTool(String name, @Nullable Map<String, Object> arguments) {
		return this.delegate.callTool(name, arguments).block();
	}

	public List<Tool> listTools() {
		return this.delegate.listTools();
	}

	public List<Tool> refreshTools() {
		return this.delegate.refreshTools().block();
	}

	public McpServerStatus getStatus() {
		return this.delegate.getStatus();
	}

	@Nullable
	public InitializeResult getInitializeResult() {
		return this.delegate.getInitializeResult();
	}

	public NegotiatedTransport getTransport() {
		return this.delegate.getTransport();
	}

	public long getUnmatchedResponseCount() {
		return this.delegate.getUnmatchedResponseCount();
	}

	/**
	 * The wrapped asynchronous connection.
	 */
	public McpRemoteConnection async() {
		return this.delegate;
	}

}
