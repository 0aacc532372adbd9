/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpremote.client;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import io.mcpremote.client.MockMcpServer.RecordedRequest;
import io.mcpremote.spec.McpConnectionState;
import io.mcpremote.spec.McpSchema;
import io.mcpremote.spec.McpServerStatus;
import io.mcpremote.spec.McpTransportException;
import io.mcpremote.spec.NegotiatedTransport;
import io.mcpremote.spec.TransportKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Connection tests against a server that only speaks the legacy HTTP+SSE transport.
 */
class McpRemoteConnectionLegacyTests {

	private static final Duration TIMEOUT = Duration.ofSeconds(5);

	private final MockMcpServer server = new MockMcpServer(MockMcpServer.Mode.LEGACY);

	private final List<McpServerStatus> statuses = new CopyOnWriteArrayList<>();

	private McpRemoteConnection connection;

	@AfterEach
	void tearDown() {
		if (this.connection != null) {
			this.connection.disconnect();
		}
		this.server.close();
	}

	private McpRemoteConnection connection(McpConnectionConfig config) {
		this.connection = McpRemoteConnection.builder(this.server.baseUrl())
			.serverId("legacy")
			.accessToken("token-123")
			.config(config)
			.onStatusChange(this.statuses::add)
			.build();
		return this.connection;
	}

	@Test
	void fallsBackToLegacyTransportOnMethodNotAllowed() {
		connection(McpConnectionConfig.defaults()).connect().block(TIMEOUT);

		assertThat(this.connection.getStatus().state()).isEqualTo(McpConnectionState.CONNECTED);
		assertThat(this.connection.getStatus().transport()).isEqualTo(TransportKind.LEGACY_SSE);
		assertThat(this.connection.getTransport())
			.isEqualTo(new NegotiatedTransport.Legacy(URI.create(this.server.legacyEndpointUrl()), "abc123"));
		assertThat(this.connection.listTools()).hasSize(2);

		List<RecordedRequest> requests = this.server.requests();
		assertThat(requests.get(0).method()).isEqualTo("POST");
		assertThat(requests.get(0).uri()).isEqualTo("/mcp");
		assertThat(requests.get(1).method()).isEqualTo("GET");
		assertThat(requests.get(1).uri()).isEqualTo("/mcp");
		assertThat(requests.get(1).header("Accept")).isEqualTo("text/event-stream");
		assertThat(requests.get(1).header("MCP-Protocol-Version")).isEqualTo("2024-11-05");
		assertThat(requests.get(1).header("Authorization")).isEqualTo("Bearer token-123");

		List<RecordedRequest> initialize = this.server.rpcRequests(McpSchema.METHOD_INITIALIZE);
		assertThat(initialize).hasSize(2);
		assertThat(initialize.get(1).uri()).isEqualTo(MockMcpServer.LEGACY_ENDPOINT);
		assertThat(initialize.get(1).header("Mcp-Session-Id")).isNull();
		assertThat(this.server.rpcRequests(McpSchema.METHOD_TOOLS_LIST))
			.allSatisfy(request -> assertThat(request.uri()).isEqualTo(MockMcpServer.LEGACY_ENDPOINT));
	}

	@Test
	void requestsAreAnsweredOnTheEventStream() {
		connection(McpConnectionConfig.defaults()).connect().block(TIMEOUT);

		StepVerifier.create(this.connection.callTool("echo", Map.of("text", "hi")))
			.assertNext(result -> assertThat(result.content().get(0)).containsEntry("text", "echo: {text=hi}"))
			.verifyComplete();
	}

	@Test
	void serverPushedPingIsAnswered() {
		connection(McpConnectionConfig.defaults()).connect().block(TIMEOUT);

		this.server.pushToLegacyStream("event: message\ndata: {\"jsonrpc\":\"2.0\",\"id\":7,\"method\":\"ping\"}\n\n");

		await().atMost(TIMEOUT)
			.untilAsserted(() -> assertThat(this.server.clientResponses()).singleElement()
				.satisfies(response -> assertThat(response).containsEntry("id", 7).containsEntry("result", Map.of())));
	}

	@Test
	void reconnectsWithBackoffWhenTheEventStreamCloses() {
		connection(McpConnectionConfig.defaults()).connect().block(TIMEOUT);

		this.server.closeLegacyStream();

		await().atMost(TIMEOUT).until(() -> this.server.requests("GET").size() == 2);
		long closedAt = this.server.legacyStreamClosedAtNanos().get(0);
		long reopenedAt = this.server.requests("GET").get(1).receivedAtNanos();
		assertThat(Duration.ofNanos(reopenedAt - closedAt)).isGreaterThanOrEqualTo(Duration.ofMillis(500));

		await().atMost(TIMEOUT)
			.until(() -> this.connection.getStatus().state() == McpConnectionState.CONNECTED
					&& this.server.rpcRequests(McpSchema.METHOD_INITIALIZE).size() == 4
					&& this.connection.listTools().size() == 2);
		assertThat(this.statuses).extracting(McpServerStatus::state)
			.containsSubsequence(McpConnectionState.CONNECTED, McpConnectionState.ERROR,
					McpConnectionState.CONNECTING, McpConnectionState.CONNECTED);
		assertThat(this.statuses).filteredOn(status -> status.state() == McpConnectionState.ERROR)
			.first()
			.satisfies(status -> assertThat(status.error()).contains("Event stream closed unexpectedly"));
	}

	@Test
	void missingEndpointEventFailsTheHandshake() {
		this.server.sendEndpoint(false);
		McpConnectionConfig config = McpConnectionConfig.builder()
			.endpointDiscoveryTimeout(Duration.ofMillis(300))
			.maxReconnectAttempts(0)
			.build();

		StepVerifier.create(connection(config).connect())
			.expectErrorSatisfies(error -> assertThat(error).isInstanceOf(McpTransportException.class)
				.hasMessageContaining("Endpoint event not received"))
			.verify(TIMEOUT);

		assertThat(this.connection.getStatus().state()).isEqualTo(McpConnectionState.ERROR);
		assertThat(this.connection.getStatus().error()).contains("Endpoint event not received");
		await().during(Duration.ofMillis(800))
			.atMost(TIMEOUT)
			.until(() -> this.server.requests("GET").size() == 1);
	}

	@Test
	void disconnectDuringEndpointDiscoveryStopsTheAttempt() {
		this.server.sendEndpoint(false);
		connection(McpConnectionConfig.defaults());

		CompletableFuture<Void> attempt = this.connection.connect().toFuture();
		await().atMost(TIMEOUT).until(() -> this.connection.getStatus().state() == McpConnectionState.CONNECTED);

		this.connection.disconnect();

		assertThat(attempt).failsWithin(Duration.ofSeconds(2));
		assertThat(this.connection.getStatus().state()).isEqualTo(McpConnectionState.DISCONNECTED);
		assertThat(this.connection.getTransport()).isEqualTo(NegotiatedTransport.unknown());
		await().during(Duration.ofMillis(800))
			.atMost(TIMEOUT)
			.until(() -> this.server.requests("GET").size() == 1);
		assertThat(this.server.requests("DELETE")).isEmpty();
	}

}
