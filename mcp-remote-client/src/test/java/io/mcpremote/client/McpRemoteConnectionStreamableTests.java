/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpremote.client;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;

import io.mcpremote.client.MockMcpServer.RecordedRequest;
import io.mcpremote.spec.McpConnectionState;
import io.mcpremote.spec.McpError;
import io.mcpremote.spec.McpRequestTimeoutException;
import io.mcpremote.spec.McpSchema;
import io.mcpremote.spec.McpSchema.CallToolResult;
import io.mcpremote.spec.McpSchema.JSONRPCMessage;
import io.mcpremote.spec.McpSchema.JSONRPCNotification;
import io.mcpremote.spec.McpSchema.Tool;
import io.mcpremote.spec.McpServerStatus;
import io.mcpremote.spec.McpTransportException;
import io.mcpremote.spec.NegotiatedTransport;
import io.mcpremote.spec.TransportKind;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Connection tests against a server speaking the Streamable HTTP transport.
 */
class McpRemoteConnectionStreamableTests {

	private static final Duration TIMEOUT = Duration.ofSeconds(5);

	private MockMcpServer server;

	private McpRemoteConnection connection;

	private final List<McpServerStatus> statuses = new CopyOnWriteArrayList<>();

	private final List<JSONRPCMessage> inbound = new CopyOnWriteArrayList<>();

	@AfterEach
	void tearDown() {
		if (this.connection != null) {
			this.connection.disconnect();
		}
		if (this.server != null) {
			this.server.close();
		}
	}

	private McpRemoteConnection connect(MockMcpServer.Mode mode) {
		return connect(mode, McpConnectionConfig.defaults());
	}

	private McpRemoteConnection connect(MockMcpServer.Mode mode, McpConnectionConfig config) {
		this.server = new MockMcpServer(mode);
		this.connection = McpRemoteConnection.builder(this.server.baseUrl())
			.serverId("streamable")
			.accessToken("token-123")
			.config(config)
			.onStatusChange(this.statuses::add)
			.onMessage(this.inbound::add)
			.build();
		return this.connection;
	}

	@Test
	void negotiatesStreamableAndDiscoversTools() {
		connect(MockMcpServer.Mode.STREAMABLE_JSON).connect().block(TIMEOUT);

		McpServerStatus status = this.connection.getStatus();
		assertThat(status.state()).isEqualTo(McpConnectionState.CONNECTED);
		assertThat(status.transport()).isEqualTo(TransportKind.STREAMABLE);
		assertThat(status.error()).isNull();
		assertThat(status.lastConnected()).isNotNull();
		assertThat(status.tools()).extracting(Tool::name).containsExactly("echo", "add");
		assertThat(this.connection.listTools()).isEqualTo(status.tools());
		assertThat(this.connection.getTransport()).isEqualTo(new NegotiatedTransport.Streamable("xyz"));
		assertThat(this.connection.getInitializeResult().serverInfo().name()).isEqualTo("mock-server");

		assertThat(this.statuses).extracting(McpServerStatus::state)
			.startsWith(McpConnectionState.CONNECTING, McpConnectionState.CONNECTED);
		assertThat(this.server.requests("GET")).isEmpty();
	}

	@Test
	void handshakeCarriesProtocolHeaders() {
		connect(MockMcpServer.Mode.STREAMABLE_JSON).connect().block(TIMEOUT);

		RecordedRequest initialize = this.server.rpcRequests(McpSchema.METHOD_INITIALIZE).get(0);
		assertThat(initialize.header("Accept")).contains("text/event-stream").contains("application/json");
		assertThat(initialize.header("Content-Type")).isEqualTo("application/json");
		assertThat(initialize.header("MCP-Protocol-Version")).isEqualTo("2025-06-18");
		assertThat(initialize.header("Authorization")).isEqualTo("Bearer token-123");
		assertThat(initialize.header("Mcp-Session-Id")).isNull();

		RecordedRequest initialized = this.server.rpcRequests(McpSchema.METHOD_NOTIFICATION_INITIALIZED).get(0);
		assertThat(initialized.header("Mcp-Session-Id")).isEqualTo("xyz");
		assertThat(initialized.body()).doesNotContain("\"id\"");
		assertThat(this.server.rpcRequests(McpSchema.METHOD_TOOLS_LIST)).singleElement()
			.satisfies(request -> assertThat(request.header("Mcp-Session-Id")).isEqualTo("xyz"));
	}

	@Test
	void usesConfiguredSessionHeader() {
		McpConnectionConfig config = McpConnectionConfig.builder().sessionHeaderName("Session-Id").build();
		connect(MockMcpServer.Mode.STREAMABLE_JSON, config);
		this.server.sessionHeader("Session-Id", "xyz");

		this.connection.connect().block(TIMEOUT);

		assertThat(this.connection.getTransport()).isEqualTo(new NegotiatedTransport.Streamable("xyz"));
		assertThat(this.server.rpcRequests(McpSchema.METHOD_TOOLS_LIST).get(0).header("Session-Id"))
			.isEqualTo("xyz");
	}

	@Test
	void sessionlessServerGetsNoSessionHeader() {
		connect(MockMcpServer.Mode.STREAMABLE_JSON);
		this.server.sessionHeader("Mcp-Session-Id", null);

		this.connection.connect().block(TIMEOUT);

		assertThat(this.connection.getTransport()).isEqualTo(new NegotiatedTransport.Streamable(null));
		assertThat(this.server.rpcRequests(McpSchema.METHOD_TOOLS_LIST).get(0).header("Mcp-Session-Id")).isNull();

		this.connection.disconnect();
		await().during(Duration.ofMillis(300)).atMost(TIMEOUT).until(() -> this.server.requests("DELETE").isEmpty());
	}

	@Test
	void repliesInEventStreamBodiesResolveRequests() {
		connect(MockMcpServer.Mode.STREAMABLE_SSE).connect().block(TIMEOUT);

		StepVerifier.create(this.connection.callTool("echo", Map.of("text", "hi")))
			.assertNext(result -> {
				assertThat(result.isError()).isFalse();
				assertThat(result.content()).singleElement()
					.satisfies(content -> assertThat(content).containsEntry("text", "echo: {text=hi}"));
			})
			.verifyComplete();
		assertThat(this.connection.getStatus().tools()).hasSize(2);
	}

	@Test
	void concurrentRequestsResolveWithTheirOwnReplies() {
		connect(MockMcpServer.Mode.STREAMABLE_SSE).connect().block(TIMEOUT);

		List<String> texts = Flux.range(0, 20)
			.flatMap(i -> this.connection.callTool("echo", Map.of("n", i))
				.map(result -> String.valueOf(result.content().get(0)) + "|" + i))
			.collectList()
			.block(TIMEOUT);

		assertThat(texts).hasSize(20).allSatisfy(text -> {
			String[] parts = text.split("\\|");
			assertThat(parts[0]).contains("n=" + parts[1] + "}");
		});
		assertThat(this.connection.getPendingRequestCount()).isZero();
	}

	@Test
	void pagesThroughTheToolList() {
		connect(MockMcpServer.Mode.STREAMABLE_JSON);
		this.server.tools(List.of(MockMcpServer.tool("a"), MockMcpServer.tool("b"), MockMcpServer.tool("c")))
			.toolPageSize(1);

		this.connection.connect().block(TIMEOUT);

		assertThat(this.connection.listTools()).extracting(Tool::name).containsExactly("a", "b", "c");
		assertThat(this.server.rpcRequests(McpSchema.METHOD_TOOLS_LIST)).hasSize(3);
	}

	@Test
	void errorReplySurfacesAsMcpError() {
		connect(MockMcpServer.Mode.STREAMABLE_JSON).connect().block(TIMEOUT);

		StepVerifier.create(this.connection.callTool("fail", Map.of()))
			.expectErrorSatisfies(error -> {
				assertThat(error).isInstanceOf(McpError.class).hasMessage("Tool failed");
				assertThat(((McpError) error).getCode()).isEqualTo(McpSchema.ErrorCodes.INVALID_PARAMS);
			})
			.verify(TIMEOUT);
		assertThat(this.connection.getStatus().state()).isEqualTo(McpConnectionState.CONNECTED);
	}

	@Test
	void unansweredRequestTimesOutWithoutAffectingTheConnection() {
		McpConnectionConfig config = McpConnectionConfig.builder().requestTimeout(Duration.ofMillis(300)).build();
		connect(MockMcpServer.Mode.STREAMABLE_JSON, config);
		this.server.silence(McpSchema.METHOD_TOOLS_CALL);
		this.connection.connect().block(TIMEOUT);

		StepVerifier.create(this.connection.callTool("echo", Map.of()))
			.expectErrorSatisfies(error -> assertThat(error).isInstanceOf(McpRequestTimeoutException.class)
				.hasMessageContaining(McpSchema.METHOD_TOOLS_CALL))
			.verify(TIMEOUT);
		assertThat(this.connection.getPendingRequestCount()).isZero();
		assertThat(this.connection.getStatus().state()).isEqualTo(McpConnectionState.CONNECTED);
	}

	@Test
	void timedOutRequestClosesItsResponseStream() {
		McpConnectionConfig config = McpConnectionConfig.builder().requestTimeout(Duration.ofMillis(300)).build();
		connect(MockMcpServer.Mode.STREAMABLE_SSE, config).connect().block(TIMEOUT);

		StepVerifier.create(this.connection.callTool(MockMcpServer.HOLD_TOOL, Map.of()))
			.expectError(McpRequestTimeoutException.class)
			.verify(TIMEOUT);

		await().atMost(TIMEOUT)
			.until(() -> this.server.closedHeldStreams() == 1 && this.server.openHeldStreams() == 0);
		assertThat(this.connection.getPendingRequestCount()).isZero();
		assertThat(this.connection.getStatus().state()).isEqualTo(McpConnectionState.CONNECTED);
		assertThat(this.connection.listTools()).hasSize(2);
	}

	@Test
	void cancelledRequestClosesItsResponseStream() {
		connect(MockMcpServer.Mode.STREAMABLE_SSE).connect().block(TIMEOUT);

		Disposable call = this.connection.callTool(MockMcpServer.HOLD_TOOL, Map.of()).subscribe();
		await().atMost(TIMEOUT).until(() -> this.server.openHeldStreams() == 1);
		call.dispose();

		await().atMost(TIMEOUT)
			.until(() -> this.server.closedHeldStreams() == 1 && this.server.openHeldStreams() == 0);
		assertThat(this.connection.getPendingRequestCount()).isZero();
		assertThat(this.connection.getStatus().state()).isEqualTo(McpConnectionState.CONNECTED);
	}

	@Test
	void completedResponseStreamDoesNotReconnect() {
		connect(MockMcpServer.Mode.STREAMABLE_SSE).connect().block(TIMEOUT);

		await().during(Duration.ofMillis(1200))
			.atMost(TIMEOUT)
			.until(() -> this.server.rpcRequests(McpSchema.METHOD_INITIALIZE).size() == 1);
		assertThat(this.connection.getStatus().state()).isEqualTo(McpConnectionState.CONNECTED);
		assertThat(this.statuses).extracting(McpServerStatus::state).doesNotContain(McpConnectionState.ERROR);
	}

	@Test
	void toolListChangedNotificationRefreshesTools() {
		connect(MockMcpServer.Mode.STREAMABLE_SSE).connect().block(TIMEOUT);

		this.connection.callTool("mutate", Map.of()).block(TIMEOUT);

		await().atMost(TIMEOUT)
			.untilAsserted(() -> assertThat(this.connection.listTools()).extracting(Tool::name)
				.containsExactly("echo", "add", "added"));
		assertThat(this.inbound).filteredOn(JSONRPCNotification.class::isInstance)
			.extracting(message -> ((JSONRPCNotification) message).method())
			.contains(McpSchema.METHOD_NOTIFICATION_TOOLS_LIST_CHANGED);
	}

	@Test
	void answersServerRequests() {
		connect(MockMcpServer.Mode.STREAMABLE_SSE).connect().block(TIMEOUT);

		this.connection.callTool("ping-me", Map.of()).block(TIMEOUT);

		await().atMost(TIMEOUT).untilAsserted(() -> assertThat(this.server.clientResponses()).hasSize(2));
		Map<String, Object> pong = this.server.clientResponses()
			.stream()
			.filter(response -> "srv-1".equals(response.get("id")))
			.findFirst()
			.orElseThrow();
		assertThat(pong).containsEntry("result", Map.of());
		Map<String, Object> rejected = this.server.clientResponses()
			.stream()
			.filter(response -> "srv-2".equals(response.get("id")))
			.findFirst()
			.orElseThrow();
		assertThat(rejected.get("error")).asInstanceOf(InstanceOfAssertFactories.MAP)
			.containsEntry("code", McpSchema.ErrorCodes.METHOD_NOT_FOUND);
	}

	@Test
	void unmatchedReplyIsCountedAndForwarded() {
		connect(MockMcpServer.Mode.STREAMABLE_SSE).connect().block(TIMEOUT);

		CallToolResult result = this.connection.callTool("duplicate", Map.of()).block(TIMEOUT);

		assertThat(result).isNotNull();
		assertThat(this.connection.getUnmatchedResponseCount()).isEqualTo(1);
		assertThat(this.inbound).filteredOn(McpSchema.JSONRPCResponse.class::isInstance)
			.extracting(message -> ((McpSchema.JSONRPCResponse) message).id())
			.contains(9999);
	}

	@Test
	void disconnectRejectsPendingRequestsAndTerminatesTheSession() {
		connect(MockMcpServer.Mode.STREAMABLE_JSON);
		this.server.silence(McpSchema.METHOD_TOOLS_CALL);
		this.connection.connect().block(TIMEOUT);

		CompletableFuture<CallToolResult> call = this.connection.callTool("echo", Map.of()).toFuture();
		await().atMost(TIMEOUT).until(() -> this.connection.getPendingRequestCount() == 1);

		this.connection.disconnect();
		this.connection.disconnect();

		assertThat(call).failsWithin(TIMEOUT)
			.withThrowableOfType(ExecutionException.class)
			.withCauseInstanceOf(McpTransportException.class)
			.withMessageContaining("Disconnected");
		assertThat(this.connection.getStatus().state()).isEqualTo(McpConnectionState.DISCONNECTED);
		assertThat(this.connection.getStatus().tools()).isEmpty();
		assertThat(this.connection.getTransport()).isEqualTo(NegotiatedTransport.unknown());
		assertThat(this.connection.getInitializeResult()).isNull();
		assertThat(this.statuses).filteredOn(status -> status.state() == McpConnectionState.DISCONNECTED)
			.hasSize(1);

		await().atMost(TIMEOUT).untilAsserted(() -> assertThat(this.server.requests("DELETE")).singleElement()
			.satisfies(request -> assertThat(request.header("Mcp-Session-Id")).isEqualTo("xyz")));
	}

	@Test
	void requestsFailWhenNotConnected() {
		connect(MockMcpServer.Mode.STREAMABLE_JSON);

		StepVerifier.create(this.connection.callTool("echo", Map.of()))
			.expectErrorSatisfies(error -> assertThat(error).isInstanceOf(McpTransportException.class)
				.hasMessage("Not connected to streamable"))
			.verify(TIMEOUT);
		StepVerifier.create(this.connection.sendNotification("notifications/progress", null))
			.expectError(McpTransportException.class)
			.verify(TIMEOUT);
		assertThat(this.server.requests()).isEmpty();
	}

	@Test
	void connectAgainAfterDisconnectStartsANewSession() {
		connect(MockMcpServer.Mode.STREAMABLE_JSON).connect().block(TIMEOUT);
		this.connection.disconnect();

		this.connection.connect().block(TIMEOUT);

		assertThat(this.connection.getStatus().state()).isEqualTo(McpConnectionState.CONNECTED);
		assertThat(this.server.rpcRequests(McpSchema.METHOD_INITIALIZE)).hasSize(2);
		RecordedRequest secondInitialize = this.server.rpcRequests(McpSchema.METHOD_INITIALIZE).get(1);
		assertThat(secondInitialize.header("Mcp-Session-Id")).isNull();
	}

	@Test
	void requestCustomizerAndBlankCredential() {
		this.server = new MockMcpServer(MockMcpServer.Mode.STREAMABLE_JSON);
		this.connection = McpRemoteConnection.builder(this.server.baseUrl())
			.credentialSupplier(() -> " ")
			.customizeRequest(builder -> builder.header("X-Client", "tests"))
			.build();

		this.connection.connect().block(TIMEOUT);

		assertThat(this.connection.getServerId()).isEqualTo(this.server.baseUrl());
		assertThat(this.server.requests()).allSatisfy(request -> {
			assertThat(request.header("Authorization")).isNull();
			assertThat(request.header("X-Client")).isEqualTo("tests");
		});
	}

}
