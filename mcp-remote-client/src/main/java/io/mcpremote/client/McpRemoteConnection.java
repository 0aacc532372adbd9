/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpremote.client;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Supplier;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpremote.client.PendingRequests.PendingRequest;
import io.mcpremote.client.transport.McpHttpTransport;
import io.mcpremote.client.transport.SseFrameParser;
import io.mcpremote.client.transport.TransportNegotiator;
import io.mcpremote.spec.McpAuthenticationException;
import io.mcpremote.spec.McpConnectionState;
import io.mcpremote.spec.McpHttpStatusException;
import io.mcpremote.spec.McpRequestTimeoutException;
import io.mcpremote.spec.McpSchema;
import io.mcpremote.spec.McpSchema.CallToolRequest;
import io.mcpremote.spec.McpSchema.CallToolResult;
import io.mcpremote.spec.McpSchema.ClientCapabilities;
import io.mcpremote.spec.McpSchema.InitializeRequest;
import io.mcpremote.spec.McpSchema.InitializeResult;
import io.mcpremote.spec.McpSchema.JSONRPCMessage;
import io.mcpremote.spec.McpSchema.JSONRPCNotification;
import io.mcpremote.spec.McpSchema.JSONRPCRequest;
import io.mcpremote.spec.McpSchema.JSONRPCResponse;
import io.mcpremote.spec.McpSchema.ListToolsResult;
import io.mcpremote.spec.McpSchema.PaginatedRequest;
import io.mcpremote.spec.McpSchema.Tool;
import io.mcpremote.spec.McpServerStatus;
import io.mcpremote.spec.McpTransportException;
import io.mcpremote.spec.McpTransportSession;
import io.mcpremote.spec.NegotiatedTransport;
import io.mcpremote.spec.TransportKind;
import io.mcpremote.util.Assert;
import io.mcpremote.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.util.annotation.Nullable;

/**
 * A connection to one remote MCP server.
 * <p>
 * The connection negotiates the transport on {@link #connect()}, performs the
 * {@code initialize} handshake, discovers the server's tools and then keeps the session
 * alive: connection-scoped failures move it to {@link McpConnectionState#ERROR} and
 * schedule a reconnect with exponential backoff, authentication failures move it to
 * {@link McpConnectionState#NEEDS_AUTH} or {@link McpConnectionState#INVALID_TOKEN} and
 * wait for the caller. Only {@link #disconnect()} leads back to
 * {@link McpConnectionState#DISCONNECTED}.
 * <p>
 * Requests may be sent concurrently. Each is answered through the {@link Mono} returned
 * by {@link #sendRequest(String, Object)}, whichever stream the reply arrives on.
 * <p>
 * Status and message listeners are invoked on I/O threads and must not block. Exceptions
 * they throw are logged and otherwise ignored.
 *
 * <pre>{@code
 * McpRemoteConnection connection = McpRemoteConnection.builder("https://mcp.example.com/mcp")
 * 	.serverId("example")
 * 	.accessToken(token)
 * 	.onStatusChange(status -> render(status))
 * 	.build();
 * connection.connect().block();
 * CallToolResult result = connection.callTool("search", Map.of("query", "mcp")).block();
 * }</pre>
 */
public class McpRemoteConnection {

	private static final Logger logger = LoggerFactory.getLogger(McpRemoteConnection.class);

	private static final TypeReference<ListToolsResult> LIST_TOOLS_RESULT_TYPE_REF = new TypeReference<>() {
	};

	private static final TypeReference<CallToolResult> CALL_TOOL_RESULT_TYPE_REF = new TypeReference<>() {
	};

	private static final TypeReference<Object> OBJECT_TYPE_REF = new TypeReference<>() {
	};

	private final String serverId;

	private final URI baseUri;

	private final McpConnectionConfig config;

	private final ObjectMapper objectMapper;

	private final McpHttpTransport httpTransport;

	private final TransportNegotiator negotiator;

	private final ReconnectBackoff backoff;

	private final Consumer<McpServerStatus> statusListener;

	private final Consumer<JSONRPCMessage> messageListener;

	private final PendingRequests pendingRequests = new PendingRequests();

	private final AtomicReference<McpTransportSession> activeSession = new AtomicReference<>();

	private final Object lifecycleLock = new Object();

	private volatile McpServerStatus status;

	@Nullable
	private volatile InitializeResult initializeResult;

	// guarded by lifecycleLock
	private int reconnectAttempt;

	// guarded by lifecycleLock, bumped by connect() and disconnect() to retire older
	// attempts and timers
	private long generation;

	// guarded by lifecycleLock
	@Nullable
	private Disposable reconnectTimer;

	McpRemoteConnection(String serverId, URI baseUri, McpConnectionConfig config, ObjectMapper objectMapper,
			McpHttpTransport httpTransport, Consumer<McpServerStatus> statusListener,
			Consumer<JSONRPCMessage> messageListener) {
		this.serverId = serverId;
		this.baseUri = baseUri;
		this.config = config;
		this.objectMapper = objectMapper;
		this.httpTransport = httpTransport;
		this.negotiator = new TransportNegotiator(httpTransport, baseUri, config.legacyProtocolVersion());
		this.backoff = config.backoff();
		this.statusListener = statusListener;
		this.messageListener = messageListener;
		this.status = McpServerStatus.disconnected(serverId);
	}

	public static Builder builder(String baseUrl) {
		return new Builder(baseUrl);
	}

	// --------------------------
	// Lifecycle
	// --------------------------

	/**
	 * Negotiates the transport and performs the handshake, starting from scratch. A
	 * pending reconnect is cancelled and the reconnect budget is restored.
	 * @return completes once the handshake and tool discovery are done; fails with the
	 * classified error of this attempt, while the connection keeps retrying in the
	 * background unless the error requires the caller to act
	 */
	public Mono<Void> connect() {
		return Mono.defer(() -> {
			long attemptGeneration;
			synchronized (this.lifecycleLock) {
				cancelReconnectTimer();
				this.reconnectAttempt = 0;
				attemptGeneration = ++this.generation;
			}
			return attemptConnect(attemptGeneration);
		});
	}

	/**
	 * Closes the stream, cancels every exchange and pending timer, rejects every pending
	 * request and forgets the negotiated transport. A Streamable session is terminated
	 * with a {@code DELETE} that is not awaited. Calling this again is a no-op.
	 */
	public void disconnect() {
		McpTransportSession session;
		synchronized (this.lifecycleLock) {
			cancelReconnectTimer();
			this.generation++;
			session = this.activeSession.getAndSet(null);
			if (session == null && this.status.state() == McpConnectionState.DISCONNECTED) {
				return;
			}
			if (session != null) {
				session.close();
			}
			this.initializeResult = null;
			setStatus(McpConnectionState.DISCONNECTED, null, TransportKind.UNKNOWN, List.of());
		}
		int rejected = this.pendingRequests.rejectAll(new McpTransportException("Disconnected"));
		logger.info("Disconnected from {} ({} pending requests rejected)", this.serverId, rejected);
		if (session != null) {
			terminateSession(session);
		}
	}

	/**
	 * Installs a fresh session and runs the handshake on it, unless a later
	 * {@code connect()} or {@code disconnect()} retired the given generation.
	 */
	private Mono<Void> attemptConnect(long attemptGeneration) {
		McpTransportSession session = new McpTransportSession(this.config.protocolVersion());
		McpTransportSession previous;
		synchronized (this.lifecycleLock) {
			if (this.generation != attemptGeneration) {
				logger.debug("Dropping a superseded connection attempt to {}", this.serverId);
				return Mono.error(new McpTransportException("Connection attempt was superseded"));
			}
			previous = this.activeSession.getAndSet(session);
			updateStatus(session, McpConnectionState.CONNECTING, null);
		}
		if (previous != null) {
			previous.close();
		}
		logger.info("Connecting to {} at {}", this.serverId, this.baseUri);

		PendingRequest initialize = this.pendingRequests.register(McpSchema.METHOD_INITIALIZE);
		JSONRPCRequest initializeRequest = new JSONRPCRequest(McpSchema.JSONRPC_VERSION, McpSchema.METHOD_INITIALIZE,
				initialize.id(), new InitializeRequest(this.config.protocolVersion(), ClientCapabilities.defaults(),
						this.config.clientInfo()));

		return this.negotiator.negotiate(session, initializeRequest).flatMap(negotiation -> {
			track(session, negotiation.stream().consume(frameHandler(session)), error -> handleFailure(session, error),
					() -> onStreamEnd(session));
			if (session.isClosed()) {
				return Mono.error(new McpTransportException("Connection attempt was superseded"));
			}
			updateStatus(session, McpConnectionState.CONNECTED, null);
			Mono<Void> sendInitialize = negotiation.initializeSent() ? Mono.empty()
					: session.awaitEndpoint(this.config.endpointDiscoveryTimeout())
						.flatMap(endpoint -> transmit(session, initializeRequest));
			return sendInitialize.then(this.pendingRequests.await(initialize, this.config.initializationTimeout()));
		})
			.flatMap(response -> completeHandshake(session, response))
			.or(session.whenClosed()
				.then(Mono.error(() -> new McpTransportException("Connection closed during the handshake"))))
			.doOnError(error -> {
				this.pendingRequests.reject(initialize.id(), error);
				handleFailure(session, error);
			});
	}

	private Mono<Void> completeHandshake(McpTransportSession session, JSONRPCResponse response) {
		InitializeResult result = this.objectMapper.convertValue(response.result(), InitializeResult.class);
		if (result == null) {
			return Mono.error(new McpTransportException("Server returned an empty initialize result"));
		}
		this.initializeResult = result;
		session.setProtocolVersion(result.protocolVersion());
		logger.info("Initialized {} (server: {}, protocol: {}, session: {})", this.serverId, result.serverInfo(),
				result.protocolVersion(), NegotiatedTransport.sessionId(session.transport()).orElse("none"));

		JSONRPCNotification initialized = new JSONRPCNotification(McpSchema.JSONRPC_VERSION,
				McpSchema.METHOD_NOTIFICATION_INITIALIZED, null);
		return transmit(session, initialized).then(refreshTools().onErrorResume(error -> {
			logger.error("Tool discovery failed for {}: {}", this.serverId, error.getMessage());
			return Mono.empty();
		})).then(Mono.fromRunnable(() -> {
			synchronized (this.lifecycleLock) {
				this.reconnectAttempt = 0;
			}
		}));
	}

	private void onStreamEnd(McpTransportSession session) {
		if (session.isClosed() || this.activeSession.get() != session) {
			return;
		}
		if (NegotiatedTransport.reconnectsOnStreamEnd(session.transport())) {
			logger.warn("Event stream of {} closed unexpectedly", this.serverId);
			handleFailure(session, new McpTransportException("Event stream closed unexpectedly"));
		}
		else {
			logger.debug("Response stream of {} completed", this.serverId);
		}
	}

	/**
	 * Handles a connection-scoped failure. Failures of a session that was already
	 * replaced, closed or failed are ignored.
	 */
	private void handleFailure(McpTransportSession session, Throwable error) {
		synchronized (this.lifecycleLock) {
			if (this.activeSession.get() != session || !session.close()) {
				logger.debug("Ignoring failure of a stale session of {}: {}", this.serverId, error.getMessage());
				return;
			}
			long failedGeneration = this.generation;
			String message = describe(error);
			if (error instanceof McpAuthenticationException authError) {
				logger.error("Authentication with {} failed: {}", this.serverId, message);
				updateStatus(session, authError.connectionState(), message);
				return;
			}
			logger.error("Connection to {} failed: {}", this.serverId, message);
			if (this.reconnectAttempt >= this.config.maxReconnectAttempts()) {
				updateStatus(session, McpConnectionState.ERROR,
						"Connection failed after " + this.reconnectAttempt + " reconnect attempts: " + message);
				return;
			}
			Duration delay = this.backoff.delayFor(this.reconnectAttempt);
			Optional<Duration> retryAfter = (error instanceof McpHttpStatusException statusError)
					? statusError.getRetryAfter() : Optional.empty();
			if (retryAfter.isPresent() && retryAfter.get().compareTo(delay) > 0) {
				delay = retryAfter.get();
			}
			this.reconnectAttempt++;
			updateStatus(session, McpConnectionState.ERROR, message);
			if (this.generation != failedGeneration) {
				// the status listener disconnected or reconnected
				return;
			}
			logger.info("Reconnecting to {} in {}ms (attempt {} of {})", this.serverId, delay.toMillis(),
					this.reconnectAttempt, this.config.maxReconnectAttempts());
			this.reconnectTimer = Mono.delay(delay).subscribe(tick -> reconnect(failedGeneration));
		}
	}

	private void reconnect(long timerGeneration) {
		synchronized (this.lifecycleLock) {
			if (this.generation != timerGeneration) {
				return;
			}
			this.reconnectTimer = null;
		}
		attemptConnect(timerGeneration).subscribe(null,
				error -> logger.debug("Reconnect attempt to {} failed: {}", this.serverId, error.getMessage()));
	}

	private void cancelReconnectTimer() {
		if (this.reconnectTimer != null) {
			this.reconnectTimer.dispose();
			this.reconnectTimer = null;
		}
	}

	private void terminateSession(McpTransportSession session) {
		if (!(session.transport() instanceof NegotiatedTransport.Streamable streamable)
				|| streamable.sessionId() == null) {
			return;
		}
		this.httpTransport.delete(this.baseUri, session)
			.subscribe(null, error -> logger.warn("Failed to terminate session {} of {}: {}", streamable.sessionId(),
					this.serverId, error.getMessage()));
	}

	// --------------------------
	// Requests and notifications
	// --------------------------

	/**
	 * Sends a request and waits for its reply.
	 * @param method the method name
	 * @param params the parameters, may be {@code null}
	 * @return the {@code result} of the reply; an {@link io.mcpremote.spec.McpError} if
	 * the server answered with an error, an
	 * {@link McpRequestTimeoutException} if no reply arrived in time, an
	 * {@link McpTransportException} if the request could not be delivered
	 */
	public Mono<Object> sendRequest(String method, @Nullable Object params) {
		return sendRequest(method, params, OBJECT_TYPE_REF);
	}

	/**
	 * Sends a request and converts the {@code result} of its reply.
	 * @param method the method name
	 * @param params the parameters, may be {@code null}
	 * @param resultType the type to convert the result to
	 * @return the converted result
	 */
	public <T> Mono<T> sendRequest(String method, @Nullable Object params, TypeReference<T> resultType) {
		Assert.hasText(method, "method must not be empty");
		Assert.notNull(resultType, "resultType must not be null");
		return Mono.defer(() -> {
			McpTransportSession session = this.activeSession.get();
			if (session == null || session.isClosed()) {
				return Mono.<JSONRPCResponse>error(new McpTransportException("Not connected to " + this.serverId));
			}
			PendingRequest pending = this.pendingRequests.register(method);
			JSONRPCRequest request = new JSONRPCRequest(McpSchema.JSONRPC_VERSION, method, pending.id(), params);
			logger.debug("Sending request {} ({}) to {}", pending.id(), method, this.serverId);
			Disposable exchange = track(session, transmit(session, request), error -> {
				this.pendingRequests.reject(pending.id(), error);
				onRequestFailure(session, error);
			}, () -> {
			});
			// an abandoned request gives up its response stream
			return this.pendingRequests.await(pending, this.config.requestTimeout())
				.doOnError(McpRequestTimeoutException.class, timeout -> exchange.dispose())
				.doOnCancel(exchange::dispose);
		}).handle((response, sink) -> {
			try {
				T result = this.objectMapper.convertValue(response.result(), resultType);
				if (result != null) {
					sink.next(result);
				}
			}
			catch (IllegalArgumentException e) {
				sink.error(new McpTransportException("Unexpected result for " + method, e));
			}
		});
	}

	/**
	 * Sends a notification.
	 * @param method the method name
	 * @param params the parameters, may be {@code null}
	 * @return completes once the server accepted the notification, fails if it did not
	 */
	public Mono<Void> sendNotification(String method, @Nullable Object params) {
		Assert.hasText(method, "method must not be empty");
		return Mono.defer(() -> {
			McpTransportSession session = this.activeSession.get();
			if (session == null || session.isClosed()) {
				return Mono.error(new McpTransportException("Not connected to " + this.serverId));
			}
			logger.debug("Sending notification {} to {}", method, this.serverId);
			return transmit(session, new JSONRPCNotification(McpSchema.JSONRPC_VERSION, method, params))
				.doOnError(error -> onRequestFailure(session, error));
		});
	}

	/**
	 * Calls a tool on the server.
	 * @param name the tool name
	 * @param arguments the tool arguments, may be {@code null}
	 * @return the tool result
	 */
	public Mono<CallToolResult> callTool(String name, @Nullable Map<String, Object> arguments) {
		Assert.hasText(name, "name must not be empty");
		return sendRequest(McpSchema.METHOD_TOOLS_CALL, new CallToolRequest(name, arguments),
				CALL_TOOL_RESULT_TYPE_REF);
	}

	/**
	 * Fetches every page of the tool list and publishes it on the status.
	 * @return the tools the server currently advertises
	 */
	public Mono<List<Tool>> refreshTools() {
		return fetchToolPage(null)
			.expand(page -> Utils.hasText(page.nextCursor()) ? fetchToolPage(page.nextCursor()) : Mono.empty())
			.concatMapIterable(page -> (page.tools() != null) ? page.tools() : List.<Tool>of())
			.collectList()
			.doOnNext(tools -> {
				logger.info("Discovered {} tools on {}", tools.size(), this.serverId);
				McpTransportSession session = this.activeSession.get();
				if (session != null && !session.isClosed()) {
					updateTools(session, tools);
				}
			});
	}

	private Mono<ListToolsResult> fetchToolPage(@Nullable String cursor) {
		return sendRequest(McpSchema.METHOD_TOOLS_LIST, (cursor != null) ? new PaginatedRequest(cursor) : null,
				LIST_TOOLS_RESULT_TYPE_REF);
	}

	/**
	 * A 401 on an individual request reflects on the status without tearing the session
	 * down; the caller decides whether to reconnect with a new credential.
	 */
	private void onRequestFailure(McpTransportSession session, Throwable error) {
		if (error instanceof McpAuthenticationException authError) {
			synchronized (this.lifecycleLock) {
				if (this.activeSession.get() == session && !session.isClosed()) {
					updateStatus(session, authError.connectionState(), describe(error));
				}
			}
		}
		logger.warn("Request to {} failed: {}", this.serverId, error.getMessage());
	}

	// --------------------------
	// Wire plumbing
	// --------------------------

	/**
	 * POSTs a message to the negotiated target and processes whatever the response body
	 * carries. For Legacy the target is known only once the endpoint event arrived.
	 */
	private Mono<Void> transmit(McpTransportSession session, JSONRPCMessage message) {
		return postTarget(session).flatMap(target -> this.httpTransport.post(target, session, message))
			.flatMap(this.httpTransport::requireSuccess)
			.flatMap(response -> response.consume(frameHandler(session)));
	}

	private Mono<URI> postTarget(McpTransportSession session) {
		NegotiatedTransport transport = session.transport();
		if (transport instanceof NegotiatedTransport.Legacy legacy && legacy.endpoint() == null) {
			return session.awaitEndpoint(this.config.endpointDiscoveryTimeout());
		}
		return Mono.fromCallable(() -> NegotiatedTransport.postTarget(transport, this.baseUri));
	}

	/**
	 * Subscribes to an exchange and registers it with the session, so closing the session
	 * cancels it.
	 * @return the subscription, disposing it cancels the exchange
	 */
	private Disposable track(McpTransportSession session, Mono<Void> exchange, Consumer<Throwable> onError,
			Runnable onComplete) {
		AtomicReference<Disposable> disposableRef = new AtomicReference<>();
		Disposable connection = exchange.doFinally(signal -> {
			Disposable ref = disposableRef.getAndSet(null);
			if (ref != null) {
				session.removeConnection(ref);
			}
		}).subscribe(null, onError, onComplete);
		disposableRef.set(connection);
		session.addConnection(connection);
		return connection;
	}

	private SseFrameParser.FrameHandler frameHandler(McpTransportSession session) {
		return new SseFrameParser.FrameHandler() {

			@Override
			public void onEndpoint(String endpoint) {
				handleEndpoint(session, endpoint);
			}

			@Override
			public void onMessage(JSONRPCMessage message) {
				handleInbound(session, message);
			}

		};
	}

	private void handleEndpoint(McpTransportSession session, String endpoint) {
		if (!(session.transport() instanceof NegotiatedTransport.Legacy)) {
			logger.warn("Ignoring endpoint event on a {} stream of {}", session.transport().kind().value(),
					this.serverId);
			return;
		}
		URI target;
		try {
			target = Utils.resolveUri(this.baseUri, endpoint);
		}
		catch (IllegalArgumentException e) {
			logger.warn("Ignoring malformed endpoint '{}' from {}", endpoint, this.serverId);
			return;
		}
		session.endpointDiscovered(target);
		logger.info("Message endpoint of {}: {} (session: {})", this.serverId, target,
				NegotiatedTransport.sessionId(session.transport()).orElse("none"));
	}

	private void handleInbound(McpTransportSession session, JSONRPCMessage message) {
		notifyMessageListener(message);
		if (message instanceof JSONRPCResponse response) {
			this.pendingRequests.complete(response);
		}
		else if (message instanceof JSONRPCRequest request) {
			answerServerRequest(session, request);
		}
		else if (message instanceof JSONRPCNotification notification) {
			if (McpSchema.METHOD_NOTIFICATION_TOOLS_LIST_CHANGED.equals(notification.method())) {
				logger.info("Tool list of {} changed, refreshing", this.serverId);
				refreshTools().subscribe(null,
						error -> logger.warn("Tool refresh for {} failed: {}", this.serverId, error.getMessage()));
			}
		}
	}

	private void answerServerRequest(McpTransportSession session, JSONRPCRequest request) {
		JSONRPCResponse reply;
		if (McpSchema.METHOD_PING.equals(request.method())) {
			reply = new JSONRPCResponse(McpSchema.JSONRPC_VERSION, request.id(), Map.of(), null);
		}
		else {
			logger.debug("Rejecting unsupported server request {} from {}", request.method(), this.serverId);
			reply = new JSONRPCResponse(McpSchema.JSONRPC_VERSION, request.id(), null,
					new JSONRPCResponse.JSONRPCError(McpSchema.ErrorCodes.METHOD_NOT_FOUND,
							"Method not found: " + request.method(), null));
		}
		track(session, transmit(session, reply), error -> logger.warn("Failed to answer {} request from {}: {}",
				request.method(), this.serverId, error.getMessage()), () -> {
				});
	}

	// --------------------------
	// Status
	// --------------------------

	private void updateStatus(McpTransportSession session, McpConnectionState state, @Nullable String error) {
		synchronized (this.lifecycleLock) {
			if (this.activeSession.get() != session) {
				return;
			}
			setStatus(state, error, session.transport().kind(), this.status.tools());
		}
	}

	private void updateTools(McpTransportSession session, List<Tool> tools) {
		synchronized (this.lifecycleLock) {
			if (this.activeSession.get() != session) {
				return;
			}
			McpServerStatus current = this.status;
			setStatus(current.state(), current.error(), current.transport(), tools);
		}
	}

	// guarded by lifecycleLock
	private void setStatus(McpConnectionState state, @Nullable String error, TransportKind transport,
			List<Tool> tools) {
		McpServerStatus current = this.status;
		Instant lastConnected = (state == McpConnectionState.CONNECTED && current.state() != state) ? Instant.now()
				: current.lastConnected();
		McpServerStatus next = new McpServerStatus(this.serverId, state, transport, error, lastConnected, tools);
		this.status = next;
		logger.debug("Status of {}: {}", this.serverId, state.value());
		try {
			this.statusListener.accept(next);
		}
		catch (RuntimeException e) {
			logger.error("Status listener of {} failed", this.serverId, e);
		}
	}

	private void notifyMessageListener(JSONRPCMessage message) {
		try {
			this.messageListener.accept(message);
		}
		catch (RuntimeException e) {
			logger.error("Message listener of {} failed", this.serverId, e);
		}
	}

	private static String describe(Throwable error) {
		return (error.getMessage() != null) ? error.getMessage() : error.getClass().getSimpleName();
	}

	// --------------------------
	// Accessors
	// --------------------------

	public McpServerStatus getStatus() {
		return this.status;
	}

	public String getServerId() {
		return this.serverId;
	}

	/**
	 * The tools discovered during the last successful discovery.
	 */
	public List<Tool> listTools() {
		return this.status.tools();
	}

	/**
	 * The server's reply to the last successful handshake, or {@code null} before one
	 * completed.
	 */
	@Nullable
	public InitializeResult getInitializeResult() {
		return this.initializeResult;
	}

	/**
	 * The transport negotiated for the current session.
	 */
	public NegotiatedTransport getTransport() {
		McpTransportSession session = this.activeSession.get();
		return (session != null) ? session.transport() : NegotiatedTransport.unknown();
	}

	/**
	 * Number of replies that matched no pending request: duplicates and replies that
	 * arrived after their request timed out.
	 */
	public long getUnmatchedResponseCount() {
		return this.pendingRequests.unmatchedResponseCount();
	}

	int getPendingRequestCount() {
		return this.pendingRequests.size();
	}

	/**
	 * Builder for {@link McpRemoteConnection}.
	 */
	public static class Builder {

		private final String baseUrl;

		private String serverId;

		private Supplier<String> credentialSupplier = () -> null;

		private McpConnectionConfig config = McpConnectionConfig.defaults();

		private ObjectMapper objectMapper;

		private HttpClient.Builder clientBuilder = HttpClient.newBuilder()
			.version(HttpClient.Version.HTTP_1_1)
			.connectTimeout(Duration.ofSeconds(10));

		private Consumer<HttpRequest.Builder> requestCustomizer = builder -> {
		};

		private Consumer<McpServerStatus> statusListener = status -> {
		};

		private Consumer<JSONRPCMessage> messageListener = message -> {
		};

		private Builder(String baseUrl) {
			Assert.hasText(baseUrl, "baseUrl must not be empty");
			this.baseUrl = baseUrl;
		}

		/**
		 * Opaque identifier used in logs and on the status. Defaults to the base URL.
		 */
		public Builder serverId(String serverId) {
			Assert.hasText(serverId, "serverId must not be empty");
			this.serverId = serverId;
			return this;
		}

		/**
		 * A fixed bearer credential.
		 */
		public Builder accessToken(String accessToken) {
			Assert.notNull(accessToken, "accessToken must not be null");
			this.credentialSupplier = () -> accessToken;
			return this;
		}

		/**
		 * Supplies the bearer credential for every request, so a refreshed credential is
		 * picked up by the next request or connect attempt. A blank credential sends no
		 * {@code Authorization} header.
		 */
		public Builder credentialSupplier(Supplier<String> credentialSupplier) {
			Assert.notNull(credentialSupplier, "credentialSupplier must not be null");
			this.credentialSupplier = credentialSupplier;
			return this;
		}

		public Builder config(McpConnectionConfig config) {
			Assert.notNull(config, "config must not be null");
			this.config = config;
			return this;
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "objectMapper must not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		public Builder clientBuilder(HttpClient.Builder clientBuilder) {
			Assert.notNull(clientBuilder, "clientBuilder must not be null");
			this.clientBuilder = clientBuilder;
			return this;
		}

		/**
		 * Applied to every outgoing HTTP request, after the protocol headers were set.
		 */
		public Builder customizeRequest(Consumer<HttpRequest.Builder> requestCustomizer) {
			Assert.notNull(requestCustomizer, "requestCustomizer must not be null");
			this.requestCustomizer = requestCustomizer;
			return this;
		}

		/**
		 * Invoked with a fresh snapshot on every status transition.
		 */
		public Builder onStatusChange(Consumer<McpServerStatus> statusListener) {
			Assert.notNull(statusListener, "statusListener must not be null");
			this.statusListener = statusListener;
			return this;
		}

		/**
		 * Invoked with every inbound message, replies included.
		 */
		public Builder onMessage(Consumer<JSONRPCMessage> messageListener) {
			Assert.notNull(messageListener, "messageListener must not be null");
			this.messageListener = messageListener;
			return this;
		}

		public McpRemoteConnection build() {
			URI baseUri = URI.create(this.baseUrl);
			Assert.isTrue(baseUri.isAbsolute(), "baseUrl must be absolute");
			ObjectMapper mapper = (this.objectMapper != null) ? this.objectMapper : new ObjectMapper();
			McpHttpTransport httpTransport = new McpHttpTransport(this.clientBuilder.build(), mapper,
					this.credentialSupplier, this.config.sessionHeaderName(), this.requestCustomizer);
			String id = (this.serverId != null) ? this.serverId : this.baseUrl;
			return new McpRemoteConnection(id, baseUri, this.config, mapper, httpTransport, this.statusListener,
					this.messageListener);
		}

	}

}
