/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpremote.client.transport;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.concurrent.Flow;
import java.util.function.Consumer;
import java.util.function.Supplier;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpremote.spec.HttpHeaders;
import io.mcpremote.spec.McpSchema.JSONRPCMessage;
import io.mcpremote.spec.McpTransportException;
import io.mcpremote.spec.McpTransportSession;
import io.mcpremote.spec.NegotiatedTransport;
import io.mcpremote.util.Assert;
import io.mcpremote.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * The HTTP exchanges a remote connection performs, on top of the JDK
 * {@link HttpClient}. Every request carries the bearer credential, the protocol version
 * and, once a Streamable session exists, the session header; the request customizer runs
 * last.
 * <p>
 * Responses are returned as soon as their headers arrive. Non-2xx responses are turned
 * into exceptions by {@link #requireSuccess(McpHttpResponse)}.
 */
public class McpHttpTransport {

	private static final Logger logger = LoggerFactory.getLogger(McpHttpTransport.class);

	public static final String APPLICATION_JSON = "application/json";

	public static final String TEXT_EVENT_STREAM = "text/event-stream";

	static final String CONTENT_TYPE = HttpHeaders.CONTENT_TYPE;

	private final HttpClient httpClient;

	private final ObjectMapper objectMapper;

	private final Supplier<String> credentialSupplier;

	private final String sessionHeaderName;

	private final Consumer<HttpRequest.Builder> requestCustomizer;

	private final McpHttpErrorClassifier errorClassifier;

	public McpHttpTransport(HttpClient httpClient, ObjectMapper objectMapper, Supplier<String> credentialSupplier,
			String sessionHeaderName, Consumer<HttpRequest.Builder> requestCustomizer) {
		Assert.notNull(httpClient, "httpClient must not be null");
		Assert.notNull(objectMapper, "objectMapper must not be null");
		Assert.notNull(credentialSupplier, "credentialSupplier must not be null");
		Assert.hasText(sessionHeaderName, "sessionHeaderName must not be empty");
		Assert.notNull(requestCustomizer, "requestCustomizer must not be null");
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
		this.credentialSupplier = credentialSupplier;
		this.sessionHeaderName = sessionHeaderName;
		this.requestCustomizer = requestCustomizer;
		this.errorClassifier = new McpHttpErrorClassifier(objectMapper);
	}

	public String sessionHeaderName() {
		return this.sessionHeaderName;
	}

	/**
	 * POSTs a JSON-RPC message.
	 * @param uri the POST target
	 * @param session the session whose headers apply
	 * @param message the message to send
	 * @return the response, whatever its status
	 */
	public Mono<McpHttpResponse> post(URI uri, McpTransportSession session, JSONRPCMessage message) {
		return Mono.defer(() -> {
			String json;
			try {
				json = this.objectMapper.writeValueAsString(message);
			}
			catch (IOException e) {
				return Mono.error(new McpTransportException("Failed to serialize message", e));
			}
			logger.debug("POST {}: {}", uri, json);
			HttpRequest request = newRequest(uri, session)
				.header(HttpHeaders.CONTENT_TYPE, APPLICATION_JSON)
				.header(HttpHeaders.ACCEPT, TEXT_EVENT_STREAM + ", " + APPLICATION_JSON)
				.POST(HttpRequest.BodyPublishers.ofString(json))
				.build();
			return send(request);
		});
	}

	/**
	 * Opens a long-lived event stream with a GET.
	 * @param uri the stream endpoint
	 * @param session the session whose headers apply
	 * @return the response, whatever its status
	 */
	public Mono<McpHttpResponse> openStream(URI uri, McpTransportSession session) {
		return Mono.defer(() -> {
			logger.debug("GET {}", uri);
			HttpRequest request = newRequest(uri, session).header(HttpHeaders.ACCEPT, TEXT_EVENT_STREAM)
				.GET()
				.build();
			return send(request);
		});
	}

	/**
	 * Asks the server to terminate a session.
	 * @param uri the base endpoint
	 * @param session the session to terminate
	 * @return completes once the server answered; a 405 means the server does not allow
	 * clients to terminate sessions and is not an error
	 */
	public Mono<Void> delete(URI uri, McpTransportSession session) {
		return Mono.defer(() -> {
			logger.debug("DELETE {}", uri);
			HttpRequest request = newRequest(uri, session).DELETE().build();
			return send(request);
		}).flatMap(response -> {
			if (response.statusCode() == 405) {
				return response.discard();
			}
			return requireSuccess(response).flatMap(McpHttpResponse::discard);
		});
	}

	/**
	 * Passes successful responses through. For any other status the body is read and
	 * the classified exception is signalled.
	 * @param response the response
	 * @return the same response, or an error
	 */
	public Mono<McpHttpResponse> requireSuccess(McpHttpResponse response) {
		if (response.isSuccessful()) {
			return Mono.just(response);
		}
		return response.bodyAsString()
			.defaultIfEmpty("")
			.onErrorReturn("")
			.flatMap(body -> Mono.error(this.errorClassifier.classify(response.statusCode(), body,
					response.header(HttpHeaders.RETRY_AFTER).orElse(null))));
	}

	HttpRequest.Builder newRequest(URI uri, McpTransportSession session) {
		HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
			.header(HttpHeaders.CACHE_CONTROL, "no-cache")
			.header(HttpHeaders.MCP_PROTOCOL_VERSION, session.protocolVersion());
		String credential = this.credentialSupplier.get();
		if (Utils.hasText(credential)) {
			builder.header(HttpHeaders.AUTHORIZATION, "Bearer " + credential);
		}
		NegotiatedTransport.sessionHeaderValue(session.transport())
			.ifPresent(id -> builder.header(this.sessionHeaderName, id));
		this.requestCustomizer.accept(builder);
		return builder;
	}

	private Mono<McpHttpResponse> send(HttpRequest request) {
		return Mono
			.fromFuture(() -> this.httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofPublisher()))
			.map(this::wrap)
			.onErrorMap(e -> !(e instanceof McpTransportException),
					e -> new McpTransportException("HTTP " + request.method() + " " + request.uri() + " failed", e));
	}

	private McpHttpResponse wrap(HttpResponse<Flow.Publisher<List<ByteBuffer>>> response) {
		logger.debug("{} {} -> {}", response.request().method(), response.uri(), response.statusCode());
		return new McpHttpResponse(response, this.objectMapper);
	}

}
