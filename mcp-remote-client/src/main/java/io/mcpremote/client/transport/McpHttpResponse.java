/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpremote.client.transport;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Flow;
import java.util.function.Function;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpremote.spec.McpSchema;
import io.mcpremote.spec.McpSchema.JSONRPCMessage;
import io.mcpremote.util.Utils;
import org.reactivestreams.FlowAdapters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * An HTTP response whose headers have arrived and whose body has not been read yet. The
 * body can be consumed exactly once.
 */
public class McpHttpResponse {

	private static final Logger logger = LoggerFactory.getLogger(McpHttpResponse.class);

	private final HttpResponse<Flow.Publisher<List<ByteBuffer>>> response;

	private final ObjectMapper objectMapper;

	McpHttpResponse(HttpResponse<Flow.Publisher<List<ByteBuffer>>> response, ObjectMapper objectMapper) {
		this.response = response;
		this.objectMapper = objectMapper;
	}

	public int statusCode() {
		return this.response.statusCode();
	}

	public boolean isSuccessful() {
		return this.response.statusCode() >= 200 && this.response.statusCode() < 300;
	}

	public Optional<String> header(String name) {
		return this.response.headers().firstValue(name);
	}

	public String contentType() {
		return header(McpHttpTransport.CONTENT_TYPE).orElse("");
	}

	/**
	 * The raw body chunks as delivered by the HTTP client. Cancelling the subscription
	 * closes the underlying stream.
	 */
	public Flux<ByteBuffer> body() {
		return Flux.from(FlowAdapters.toPublisher(this.response.body())).concatMapIterable(Function.identity());
	}

	public Mono<String> bodyAsString() {
		return body().collect(ByteArrayOutputStream::new, (out, buffer) -> {
			byte[] bytes = new byte[buffer.remaining()];
			buffer.get(bytes);
			out.write(bytes, 0, bytes.length);
		}).map(out -> out.toString(StandardCharsets.UTF_8));
	}

	/**
	 * Reads the body according to its content type and hands every decoded message to
	 * the handler. A JSON document body is parsed once complete; any other body,
	 * including an empty one, goes through the {@link SseFrameParser}.
	 * @param handler receives endpoint announcements and messages
	 * @return completes when the body ends
	 */
	public Mono<Void> consume(SseFrameParser.FrameHandler handler) {
		if (contentType().contains(McpHttpTransport.APPLICATION_JSON)) {
			return bodyAsString().doOnNext(json -> dispatchDocument(json, handler)).then();
		}
		return Mono.defer(() -> {
			SseFrameParser parser = new SseFrameParser(this.objectMapper, handler);
			return body().doOnNext(parser::feed).then(Mono.fromRunnable(parser::finish));
		});
	}

	/**
	 * Reads and drops the body so the connection can be reused.
	 */
	public Mono<Void> discard() {
		return body().then();
	}

	private void dispatchDocument(String json, SseFrameParser.FrameHandler handler) {
		if (!Utils.hasText(json)) {
			return;
		}
		List<JSONRPCMessage> messages;
		try {
			messages = McpSchema.deserializeJsonRpcMessages(this.objectMapper, json);
		}
		catch (IOException | IllegalArgumentException e) {
			logger.warn("Dropping unparseable JSON response body: {} ({})", json, e.getMessage());
			return;
		}
		messages.forEach(handler::onMessage);
	}

}
