/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpremote.client.transport;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpremote.spec.McpSchema;
import io.mcpremote.spec.McpSchema.JSONRPCMessage;
import io.mcpremote.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Incremental decoder for a Server-Sent Events body carrying JSON-RPC messages.
 * <p>
 * Bytes are fed in chunks of arbitrary size. Only complete lines are interpreted, so the
 * decoded sequence does not depend on where the chunks were split, including splits
 * inside a multi-byte UTF-8 sequence or between {@code \r} and {@code \n}.
 * <p>
 * Each {@code data:} line is a complete payload. The {@code event:} type seen before it
 * applies to that one line only: an {@code endpoint} event announces the POST target,
 * every other payload is parsed as a single JSON-RPC message or a batch. Payloads that
 * are not JSON, {@code [DONE]} sentinels, comments and {@code id:}/{@code retry:} fields
 * are skipped. Unparseable JSON is logged and dropped.
 * <p>
 * Instances are not thread-safe; one parser serves one response body.
 */
public class SseFrameParser {

	private static final Logger logger = LoggerFactory.getLogger(SseFrameParser.class);

	public static final String ENDPOINT_EVENT_TYPE = "endpoint";

	private static final String DONE_SENTINEL = "[DONE]";

	/**
	 * Receives what the parser decodes.
	 */
	public interface FrameHandler {

		/**
		 * Called with the raw data of an {@code endpoint} event.
		 * @param endpoint the announced endpoint, absolute or relative
		 */
		void onEndpoint(String endpoint);

		/**
		 * Called for every decoded JSON-RPC message.
		 * @param message the message
		 */
		void onMessage(JSONRPCMessage message);

	}

	private final ObjectMapper objectMapper;

	private final FrameHandler handler;

	private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
		.onMalformedInput(CodingErrorAction.REPLACE)
		.onUnmappableCharacter(CodingErrorAction.REPLACE);

	private ByteBuffer undecoded = ByteBuffer.allocate(0);

	private final StringBuilder lineBuffer = new StringBuilder();

	private String currentEventType;

	private long skippedFrames;

	private boolean finished;

	public SseFrameParser(ObjectMapper objectMapper, FrameHandler handler) {
		Assert.notNull(objectMapper, "objectMapper must not be null");
		Assert.notNull(handler, "handler must not be null");
		this.objectMapper = objectMapper;
		this.handler = handler;
	}

	public void feed(byte[] chunk) {
		feed(ByteBuffer.wrap(chunk));
	}

	/**
	 * Decodes the chunk and processes every line it completes. Bytes of a trailing
	 * incomplete character are kept for the next chunk.
	 * @param chunk the next part of the body
	 */
	public void feed(ByteBuffer chunk) {
		Assert.isTrue(!this.finished, "Parser already finished");
		ByteBuffer input = chunk.slice();
		if (this.undecoded.hasRemaining()) {
			input = ByteBuffer.allocate(this.undecoded.remaining() + chunk.remaining())
				.put(this.undecoded)
				.put(chunk.slice())
				.flip();
		}
		decode(input, false);
		this.undecoded = ByteBuffer.allocate(input.remaining()).put(input).flip();
		drainCompleteLines();
	}

	/**
	 * Signals the end of the body. Whatever remains buffered is processed as a last
	 * unterminated line: a {@code data:} payload or a bare JSON document.
	 */
	public void finish() {
		if (this.finished) {
			return;
		}
		this.finished = true;
		decode(this.undecoded, true);
		CharBuffer out = CharBuffer.allocate(16);
		this.decoder.flush(out);
		this.lineBuffer.append(out.flip());
		drainCompleteLines();

		String residual = stripCarriageReturn(this.lineBuffer.toString()).trim();
		this.lineBuffer.setLength(0);
		if (residual.isEmpty()) {
			return;
		}
		if (looksLikeJson(residual)) {
			logger.debug("Parsing residual stream content as a JSON document");
			dispatchJson(residual);
		}
		else {
			processLine(residual);
		}
	}

	/**
	 * Number of payloads dropped because they were not JSON or could not be parsed.
	 */
	public long getSkippedFrames() {
		return this.skippedFrames;
	}

	private void decode(ByteBuffer input, boolean endOfInput) {
		CharBuffer out = CharBuffer.allocate((int) (input.remaining() * this.decoder.maxCharsPerByte()) + 1);
		this.decoder.decode(input, out, endOfInput);
		this.lineBuffer.append(out.flip());
	}

	private void drainCompleteLines() {
		int start = 0;
		int newline;
		while ((newline = this.lineBuffer.indexOf("\n", start)) >= 0) {
			String line = stripCarriageReturn(this.lineBuffer.substring(start, newline));
			start = newline + 1;
			processLine(line);
		}
		this.lineBuffer.delete(0, start);
	}

	private void processLine(String line) {
		if (line.isEmpty()) {
			// End of event
			this.currentEventType = null;
		}
		else if (line.startsWith("event:")) {
			this.currentEventType = line.substring("event:".length()).trim();
		}
		else if (line.startsWith("data:")) {
			String data = line.substring("data:".length()).trim();
			String eventType = this.currentEventType;
			this.currentEventType = null;
			processData(eventType, data);
		}
		else if (line.startsWith(":") || line.startsWith("id:") || line.startsWith("retry:")) {
			logger.trace("Ignoring SSE line: {}", line);
		}
		else {
			logger.debug("Ignoring unexpected SSE line: {}", line);
		}
	}

	private void processData(String eventType, String data) {
		if (ENDPOINT_EVENT_TYPE.equals(eventType)) {
			if (data.isEmpty()) {
				skip("Ignoring endpoint event without data", null);
				return;
			}
			logger.debug("Received endpoint event: {}", data);
			this.handler.onEndpoint(data);
			return;
		}
		if (data.isEmpty() || DONE_SENTINEL.equals(data)) {
			return;
		}
		if (!looksLikeJson(data)) {
			skip("Skipping non-JSON SSE data: {}", data);
			return;
		}
		dispatchJson(data);
	}

	private void dispatchJson(String json) {
		List<JSONRPCMessage> messages;
		try {
			messages = McpSchema.deserializeJsonRpcMessages(this.objectMapper, json);
		}
		catch (IOException | IllegalArgumentException e) {
			this.skippedFrames++;
			logger.warn("Dropping unparseable message: {} ({})", json, e.getMessage());
			return;
		}
		for (JSONRPCMessage message : messages) {
			this.handler.onMessage(message);
		}
	}

	private void skip(String format, String argument) {
		this.skippedFrames++;
		logger.warn(format, argument);
	}

	private static boolean looksLikeJson(String text) {
		return text.startsWith("{") || text.startsWith("[");
	}

	private static String stripCarriageReturn(String line) {
		return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
	}

}
