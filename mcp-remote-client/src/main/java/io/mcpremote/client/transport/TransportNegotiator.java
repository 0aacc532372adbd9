/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcpremote.client.transport;

import java.net.URI;

import io.mcpremote.spec.McpSchema.JSONRPCRequest;
import io.mcpremote.spec.McpTransportSession;
import io.mcpremote.spec.NegotiatedTransport;
import io.mcpremote.util.Assert;
import io.mcpremote.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Finds out which transport a server speaks, in at most two round trips.
 * <p>
 * The {@code initialize} request is POSTed to the base endpoint first. A 2xx answer means
 * the Streamable transport: the response body carries the reply and the session id, if
 * any, comes from the session header. A 405 means the server only speaks the legacy
 * HTTP+SSE transport: a GET opens the event stream, and the {@code initialize} request
 * has to be sent again once the stream announced its endpoint. Any other status fails
 * the negotiation with the classified HTTP error.
 */
public class TransportNegotiator {

	private static final Logger logger = LoggerFactory.getLogger(TransportNegotiator.class);

	private final McpHttpTransport httpTransport;

	private final URI baseUri;

	private final String legacyProtocolVersion;

	/**
	 * The outcome of a negotiation.
	 *
	 * @param transport the negotiated transport, also stored on the session
	 * @param stream the response whose body carries inbound traffic: the reply to the
	 * {@code initialize} POST, or the Legacy event stream
	 * @param initializeSent whether the {@code initialize} request reached the server,
	 * {@code false} for Legacy where it has to be POSTed to the announced endpoint
	 */
	public record Negotiation(NegotiatedTransport transport, McpHttpResponse stream, boolean initializeSent) {
	}

	public TransportNegotiator(McpHttpTransport httpTransport, URI baseUri, String legacyProtocolVersion) {
		Assert.notNull(httpTransport, "httpTransport must not be null");
		Assert.notNull(baseUri, "baseUri must not be null");
		Assert.hasText(legacyProtocolVersion, "legacyProtocolVersion must not be empty");
		this.httpTransport = httpTransport;
		this.baseUri = baseUri;
		this.legacyProtocolVersion = legacyProtocolVersion;
	}

	/**
	 * @param session a fresh session, updated with the negotiated transport
	 * @param initializeRequest the handshake request
	 * @return the negotiation outcome, or the classified failure
	 */
	public Mono<Negotiation> negotiate(McpTransportSession session, JSONRPCRequest initializeRequest) {
		return this.httpTransport.post(this.baseUri, session, initializeRequest).flatMap(response -> {
			if (response.isSuccessful()) {
				String sessionId = response.header(this.httpTransport.sessionHeaderName())
					.filter(Utils::hasText)
					.orElse(null);
				NegotiatedTransport transport = new NegotiatedTransport.Streamable(sessionId);
				session.setTransport(transport);
				logger.info("Using Streamable HTTP transport for {} (session: {})", this.baseUri,
						(sessionId != null) ? sessionId : "none");
				return Mono.just(new Negotiation(transport, response, true));
			}
			if (response.statusCode() == 405) {
				logger.info("POST to {} returned 405, falling back to HTTP+SSE transport", this.baseUri);
				return response.discard().then(Mono.defer(() -> openLegacyStream(session)));
			}
			return this.httpTransport.requireSuccess(response).cast(Negotiation.class);
		});
	}

	private Mono<Negotiation> openLegacyStream(McpTransportSession session) {
		session.setProtocolVersion(this.legacyProtocolVersion);
		NegotiatedTransport.Legacy transport = NegotiatedTransport.Legacy.awaitingEndpoint();
		session.setTransport(transport);
		return this.httpTransport.openStream(this.baseUri, session)
			.flatMap(this.httpTransport::requireSuccess)
			.map(response -> {
				logger.info("Using HTTP+SSE transport for {}", this.baseUri);
				return new Negotiation(transport, response, false);
			});
	}

}
