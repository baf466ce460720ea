package com.questrail.vault.protocol.client;

import com.questrail.vault.api.VaultClientException;
import com.questrail.vault.api.VaultFramingException;
import com.questrail.vault.protocol.codec.VaultFrameDecoder;
import com.questrail.vault.protocol.codec.VaultFrameEncoder;
import com.questrail.vault.protocol.codec.impl.DefaultVaultFrameDecoder;
import com.questrail.vault.protocol.codec.impl.DefaultVaultFrameEncoder;
import com.questrail.vault.protocol.config.VaultClientConfig;
import com.questrail.vault.protocol.model.Direction;
import com.questrail.vault.protocol.model.VaultContentType;
import com.questrail.vault.protocol.model.VaultHeaders;
import com.questrail.vault.protocol.model.VaultMessage;
import com.questrail.vault.protocol.model.VaultMethod;
import com.questrail.vault.protocol.observability.NullObservabilitySink;
import com.questrail.vault.protocol.observability.Slf4jVaultObservabilitySink;
import com.questrail.vault.protocol.observability.VaultErrorEvent;
import com.questrail.vault.protocol.observability.VaultExchangeEvent;
import com.questrail.vault.protocol.observability.VaultObservabilitySink;
import com.questrail.vault.protocol.transport.VaultConnection;
import com.questrail.vault.protocol.transport.VaultConnector;
import com.questrail.vault.protocol.transport.tcp.netty.NettyVaultConnector;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * VaultProtocolClient
 * =============================================================================
 * Performs one request/response exchange per call.
 *
 * <h2>Data Flow</h2>
 * <pre>
 *   exchange(method, body, session, contentType)
 *        → VaultMessage (req)
 *            → VaultFrameEncoder
 *                → VaultConnector.open() / send
 *                    → receiveFrame
 *                        → VaultFrameDecoder
 *                            → VaultMessage (res)
 * </pre>
 *
 * <p>Every call opens its own connection and closes it before returning, on
 * every exit path. The client holds no per-exchange state, so independent
 * exchanges may run concurrently on different threads.</p>
 *
 * <p>Failures are raised as classified {@link VaultClientException}s and never
 * retried. The response body is returned untouched; this class does not
 * interpret it.</p>
 */
public final class VaultProtocolClient implements AutoCloseable
{
    private final VaultConnector connector;
    private final VaultFrameEncoder encoder;
    private final VaultFrameDecoder decoder;
    private final VaultObservabilitySink sink;

    public VaultProtocolClient(VaultConnector connector,
                               VaultFrameEncoder encoder,
                               VaultFrameDecoder decoder,
                               VaultObservabilitySink sink)
    {
        this.connector = Objects.requireNonNull(connector, "connector");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public VaultProtocolClient(VaultConnector connector, VaultObservabilitySink sink)
    {
        this(connector, new DefaultVaultFrameEncoder(), new DefaultVaultFrameDecoder(), sink);
    }

    public VaultProtocolClient(VaultConnector connector)
    {
        this(connector, NullObservabilitySink.INSTANCE);
    }

    /**
     * Composition root: plaintext or TLS transport chosen by
     * {@link VaultClientConfig#tlsEnabled()}, logging through SLF4J.
     */
    public static VaultProtocolClient create(VaultClientConfig config)
    {
        return new VaultProtocolClient(NettyVaultConnector.create(config), new Slf4jVaultObservabilitySink());
    }

    /**
     * Exchange a request carrying a {@code Content-Type} header.
     *
     * @param method      request method
     * @param body        request body, sent verbatim
     * @param session     session token, or {@link VaultHeaders#NO_SESSION} / {@link VaultHeaders#NEW_SESSION}
     * @param contentType content type; {@code null} omits the header
     * @return the server's response
     */
    public VaultMessage exchange(VaultMethod method, byte[] body, String session, VaultContentType contentType)
    {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(session, "session");

        VaultMessage.Builder request = VaultMessage.request()
                .header(VaultHeaders.METHOD, method.wireName())
                .header(VaultHeaders.SESSION, session);
        if (contentType != null) {
            request.header(VaultHeaders.CONTENT_TYPE, contentType.wireName());
        }
        request.header(VaultHeaders.CONTENT_LENGTH, Integer.toString(body.length))
                .body(body);

        return exchange(method, request.build());
    }

    /**
     * Exchange a request without a {@code Content-Type} header.
     */
    public VaultMessage exchange(VaultMethod method, byte[] body, String session)
    {
        return exchange(method, body, session, null);
    }

    private VaultMessage exchange(VaultMethod method, VaultMessage request)
    {
        final byte[] frame = encoder.encode(request);
        final long started = System.nanoTime();

        try (VaultConnection connection = connector.open()) {
            connection.send(frame);
            VaultMessage response = decoder.decode(connection.receiveFrame());

            if (response.direction() != Direction.RESPONSE) {
                throw new VaultFramingException("Expected a response frame but received '"
                        + response.direction().tag() + "'");
            }

            sink.onExchange(new VaultExchangeEvent(
                    Instant.now(),
                    method,
                    request.bodyLength(),
                    response.bodyLength(),
                    Duration.ofNanos(System.nanoTime() - started)));
            return response;
        }
        catch (VaultClientException e) {
            sink.onError(new VaultErrorEvent(Instant.now(), method, e.getMessage(), e));
            throw e;
        }
    }

    @Override
    public void close()
    {
        connector.close();
    }
}
