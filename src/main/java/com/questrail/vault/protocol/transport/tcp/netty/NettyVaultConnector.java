package com.questrail.vault.protocol.transport.tcp.netty;

import com.questrail.vault.api.TransportFailure;
import com.questrail.vault.api.VaultTransportException;
import com.questrail.vault.protocol.config.VaultClientConfig;
import com.questrail.vault.protocol.transport.VaultConnection;
import com.questrail.vault.protocol.transport.VaultConnector;
import com.questrail.vault.protocol.transport.tls.ServerCertificateVerifier;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslHandler;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLParameters;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * NettyVaultConnector
 * =============================================================================
 * Netty-backed implementation of the {@link VaultConnector} port, covering
 * both the plaintext and the TLS mode.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Decode header entries or interpret bodies</li>
 *   <li>Reuse a channel across exchanges</li>
 *   <li>Retry a failed connect, handshake, write or read</li>
 * </ul>
 *
 * <h2>Pipeline</h2>
 * <pre>
 *   [ SslHandler ]  (TLS mode only; handshake completes inside open())
 *   ReadTimeoutHandler
 *   VaultFrameAccumulator
 *   FrameReceiver
 * </pre>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <h2>Lifecycle</h2>
 * The connector owns one {@link NioEventLoopGroup} shared by all of its
 * connections. {@link #close()} shuts it down.
 */
public final class NettyVaultConnector implements VaultConnector
{
    private static final Logger log = LoggerFactory.getLogger(NettyVaultConnector.class);

    private final String host;
    private final int port;
    private final long readTimeoutMillis;
    private final long connectTimeoutMillis;
    private final SslContext sslContext;
    private final boolean verifyHostname;
    private final int maxFrameLength;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private NettyVaultConnector(VaultClientConfig config, SslContext sslContext, int maxFrameLength)
    {
        Objects.requireNonNull(config, "config");
        this.host = config.serverHost();
        this.port = config.serverPort();
        this.readTimeoutMillis = config.readTimeout().toMillis();
        this.connectTimeoutMillis = config.connectTimeout().toMillis();
        this.sslContext = sslContext;
        this.verifyHostname = config.verifyHostname();
        this.maxFrameLength = maxFrameLength;

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, connectTimeoutMillis))
                .option(ChannelOption.TCP_NODELAY, true);
    }

    /**
     * Build the connector selected by {@link VaultClientConfig#tlsEnabled()}.
     */
    public static NettyVaultConnector create(VaultClientConfig config)
    {
        return config.tlsEnabled() ? tls(config) : plaintext(config);
    }

    public static NettyVaultConnector plaintext(VaultClientConfig config)
    {
        return new NettyVaultConnector(config, null, VaultFrameAccumulator.DEFAULT_MAX_FRAME_LENGTH);
    }

    /**
     * @throws VaultTransportException with {@link TransportFailure#HANDSHAKE_FAILED}
     *         if the certificate verifier cannot produce trust managers
     */
    public static NettyVaultConnector tls(VaultClientConfig config)
    {
        ServerCertificateVerifier verifier = config.certificateVerifier();
        try {
            SslContext ctx = SslContextBuilder.forClient()
                    .trustManager(verifier.trustManagerFactory())
                    .build();
            log.debug("TLS enabled for {}:{} using {}", config.serverHost(), config.serverPort(), verifier.describe());
            return new NettyVaultConnector(config, ctx, VaultFrameAccumulator.DEFAULT_MAX_FRAME_LENGTH);
        }
        catch (GeneralSecurityException | IOException e) {
            throw new VaultTransportException(TransportFailure.HANDSHAKE_FAILED,
                    "Cannot initialise TLS with " + verifier.describe(), e);
        }
    }

    public boolean isTls()
    {
        return sslContext != null;
    }

    @Override
    public VaultConnection open()
    {
        CompletableFuture<byte[]> frame = new CompletableFuture<>();

        ChannelFuture connect = bootstrap.clone()
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        if (sslContext != null) {
                            p.addLast("tls", newSslHandler(ch));
                        }
                        p.addLast("readTimeout", new ReadTimeoutHandler(readTimeoutMillis, TimeUnit.MILLISECONDS));
                        p.addLast("frames", new VaultFrameAccumulator(maxFrameLength));
                        p.addLast("receiver", new NettyVaultConnection.FrameReceiver(frame));
                    }
                })
                .connect(host, port);

        Channel channel = connect.channel();
        await(connect, channel);
        if (!connect.isSuccess()) {
            channel.close();
            throw NettyFailures.toException(connect.cause(), "Connecting to " + host + ":" + port);
        }

        if (sslContext != null) {
            Future<Channel> handshake = channel.pipeline().get(SslHandler.class).handshakeFuture();
            await(handshake, channel);
            if (!handshake.isSuccess()) {
                channel.close();
                throw NettyFailures.toException(handshake.cause(), "TLS handshake with " + host + ":" + port);
            }
        }

        log.debug("Opened {} connection to {}:{}", isTls() ? "TLS" : "plain", host, port);
        return new NettyVaultConnection(channel, frame);
    }

    @Override
    public void close()
    {
        group.shutdownGracefully();
    }

    private SslHandler newSslHandler(SocketChannel ch)
    {
        SslHandler handler = sslContext.newHandler(ch.alloc(), host, port);
        handler.setHandshakeTimeoutMillis(connectTimeoutMillis);

        if (verifyHostname) {
            SSLEngine engine = handler.engine();
            SSLParameters params = engine.getSSLParameters();
            params.setEndpointIdentificationAlgorithm("HTTPS");
            engine.setSSLParameters(params);
        }
        return handler;
    }

    /**
     * Block the calling (non event loop) thread until {@code future} is done.
     */
    static void await(Future<?> future, Channel channel)
    {
        try {
            future.await();
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            channel.close();
            throw new VaultTransportException(TransportFailure.UNKNOWN, "Interrupted during transport I/O", e);
        }
    }
}
