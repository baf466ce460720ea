package com.questrail.vault.protocol.transport.tcp.netty;

import com.questrail.vault.api.TransportFailure;
import com.questrail.vault.api.VaultFramingException;
import com.questrail.vault.api.VaultTransportException;
import com.questrail.vault.protocol.transport.VaultConnection;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Netty-backed {@link VaultConnection}: one channel, one exchange.
 *
 * <p>The channel pipeline is assembled by {@link NettyVaultConnector}. Inbound
 * frames produced by {@link VaultFrameAccumulator} land in a single-shot
 * future that {@link #receiveFrame()} blocks on.</p>
 */
final class NettyVaultConnection implements VaultConnection
{
    private final Channel channel;
    private final CompletableFuture<byte[]> frame;

    NettyVaultConnection(Channel channel, CompletableFuture<byte[]> frame)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.frame = Objects.requireNonNull(frame, "frame");
    }

    @Override
    public void send(byte[] bytes)
    {
        Objects.requireNonNull(bytes, "bytes");

        ChannelFuture write = channel.writeAndFlush(Unpooled.wrappedBuffer(bytes));
        NettyVaultConnector.await(write, channel);
        if (!write.isSuccess()) {
            throw NettyFailures.toException(write.cause(), "Sending request to " + channel.remoteAddress());
        }
    }

    @Override
    public byte[] receiveFrame()
    {
        try {
            return frame.get();
        }
        catch (ExecutionException e) {
            throw NettyFailures.toException(e.getCause(), "Receiving response from " + channel.remoteAddress());
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            channel.close();
            throw new VaultTransportException(TransportFailure.UNKNOWN, "Interrupted while waiting for response", e);
        }
    }

    @Override
    public void close()
    {
        channel.close().awaitUninterruptibly();
    }

    /**
     * FrameReceiver
     * -------------------------------------------------------------------------
     * Last handler in the pipeline. Completes the exchange future with the
     * first frame, the first failure, or a framing error if the peer closes
     * before a frame arrives.
     */
    static final class FrameReceiver extends SimpleChannelInboundHandler<byte[]>
    {
        private final CompletableFuture<byte[]> frame;

        FrameReceiver(CompletableFuture<byte[]> frame)
        {
            this.frame = frame;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, byte[] received)
        {
            frame.complete(received);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            frame.completeExceptionally(
                    new VaultFramingException("Connection closed before a complete frame was received"));
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            frame.completeExceptionally(cause);
            ctx.close();
        }
    }
}
