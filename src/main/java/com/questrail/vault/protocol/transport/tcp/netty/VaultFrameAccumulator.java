package com.questrail.vault.protocol.transport.tcp.netty;

import com.questrail.vault.api.VaultFramingException;
import com.questrail.vault.protocol.codec.impl.VaultFraming;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;

import java.util.List;

/**
 * VaultFrameAccumulator
 * =============================================================================
 * Reassembles whole vault frames from a TCP (or TLS) byte stream.
 *
 * <p>The frame has no whole-message length prefix, so its end is found in
 * four fixed-length steps:</p>
 * <ol>
 *   <li>3 bytes: direction tag, validated</li>
 *   <li>6 bytes: {@code ':' + int32 + ':'}, giving the header length</li>
 *   <li>{@code headerLength - 9} bytes: the header block, searched for
 *       {@code Content-Length=<digits>}</li>
 *   <li>{@code contentLength} bytes: the body</li>
 * </ol>
 *
 * <p>Each step waits until the cumulation holds at least the bytes it needs.
 * Netty calls {@link #decode} again on every read, so a frame delivered one
 * byte at a time is reassembled exactly like one delivered in a single read.</p>
 *
 * <p>Emits one {@code byte[]} per complete frame, laid out exactly as it was
 * on the wire. Netty types do not leave this package.</p>
 */
final class VaultFrameAccumulator extends ByteToMessageDecoder
{
    /** Upper bound on a single frame; guards the cumulation against a hostile length field. */
    static final int DEFAULT_MAX_FRAME_LENGTH = 16 * 1024 * 1024;

    private enum Step { TAG, LENGTH, HEADERS, BODY }

    private final int maxFrameLength;

    private Step step = Step.TAG;
    private byte[] tag;
    private byte[] lengthSpan;
    private byte[] headerBlock;
    private int headerLength;
    private int contentLength;

    VaultFrameAccumulator(int maxFrameLength)
    {
        if (maxFrameLength < VaultFraming.PREFIX_LENGTH) {
            throw new IllegalArgumentException("maxFrameLength must be at least " + VaultFraming.PREFIX_LENGTH);
        }
        this.maxFrameLength = maxFrameLength;
    }

    VaultFrameAccumulator()
    {
        this(DEFAULT_MAX_FRAME_LENGTH);
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out)
    {
        while (true) {
            switch (step) {
                case TAG -> {
                    if (in.readableBytes() < VaultFraming.TAG_LENGTH) {
                        return;
                    }
                    tag = take(in, VaultFraming.TAG_LENGTH);
                    VaultFraming.readDirection(tag, 0);
                    step = Step.LENGTH;
                }
                case LENGTH -> {
                    if (in.readableBytes() < VaultFraming.LENGTH_SPAN) {
                        return;
                    }
                    lengthSpan = take(in, VaultFraming.LENGTH_SPAN);
                    headerLength = VaultFraming.readHeaderLength(lengthSpan, 0);
                    requireWithinLimit(headerLength);
                    step = Step.HEADERS;
                }
                case HEADERS -> {
                    int headerBytes = headerLength - VaultFraming.PREFIX_LENGTH;
                    if (in.readableBytes() < headerBytes) {
                        return;
                    }
                    headerBlock = take(in, headerBytes);
                    contentLength = VaultFraming.contentLength(headerBlock);
                    requireWithinLimit((long) headerLength + contentLength);
                    step = Step.BODY;
                }
                case BODY -> {
                    if (in.readableBytes() < contentLength) {
                        return;
                    }
                    byte[] body = take(in, contentLength);
                    out.add(assemble(body));
                    reset();
                    return;
                }
            }
        }
    }

    /**
     * True while part of a frame has been consumed but the frame is not complete.
     */
    boolean isMidFrame()
    {
        return step != Step.TAG;
    }

    private byte[] assemble(byte[] body)
    {
        byte[] frame = new byte[headerLength + body.length];
        int w = 0;
        System.arraycopy(tag, 0, frame, w, tag.length);
        w += tag.length;
        System.arraycopy(lengthSpan, 0, frame, w, lengthSpan.length);
        w += lengthSpan.length;
        System.arraycopy(headerBlock, 0, frame, w, headerBlock.length);
        w += headerBlock.length;
        System.arraycopy(body, 0, frame, w, body.length);
        return frame;
    }

    private void requireWithinLimit(long length)
    {
        if (length > maxFrameLength) {
            throw new VaultFramingException("Frame of " + length + " bytes exceeds limit of " + maxFrameLength);
        }
    }

    private void reset()
    {
        step = Step.TAG;
        tag = null;
        lengthSpan = null;
        headerBlock = null;
        headerLength = 0;
        contentLength = 0;
    }

    private static byte[] take(ByteBuf in, int length)
    {
        byte[] bytes = new byte[length];
        in.readBytes(bytes);
        return bytes;
    }
}
