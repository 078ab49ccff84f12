package com.questrail.homeshadow.protocol.isy.transport.netty;

import com.questrail.homeshadow.protocol.isy.transport.EventStreamProtocolException;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * EventStreamFrameDecoder
 * =============================================================================
 * Splits the raw-socket event stream into frames.
 *
 * <p>After the SOAP subscription, the controller writes a sequence of HTTP-like
 * messages on the same socket: a header block terminated by a blank line,
 * then exactly {@code Content-Length} bytes of XML body. Each body is emitted
 * downstream as one {@link String}.</p>
 *
 * <h2>Rejections</h2>
 * <ul>
 *   <li>{@code HTTP/1.1 401}: invalid credentials</li>
 *   <li>{@code HTTP/1.1 817}: the controller has no free subscriber slot</li>
 *   <li>a header block without a positive {@code Content-Length}</li>
 * </ul>
 * All are raised as {@link EventStreamProtocolException}.
 */
final class EventStreamFrameDecoder extends ByteToMessageDecoder
{
    static final int MAX_HEADER_BYTES = 8 * 1024;
    static final int MAX_BODY_BYTES = 1024 * 1024;

    private static final byte[] HEADER_END = {'\r', '\n', '\r', '\n'};

    private int contentLength = -1;

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        while (true) {
            if (contentLength < 0) {
                int end = indexOf(in, HEADER_END);
                if (end < 0) {
                    if (in.readableBytes() > MAX_HEADER_BYTES) {
                        throw new EventStreamProtocolException("Header block exceeds " + MAX_HEADER_BYTES + " bytes");
                    }
                    return;
                }
                String headers = in.toString(in.readerIndex(), end - in.readerIndex(), StandardCharsets.ISO_8859_1);
                in.readerIndex(end + HEADER_END.length);
                contentLength = parseContentLength(headers);
            }

            if (in.readableBytes() < contentLength) {
                return;
            }
            out.add(in.readCharSequence(contentLength, StandardCharsets.UTF_8).toString());
            contentLength = -1;
        }
    }

    static int parseContentLength(String headers) {
        String[] lines = headers.split("\r\n");
        String status = lines[0].trim();
        if (status.startsWith("HTTP/1.1 817")) {
            throw new EventStreamProtocolException("Controller reached its maximum number of event subscribers");
        }
        if (status.startsWith("HTTP/1.1 401")) {
            throw new EventStreamProtocolException("Controller rejected the event stream credentials");
        }

        int length = -1;
        for (int i = 1; i < lines.length; i++) {
            int colon = lines[i].indexOf(':');
            if (colon < 0) {
                continue;
            }
            String name = lines[i].substring(0, colon).trim().toLowerCase(Locale.ROOT);
            if (name.equals("content-length")) {
                try {
                    length = Integer.parseInt(lines[i].substring(colon + 1).trim());
                } catch (NumberFormatException e) {
                    throw new EventStreamProtocolException("Invalid Content-Length in '" + status + "'", e);
                }
            }
        }

        if (length <= 0) {
            throw new EventStreamProtocolException("Stream message without Content-Length: '" + status + "'");
        }
        if (length > MAX_BODY_BYTES) {
            throw new EventStreamProtocolException("Stream message of " + length + " bytes exceeds " + MAX_BODY_BYTES);
        }
        return length;
    }

    private static int indexOf(ByteBuf buf, byte[] needle) {
        int last = buf.writerIndex() - needle.length;
        outer:
        for (int i = buf.readerIndex(); i <= last; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (buf.getByte(i + j) != needle[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }
}
