package com.questrail.homeshadow.protocol.isy.codec.impl;

import com.questrail.homeshadow.protocol.isy.codec.EventFrameDecoder;
import com.questrail.homeshadow.protocol.isy.internal.decode.EventMessageDecoder;
import com.questrail.homeshadow.protocol.isy.internal.events.StreamEvent;

import java.util.Objects;
import java.util.Optional;

/**
 * DefaultEventFrameDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link EventFrameDecoder}.
 *
 * <p>Decoding happens in two steps:</p>
 * <ol>
 *   <li>XML parsing into an immutable element tree ({@link XmlFrameParser})</li>
 *   <li>Category routing and field extraction ({@link EventMessageDecoder})</li>
 * </ol>
 *
 * <p>Both steps report failures as
 * {@link com.questrail.homeshadow.protocol.isy.codec.EventDecodeException}.</p>
 */
public final class DefaultEventFrameDecoder implements EventFrameDecoder
{
    private final XmlFrameParser parser = new XmlFrameParser();
    private final EventMessageDecoder messageDecoder;

    public DefaultEventFrameDecoder() {
        this(new EventMessageDecoder());
    }

    public DefaultEventFrameDecoder(EventMessageDecoder messageDecoder) {
        this.messageDecoder = Objects.requireNonNull(messageDecoder, "messageDecoder");
    }

    @Override
    public Optional<StreamEvent> decode(String frame) {
        return messageDecoder.decode(parser.parse(frame));
    }
}
