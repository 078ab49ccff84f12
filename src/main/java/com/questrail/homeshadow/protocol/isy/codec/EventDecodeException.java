package com.questrail.homeshadow.protocol.isy.codec;

/**
 * Indicates that an event-stream frame could not be decoded.
 *
 * This typically reflects:
 * <ul>
 *   <li>text that is not well-formed XML</li>
 *   <li>an unrecognized root element</li>
 *   <li>a required field missing or not parseable for the frame's category</li>
 * </ul>
 *
 * A decode failure is never fatal to the stream: the frame is logged and
 * dropped.
 */
public final class EventDecodeException extends RuntimeException
{
    public EventDecodeException(String message) {
        super(message);
    }

    public EventDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
