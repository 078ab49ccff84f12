package com.questrail.homeshadow.protocol.isy.codec;

import com.questrail.homeshadow.protocol.isy.internal.events.StreamEvent;

import java.util.Optional;

/**
 * EventFrameDecoder
 * -----------------------------------------------------------------------------
 * Decoder from one event-stream frame (an XML document) to one
 * {@link StreamEvent}.
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Parsing the frame text</li>
 *   <li>Identifying the frame category from the root element and the
 *       {@code control} code</li>
 *   <li>Defaulting optional fields (an absent unit is "not set", distinct
 *       from an explicit {@code "0"})</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Knowing which entities exist</li>
 *   <li>Deciding whether a value changed</li>
 *   <li>Splitting a byte stream into frames</li>
 * </ul>
 *
 * <p>Implementations are pure and may be called from any thread.</p>
 */
public interface EventFrameDecoder
{
    /**
     * @param frame complete frame text
     * @return the decoded event, or {@link Optional#empty()} for a well-formed
     *         frame of a category the client does not act on
     * @throws EventDecodeException if the frame is malformed or unrecognized
     */
    Optional<StreamEvent> decode(String frame);
}
