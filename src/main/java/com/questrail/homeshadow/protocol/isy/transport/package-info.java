/**
 * Event Stream Transport Ports
 * =============================================================================
 *
 * These interfaces define the framework-agnostic boundary between a concrete
 * networking implementation (Netty websocket, Netty TCP, or a test double) and
 * the stream session.
 *
 * <h2>Why these ports exist</h2>
 * Netty does the I/O in production, but Netty types must not leak into the
 * session, the supervisor or the shadow tree. Everything above the adapter sees
 * only complete frames as {@code String}s and up/down notifications.
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only (no frame decoding beyond splitting)</li>
 *   <li>Not retry or schedule anything</li>
 *   <li>Report failures through the listener, never by throwing from I/O threads</li>
 * </ul>
 */
package com.questrail.homeshadow.protocol.isy.transport;
