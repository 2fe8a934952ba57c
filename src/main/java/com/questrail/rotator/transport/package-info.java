/**
 * Translator Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between concrete socket I/O and the translation layers above it.
 *
 * <ul>
 *   <li>{@link com.questrail.rotator.transport.ClientConnection} - the K4 client side
 *       of one session</li>
 *   <li>{@link com.questrail.rotator.transport.BackendLink} - the RT21 device side of
 *       one session</li>
 * </ul>
 *
 * <p>Everything above this package sees only raw {@code byte[]} reads and writes
 * plus explicit timeouts. Implementations MUST NOT interpret payloads, retry, or
 * reconnect. One read returns whatever a single socket read delivers (up to
 * {@link com.questrail.rotator.transport.BackendLink#READ_BUFFER_SIZE} bytes);
 * both protocols treat one read as one message.</p>
 *
 * <p>Blocking {@code java.net.Socket} implementations live in
 * {@code com.questrail.rotator.transport.tcp}; tests use in-memory fakes.</p>
 */
package com.questrail.rotator.transport;
