/**
 * Archon Transport Port
 * =============================================================================
 *
 * The framework-agnostic boundary between the Archon command channel and a
 * concrete byte stream (a TCP socket in production, a scripted fake in tests).
 *
 * <h2>Architectural constraints</h2>
 * Implementations of {@link com.questrail.archon.transport.ArchonTransport} MUST:
 * <ul>
 *   <li>Perform transport I/O only (no protocol interpretation)</li>
 *   <li>Not add or strip framing characters</li>
 *   <li>Not retry or reconnect on their own</li>
 * </ul>
 *
 * <p>The emulator side does not use this port. Its listener lives in
 * {@code com.questrail.archon.emulator.netty}, which keeps Netty types out of
 * the protocol core.</p>
 */
package com.questrail.archon.transport;
