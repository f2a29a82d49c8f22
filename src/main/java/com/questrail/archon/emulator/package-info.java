/**
 * Emulated Archon controller.
 *
 * <p>{@link com.questrail.archon.emulator.ArchonEmulator} maps one command line
 * to a reply; {@link com.questrail.archon.emulator.EmulatedController} holds the
 * device state it acts on. Networking lives in
 * {@code com.questrail.archon.emulator.netty}.</p>
 */
package com.questrail.archon.emulator;
