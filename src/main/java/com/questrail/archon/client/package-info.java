/**
 * Archon Client
 * =============================================================================
 *
 * Drives a real (or emulated) Archon controller over one
 * {@link com.questrail.archon.transport.ArchonTransport} session.
 *
 * <h2>Layering</h2>
 * <ul>
 *   <li>{@link com.questrail.archon.client.ArchonCommandChannel}: one exchange at a time, reference ids</li>
 *   <li>{@link com.questrail.archon.client.ArchonConfigurationMemory},
 *       {@link com.questrail.archon.client.FrameRing},
 *       {@link com.questrail.archon.client.BulkTransfer}: built on the channel</li>
 *   <li>{@link com.questrail.archon.client.ArchonController}: composes the above</li>
 * </ul>
 */
package com.questrail.archon.client;
