/**
 * Archon Wire Codec
 * =============================================================================
 *
 * <p>Text and block framing of the Archon command protocol. Everything that
 * knows about bytes on the wire lives here; the client and emulator layers
 * above only see command strings, payload strings and model records.</p>
 *
 * <pre>
 *   host       &gt;RRcommand\n                     (ArchonCommandEncoder)
 *   controller &lt;RRpayload\n  |  ?RRdetails\n    (ArchonReplyDecoder)
 *   controller &lt;RR: + 1024 bytes, repeated       (FETCH only)
 * </pre>
 *
 * <p>RR is the two hex digit reference id of the command being answered.
 * FRAME payloads are decoded by {@link com.questrail.archon.protocol.codec.FrameStatusCodec},
 * which also applies the newest-frame rule of
 * {@link com.questrail.archon.protocol.codec.NewestFrameSelector}.</p>
 */
package com.questrail.archon.protocol.codec;
