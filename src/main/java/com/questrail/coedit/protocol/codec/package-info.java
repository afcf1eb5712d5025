/**
 * Collaboration Codec (Wire Level)
 * =============================================================================
 *
 * <p>This package defines the <strong>codec boundary</strong> between the raw
 * TCP byte stream and typed {@link com.questrail.coedit.protocol.model.CollabMessage}
 * values.</p>
 *
 * <h2>Wire format</h2>
 * <pre>
 *   +----------------------+-------------------------------------------+
 *   | length N (4 bytes,   | N bytes of UTF-8 JSON                     |
 *   | big-endian unsigned) | {"type": "&lt;kind&gt;", "content": "&lt;text&gt;"} |
 *   +----------------------+-------------------------------------------+
 * </pre>
 *
 * <p>{@code type} is one of {@code TEXT_UPDATE}, {@code REQ_CONTROL},
 * {@code GRANT_CONTROL}, {@code REVOKE_CONTROL}, {@code DECLINE_CONTROL};
 * {@code content} is {@code ""} for every kind except {@code TEXT_UPDATE}.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   socket bytes
 *        → PeerLink read buffer      (accumulation across reads)
 *            → CollabFrameDecoder    (one frame at a time, from the front)
 *                → CollabMessage
 *                    → session events
 * </pre>
 *
 * <p>The codec holds no state. Partial frames are reported as incomplete and
 * left in the caller's buffer.</p>
 */
package com.questrail.coedit.protocol.codec;
