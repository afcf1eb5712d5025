/**
 * Collaboration codec: length-prefixed JSON implementation
 * =============================================================================
 *
 * <p>Concrete codec that bridges raw stream bytes and
 * {@link com.questrail.coedit.protocol.model.CollabMessage} values.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] stream region
 *        → CollabFraming.readBodyLength
 *        → strict UTF-8 decode
 *        → CollabJsonEnvelope.fromJson
 *        → CollabMessage
 * </pre>
 *
 * <p>JSON handling uses Gson. Gson types never leave this package.</p>
 */
package com.questrail.coedit.protocol.codec.impl;
