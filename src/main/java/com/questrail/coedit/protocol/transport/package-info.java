/**
 * Transport port for the collaboration session.
 *
 * <p>The types here describe a single-peer stream transport without naming
 * any networking library. The Netty adapter lives in
 * {@code com.questrail.coedit.protocol.transport.tcp.netty}; tests supply
 * in-memory fakes.</p>
 */
package com.questrail.coedit.protocol.transport;
