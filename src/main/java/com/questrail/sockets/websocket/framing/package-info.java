/**
 * Message Framing
 * =============================================================================
 *
 * <p>Splits one logical message into wire frames following the RFC 6455
 * fragmentation rules:</p>
 * <ul>
 *   <li>the first frame carries the data opcode ({@link com.questrail.sockets.websocket.framing.OpCode#TEXT}
 *       or {@link com.questrail.sockets.websocket.framing.OpCode#BINARY})</li>
 *   <li>every later frame carries {@link com.questrail.sockets.websocket.framing.OpCode#CONTINUATION}</li>
 *   <li>only the last frame has FIN set</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   List&lt;String&gt; fragments
 *        → TextFragmentation      (opcode and FIN per position)
 *            → FrameEncoder       (header, length, masking)
 *                → byte[] frame   (one per fragment, produced lazily)
 * </pre>
 *
 * <p>Fragment boundaries are chosen by the caller. Nothing in this package
 * negotiates sizes or touches the handshake.</p>
 */
package com.questrail.sockets.websocket.framing;
