/**
 * RFC 6455 Frame Codec
 * =============================================================================
 *
 * <p>Concrete {@link com.questrail.sockets.websocket.framing.FrameEncoder} and
 * {@link com.questrail.sockets.websocket.framing.FrameDecoder} for the base
 * framing protocol (RFC 6455 §5.2 to §5.5).</p>
 *
 * <pre>
 *   byte[] frame
 *        → base header (FIN, RSV, opcode)
 *        → payload length (7 / 16 / 64 bit)
 *        → masking key and unmask
 *        → Frame
 * </pre>
 *
 * <p>Any failure at this layer results in the frame being dropped.</p>
 */
package com.questrail.sockets.websocket.framing.impl;
