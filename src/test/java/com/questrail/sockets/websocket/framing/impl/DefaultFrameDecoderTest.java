package com.questrail.sockets.websocket.framing.impl;

import com.questrail.sockets.websocket.framing.Frame;
import com.questrail.sockets.websocket.framing.OpCode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultFrameDecoderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link DefaultFrameDecoder}.
 *
 * <p>Valid inputs are taken from the RFC 6455 §5.7 examples. Invalid inputs
 * must be dropped, never thrown.</p>
 */
final class DefaultFrameDecoderTest
{
    private final DefaultFrameDecoder decoder = new DefaultFrameDecoder();

    @Test
    void decodeUnmaskedText()
    {
        byte[] wire = { (byte) 0x81, 0x05, 0x48, 0x65, 0x6c, 0x6c, 0x6f };

        Frame frame = decoder.decode(wire).orElseThrow();

        assertEquals(OpCode.TEXT, frame.opCode());
        assertTrue(frame.fin());
        assertArrayEquals("Hello".getBytes(), frame.payload());
    }

    @Test
    void decodeMaskedText()
    {
        // RFC 6455 §5.7: masked "Hello" with key 37 fa 21 3d
        byte[] wire = {
                (byte) 0x81, (byte) 0x85, 0x37, (byte) 0xfa, 0x21, 0x3d,
                0x7f, (byte) 0x9f, 0x4d, 0x51, 0x58 };

        Frame frame = decoder.decode(wire).orElseThrow();

        assertArrayEquals("Hello".getBytes(), frame.payload());
    }

    @Test
    void decodeContinuationNotFinal()
    {
        byte[] wire = { 0x00, 0x01, 0x41 };

        Frame frame = decoder.decode(wire).orElseThrow();

        assertEquals(OpCode.CONTINUATION, frame.opCode());
        assertFalse(frame.fin());
    }

    @Test
    void decodeSixteenBitLength()
    {
        byte[] wire = new byte[4 + 300];
        wire[0] = (byte) 0x82;
        wire[1] = 126;
        wire[2] = 0x01;
        wire[3] = 0x2C;

        Frame frame = decoder.decode(wire).orElseThrow();

        assertEquals(300, frame.payloadLength());
    }

    @Test
    void dropsTruncatedInput()
    {
        assertTrue(decoder.decode(null).isEmpty());
        assertTrue(decoder.decode(new byte[] { (byte) 0x81 }).isEmpty());
        assertTrue(decoder.decode(new byte[] { (byte) 0x81, 0x05, 0x48 }).isEmpty());
        assertTrue(decoder.decode(new byte[] { (byte) 0x82, 126, 0x01 }).isEmpty());
        assertTrue(decoder.decode(new byte[] { (byte) 0x81, (byte) 0x81, 0x01, 0x02 }).isEmpty());
    }

    @Test
    void dropsTrailingBytes()
    {
        assertTrue(decoder.decode(new byte[] { (byte) 0x81, 0x01, 0x41, 0x42 }).isEmpty());
    }

    @Test
    void dropsReservedBitsAndUnknownOpcodes()
    {
        assertTrue(decoder.decode(new byte[] { (byte) 0xC1, 0x00 }).isEmpty());
        assertTrue(decoder.decode(new byte[] { (byte) 0x83, 0x00 }).isEmpty());
        assertTrue(decoder.decode(new byte[] { (byte) 0x8B, 0x00 }).isEmpty());
    }

    @Test
    void dropsInvalidControlFrames()
    {
        // fragmented ping
        assertTrue(decoder.decode(new byte[] { 0x09, 0x00 }).isEmpty());

        // close with 126-byte payload
        byte[] longClose = new byte[4 + 126];
        longClose[0] = (byte) 0x88;
        longClose[1] = 126;
        longClose[3] = 126;
        assertTrue(decoder.decode(longClose).isEmpty());
    }

    @Test
    void dropsNegativeSixtyFourBitLength()
    {
        byte[] wire = { (byte) 0x82, 127, (byte) 0x80, 0, 0, 0, 0, 0, 0, 0 };
        assertTrue(decoder.decode(wire).isEmpty());
    }

    @Test
    void decodesWhatTheEncoderProduces()
    {
        DefaultFrameEncoder masking = DefaultFrameEncoder.masked();
        byte[] payload = new byte[70000];
        for (int i = 0; i < payload.length; i++) {
            payload[i] = (byte) i;
        }

        Frame frame = decoder.decode(masking.encode(OpCode.BINARY, payload, 0, payload.length, false)).orElseThrow();

        assertEquals(new Frame(OpCode.BINARY, false, payload), frame);
    }
}
