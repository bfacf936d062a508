package com.questrail.sockets.websocket.framing;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class OpCodeTest
{
    @Test
    void wireCodesFollowRfc6455()
    {
        assertEquals(0x0, OpCode.CONTINUATION.code());
        assertEquals(0x1, OpCode.TEXT.code());
        assertEquals(0x2, OpCode.BINARY.code());
        assertEquals(0x8, OpCode.CLOSE.code());
        assertEquals(0x9, OpCode.PING.code());
        assertEquals(0xA, OpCode.PONG.code());
    }

    @Test
    void onlyCloseAndPingPongAreControl()
    {
        assertFalse(OpCode.CONTINUATION.isControl());
        assertFalse(OpCode.TEXT.isControl());
        assertFalse(OpCode.BINARY.isControl());
        assertTrue(OpCode.CLOSE.isControl());
        assertTrue(OpCode.PING.isControl());
        assertTrue(OpCode.PONG.isControl());
    }

    @Test
    void fromCodeRejectsReservedValues()
    {
        assertEquals(OpCode.PONG, OpCode.fromCode(0xA));
        assertThrows(IllegalArgumentException.class, () -> OpCode.fromCode(0x3));
        assertThrows(IllegalArgumentException.class, () -> OpCode.fromCode(0xF));
    }
}
