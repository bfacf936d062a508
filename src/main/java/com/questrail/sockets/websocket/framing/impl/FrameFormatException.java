package com.questrail.sockets.websocket.framing.impl;

/**
 * Raised inside the decoder when bytes violate framing rules. Never escapes
 * the decoder: the frame is dropped instead.
 */
final class FrameFormatException extends Exception
{
    FrameFormatException(String message)
    {
        super(message);
    }
}
