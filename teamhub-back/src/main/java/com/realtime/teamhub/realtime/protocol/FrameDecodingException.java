package com.realtime.teamhub.realtime.protocol;

public class FrameDecodingException extends RuntimeException {

    public FrameDecodingException(String message) {
        super(message);
    }

    public FrameDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
