package com.anamnesis.worker;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;

/**
 * 4-byte big-endian length prefix followed by exactly that many payload bytes.
 */
public class FrameCodec {
    public static final int DEFAULT_MAX_FRAME_BYTES = 16 * 1024 * 1024;
    private static final int PREFIX_BYTES = 4;

    private final int maxFrameBytes;

    public FrameCodec(int maxFrameBytes) {
        if (maxFrameBytes <= 0) {
            throw new IllegalArgumentException("maxFrameBytes must be > 0");
        }
        this.maxFrameBytes = maxFrameBytes;
    }

    public int maxFrameBytes() {
        return maxFrameBytes;
    }

    /**
     * Reads one frame. Returns null when the stream ends cleanly on a frame boundary.
     *
     * @throws FrameTooLargeException when the declared length is over the limit
     * @throws EOFException when the stream ends inside a frame
     */
    public byte[] read(InputStream in) throws IOException {
        byte[] prefix = in.readNBytes(PREFIX_BYTES);
        if (prefix.length == 0) {
            return null;
        }
        if (prefix.length < PREFIX_BYTES) {
            throw new EOFException("stream ended inside a length prefix (" + prefix.length + " of 4 bytes)");
        }
        long length = Integer.toUnsignedLong(ByteBuffer.wrap(prefix).getInt());
        if (length > maxFrameBytes) {
            throw new FrameTooLargeException(length, maxFrameBytes);
        }
        byte[] payload = in.readNBytes((int) length);
        if (payload.length < length) {
            throw new EOFException("stream ended after " + payload.length + " of " + length + " declared bytes");
        }
        return payload;
    }

    public void write(OutputStream out, byte[] payload) throws IOException {
        if (payload.length > maxFrameBytes) {
            throw new FrameTooLargeException(payload.length, maxFrameBytes);
        }
        out.write(ByteBuffer.allocate(PREFIX_BYTES).putInt(payload.length).array());
        out.write(payload);
        out.flush();
    }
}
