package com.anamnesis.worker;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;

/**
 * Blocking in-memory byte pipe. Unlike piped streams it does not care which threads read or write.
 * Closing either end ends the pipe: readers drain what is buffered, then see end of stream.
 */
public final class MemoryPipe {
    private byte[] buffer = new byte[4096];
    private int start;
    private int end;
    private boolean closed;

    private final InputStream input = new InputStream() {
        @Override
        public int read() throws IOException {
            byte[] one = new byte[1];
            int n = read(one, 0, 1);
            return n < 0 ? -1 : one[0] & 0xFF;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            return take(b, off, len);
        }

        @Override
        public void close() {
            MemoryPipe.this.close();
        }
    };

    private final OutputStream output = new OutputStream() {
        @Override
        public void write(int b) throws IOException {
            write(new byte[] { (byte) b }, 0, 1);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            put(b, off, len);
        }

        @Override
        public void close() {
            MemoryPipe.this.close();
        }
    };

    public InputStream input() {
        return input;
    }

    public OutputStream output() {
        return output;
    }

    public synchronized void close() {
        closed = true;
        notifyAll();
    }

    private synchronized void put(byte[] b, int off, int len) throws IOException {
        if (closed) {
            throw new IOException("pipe closed");
        }
        if (end + len > buffer.length) {
            int used = end - start;
            byte[] grown = used + len > buffer.length ? new byte[Math.max(buffer.length * 2, used + len)] : buffer;
            System.arraycopy(buffer, start, grown, 0, used);
            buffer = grown;
            start = 0;
            end = used;
        }
        System.arraycopy(b, off, buffer, end, len);
        end += len;
        notifyAll();
    }

    private synchronized int take(byte[] b, int off, int len) throws IOException {
        if (len == 0) {
            return 0;
        }
        while (start == end && !closed) {
            try {
                wait();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("interrupted while reading pipe");
            }
        }
        if (start == end) {
            return -1;
        }
        int n = Math.min(len, end - start);
        System.arraycopy(buffer, start, b, off, n);
        start += n;
        if (start == end) {
            start = 0;
            end = 0;
        }
        return n;
    }

    @Override
    public synchronized String toString() {
        return "MemoryPipe[buffered=" + (end - start) + (closed ? ", closed" : "") + "]";
    }
}
