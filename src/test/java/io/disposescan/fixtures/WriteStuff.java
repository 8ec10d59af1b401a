package io.disposescan.fixtures;

import java.io.Closeable;

/**
 * Closeable that keeps writing after close().
 */
public class WriteStuff implements Closeable {

    private final StringBuilder buffer = new StringBuilder();
    private boolean closed;
    private int writes;

    public void write(String message) {
        buffer.append(message);
        writes++;
    }

    public void flush() {
        flushInternal();
    }

    private void flushInternal() {
        buffer.setLength(0);
    }

    public int lengthOf(WriteStuff other) {
        return other.buffer.length();
    }

    public void writeTwice(String message) {
        write(message);
        write(message);
    }

    public static WriteStuff create() {
        return new WriteStuff();
    }

    @Override
    public void close() {
        if (!closed) {
            buffer.setLength(0);
            closed = true;
        }
    }
}
