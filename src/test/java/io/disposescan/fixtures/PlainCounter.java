package io.disposescan.fixtures;

/**
 * Not closeable, so never checked.
 */
public class PlainCounter {

    private int count;

    public void increment() {
        count++;
    }
}
