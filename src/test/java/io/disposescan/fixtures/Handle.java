package io.disposescan.fixtures;

public record Handle(String name, int id) implements AutoCloseable {

    @Override
    public void close() {
    }
}
