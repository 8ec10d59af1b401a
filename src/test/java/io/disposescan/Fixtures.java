package io.disposescan;

import io.disposescan.bytecode.BytecodeScanner;
import io.disposescan.hierarchy.ClassPool;
import io.disposescan.model.ClassInfo;
import io.disposescan.model.MethodInfo;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Reads compiled test classes the way the scanner does.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static ClassInfo read(Class<?> type) {
        String resource = "/" + type.getName().replace('.', '/') + ".class";
        try (InputStream is = Fixtures.class.getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException("Class file not found: " + resource);
            }
            return BytecodeScanner.readClass(is, true);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static ClassPool pool(Class<?>... types) {
        ClassPool.Builder builder = ClassPool.builder();
        for (Class<?> type : types) {
            builder.addClass(read(type));
        }
        return builder.build();
    }

    public static MethodInfo method(Class<?> type, String name) {
        return read(type).findMethodByName(name)
                .orElseThrow(() -> new IllegalArgumentException("No method " + name + " in " + type.getName()));
    }
}
