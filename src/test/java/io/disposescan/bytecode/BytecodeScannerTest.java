package io.disposescan.bytecode;

import io.disposescan.fixtures.GuardedWriter;
import io.disposescan.fixtures.WriteStuff;
import io.disposescan.hierarchy.ClassPool;
import io.disposescan.model.ClassInfo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;

import static org.assertj.core.api.Assertions.assertThat;

class BytecodeScannerTest {

    @TempDir
    Path tempDir;

    @Test
    void scan_readsClassDirectory() throws IOException {
        Path classes = tempDir.resolve("classes");
        copyClass(WriteStuff.class, classes);
        copyClass(GuardedWriter.class, classes);

        BytecodeScanner scanner = new BytecodeScanner();
        ClassPool pool = scanner.scan(List.of(classes));

        assertThat(pool.scannedClasses())
                .extracting(ClassInfo::fqn)
                .containsExactlyInAnyOrder(
                        "io.disposescan.fixtures.WriteStuff",
                        "io.disposescan.fixtures.GuardedWriter");
        assertThat(scanner.getClassesScanned()).isEqualTo(2);
        assertThat(scanner.getJarsScanned()).isZero();
    }

    @Test
    void scan_readsJar() throws IOException {
        Path jar = tempDir.resolve("fixtures.jar");
        try (JarOutputStream out = new JarOutputStream(Files.newOutputStream(jar))) {
            addEntry(out, WriteStuff.class);
            addEntry(out, GuardedWriter.class);
        }

        BytecodeScanner scanner = new BytecodeScanner();
        ClassPool pool = scanner.scan(List.of(jar));

        assertThat(pool.scannedClassCount()).isEqualTo(2);
        assertThat(scanner.getJarsScanned()).isEqualTo(1);
    }

    @Test
    void scan_excludesMatchingClasses() throws IOException {
        Path classes = tempDir.resolve("classes");
        copyClass(WriteStuff.class, classes);
        copyClass(GuardedWriter.class, classes);

        BytecodeScanner scanner = new BytecodeScanner(List.of("io.disposescan.**.Guarded*"));
        ClassPool pool = scanner.scan(List.of(classes));

        assertThat(pool.scannedClasses())
                .extracting(ClassInfo::fqn)
                .containsExactly("io.disposescan.fixtures.WriteStuff");
    }

    @Test
    void scan_countsUnreadableClassesAndContinues() throws IOException {
        Path classes = tempDir.resolve("classes");
        copyClass(WriteStuff.class, classes);
        Files.write(classes.resolve("Broken.class"), new byte[]{0x01, 0x02, 0x03});

        BytecodeScanner scanner = new BytecodeScanner();
        ClassPool pool = scanner.scan(List.of(classes));

        assertThat(pool.scannedClassCount()).isEqualTo(1);
        assertThat(scanner.getClassesFailed()).isEqualTo(1);
    }

    @Test
    void globToRegex_singleStarStaysInPackage() {
        assertThat(BytecodeScanner.globToRegex("com.example.*").matcher("com.example.Foo").matches()).isTrue();
        assertThat(BytecodeScanner.globToRegex("com.example.*").matcher("com.example.sub.Foo").matches()).isFalse();
        assertThat(BytecodeScanner.globToRegex("com.example.**").matcher("com.example.sub.Foo").matches()).isTrue();
        assertThat(BytecodeScanner.globToRegex("**.Outer$*").matcher("a.b.Outer$Inner").matches()).isTrue();
    }

    @Test
    void pathToClassName_convertsSeparators() {
        assertThat(BytecodeScanner.pathToClassName("com/example/MyClass.class")).isEqualTo("com.example.MyClass");
    }

    private static String resourceName(Class<?> type) {
        return type.getName().replace('.', '/') + ".class";
    }

    private static void copyClass(Class<?> type, Path root) throws IOException {
        Path target = root.resolve(resourceName(type));
        Files.createDirectories(target.getParent());
        try (InputStream is = type.getResourceAsStream("/" + resourceName(type))) {
            Files.copy(is, target);
        }
    }

    private static void addEntry(JarOutputStream out, Class<?> type) throws IOException {
        out.putNextEntry(new JarEntry(resourceName(type)));
        try (InputStream is = type.getResourceAsStream("/" + resourceName(type))) {
            is.transferTo(out);
        }
        out.closeEntry();
    }
}
