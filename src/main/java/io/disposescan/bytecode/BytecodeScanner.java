package io.disposescan.bytecode;

import io.disposescan.hierarchy.ClassPool;
import io.disposescan.model.ClassInfo;
import org.objectweb.asm.ClassReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Collection;
import java.util.Enumeration;
import java.util.List;
import java.util.Set;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.regex.Pattern;

/**
 * Reads class files from directories and JARs into a {@link ClassPool}.
 */
public class BytecodeScanner {

    private static final Logger log = LoggerFactory.getLogger(BytecodeScanner.class);

    private final List<Pattern> excludePatterns;

    private int classesScanned = 0;
    private int jarsScanned = 0;
    private int classesFailed = 0;

    public BytecodeScanner() {
        this(Set.of());
    }

    /**
     * @param excludePatterns Glob patterns over class FQNs; {@code *} stays within a package
     *                        segment, {@code **} crosses segments
     */
    public BytecodeScanner(Collection<String> excludePatterns) {
        this.excludePatterns = excludePatterns == null
                ? List.of()
                : excludePatterns.stream().map(BytecodeScanner::globToRegex).toList();
    }

    /**
     * Scans all given paths. Directories are walked recursively for .class files,
     * files ending in .jar are read as archives; anything else is ignored with a warning.
     *
     * @return ClassPool containing every class that was read
     */
    public ClassPool scan(List<Path> paths) throws IOException {
        ClassPool.Builder pool = ClassPool.builder();

        for (Path path : paths) {
            if (Files.isDirectory(path)) {
                scanDirectory(path, pool);
            } else if (Files.isRegularFile(path) && path.toString().endsWith(".jar")) {
                scanJar(path, pool);
            } else {
                log.warn("Skipping {}: not a class directory or JAR", path);
            }
        }

        return pool.build();
    }

    /**
     * Scans a directory of class files recursively.
     */
    private void scanDirectory(Path directory, ClassPool.Builder pool) throws IOException {
        Files.walkFileTree(directory, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                if (file.toString().endsWith(".class")) {
                    String className = pathToClassName(directory.relativize(file).toString());
                    if (!shouldExclude(className)) {
                        try (InputStream is = Files.newInputStream(file)) {
                            addClass(readClass(is, true), pool);
                        } catch (RuntimeException e) {
                            // ASM signals malformed class files with unchecked exceptions
                            classesFailed++;
                            log.warn("Failed to scan class {}: {}", className, e.toString());
                        }
                    }
                }
                return FileVisitResult.CONTINUE;
            }
        });
    }

    /**
     * Scans a JAR file for classes.
     */
    private void scanJar(Path jarPath, ClassPool.Builder pool) throws IOException {
        try (JarFile jarFile = new JarFile(jarPath.toFile())) {
            jarsScanned++;

            Enumeration<JarEntry> entries = jarFile.entries();
            while (entries.hasMoreElements()) {
                JarEntry entry = entries.nextElement();
                String name = entry.getName();

                if (name.endsWith(".class") && !name.startsWith("META-INF/")) {
                    String className = pathToClassName(name);
                    if (!shouldExclude(className)) {
                        try (InputStream is = jarFile.getInputStream(entry)) {
                            addClass(readClass(is, true), pool);
                        } catch (RuntimeException e) {
                            classesFailed++;
                            log.warn("Failed to scan class {} from {}: {}",
                                    className, jarPath.getFileName(), e.toString());
                        }
                    }
                }
            }
        }
    }

    private void addClass(ClassInfo classInfo, ClassPool.Builder pool) {
        if (classInfo != null) {
            pool.addClass(classInfo);
            classesScanned++;
        }
    }

    /**
     * Reads a single class.
     *
     * @param withBodies Decode method bodies (and keep debug info) when true;
     *                   read signatures only when false
     */
    public static ClassInfo readClass(InputStream is, boolean withBodies) throws IOException {
        ClassReader reader = new ClassReader(is);
        ClassScanner scanner = new ClassScanner(withBodies);
        int flags = withBodies
                ? ClassReader.SKIP_FRAMES
                : ClassReader.SKIP_CODE | ClassReader.SKIP_DEBUG | ClassReader.SKIP_FRAMES;
        reader.accept(scanner, flags);
        return scanner.buildClassInfo();
    }

    /**
     * Converts a file path to a class name.
     * E.g., "com/company/MyClass.class" -> "com.company.MyClass"
     */
    static String pathToClassName(String path) {
        String withoutExtension = path;
        if (path.endsWith(".class")) {
            withoutExtension = path.substring(0, path.length() - 6);
        }
        return withoutExtension.replace('/', '.').replace('\\', '.');
    }

    private boolean shouldExclude(String className) {
        for (Pattern pattern : excludePatterns) {
            if (pattern.matcher(className).matches()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Simple glob-like pattern matching.
     * Supports * (any sequence within a segment) and ** (any sequence including .)
     */
    static Pattern globToRegex(String glob) {
        String regex = glob
                .replace(".", "\\.")
                .replace("$", "\\$")
                .replace("**", "@@DOUBLESTAR@@")
                .replace("*", "[^.]*")
                .replace("@@DOUBLESTAR@@", ".*");
        return Pattern.compile(regex);
    }

    public int getClassesScanned() {
        return classesScanned;
    }

    public int getJarsScanned() {
        return jarsScanned;
    }

    /**
     * Returns the number of class files that could not be parsed.
     */
    public int getClassesFailed() {
        return classesFailed;
    }
}
