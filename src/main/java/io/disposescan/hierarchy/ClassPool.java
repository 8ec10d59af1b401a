package io.disposescan.hierarchy;

import io.disposescan.bytecode.BytecodeScanner;
import io.disposescan.bytecode.DescriptorParser;
import io.disposescan.model.ClassInfo;
import io.disposescan.model.MethodInfo;
import io.disposescan.model.MethodRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * All classes known to a scan.
 * <p>
 * Scanned classes carry decoded method bodies and are the ones the rules analyze. Any other
 * class the hierarchy or resolver asks for (JDK and library types) is read lazily from a
 * class loader, signatures only, and remembered, including when it is missing.
 * <p>
 * Safe for concurrent use once built.
 */
public class ClassPool implements TypeHierarchy, ReferenceResolver {

    private static final Logger log = LoggerFactory.getLogger(ClassPool.class);

    private static final String OBJECT = "java.lang.Object";

    private final Map<String, ClassInfo> scanned;
    private final ClassLoader libraryLoader;
    private final ConcurrentMap<String, Optional<ClassInfo>> libraries = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Boolean> implementsCache = new ConcurrentHashMap<>();

    private ClassPool(Map<String, ClassInfo> scanned, ClassLoader libraryLoader) {
        this.scanned = Collections.unmodifiableMap(new LinkedHashMap<>(scanned));
        this.libraryLoader = libraryLoader;
    }

    /**
     * Returns the classes read by the scanner, in scan order.
     */
    public Collection<ClassInfo> scannedClasses() {
        return scanned.values();
    }

    public int scannedClassCount() {
        return scanned.size();
    }

    /**
     * Looks a class up among scanned classes, then through the library class loader.
     */
    public Optional<ClassInfo> lookup(String fqn) {
        if (fqn == null) {
            return Optional.empty();
        }
        ClassInfo classInfo = scanned.get(fqn);
        if (classInfo != null) {
            return Optional.of(classInfo);
        }
        return libraries.computeIfAbsent(fqn, this::loadLibraryClass);
    }

    private Optional<ClassInfo> loadLibraryClass(String fqn) {
        if (libraryLoader == null) {
            return Optional.empty();
        }
        String resource = DescriptorParser.toInternalName(fqn) + ".class";
        try (InputStream is = libraryLoader.getResourceAsStream(resource)) {
            if (is == null) {
                log.debug("Class {} not found on the library class path", fqn);
                return Optional.empty();
            }
            return Optional.ofNullable(BytecodeScanner.readClass(is, false));
        } catch (IOException | RuntimeException e) {
            log.warn("Could not read library class {}: {}", fqn, e.toString());
            return Optional.empty();
        }
    }

    @Override
    public boolean implementsInterface(String type, String interfaceName) {
        if (type == null || interfaceName == null) {
            return false;
        }
        return implementsCache.computeIfAbsent(type + "#" + interfaceName,
                key -> searchInterface(type, interfaceName));
    }

    private boolean searchInterface(String type, String interfaceName) {
        Deque<String> work = new ArrayDeque<>();
        Set<String> seen = new HashSet<>();
        work.add(type);

        while (!work.isEmpty()) {
            String current = work.poll();
            if (!seen.add(current)) {
                continue;
            }
            Optional<ClassInfo> info = lookup(current);
            if (info.isEmpty()) {
                continue;
            }
            ClassInfo classInfo = info.get();
            if (classInfo.isInterface() && classInfo.fqn().equals(interfaceName)) {
                return true;
            }
            for (String iface : classInfo.implementedInterfaces()) {
                if (iface.equals(interfaceName)) {
                    return true;
                }
                work.add(iface);
            }
            if (classInfo.superClass() != null) {
                work.add(classInfo.superClass());
            }
        }
        return false;
    }

    @Override
    public Optional<MethodInfo> resolve(MethodRef ref) {
        Optional<ClassInfo> owner = lookup(ref.declaringType());
        if (owner.isEmpty()) {
            return Optional.empty();
        }

        // Super class chain
        Deque<String> interfaces = new ArrayDeque<>();
        ClassInfo current = owner.get();
        while (current != null) {
            Optional<MethodInfo> found = current.findMethod(ref.name(), ref.descriptor());
            if (found.isPresent()) {
                return found;
            }
            interfaces.addAll(current.implementedInterfaces());
            if (current.superClass() == null) {
                break;
            }
            current = lookup(current.superClass()).orElse(null);
        }

        // Super interfaces
        Set<String> seen = new HashSet<>();
        while (!interfaces.isEmpty()) {
            String iface = interfaces.poll();
            if (!seen.add(iface)) {
                continue;
            }
            Optional<ClassInfo> info = lookup(iface);
            if (info.isPresent()) {
                Optional<MethodInfo> found = info.get().findMethod(ref.name(), ref.descriptor());
                if (found.isPresent()) {
                    return found;
                }
                interfaces.addAll(info.get().implementedInterfaces());
            }
        }

        // Every class and interface inherits java.lang.Object's public methods
        if (!ref.declaringType().equals(OBJECT)) {
            return lookup(OBJECT).flatMap(object -> object.findMethod(ref.name(), ref.descriptor()));
        }
        return Optional.empty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, ClassInfo> classes = new LinkedHashMap<>();
        private ClassLoader libraryLoader = ClassLoader.getSystemClassLoader();

        public Builder addClass(ClassInfo classInfo) {
            classes.put(classInfo.fqn(), classInfo);
            return this;
        }

        /**
         * Class loader used to read classes that were not scanned; null disables the fallback.
         */
        public Builder libraryLoader(ClassLoader libraryLoader) {
            this.libraryLoader = libraryLoader;
            return this;
        }

        public ClassPool build() {
            return new ClassPool(classes, libraryLoader);
        }
    }
}
