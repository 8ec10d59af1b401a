package io.disposescan.hierarchy;

import io.disposescan.Fixtures;
import io.disposescan.fixtures.PlainCounter;
import io.disposescan.fixtures.WriteStuff;
import io.disposescan.model.ClassInfo;
import io.disposescan.model.MethodFlag;
import io.disposescan.model.MethodInfo;
import io.disposescan.model.MethodRef;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ClassPoolTest {

    @Test
    void implementsInterface_followsLibraryHierarchy() {
        ClassPool pool = Fixtures.pool(WriteStuff.class, PlainCounter.class);

        // WriteStuff -> java.io.Closeable -> java.lang.AutoCloseable
        assertThat(pool.implementsInterface("io.disposescan.fixtures.WriteStuff", "java.lang.AutoCloseable")).isTrue();
        assertThat(pool.implementsInterface("io.disposescan.fixtures.PlainCounter", "java.lang.AutoCloseable")).isFalse();
        assertThat(pool.implementsInterface("java.io.FileInputStream", "java.lang.AutoCloseable")).isTrue();
    }

    @Test
    void implementsInterface_interfaceImplementsItself() {
        ClassPool pool = ClassPool.builder().build();

        assertThat(pool.implementsInterface("java.lang.AutoCloseable", "java.lang.AutoCloseable")).isTrue();
    }

    @Test
    void implementsInterface_unknownTypeIsFalse() {
        ClassPool pool = ClassPool.builder().libraryLoader(null).build();

        assertThat(pool.implementsInterface("com.example.Missing", "java.lang.AutoCloseable")).isFalse();
        assertThat(pool.lookup("java.lang.String")).isEmpty();
    }

    @Test
    void implementsInterface_throughScannedSuperClass() {
        ClassPool pool = ClassPool.builder()
                .libraryLoader(null)
                .addClass(new ClassInfo("com.example.Base", null, Set.of("com.example.Disposable"),
                        false, false, null, Map.of()))
                .addClass(new ClassInfo("com.example.Derived", "com.example.Base", Set.of(),
                        false, false, null, Map.of()))
                .addClass(new ClassInfo("com.example.Disposable", null, Set.of(),
                        true, false, null, Map.of()))
                .build();

        assertThat(pool.implementsInterface("com.example.Derived", "com.example.Disposable")).isTrue();
        assertThat(pool.implementsInterface("com.example.Derived", "java.lang.AutoCloseable")).isFalse();
    }

    @Test
    void resolve_findsDeclaredPrivateMethod() {
        ClassPool pool = Fixtures.pool(WriteStuff.class);

        Optional<MethodInfo> resolved = pool.resolve(
                new MethodRef("io.disposescan.fixtures.WriteStuff", "flushInternal", "()V"));

        assertThat(resolved).isPresent();
        assertThat(resolved.get().isPublic()).isFalse();
        assertThat(resolved.get().declaringType()).isEqualTo("io.disposescan.fixtures.WriteStuff");
    }

    @Test
    void resolve_walksSuperClassChain() {
        MethodInfo helper = MethodInfo.builder()
                .declaringType("com.example.Base")
                .name("helper")
                .flag(MethodFlag.PUBLIC)
                .build();
        ClassPool pool = ClassPool.builder()
                .libraryLoader(null)
                .addClass(new ClassInfo("com.example.Base", null, Set.of(), false, false, null,
                        Map.of(helper.key(), helper)))
                .addClass(new ClassInfo("com.example.Derived", "com.example.Base", Set.of(),
                        false, false, null, Map.of()))
                .build();

        assertThat(pool.resolve(new MethodRef("com.example.Derived", "helper", "()V")))
                .contains(helper);
    }

    @Test
    void resolve_fallsBackToObjectMethods() {
        ClassPool pool = Fixtures.pool(WriteStuff.class);

        Optional<MethodInfo> resolved = pool.resolve(
                new MethodRef("io.disposescan.fixtures.WriteStuff", "getClass", "()Ljava/lang/Class;"));

        assertThat(resolved).isPresent();
        assertThat(resolved.get().declaringType()).isEqualTo("java.lang.Object");
    }

    @Test
    void resolve_unknownMethodIsEmpty() {
        ClassPool pool = Fixtures.pool(WriteStuff.class);

        assertThat(pool.resolve(new MethodRef("io.disposescan.fixtures.WriteStuff", "missing", "()V"))).isEmpty();
        assertThat(pool.resolve(new MethodRef("com.example.Missing", "run", "()V"))).isEmpty();
    }
}
