package io.disposescan.bytecode;

import io.disposescan.Fixtures;
import io.disposescan.fixtures.ExemptMethods;
import io.disposescan.fixtures.GeneratedResource;
import io.disposescan.fixtures.Handle;
import io.disposescan.fixtures.PartlyGenerated;
import io.disposescan.fixtures.WriteStuff;
import io.disposescan.model.ClassInfo;
import io.disposescan.model.MethodFlag;
import io.disposescan.model.MethodInfo;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ClassScannerTest {

    @Test
    void scan_recordsClassHeader() {
        ClassInfo info = Fixtures.read(WriteStuff.class);

        assertThat(info.fqn()).isEqualTo("io.disposescan.fixtures.WriteStuff");
        assertThat(info.superClass()).isNull();
        assertThat(info.implementedInterfaces()).containsExactly("java.io.Closeable");
        assertThat(info.isInterface()).isFalse();
        assertThat(info.isGenerated()).isFalse();
        assertThat(info.sourceFile()).isEqualTo("WriteStuff.java");
    }

    @Test
    void scan_classifiesAccessAndSpecialMethods() {
        ClassInfo info = Fixtures.read(WriteStuff.class);

        assertThat(info.findMethod("write", "(Ljava/lang/String;)V")).get()
                .satisfies(m -> assertThat(m.isPublic()).isTrue());
        assertThat(info.findMethod("flushInternal", "()V")).get()
                .satisfies(m -> assertThat(m.isPublic()).isFalse());
        assertThat(info.findMethod("create", "()Lio/disposescan/fixtures/WriteStuff;")).get()
                .satisfies(m -> assertThat(m.isStatic()).isTrue());
        assertThat(info.findMethod("<init>", "()V")).get()
                .satisfies(m -> assertThat(m.is(MethodFlag.CONSTRUCTOR)).isTrue());
    }

    @Test
    void scan_marksGettersAndEventAccessors() {
        ClassInfo info = Fixtures.read(ExemptMethods.class);

        assertThat(flags(info, "getName")).contains(MethodFlag.PROPERTY_GETTER);
        assertThat(flags(info, "isOpen")).contains(MethodFlag.PROPERTY_GETTER);
        assertThat(flags(info, "addChangeListener")).contains(MethodFlag.EVENT_ACCESSOR);
        assertThat(flags(info, "removeChangeListener")).contains(MethodFlag.EVENT_ACCESSOR);
        assertThat(flags(info, "fireChange")).contains(MethodFlag.EVENT_ACCESSOR);
        assertThat(flags(info, "close"))
                .doesNotContain(MethodFlag.PROPERTY_GETTER, MethodFlag.EVENT_ACCESSOR);
    }

    @Test
    void scan_marksRecordAccessorsAsGetters() {
        ClassInfo info = Fixtures.read(Handle.class);

        assertThat(flags(info, "name")).contains(MethodFlag.PROPERTY_GETTER);
        assertThat(flags(info, "id")).contains(MethodFlag.PROPERTY_GETTER);
    }

    @Test
    void scan_marksGeneratedCode() {
        ClassInfo generatedClass = Fixtures.read(GeneratedResource.class);
        ClassInfo partly = Fixtures.read(PartlyGenerated.class);

        assertThat(generatedClass.isGenerated()).isTrue();
        assertThat(flags(generatedClass, "use")).contains(MethodFlag.GENERATED_CODE);
        assertThat(partly.isGenerated()).isFalse();
        assertThat(flags(partly, "copyFrom")).contains(MethodFlag.GENERATED_CODE);
        assertThat(flags(partly, "use")).doesNotContain(MethodFlag.GENERATED_CODE);
    }

    @Test
    void scan_decodesBodiesWithLineNumbers() {
        MethodInfo write = Fixtures.method(WriteStuff.class, "write");

        assertThat(write.hasBody()).isTrue();
        assertThat(write.firstLine()).isPositive();
        assertThat(write.instructions().get(0).mnemonic()).isEqualTo("aload");
    }

    private static Set<MethodFlag> flags(ClassInfo info, String name) {
        return info.findMethodByName(name).orElseThrow().flags();
    }
}
