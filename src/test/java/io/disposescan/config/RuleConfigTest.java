package io.disposescan.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void loadDefault_mapsLifecycleToAutoCloseable() {
        RuleConfig config = RuleConfig.loadDefault();

        assertThat(config.lifecycleInterface()).isEqualTo("java.lang.AutoCloseable");
        assertThat(config.guardException()).isEqualTo("java.lang.IllegalStateException");
        assertThat(config.disposeMethod()).isEqualTo("close");
        assertThat(config.guardHelperFragments()).containsExactly("Check", "Dispose");
        assertThat(config.excludeClasses()).isEmpty();
    }

    @Test
    void isGuardHelperName_requiresAllFragmentsCaseSensitive() {
        RuleConfig config = RuleConfig.loadDefault();

        assertThat(config.isGuardHelperName("CheckObjectDisposed")).isTrue();
        assertThat(config.isGuardHelperName("throwIfCheckDisposed")).isTrue();
        assertThat(config.isGuardHelperName("checkDisposed")).isFalse();
        assertThat(config.isGuardHelperName("CheckOpen")).isFalse();
    }

    @Test
    void isGuardHelperName_emptyFragmentsMatchNothing() {
        RuleConfig config = RuleConfig.of(Map.of("guardHelperFragments", List.of()));

        assertThat(config.isGuardHelperName("CheckDisposed")).isFalse();
    }

    @Test
    void merge_projectValuesWin() throws IOException {
        Path file = tempDir.resolve("dispose-scan.yaml");
        Files.writeString(file, ""
                + "guardException: com.example.ClosedException\n"
                + "guardHelperFragments: [ensure, Open]\n");

        RuleConfig config = RuleConfig.loadDefault().merge(RuleConfig.loadFromFile(file));

        assertThat(config.guardException()).isEqualTo("com.example.ClosedException");
        assertThat(config.guardHelperFragments()).containsExactly("ensure", "Open");
        assertThat(config.lifecycleInterface()).isEqualTo("java.lang.AutoCloseable");
        assertThat(config.isGuardHelperName("ensureOpen")).isTrue();
    }

    @Test
    void loadFromFile_rejectsEmptyFile() throws IOException {
        Path file = tempDir.resolve("empty.yaml");
        Files.writeString(file, "");

        assertThatThrownBy(() -> RuleConfig.loadFromFile(file))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Empty or invalid");
    }

    @Test
    void loadFromFile_rejectsWrongValueType() throws IOException {
        Path file = tempDir.resolve("bad.yaml");
        Files.writeString(file, "guardHelperFragments: Check\n");

        assertThatThrownBy(() -> RuleConfig.loadFromFile(file))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("guardHelperFragments");
    }

    @Test
    void loadFromFile_rejectsMalformedYaml() throws IOException {
        Path file = tempDir.resolve("broken.yaml");
        Files.writeString(file, "guardException: [unclosed\n");

        assertThatThrownBy(() -> RuleConfig.loadFromFile(file))
                .isInstanceOf(IOException.class);
    }

    @Test
    void requireComplete_namesMissingKey() {
        RuleConfig config = RuleConfig.of(Map.of("lifecycleInterface", "java.lang.AutoCloseable"));

        assertThatThrownBy(config::requireComplete)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("guardException");
    }
}
