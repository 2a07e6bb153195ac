package com.phillippitts.scantomack.service.ocr.bridge;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BridgeScriptsTest {

    @TempDir
    Path tempDir;

    @Test
    void configuredScriptWins() throws IOException {
        Path script = Files.writeString(tempDir.resolve("custom_bridge.py"), "print('hi')");

        assertThat(BridgeScripts.resolve("easyocr_bridge.py", script.toString())).isEqualTo(script.toAbsolutePath());
    }

    @Test
    void missingConfiguredScriptFails() {
        assertThatThrownBy(() -> BridgeScripts.resolve("easyocr_bridge.py", tempDir.resolve("nope.py").toString()))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Bridge script not found");
    }

    @Test
    void bundledScriptIsExtractedToATempFile() throws IOException {
        Path extracted = BridgeScripts.resolve("easyocr_bridge.py", null);

        assertThat(extracted).isRegularFile();
        assertThat(extracted.getFileName().toString()).isEqualTo("easyocr_bridge.py");
        assertThat(Files.readString(extracted)).contains("import");
    }

    @Test
    void extractedDirectoryIsRegisteredForDeletionBeforeItsFile() throws IOException {
        List<File> registered = new ArrayList<>();

        Path extracted = BridgeScripts.extract("easyocr_bridge.py", registered::add);

        // shutdown hooks delete in reverse order: file first, then the emptied directory
        assertThat(registered).containsExactly(extracted.getParent().toFile(), extracted.toFile());
        Files.delete(extracted);
        Files.delete(extracted.getParent());
    }

    @Test
    void unknownBundledScriptFails() {
        assertThatThrownBy(() -> BridgeScripts.resolve("tesseract_bridge.py", " "))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("missing from classpath");
    }
}
