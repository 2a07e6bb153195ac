package com.phillippitts.scantomack.service.ocr.bridge;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.io.ClassPathResource;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.function.Consumer;

/**
 * Locates bridge scripts: an explicitly configured path wins, otherwise the script bundled under
 * {@code classpath:bridges/} is copied to a temp directory so the interpreter can run it.
 */
final class BridgeScripts {

    private static final Logger LOG = LogManager.getLogger(BridgeScripts.class);

    static final String CLASSPATH_DIR = "bridges/";

    private BridgeScripts() {
    }

    /**
     * @param scriptName bundled file name, e.g. {@code easyocr_bridge.py}
     * @param override   configured script path, or null/blank for the bundled one
     * @return absolute script path
     * @throws IOException if the override does not exist or the bundled script cannot be extracted
     */
    static Path resolve(String scriptName, String override) throws IOException {
        if (override != null && !override.isBlank()) {
            Path path = Path.of(override).toAbsolutePath().normalize();
            if (!Files.isRegularFile(path)) {
                throw new IOException("Bridge script not found: " + path);
            }
            return path;
        }
        return extract(scriptName, File::deleteOnExit);
    }

    /**
     * Copies a bundled script into a fresh temp directory.
     *
     * @param deleteOnExit registers paths for removal at shutdown; removal runs in reverse
     *                     registration order, so the directory is registered before its file
     */
    static Path extract(String scriptName, Consumer<File> deleteOnExit) throws IOException {
        ClassPathResource resource = new ClassPathResource(CLASSPATH_DIR + scriptName);
        if (!resource.exists()) {
            throw new IOException("Bundled bridge script missing from classpath: " + CLASSPATH_DIR + scriptName);
        }
        Path dir = Files.createTempDirectory("scantomack-bridge-");
        deleteOnExit.accept(dir.toFile());
        Path target = dir.resolve(scriptName);
        deleteOnExit.accept(target.toFile());
        try (InputStream in = resource.getInputStream()) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
        LOG.debug("Extracted bridge script {} to {}", scriptName, target);
        return target;
    }
}
