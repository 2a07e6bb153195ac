package com.phillippitts.scantomack.service.ocr.bridge;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * {@link ProcessFactory} backed by {@link ProcessBuilder}. stdout and stderr stay separate:
 * stdout carries protocol frames, stderr only diagnostics.
 */
public final class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(List<String> command, Path workingDir) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }
        pb.redirectErrorStream(false);
        pb.environment().put("PYTHONUNBUFFERED", "1");
        return pb.start();
    }
}
