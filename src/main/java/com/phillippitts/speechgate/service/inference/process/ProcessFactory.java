package com.phillippitts.speechgate.service.inference.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} so the process runner can be tested without real
 * executables.
 */
interface ProcessFactory {

    /**
     * @param command    full command line, executable first
     * @param workingDir working directory, or null for the current one
     */
    Process start(List<String> command, Path workingDir) throws IOException;
}
