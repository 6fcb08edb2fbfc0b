package org.checkpulse.checkfile;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One check parsed from a checkfile.
 *
 * @param name             unique name within the merged registry
 * @param command          shell command, run with {@code /bin/sh -c}
 * @param sourceFile       checkfile the check was read from
 * @param workingDirectory real directory of the checkfile, symlinks followed
 * @param section          title of the latest {@code #- Title} separator above it, or null
 */
public record CheckDefinition(String name, String command, Path sourceFile, Path workingDirectory, String section) {

    public CheckDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(sourceFile, "sourceFile");
        Objects.requireNonNull(workingDirectory, "workingDirectory");
    }
}
