package org.checkpulse.checkfile;

import java.nio.file.Path;

public record ParseDiagnostic(Path path, int lineNumber, String line, String message) {

    @Override
    public String toString() {
        return path + ":" + lineNumber + ": " + message + " [" + line + "]";
    }
}
