package org.checkpulse.checkfile;

import java.nio.file.Path;
import java.util.List;

/**
 * Parsed contents of one checkfile. Hidden files carry no definitions.
 */
public record CheckFile(Path path,
                        Path realPath,
                        boolean hidden,
                        List<CheckDefinition> definitions,
                        List<Section> sections,
                        List<ParseDiagnostic> diagnostics) {

    public CheckFile {
        definitions = List.copyOf(definitions);
        sections = List.copyOf(sections);
        diagnostics = List.copyOf(diagnostics);
    }

    public static CheckFile hidden(Path path, Path realPath) {
        return new CheckFile(path, realPath, true, List.of(), List.of(), List.of());
    }

    public static boolean isHiddenName(Path path) {
        Path fileName = path.getFileName();
        return fileName != null && fileName.toString().startsWith(".");
    }
}
