package org.checkpulse.checkfile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns checkfile text into ordered check definitions.
 *
 * <pre>
 * #- Builds            opens a section titled "Builds"
 * #-                   opens an untitled section
 * # anything else      comment
 * name: command        check line
 * </pre>
 *
 * Malformed lines become {@link ParseDiagnostic}s and are skipped.
 */
public class CheckfileParser {

    private static final Logger logger = LoggerFactory.getLogger(CheckfileParser.class);

    private static final Pattern SECTION_LINE = Pattern.compile("^#-(?:\\s+(.*))?$");
    private static final String NAME_SEPARATOR = ": ";

    /**
     * Reads and parses a file from disk. Hidden files are returned empty.
     */
    public CheckFile load(Path path) throws IOException {
        Path realPath = realPathOf(path);
        if (CheckFile.isHiddenName(path)) {
            logger.debug("Skipping hidden checkfile {}", path);
            return CheckFile.hidden(path, realPath);
        }
        String text = Files.readString(path, StandardCharsets.UTF_8);
        CheckFile file = parse(path, text);
        for (ParseDiagnostic d : file.diagnostics()) {
            logger.warn("Checkfile diagnostic: {}", d);
        }
        return file;
    }

    /**
     * Pure parse of {@code text}; {@code path} only provides the working directory.
     */
    public CheckFile parse(Path path, String text) {
        Path realPath = realPathOf(path);
        Path workingDirectory = realPath.getParent() != null ? realPath.getParent() : realPath;

        List<CheckDefinition> definitions = new ArrayList<>();
        List<Section> sections = new ArrayList<>();
        List<ParseDiagnostic> diagnostics = new ArrayList<>();
        String currentSection = null;

        String[] lines = text.split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            int lineNumber = i + 1;

            if (line.isEmpty()) continue;

            Matcher section = SECTION_LINE.matcher(line);
            if (section.matches()) {
                String title = section.group(1);
                currentSection = (title == null || title.isBlank()) ? null : title.trim();
                sections.add(new Section(currentSection, definitions.size()));
                continue;
            }
            if (line.startsWith("#")) continue;

            int sep = line.indexOf(NAME_SEPARATOR);
            if (sep < 0) {
                diagnostics.add(new ParseDiagnostic(path, lineNumber, line, "expected '<name>: <command>'"));
                continue;
            }
            String name = line.substring(0, sep).trim();
            String command = line.substring(sep + NAME_SEPARATOR.length()).trim();
            if (name.isEmpty()) {
                diagnostics.add(new ParseDiagnostic(path, lineNumber, line, "empty check name"));
                continue;
            }
            if (command.isEmpty()) {
                diagnostics.add(new ParseDiagnostic(path, lineNumber, line, "empty command for check '" + name + "'"));
                continue;
            }
            definitions.add(new CheckDefinition(name, command, path, workingDirectory, currentSection));
        }

        return new CheckFile(path, realPath, false, definitions, sections, diagnostics);
    }

    static Path realPathOf(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            return path.toAbsolutePath().normalize();
        }
    }
}
