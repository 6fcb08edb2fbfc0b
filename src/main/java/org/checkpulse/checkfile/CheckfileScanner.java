package org.checkpulse.checkfile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystemLoopException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;

/**
 * Discovers checkfiles below a root directory, following symlinks and skipping hidden entries.
 */
public class CheckfileScanner {

    private static final Logger logger = LoggerFactory.getLogger(CheckfileScanner.class);

    private final CheckfileParser parser;

    public CheckfileScanner(CheckfileParser parser) {
        this.parser = parser;
    }

    /**
     * Returns every non-hidden checkfile below {@code root}, ordered by path.
     */
    public List<CheckFile> scan(Path root) {
        if (!Files.isDirectory(root)) {
            logger.warn("Checkfiles directory {} does not exist", root);
            return List.of();
        }

        List<Path> paths = new ArrayList<>();
        try {
            Files.walkFileTree(root, EnumSet.of(FileVisitOption.FOLLOW_LINKS), Integer.MAX_VALUE,
                    new SimpleFileVisitor<>() {
                        @Override
                        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                            if (!dir.equals(root) && CheckFile.isHiddenName(dir)) {
                                return FileVisitResult.SKIP_SUBTREE;
                            }
                            return FileVisitResult.CONTINUE;
                        }

                        @Override
                        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                            if (attrs.isRegularFile() && !CheckFile.isHiddenName(file)) {
                                paths.add(file);
                            }
                            return FileVisitResult.CONTINUE;
                        }

                        @Override
                        public FileVisitResult visitFileFailed(Path file, IOException e) {
                            if (e instanceof FileSystemLoopException) {
                                logger.warn("Symlink loop at {}, skipping", file);
                            } else {
                                logger.warn("Cannot read {}: {}", file, e.getMessage());
                            }
                            return FileVisitResult.CONTINUE;
                        }
                    });
        } catch (IOException e) {
            logger.error("Failed to scan checkfiles directory {}: {}", root, e.getMessage(), e);
            return List.of();
        }

        paths.sort(Comparator.comparing(Path::toString));

        List<CheckFile> files = new ArrayList<>();
        for (Path path : paths) {
            try {
                files.add(parser.load(path));
            } catch (IOException e) {
                logger.warn("Failed to read checkfile {}: {}", path, e.getMessage());
            }
        }
        logger.debug("Scanned {} checkfiles below {}", files.size(), root);
        return files;
    }
}
