package org.checkpulse.checkfile;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class CheckfileScannerTest {

    @TempDir
    Path root;

    @TempDir
    Path outside;

    private final CheckfileScanner scanner = new CheckfileScanner(new CheckfileParser());

    @Test
    void findsFilesRecursivelyInPathOrder() throws IOException {
        Files.writeString(root.resolve("b"), "b: true\n");
        Files.createDirectories(root.resolve("a"));
        Files.writeString(root.resolve("a/checks"), "a: true\n");

        var files = scanner.scan(root);

        assertEquals(2, files.size());
        assertEquals(root.resolve("a/checks"), files.get(0).path());
        assertEquals(root.resolve("b"), files.get(1).path());
    }

    @Test
    void skipsHiddenFilesAndDirectories() throws IOException {
        Files.writeString(root.resolve("visible"), "v: true\n");
        Files.writeString(root.resolve(".hidden"), "h: true\n");
        Files.createDirectories(root.resolve(".git"));
        Files.writeString(root.resolve(".git/config"), "g: true\n");

        var names = scanner.scan(root).stream()
                .flatMap(f -> f.definitions().stream())
                .map(CheckDefinition::name)
                .collect(Collectors.toList());

        assertEquals(List.of("v"), names);
    }

    @Test
    void followsSymlinkedDirectories() throws IOException {
        Path store = Files.createDirectories(root.resolve("store"));
        Files.writeString(store.resolve("checks"), "x: true\n");
        Path shared = Files.createDirectories(outside.resolve("shared"));
        Files.writeString(shared.resolve("more"), "y: true\n");
        Files.createSymbolicLink(root.resolve("linked"), shared);

        var files = scanner.scan(root);

        assertEquals(2, files.size());
        var linked = files.get(0);
        assertEquals(root.resolve("linked/more"), linked.path());
        assertEquals(shared.toRealPath(), linked.definitions().get(0).workingDirectory());
    }

    @Test
    void missingRootYieldsNothing() {
        assertTrue(scanner.scan(root.resolve("nope")).isEmpty());
    }
}
