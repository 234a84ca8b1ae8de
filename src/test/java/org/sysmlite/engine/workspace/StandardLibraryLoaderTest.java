package org.sysmlite.engine.workspace;

import org.sysmlite.engine.build.BuildOptions;
import org.sysmlite.engine.build.StandardLibrary;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StandardLibraryLoaderTest {

    @Test
    void bundledLibraryFollowsIndexOrder() {
        Map<String, String> library = StandardLibraryLoader.loadBundled();
        List<String> uris = List.copyOf(library.keySet());

        assertEquals("library:/Base.kerml", uris.get(0));
        assertEquals("library:/ScalarValues.kerml", uris.get(1));
        assertTrue(uris.contains("library:/Parts.sysml"));
        assertTrue(uris.stream().noneMatch(uri -> uri.endsWith("index.txt")));
        assertTrue(library.get("library:/Base.kerml").contains("Anything"));
    }

    @Test
    void noLibrary() {
        BuildOptions options = BuildOptions.defaults().withStandardLibrary(StandardLibrary.NONE);
        assertTrue(StandardLibraryLoader.load(options).isEmpty());
    }

    @Test
    void readsModelFilesFromDirectory(@TempDir Path directory) throws IOException {
        Path nested = Files.createDirectories(directory.resolve("nested"));
        Files.writeString(directory.resolve("b.kerml"), "package B;");
        Files.writeString(directory.resolve("a.sysml"), "package A;");
        Files.writeString(nested.resolve("c.kerml"), "package C;");
        Files.writeString(directory.resolve("notes.txt"), "not a model");

        Map<String, String> library = StandardLibraryLoader.load(BuildOptions.defaults().withLocalLibrary(directory));

        assertEquals(List.of(
                directory.resolve("a.sysml").toUri().toString(),
                directory.resolve("b.kerml").toUri().toString(),
                nested.resolve("c.kerml").toUri().toString()), List.copyOf(library.keySet()));
        assertEquals("package B;", library.get(directory.resolve("b.kerml").toUri().toString()));
    }

    @Test
    void rejectsMissingDirectory(@TempDir Path directory) {
        Path missing = directory.resolve("missing");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> StandardLibraryLoader.loadDirectory(missing));
        assertEquals("Standard library path is not a directory: " + missing, e.getMessage());
    }
}
