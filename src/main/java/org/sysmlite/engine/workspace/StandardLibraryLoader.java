package org.sysmlite.engine.workspace;

import org.sysmlite.engine.build.BuildOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Reads standard library model text, either bundled on the classpath or from
 * a local directory.
 *
 * The bundled library is listed in {@code sysml.library/index.txt}, one file
 * name per line.
 */
public final class StandardLibraryLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(StandardLibraryLoader.class);

    public static final String RESOURCE_DIR = "sysml.library/";
    public static final String URI_SCHEME = "library:/";

    private StandardLibraryLoader() {
        // Static utility class
    }

    /**
     * @return library document texts by URI, in load order
     */
    public static Map<String, String> load(BuildOptions options) {
        return switch (options.standardLibrary()) {
            case NONE -> Map.of();
            case STANDARD -> loadBundled();
            case LOCAL -> loadDirectory(options.localLibraryPath());
        };
    }

    static Map<String, String> loadBundled() {
        Map<String, String> result = new LinkedHashMap<>();
        String index = readResource(RESOURCE_DIR + "index.txt");
        if (index == null) {
            LOGGER.warn("Bundled standard library index not found");
            return result;
        }
        for (String line : index.split("\\R")) {
            String name = line.strip();
            if (name.isEmpty() || name.startsWith("#")) {
                continue;
            }
            String text = readResource(RESOURCE_DIR + name);
            if (text == null) {
                LOGGER.warn("Standard library file {} listed in index but not found", name);
                continue;
            }
            result.put(URI_SCHEME + name, text);
        }
        LOGGER.debug("Loaded {} bundled standard library files", result.size());
        return result;
    }

    /**
     * Reads every {@code .kerml} and {@code .sysml} file below {@code directory},
     * sorted by path.
     */
    static Map<String, String> loadDirectory(Path directory) {
        if (!Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Standard library path is not a directory: " + directory);
        }
        List<Path> files = new ArrayList<>();
        try (Stream<Path> walk = Files.walk(directory)) {
            walk.filter(Files::isRegularFile)
                    .filter(p -> p.toString().endsWith(".kerml") || p.toString().endsWith(".sysml"))
                    .sorted()
                    .forEach(files::add);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not list standard library directory " + directory, e);
        }
        Map<String, String> result = new LinkedHashMap<>();
        for (Path file : files) {
            try {
                result.put(file.toUri().toString(), Files.readString(file, StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new UncheckedIOException("Could not read standard library file " + file, e);
            }
        }
        LOGGER.debug("Loaded {} standard library files from {}", result.size(), directory);
        return result;
    }

    private static String readResource(String name) {
        try (InputStream in = StandardLibraryLoader.class.getClassLoader().getResourceAsStream(name)) {
            if (in == null) {
                return null;
            }
            StringBuilder sb = new StringBuilder();
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    sb.append(line).append('\n');
                }
            }
            return sb.toString();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read resource " + name, e);
        }
    }
}
