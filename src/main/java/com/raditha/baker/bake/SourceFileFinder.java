package com.raditha.baker.bake;

import com.raditha.baker.config.BakerConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Expands files and directories given on the command line into the list of
 * source files to bake.
 */
public class SourceFileFinder {

    private final BakerConfig config;

    public SourceFileFinder(BakerConfig config) {
        this.config = config;
    }

    /**
     * Collect source files. Files named explicitly are always included;
     * directories are searched recursively for configured extensions,
     * skipping excluded paths.
     *
     * @throws NoSuchFileException if a given path does not exist
     * @throws IOException         if a directory cannot be traversed
     */
    public List<Path> find(List<Path> paths) throws IOException {
        Set<Path> files = new LinkedHashSet<>();
        for (Path path : paths) {
            if (!Files.exists(path)) {
                throw new NoSuchFileException(path.toString());
            }
            if (Files.isRegularFile(path)) {
                files.add(path.normalize());
                continue;
            }
            try (Stream<Path> stream = Files.walk(path)) {
                stream.filter(Files::isRegularFile)
                        .filter(p -> config.hasSourceExtension(p.getFileName().toString()))
                        .filter(p -> !config.shouldExclude(p.toString()))
                        .sorted()
                        .forEach(p -> files.add(p.normalize()));
            }
        }
        return new ArrayList<>(files);
    }
}
