package com.example.modelaudit.file;

import com.example.modelaudit.model.ModelFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ModelFileLocator {
    private static final Logger LOGGER = LoggerFactory.getLogger(ModelFileLocator.class);
    private static final String LOCK_FILE_PREFIX = "~$";

    private final Path modelDirectory;
    private final Pattern filePattern;

    public ModelFileLocator(Path modelDirectory, String filePattern) {
        this.modelDirectory = modelDirectory;
        this.filePattern = Pattern.compile(filePattern, Pattern.CASE_INSENSITIVE);
    }

    public List<ModelFile> findModelFiles() {
        if (!Files.isDirectory(modelDirectory)) {
            LOGGER.warn("Model directory does not exist: {}", modelDirectory);
            return List.of();
        }

        try (Stream<Path> stream = Files.list(modelDirectory)) {
            return stream
                    .filter(Files::isRegularFile)
                    .map(this::toModelFile)
                    .flatMap(Optional::stream)
                    .sorted(Comparator.comparing(ModelFile::lastModified))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            LOGGER.error("Failed to list model directory {}", modelDirectory, e);
            return List.of();
        }
    }

    public Optional<ModelFile> findLatestModelFile() {
        List<ModelFile> files = findModelFiles();
        if (files.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(files.get(files.size() - 1));
    }

    private Optional<ModelFile> toModelFile(Path path) {
        String fileName = path.getFileName().toString();
        if (fileName.startsWith(LOCK_FILE_PREFIX) || !filePattern.matcher(fileName).matches()) {
            LOGGER.debug("Skipping file that does not match pattern: {}", fileName);
            return Optional.empty();
        }
        try {
            return Optional.of(new ModelFile(path, Files.getLastModifiedTime(path).toInstant()));
        } catch (IOException e) {
            LOGGER.warn("Failed to read modification time of {}", fileName, e);
            return Optional.empty();
        }
    }
}
