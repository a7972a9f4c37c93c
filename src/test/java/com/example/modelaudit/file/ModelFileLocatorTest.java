package com.example.modelaudit.file;

import com.example.modelaudit.model.ModelFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModelFileLocatorTest {

    private static final String PATTERN = ".*\\.(xlsx|xlsm|xls)";

    @TempDir
    Path directory;

    private Path touch(String name, Instant modified) throws IOException {
        Path file = Files.writeString(directory.resolve(name), "x");
        Files.setLastModifiedTime(file, FileTime.from(modified));
        return file;
    }

    @Test
    void whenFindModelFiles_givenMixedDirectory_shouldListMatchesOldestFirstWithoutLockFiles() throws IOException {
        Instant now = Instant.parse("2024-06-01T10:00:00Z");
        Path older = touch("Q1 Model.xlsx", now.minusSeconds(3600));
        Path newer = touch("Q2 Model.XLSM", now);
        touch("~$Q2 Model.XLSM", now.plusSeconds(60));
        touch("notes.txt", now.plusSeconds(120));

        ModelFileLocator locator = new ModelFileLocator(directory, PATTERN);

        List<ModelFile> files = locator.findModelFiles();
        assertEquals(List.of(older, newer), files.stream().map(ModelFile::path).toList());
        assertEquals(Optional.of(newer), locator.findLatestModelFile().map(ModelFile::path));
    }

    @Test
    void whenFindModelFiles_givenMissingDirectory_shouldReturnNothing() {
        ModelFileLocator locator = new ModelFileLocator(directory.resolve("absent"), PATTERN);

        assertTrue(locator.findModelFiles().isEmpty());
        assertTrue(locator.findLatestModelFile().isEmpty());
    }
}
