package com.example.modelaudit.model;

import java.nio.file.Path;
import java.time.Instant;

public record ModelFile(Path path, Instant lastModified) {
}
