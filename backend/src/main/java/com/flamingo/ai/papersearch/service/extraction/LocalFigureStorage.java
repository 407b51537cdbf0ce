package com.flamingo.ai.papersearch.service.extraction;

import com.flamingo.ai.papersearch.config.RagConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Writes figure images to {@code {basePath}/{documentId}/p{page}_fig{index}.png}. */
@Service
@RequiredArgsConstructor
@Slf4j
public class LocalFigureStorage implements FigureStorage {

  private final RagConfig ragConfig;

  @Override
  public Optional<String> store(UUID documentId, int pageNumber, int index, byte[] png) {
    RagConfig.Figures config = ragConfig.getFigures();
    if (!config.isEnabled() || png == null || png.length == 0) {
      return Optional.empty();
    }
    if (png.length > config.getMaxFileSizeBytes()) {
      log.warn(
          "Skipping oversized figure p{} #{} ({} bytes) for document {}",
          pageNumber,
          index,
          png.length,
          documentId);
      return Optional.empty();
    }

    Path dir = Path.of(config.getBasePath(), documentId.toString());
    Path filePath = dir.resolve("p" + pageNumber + "_fig" + index + ".png");
    try {
      Files.createDirectories(dir);
      Files.write(filePath, png);
      log.debug(
          "Stored figure p{} #{} for document {} at {}", pageNumber, index, documentId, filePath);
      return Optional.of(filePath.toAbsolutePath().toString());
    } catch (IOException e) {
      log.warn(
          "Failed to store figure p{} #{} for document {}: {}",
          pageNumber,
          index,
          documentId,
          e.getMessage());
      return Optional.empty();
    }
  }

  @Override
  public void deleteAll(UUID documentId) {
    Path dir = Path.of(ragConfig.getFigures().getBasePath(), documentId.toString());
    if (!Files.exists(dir)) {
      return;
    }
    try (Stream<Path> paths = Files.walk(dir)) {
      paths.sorted(Comparator.reverseOrder()).forEach(this::deleteQuietly);
    } catch (IOException e) {
      log.warn("Failed to delete figures of document {}: {}", documentId, e.getMessage());
    }
  }

  private void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      log.warn("Could not delete {}: {}", path, e.getMessage());
    }
  }
}
