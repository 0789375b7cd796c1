package org.moxie.attestgate.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Pretty-printed JSON documents in one directory. Writes go through a temporary file and an atomic
 * rename, so readers never observe a half-written document.
 */
public class JsonArtifactStore {

  private static final Logger log = LoggerFactory.getLogger(JsonArtifactStore.class);

  private final Path         directory;
  private final ObjectMapper mapper;

  public JsonArtifactStore(Path directory, ObjectMapper mapper) {
    this.directory = directory;
    this.mapper    = mapper;
  }

  public Path write(String name, Object document) throws ReportStorageException {
    Path target = directory.resolve(name);

    try {
      Files.createDirectories(directory);
      Path temp = Files.createTempFile(directory, name, ".tmp");

      try {
        mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), document);
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } finally {
        Files.deleteIfExists(temp);
      }
    } catch (IOException e) {
      throw new ReportStorageException("Could not write " + target, e);
    }

    log.debug("Wrote {}", target);
    return target;
  }

  public <T> Optional<T> read(String name, Class<T> type) throws ReportStorageException {
    Path source = directory.resolve(name);
    if (!Files.isRegularFile(source)) return Optional.empty();

    try {
      return Optional.of(mapper.readValue(source.toFile(), type));
    } catch (IOException e) {
      throw new ReportStorageException("Could not read " + source, e);
    }
  }

  public boolean delete(String name) throws ReportStorageException {
    try {
      return Files.deleteIfExists(directory.resolve(name));
    } catch (IOException e) {
      throw new ReportStorageException("Could not delete " + directory.resolve(name), e);
    }
  }

  public Path getDirectory() {
    return directory;
  }
}
