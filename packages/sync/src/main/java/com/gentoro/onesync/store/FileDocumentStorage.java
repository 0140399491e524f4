package com.gentoro.onesync.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.gentoro.onesync.exception.IoException;
import com.gentoro.onesync.exception.SerializationException;
import com.gentoro.onesync.exception.StateException;
import com.gentoro.onesync.model.Database;
import com.gentoro.onesync.utility.JacksonUtility;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.Optional;

/**
 * Stores the mirror as pretty-printed JSON in a single file.
 *
 * <p>Writes go to a sibling temp file that is then moved over the target, so readers never see a
 * half-written document. While open, an exclusive lock on {@code <file>.lock} keeps a second
 * process from writing the same file.
 */
public class FileDocumentStorage implements DocumentStorage {
  private static final org.slf4j.Logger log =
      com.gentoro.onesync.logging.LoggingService.getLogger(FileDocumentStorage.class);

  private final Path file;
  private final Path lockFile;
  private FileChannel lockChannel;
  private FileLock lock;

  public FileDocumentStorage(Path file) {
    this.file = Objects.requireNonNull(file, "file").toAbsolutePath().normalize();
    this.lockFile = this.file.resolveSibling(this.file.getFileName() + ".lock");
  }

  public Path getFile() {
    return file;
  }

  @Override
  public synchronized void open() {
    if (lock != null) return;
    try {
      Path parent = file.getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      lockChannel =
          FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
      lock = lockChannel.tryLock();
    } catch (OverlappingFileLockException e) {
      lock = null;
    } catch (IOException e) {
      closeChannel();
      throw new IoException("Failed to open database file " + file + ": " + e.getMessage(), e);
    }
    if (lock == null) {
      closeChannel();
      throw new StateException("Database file " + file + " is already in use by another owner");
    }
    log.debug("Acquired lock {}", lockFile);
  }

  @Override
  public Optional<Database> read() {
    if (!Files.isRegularFile(file)) {
      log.debug("Database file not found: {}", file);
      return Optional.empty();
    }
    try (var in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      return Optional.ofNullable(JacksonUtility.getJsonMapper().readValue(in, Database.class));
    } catch (JsonProcessingException e) {
      throw new SerializationException("Malformed database file " + file, e);
    } catch (IOException e) {
      throw new IoException("Failed to read database file " + file + ": " + e.getMessage(), e);
    }
  }

  @Override
  public void write(Database database) {
    Objects.requireNonNull(database, "database");
    Path temp = file.resolveSibling(file.getFileName() + ".tmp");
    try {
      Files.writeString(temp, JacksonUtility.toJson(database), StandardCharsets.UTF_8);
      try {
        Files.move(
            temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        log.debug("Atomic move not supported for {}, replacing in place", file);
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      throw new IoException("Failed to write database file " + file + ": " + e.getMessage(), e);
    }
  }

  @Override
  public synchronized void close() {
    if (lock != null) {
      try {
        lock.release();
      } catch (IOException e) {
        log.warn("Failed to release lock {}: {}", lockFile, e.getMessage());
      }
      lock = null;
    }
    closeChannel();
  }

  private void closeChannel() {
    if (lockChannel == null) return;
    try {
      lockChannel.close();
    } catch (IOException e) {
      log.warn("Failed to close lock file {}: {}", lockFile, e.getMessage());
    }
    lockChannel = null;
  }

  @Override
  public String describe() {
    return file.toString();
  }
}
