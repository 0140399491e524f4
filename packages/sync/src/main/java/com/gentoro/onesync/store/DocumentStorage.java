package com.gentoro.onesync.store;

import com.gentoro.onesync.model.Database;
import java.util.Optional;

/**
 * Backing medium for the single mirror document. Implementations read and write the whole
 * document at once; callers serialize access.
 */
public interface DocumentStorage extends AutoCloseable {

  /**
   * Acquires whatever the storage needs before reads and writes, such as directories and the
   * owner lock.
   *
   * @throws com.gentoro.onesync.exception.StateException if another owner holds the storage.
   */
  void open();

  /**
   * @return the stored document, or empty when nothing has been written yet.
   */
  Optional<Database> read();

  /** Replaces the stored document. */
  void write(Database database);

  /** Releases resources acquired by {@link #open()}. Safe to call more than once. */
  @Override
  void close();

  String describe();
}
