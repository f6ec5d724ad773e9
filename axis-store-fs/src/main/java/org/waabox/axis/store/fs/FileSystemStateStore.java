package org.waabox.axis.store.fs;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.axis.model.Mode;
import org.waabox.axis.persistence.PersistenceException;
import org.waabox.axis.persistence.StateStore;

/**
 * A {@link StateStore} implementation that persists the dashboard state to
 * the local filesystem.
 *
 * <p>Every key is its own file so that writes stay key-by-key. Item ids are
 * encoded with the URL-safe Base64 alphabet to produce portable file names.
 *
 * <p>Writes use an atomic pattern: the value is written to a unique
 * temporary file in the same directory and then moved over the target. A
 * crash mid-write leaves the previous value intact.
 *
 * <p>Storage layout:
 * <pre>
 * {baseDir}/
 *   mode
 *   statuses/
 *     {base64url(id)}.status
 * </pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FileSystemStateStore implements StateStore {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(FileSystemStateStore.class);

  /** The name of the mode file. */
  private static final String MODE_FILE = "mode";

  /** The name of the status directory. */
  private static final String STATUS_DIR = "statuses";

  /** The extension of status files. */
  private static final String STATUS_EXTENSION = ".status";

  /** The encoder of item ids into file names. */
  private static final Base64.Encoder ID_ENCODER =
      Base64.getUrlEncoder().withoutPadding();

  /** The decoder of file names into item ids. */
  private static final Base64.Decoder ID_DECODER = Base64.getUrlDecoder();

  /** The base directory, never null. */
  private final Path baseDir;

  /** The status directory, never null. */
  private final Path statusDir;

  /**
   * Creates a new store rooted at the given directory.
   *
   * <p>The directory and its status subdirectory are created if missing.
   *
   * @param theBaseDir the base directory, never null
   *
   * @throws UncheckedIOException if the directories cannot be created
   */
  public FileSystemStateStore(final Path theBaseDir) {
    Objects.requireNonNull(theBaseDir, "baseDir must not be null");
    baseDir = theBaseDir;
    statusDir = theBaseDir.resolve(STATUS_DIR);

    try {
      Files.createDirectories(statusDir);
    } catch (final IOException e) {
      throw new UncheckedIOException(
          "Failed to create state directory: " + statusDir, e);
    }
  }

  /**
   * {@inheritDoc}
   *
   * <p>A missing file or an unknown mode name yields empty.
   */
  @Override
  public Optional<Mode> loadMode() {
    final Path modeFile = baseDir.resolve(MODE_FILE);
    if (!Files.exists(modeFile)) {
      return Optional.empty();
    }
    try {
      final String value = Files.readString(modeFile, StandardCharsets.UTF_8)
          .trim();
      final Optional<Mode> mode = Mode.parse(value);
      if (mode.isEmpty()) {
        log.warn("Ignoring unknown stored mode '{}'", value);
      }
      return mode;
    } catch (final IOException e) {
      throw new PersistenceException("Failed to read " + modeFile, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void saveMode(final Mode mode) {
    Objects.requireNonNull(mode, "mode must not be null");
    writeAtomically(baseDir, baseDir.resolve(MODE_FILE), mode.name());
  }

  /** {@inheritDoc} */
  @Override
  public Map<String, String> loadStatuses() {
    final Map<String, String> statuses = new HashMap<>();
    try (DirectoryStream<Path> files =
        Files.newDirectoryStream(statusDir, "*" + STATUS_EXTENSION)) {
      for (final Path file : files) {
        final String id = decodeId(file.getFileName().toString());
        if (id == null) {
          log.warn("Skipping status file with undecodable name: {}", file);
          continue;
        }
        try {
          statuses.put(id, Files.readString(file, StandardCharsets.UTF_8));
        } catch (final IOException e) {
          log.warn("Skipping unreadable status file {}: {}", file,
              e.getMessage());
        }
      }
    } catch (final IOException e) {
      throw new PersistenceException("Failed to read " + statusDir, e);
    }
    return statuses;
  }

  /** {@inheritDoc} */
  @Override
  public void saveStatus(final String id, final String status) {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(status, "status must not be null");
    writeAtomically(statusDir, statusFile(id), status);
  }

  /** {@inheritDoc} */
  @Override
  public void deleteStatus(final String id) {
    Objects.requireNonNull(id, "id must not be null");
    final Path file = statusFile(id);
    try {
      Files.deleteIfExists(file);
    } catch (final IOException e) {
      throw new PersistenceException("Failed to delete " + file, e);
    }
  }

  /**
   * Resolves the file holding the status of an item.
   *
   * @param id the item id, never null
   *
   * @return the path, never null
   */
  Path statusFile(final String id) {
    final String encoded = ID_ENCODER.encodeToString(
        id.getBytes(StandardCharsets.UTF_8));
    return statusDir.resolve(encoded + STATUS_EXTENSION);
  }

  /**
   * Decodes the item id of a status file name.
   *
   * @param fileName the file name, never null
   *
   * @return the id, or null if the name is not valid Base64
   */
  private static String decodeId(final String fileName) {
    final String encoded = fileName.substring(0,
        fileName.length() - STATUS_EXTENSION.length());
    try {
      return new String(ID_DECODER.decode(encoded), StandardCharsets.UTF_8);
    } catch (final IllegalArgumentException e) {
      return null;
    }
  }

  /**
   * Writes a value to a temporary file and moves it over the target.
   *
   * @param dir    the directory of the target, never null
   * @param target the target file, never null
   * @param value  the content, never null
   */
  private static void writeAtomically(final Path dir, final Path target,
      final String value) {
    try {
      final Path temp = Files.createTempFile(dir, "axis-", ".tmp");
      Files.writeString(temp, value, StandardCharsets.UTF_8);
      Files.move(temp, target,
          StandardCopyOption.REPLACE_EXISTING,
          StandardCopyOption.ATOMIC_MOVE);
    } catch (final IOException e) {
      throw new PersistenceException("Failed to write " + target, e);
    }
  }
}
