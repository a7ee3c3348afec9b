package com.scrib.files;

import com.scrib.files.config.FileServiceConfig;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces a file's content so that readers see either the old content or the new, never a
 * partial write. Data goes to a sibling temp file, is forced to disk, then renamed over the
 * destination. On failure the temp file is removed and the destination is left untouched.
 * <p>
 * Knows nothing about content formats; plain, markup and encrypted saves all go through here.
 */
@Singleton
public class AtomicFileWriter {

  private static final Logger log = LoggerFactory.getLogger(AtomicFileWriter.class);

  private final String tempSuffix;

  @Inject
  public AtomicFileWriter(final FileServiceConfig config) {
    log.info("AtomicFileWriter({})", config.tempSuffix());
    this.tempSuffix = config.tempSuffix();
  }

  public AtomicFileWriter() {
    this(FileServiceConfig.DEFAULT);
  }

  /**
   * Writes text as UTF-8.
   *
   * @param path the destination
   * @param text the text
   * @throws IOException if writing, flushing or renaming fails
   */
  public void write(final Path path, final String text) throws IOException {
    Objects.requireNonNull(text, "text");
    write(path, text.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Writes bytes.
   *
   * @param path  the destination
   * @param bytes the content
   * @throws IOException if writing, flushing or renaming fails
   */
  public void write(final Path path, final byte[] bytes) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(bytes, "bytes");
    final Path temp = tempPathFor(path);
    log.debug("write({}, {} bytes)", path.getFileName(), bytes.length);
    try {
      try (FileChannel channel = FileChannel.open(temp,
          StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        while (buffer.hasRemaining()) {
          channel.write(buffer);
        }
        channel.force(true);
      }
      moveIntoPlace(temp, path);
    } catch (IOException | RuntimeException e) {
      log.warn("write({}): failed, removing temp file: {}", path.getFileName(), e.getMessage());
      try {
        Files.deleteIfExists(temp);
      } catch (IOException cleanup) {
        e.addSuppressed(cleanup);
      }
      throw e;
    }
  }

  /**
   * The sibling temp path used for a destination.
   *
   * @param path the destination
   * @return the temp path
   */
  public Path tempPathFor(final Path path) {
    Path fileName = path.getFileName();
    if (fileName == null) {
      throw new IllegalArgumentException("Not a file path: " + path);
    }
    return path.resolveSibling(fileName + tempSuffix);
  }

  /**
   * Renames the temp file over the destination. Falls back to a plain replacing move where the
   * file system has no atomic rename.
   *
   * @param temp   the written temp file
   * @param target the destination
   * @throws IOException if the rename fails
   */
  protected void moveIntoPlace(final Path temp, final Path target) throws IOException {
    try {
      Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      log.debug("moveIntoPlace(): atomic move unsupported, replacing");
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
