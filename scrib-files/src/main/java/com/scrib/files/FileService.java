package com.scrib.files;

import com.scrib.container.ContainerCodec;
import com.scrib.container.ContainerFormat;
import com.scrib.files.config.FileServiceConfig;
import com.scrib.files.exceptions.PasswordRequiredException;
import com.scrib.files.model.EditorContent;
import com.scrib.markup.RichMarkupCodec;
import com.scrib.markup.model.Document;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes documents per file type, off the caller's thread.
 * <p>
 * Every operation runs on a small daemon worker pool and returns a {@link CompletableFuture}.
 * Container encode and decode each spend most of their time in key derivation, so they must
 * never run on the interactive thread. Futures fail with:
 * <ul>
 *   <li>{@link UncheckedIOException}: read, write or rename failed</li>
 *   <li>{@code CorruptFormatException}: not a container</li>
 *   <li>{@code AuthenticationFailureException}: wrong password or altered container</li>
 *   <li>{@link PasswordRequiredException}: encrypted file opened without a password</li>
 * </ul>
 * Running work is not cancellable.
 */
@Singleton
public class FileService {

  private static final Logger log = LoggerFactory.getLogger(FileService.class);

  private final FileServiceConfig config;
  private final ContainerCodec containerCodec;
  private final RichMarkupCodec markupCodec;
  private final RichPayload richPayload;
  private final AtomicFileWriter writer;
  private final ExecutorService worker;

  @Inject
  public FileService(final FileServiceConfig config,
                     final ContainerCodec containerCodec,
                     final RichMarkupCodec markupCodec,
                     final RichPayload richPayload,
                     final AtomicFileWriter writer) {
    log.info("FileService(threads={})", config.cryptoThreads());
    this.config = config;
    this.containerCodec = containerCodec;
    this.markupCodec = markupCodec;
    this.richPayload = richPayload;
    this.writer = writer;
    final AtomicInteger threadCount = new AtomicInteger();
    this.worker = Executors.newFixedThreadPool(config.cryptoThreads(), r -> {
      Thread t = new Thread(r, "scrib-file-worker-" + threadCount.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
  }

  public FileService(final FileServiceConfig config) {
    this(config, new ContainerCodec(), new RichMarkupCodec(), new RichPayload(), new AtomicFileWriter(config));
  }

  /**
   * Stops the worker pool. Work already submitted still completes.
   */
  public void shutdown() {
    log.info("shutdown()");
    worker.shutdown();
  }

  // ── Plain text ───────────────────────────────────────────────────────────

  public CompletableFuture<String> readText(final Path path) {
    Objects.requireNonNull(path, "path");
    return submit(() -> {
      log.debug("readText({})", path.getFileName());
      return Files.readString(path, StandardCharsets.UTF_8);
    });
  }

  public CompletableFuture<Void> writeText(final Path path, final String text) {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(text, "text");
    return submit(() -> {
      log.debug("writeText({})", path.getFileName());
      writer.write(path, text);
      return null;
    });
  }

  // ── Rich markup ──────────────────────────────────────────────────────────

  /**
   * Reads a markup file. Bytes that are not valid UTF-8 are read as ISO-8859-1 when the
   * fallback is enabled.
   *
   * @param path the file
   * @return the document
   */
  public CompletableFuture<Document> readRich(final Path path) {
    Objects.requireNonNull(path, "path");
    return submit(() -> {
      log.debug("readRich({})", path.getFileName());
      byte[] bytes = Files.readAllBytes(path);
      return markupCodec.toInternal(decodeMarkup(path, bytes));
    });
  }

  public CompletableFuture<Void> writeRich(final Path path, final Document document) {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(document, "document");
    return submit(() -> {
      log.debug("writeRich({})", path.getFileName());
      writer.write(path, markupCodec.toExternal(document));
      return null;
    });
  }

  private String decodeMarkup(Path path, byte[] bytes) throws CharacterCodingException {
    try {
      return StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes))
          .toString();
    } catch (CharacterCodingException e) {
      if (!config.latin1Fallback()) {
        throw e;
      }
      log.warn("readRich({}): not UTF-8, reading as ISO-8859-1", path.getFileName());
      return new String(bytes, StandardCharsets.ISO_8859_1);
    }
  }

  // ── Encrypted ────────────────────────────────────────────────────────────

  /**
   * Decrypts a container. Rich payloads come back as rich content.
   *
   * @param path     the file
   * @param password the password
   * @return the content
   */
  public CompletableFuture<EditorContent> readEncrypted(final Path path, final String password) {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(password, "password");
    return submit(() -> {
      log.debug("readEncrypted({})", path.getFileName());
      byte[] container = Files.readAllBytes(path);
      return richPayload.unwrap(containerCodec.decode(container, password));
    });
  }

  public CompletableFuture<Void> writeEncrypted(final Path path, final String text, final String password) {
    return writeEncrypted(path, EditorContent.plain(text), password);
  }

  /**
   * Encrypts content into a container. Rich content is stored in the rich envelope.
   *
   * @param path     the file
   * @param content  the content
   * @param password the password
   * @return completion
   */
  public CompletableFuture<Void> writeEncrypted(final Path path, final EditorContent content, final String password) {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(content, "content");
    Objects.requireNonNull(password, "password");
    return submit(() -> {
      log.debug("writeEncrypted({}, mode={})", path.getFileName(), content.mode());
      String plaintext = content.isRich() ? richPayload.wrap(content.document()) : content.plainText();
      writer.write(path, containerCodec.encode(plaintext, password));
      return null;
    });
  }

  /**
   * True when the file starts with the container magic. Reads at most the magic's length.
   * Missing and shorter files are not containers.
   *
   * @param path the file
   * @return the result
   */
  public CompletableFuture<Boolean> isEncryptedFile(final Path path) {
    Objects.requireNonNull(path, "path");
    return submit(() -> {
      if (!Files.isRegularFile(path)) {
        return false;
      }
      try (InputStream in = Files.newInputStream(path)) {
        byte[] header = in.readNBytes(ContainerFormat.MAGIC_LENGTH);
        return ContainerCodec.isContainer(header);
      }
    });
  }

  // ── Dispatch ─────────────────────────────────────────────────────────────

  /**
   * Opens a file according to its {@link FileType}.
   *
   * @param path     the file
   * @param password the password for encrypted files, may be null otherwise
   * @return the content; fails with {@link PasswordRequiredException} for an encrypted file
   *     without a password
   */
  public CompletableFuture<EditorContent> open(final Path path, final String password) {
    Objects.requireNonNull(path, "path");
    return switch (FileType.fromPath(path)) {
      case ENCRYPTED -> password == null
          ? CompletableFuture.failedFuture(new PasswordRequiredException(path))
          : readEncrypted(path, password);
      case RICH_MARKUP -> readRich(path).thenApply(EditorContent::rich);
      case PLAIN_TEXT -> readText(path).thenApply(EditorContent::plain);
    };
  }

  /**
   * Saves content according to the destination's {@link FileType}. Rich content saved as
   * plain text keeps only its plain-text view; plain content saved as markup becomes one
   * unformatted paragraph, whose break stands in for a final newline of the text.
   *
   * @param path     the file
   * @param content  the content
   * @param password the password, required for encrypted files
   * @return completion
   */
  public CompletableFuture<Void> save(final Path path, final EditorContent content, final String password) {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(content, "content");
    return switch (FileType.fromPath(path)) {
      case ENCRYPTED -> password == null
          ? CompletableFuture.failedFuture(new PasswordRequiredException(path))
          : writeEncrypted(path, content, password);
      case RICH_MARKUP -> writeRich(path, content.isRich()
          ? content.document()
          : Document.fromPlainText(withoutFinalNewline(content.plainText())));
      case PLAIN_TEXT -> writeText(path, content.plainText());
    };
  }

  /** The paragraph marker already ends the text, so one trailing newline is redundant. */
  private static String withoutFinalNewline(final String text) {
    return text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
  }

  private <T> CompletableFuture<T> submit(IoTask<T> task) {
    return CompletableFuture.supplyAsync(() -> {
      try {
        return task.call();
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    }, worker);
  }

  @FunctionalInterface
  private interface IoTask<T> {
    T call() throws IOException;
  }
}
