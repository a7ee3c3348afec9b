package com.scrib.files;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;

import com.scrib.container.ContainerCodec;
import com.scrib.container.exceptions.AuthenticationFailureException;
import com.scrib.container.exceptions.CorruptFormatException;
import com.scrib.files.config.FileServiceConfig;
import com.scrib.files.exceptions.PasswordRequiredException;
import com.scrib.files.model.EditorContent;
import com.scrib.markup.RichMarkupCodec;
import com.scrib.markup.model.BlockAttributes;
import com.scrib.markup.model.BlockMarker;
import com.scrib.markup.model.Document;
import com.scrib.markup.model.InlineAttributes;
import com.scrib.markup.model.ListKind;
import com.scrib.markup.model.StyledRun;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * End-to-end behaviour of {@link FileService} against a temporary directory, using the real
 * codecs. Encrypted cases run the full key derivation.
 */
class FileServiceTest {

  private static final Document RICH = Document.builder()
      .text("Shopping").paragraph(BlockAttributes.heading(2))
      .text("eggs ").text("(free range)", InlineAttributes.builder().italic(true).build())
      .paragraph(BlockAttributes.list(ListKind.BULLET))
      .build();

  @TempDir
  Path dir;

  private FileService service;

  @BeforeEach
  void setUp() {
    service = new FileService(FileServiceConfig.forTesting());
  }

  @AfterEach
  void tearDown() {
    service.shutdown();
  }

  // ─── Plain text ───────────────────────────────────────────────────────────

  @Test
  void text_roundTrips() {
    Path path = dir.resolve("notes.txt");

    service.writeText(path, "line 1\nline 2 ✓\n").join();

    assertThat(service.readText(path).join()).isEqualTo("line 1\nline 2 ✓\n");
    assertThat(dir.resolve("notes.txt.tmp")).doesNotExist();
  }

  @Test
  void readText_missingFileFailsWithIo() {
    assertThatThrownBy(() -> service.readText(dir.resolve("missing.txt")).join())
        .isInstanceOf(CompletionException.class)
        .hasCauseInstanceOf(UncheckedIOException.class);
  }

  @Test
  void writeFailure_surfacesAsUncheckedIo() throws IOException {
    AtomicFileWriter writer = mock(AtomicFileWriter.class);
    doThrow(new IOException("disk full")).when(writer).write(any(Path.class), anyString());
    FileService failing = new FileService(FileServiceConfig.forTesting(), new ContainerCodec(),
        new RichMarkupCodec(), new RichPayload(), writer);
    try {
      assertThatThrownBy(() -> failing.writeText(dir.resolve("a.txt"), "x").join())
          .isInstanceOf(CompletionException.class)
          .hasCauseInstanceOf(UncheckedIOException.class)
          .hasRootCauseMessage("disk full");
    } finally {
      failing.shutdown();
    }
  }

  // ─── Rich markup ──────────────────────────────────────────────────────────

  @Test
  void rich_roundTrips() throws IOException {
    Path path = dir.resolve("list.rtf");

    service.writeRich(path, RICH).join();

    assertThat(Files.readString(path)).startsWith("{\\rtf1");
    assertThat(service.readRich(path).join()).isEqualTo(RICH);
  }

  @Test
  void readRich_fallsBackToLatin1() throws IOException {
    Path path = dir.resolve("word.rtf");
    Files.write(path, "{\\rtf1 café\\par}".getBytes(StandardCharsets.ISO_8859_1));

    assertThat(service.readRich(path).join().plainText()).isEqualTo("café\n");
  }

  @Test
  void readRich_withoutFallbackRejectsLatin1() throws IOException {
    Path path = dir.resolve("word.rtf");
    Files.write(path, "{\\rtf1 café\\par}".getBytes(StandardCharsets.ISO_8859_1));
    FileService strict = new FileService(FileServiceConfig.forTesting().withLatin1Fallback(false));
    try {
      assertThatThrownBy(() -> strict.readRich(path).join())
          .hasCauseInstanceOf(UncheckedIOException.class);
    } finally {
      strict.shutdown();
    }
  }

  @Test
  void readRich_plainFileBecomesOneParagraph() throws IOException {
    Path path = dir.resolve("plain.rtf");
    Files.writeString(path, "not markup");

    assertThat(service.readRich(path).join()).isEqualTo(Document.fromPlainText("not markup"));
  }

  // ─── Encrypted ────────────────────────────────────────────────────────────

  @Test
  void encryptedPlain_roundTrips() {
    Path path = dir.resolve("secret.scrb");

    service.writeEncrypted(path, "top secret", "pw").join();
    EditorContent content = service.readEncrypted(path, "pw").join();

    assertThat(content).isEqualTo(EditorContent.plain("top secret"));
  }

  @Test
  void encryptedRich_roundTripsThroughEnvelope() {
    Path path = dir.resolve("secret.scrb");

    service.writeEncrypted(path, EditorContent.rich(RICH), "pw").join();
    EditorContent content = service.readEncrypted(path, "pw").join();

    assertThat(content.isRich()).isTrue();
    assertThat(content.document()).isEqualTo(RICH);
  }

  @Test
  void encryptedWork_runsOnWorkerThreads() {
    List<String> codecThreads = new CopyOnWriteArrayList<>();
    ContainerCodec recording = spy(new ContainerCodec());
    doAnswer(invocation -> {
      codecThreads.add(Thread.currentThread().getName());
      return invocation.callRealMethod();
    }).when(recording).encode(anyString(), anyString());
    doAnswer(invocation -> {
      codecThreads.add(Thread.currentThread().getName());
      return invocation.callRealMethod();
    }).when(recording).decode(any(byte[].class), anyString());
    FileServiceConfig config = FileServiceConfig.forTesting();
    FileService offloading = new FileService(
        config, recording, new RichMarkupCodec(), new RichPayload(), new AtomicFileWriter(config));
    Path path = dir.resolve("worker.scrb");
    try {
      offloading.writeEncrypted(path, "secret", "pw").join();
      assertThat(offloading.readEncrypted(path, "pw").join()).isEqualTo(EditorContent.plain("secret"));
    } finally {
      offloading.shutdown();
    }

    assertThat(codecThreads).hasSize(2)
        .allSatisfy(name -> assertThat(name).startsWith("scrib-file-worker-"))
        .doesNotContain(Thread.currentThread().getName());
  }

  @Test
  void readEncrypted_wrongPassword() {
    Path path = dir.resolve("secret.scrb");
    service.writeEncrypted(path, "top secret", "right").join();

    assertThatThrownBy(() -> service.readEncrypted(path, "wrong").join())
        .hasCauseInstanceOf(AuthenticationFailureException.class);
  }

  @Test
  void readEncrypted_notAContainer() throws IOException {
    Path path = dir.resolve("fake.scrb");
    Files.writeString(path, "just some text pretending");

    assertThatThrownBy(() -> service.readEncrypted(path, "pw").join())
        .hasCauseInstanceOf(CorruptFormatException.class);
  }

  @Test
  void isEncryptedFile() throws IOException {
    Path container = dir.resolve("secret.scrb");
    service.writeEncrypted(container, "x", "pw").join();
    Path text = dir.resolve("notes.txt");
    Files.writeString(text, "SCR");
    Path renamed = dir.resolve("renamed.txt");
    Files.copy(container, renamed);

    assertThat(service.isEncryptedFile(container).join()).isTrue();
    assertThat(service.isEncryptedFile(renamed).join()).isTrue();
    assertThat(service.isEncryptedFile(text).join()).isFalse();
    assertThat(service.isEncryptedFile(dir.resolve("missing.scrb")).join()).isFalse();
    assertThat(service.isEncryptedFile(dir).join()).isFalse();
  }

  // ─── Dispatch ─────────────────────────────────────────────────────────────

  @Test
  void open_dispatchesOnExtension() throws IOException {
    Files.writeString(dir.resolve("a.txt"), "plain");
    Files.writeString(dir.resolve("B.RTF"), "{\\rtf1 {\\b x}\\par}");

    assertThat(service.open(dir.resolve("a.txt"), null).join()).isEqualTo(EditorContent.plain("plain"));
    EditorContent rich = service.open(dir.resolve("B.RTF"), null).join();
    assertThat(rich.isRich()).isTrue();
    assertThat(rich.plainText()).isEqualTo("x\n");
  }

  @Test
  void open_encryptedWithoutPasswordAsksForOne() {
    Path path = dir.resolve("secret.scrb");

    assertThatThrownBy(() -> service.open(path, null).join())
        .isInstanceOf(CompletionException.class)
        .hasCauseInstanceOf(PasswordRequiredException.class)
        .hasMessageContaining("secret.scrb");
  }

  @Test
  void save_thenOpen_perFileType() {
    EditorContent content = EditorContent.rich(RICH);
    Path txt = dir.resolve("out.txt");
    Path rtf = dir.resolve("out.rtf");
    Path scrb = dir.resolve("out.scrb");

    service.save(txt, content, null).join();
    service.save(rtf, content, null).join();
    service.save(scrb, content, "pw").join();

    assertThat(service.open(txt, null).join()).isEqualTo(EditorContent.plain("Shopping\neggs (free range)\n"));
    assertThat(service.open(rtf, null).join()).isEqualTo(content);
    assertThat(service.open(scrb, "pw").join()).isEqualTo(content);
  }

  @Test
  void save_plainTextAsMarkup_keepsSingleFinalNewline() {
    Path rtf = dir.resolve("plain.rtf");

    service.save(rtf, EditorContent.plain("one\ntwo\n"), null).join();

    EditorContent reopened = service.open(rtf, null).join();
    assertThat(reopened.plainText()).isEqualTo("one\ntwo\n");
    assertThat(reopened.document().elements()).containsExactly(
        StyledRun.plain("one"), BlockMarker.PARAGRAPH, StyledRun.plain("two"), BlockMarker.PARAGRAPH);
  }

  @Test
  void save_encryptedWithoutPasswordFails() {
    assertThatThrownBy(() -> service.save(dir.resolve("x.scrb"), EditorContent.plain("x"), null).join())
        .hasCauseInstanceOf(PasswordRequiredException.class);
    assertThat(dir.resolve("x.scrb")).doesNotExist();
  }
}
