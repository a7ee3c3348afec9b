package com.scrib.container;

import static com.scrib.container.ContainerFormat.IV_LENGTH;
import static com.scrib.container.ContainerFormat.IV_OFFSET;
import static com.scrib.container.ContainerFormat.MAC_LENGTH;
import static com.scrib.container.ContainerFormat.MAC_OFFSET;
import static com.scrib.container.ContainerFormat.MAGIC;
import static com.scrib.container.ContainerFormat.SALT_LENGTH;
import static com.scrib.container.ContainerFormat.SALT_OFFSET;
import static com.scrib.container.ContainerFormat.VERSION_OFFSET;

import com.scrib.common.ByteUtils;
import com.scrib.container.crypto.ContainerCrypto;
import com.scrib.container.crypto.ContainerRandom;
import com.scrib.container.crypto.KeyMaterial;
import com.scrib.container.exceptions.AuthenticationFailureException;
import com.scrib.container.exceptions.CorruptFormatException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Objects;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.bouncycastle.crypto.DataLengthException;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes and decodes the password-protected {@code .scrb} container.
 * <p>
 * Encoding always writes {@link ContainerVersion#V2}: PBKDF2-HMAC-SHA256 (100k iterations)
 * derives a 64-byte key, AES-256-CBC encrypts with the first half and HMAC-SHA256 over
 * {@code version || iv || salt || ciphertext} authenticates with the second half.
 * Decoding also accepts legacy {@link ContainerVersion#V1} files (10k iterations, no MAC).
 * <p>
 * <strong>Exception contract</strong>:
 * <ul>
 *   <li>{@link CorruptFormatException}: not a container, truncated header, unknown version</li>
 *   <li>{@link AuthenticationFailureException}: wrong password, tampering, bad padding or bad UTF-8</li>
 * </ul>
 * The codec keeps no state between calls, so one instance may serve concurrent calls for
 * different files. Both operations are CPU-bound; see {@code FileService} for the worker
 * that runs them off the interactive thread.
 */
@Singleton
public class ContainerCodec {

  private static final Logger log = LoggerFactory.getLogger(ContainerCodec.class);

  /**
   * Stands in for an empty document so there is always a plaintext byte to pad.
   */
  static final String EMPTY_PLACEHOLDER = "\n";

  private final ContainerRandom random;

  @Inject
  public ContainerCodec(final ContainerRandom random) {
    log.info("ContainerCodec()");
    this.random = random;
  }

  public ContainerCodec() {
    this(new ContainerRandom());
  }

  /**
   * True when the bytes start with the container magic. Only the first four bytes are read.
   *
   * @param header the leading bytes of a file
   * @return the boolean
   */
  public static boolean isContainer(byte[] header) {
    return ByteUtils.startsWith(header, MAGIC);
  }

  /**
   * Encrypts a document into a version 2 container with a fresh IV and salt.
   *
   * @param plaintext the document text; an empty string is stored as a single newline
   * @param password  the password
   * @return the container bytes
   */
  public byte[] encode(final String plaintext, final String password) {
    Objects.requireNonNull(plaintext, "plaintext");
    Objects.requireNonNull(password, "password");
    log.debug("encode()");
    final ContainerVersion version = ContainerVersion.V2;
    final String safe = plaintext.isEmpty() ? EMPTY_PLACEHOLDER : plaintext;
    final byte[] iv = random.iv();
    final byte[] salt = random.salt();
    final byte[] versionByte = {version.id()};
    final byte[] plainBytes = safe.getBytes(StandardCharsets.UTF_8);
    try (KeyMaterial keys = KeyMaterial.derive(password, salt, version)) {
      byte[] ciphertext = ContainerCrypto.encrypt(keys.encKey(), iv, plainBytes);
      byte[] mac = ContainerCrypto.hmacSha256(keys.macKey(), versionByte, iv, salt, ciphertext);
      return ByteUtils.concat(MAGIC, versionByte, iv, salt, mac, ciphertext);
    } finally {
      ByteUtils.zero(plainBytes);
    }
  }

  /**
   * Decrypts a container of either version.
   * <p>
   * A plaintext of exactly one newline is the empty-document placeholder and decodes as
   * {@code ""}, so a document holding only a newline reopens empty.
   *
   * @param container the container bytes
   * @param password  the password
   * @return the document text
   * @throws CorruptFormatException         if the bytes are not a readable container
   * @throws AuthenticationFailureException if the password is wrong or the container was altered
   */
  public String decode(final byte[] container, final String password) {
    Objects.requireNonNull(container, "container");
    Objects.requireNonNull(password, "password");
    final ContainerVersion version = readVersion(container);
    log.debug("decode(version={})", version.id());
    return switch (version) {
      case V1 -> decodeLegacy(container, password);
      case V2 -> decodeAuthenticated(container, password);
    };
  }

  private ContainerVersion readVersion(byte[] container) {
    if (container.length < ContainerFormat.PREAMBLE_LENGTH) {
      throw new CorruptFormatException("Not a valid file: " + container.length + " bytes is too short");
    }
    if (!isContainer(container)) {
      throw new CorruptFormatException("Not a valid file: missing SCRB signature");
    }
    byte id = container[VERSION_OFFSET];
    ContainerVersion version = ContainerVersion.fromId(id)
        .orElseThrow(() -> new CorruptFormatException(
            "Not a valid file: unsupported version 0x" + String.format("%02x", id)));
    if (container.length < version.minimumLength()) {
      throw new CorruptFormatException("Not a valid file: truncated version "
          + version.id() + " header (" + container.length + " bytes)");
    }
    return version;
  }

  private String decodeAuthenticated(byte[] container, String password) {
    final ContainerVersion version = ContainerVersion.V2;
    final byte[] versionByte = {version.id()};
    final byte[] iv = ByteUtils.slice(container, IV_OFFSET, IV_LENGTH);
    final byte[] salt = ByteUtils.slice(container, SALT_OFFSET, SALT_LENGTH);
    final byte[] mac = ByteUtils.slice(container, MAC_OFFSET, MAC_LENGTH);
    final int headerLength = version.headerLength();
    final byte[] ciphertext = ByteUtils.slice(container, headerLength, container.length - headerLength);
    try (KeyMaterial keys = KeyMaterial.derive(password, salt, version)) {
      byte[] expected = ContainerCrypto.hmacSha256(keys.macKey(), versionByte, iv, salt, ciphertext);
      // Security: constant-time comparison; no decryption is attempted on mismatch
      if (!MessageDigest.isEqual(expected, mac)) {
        log.debug("decode(): MAC mismatch");
        throw new AuthenticationFailureException();
      }
      return decrypt(keys, iv, ciphertext);
    }
  }

  private String decodeLegacy(byte[] container, String password) {
    final ContainerVersion version = ContainerVersion.V1;
    final byte[] iv = ByteUtils.slice(container, IV_OFFSET, IV_LENGTH);
    final byte[] salt = ByteUtils.slice(container, SALT_OFFSET, SALT_LENGTH);
    final int headerLength = version.headerLength();
    final byte[] ciphertext = ByteUtils.slice(container, headerLength, container.length - headerLength);
    try (KeyMaterial keys = KeyMaterial.derive(password, salt, version)) {
      return decrypt(keys, iv, ciphertext);
    }
  }

  private String decrypt(KeyMaterial keys, byte[] iv, byte[] ciphertext) {
    byte[] plainBytes = null;
    try {
      plainBytes = ContainerCrypto.decrypt(keys.encKey(), iv, ciphertext);
      String plaintext = StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(plainBytes))
          .toString();
      return EMPTY_PLACEHOLDER.equals(plaintext) ? "" : plaintext;
    } catch (InvalidCipherTextException | DataLengthException | CharacterCodingException e) {
      log.debug("decode(): decryption rejected");
      throw new AuthenticationFailureException();
    } finally {
      ByteUtils.zero(plainBytes);
    }
  }
}
