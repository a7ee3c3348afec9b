package com.scrib.container.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class KeyDerivationTest {

  private static final byte[] PASSWORD = "password".getBytes(StandardCharsets.US_ASCII);
  private static final byte[] SALT = "salt".getBytes(StandardCharsets.US_ASCII);

  // ─── Known-answer vectors (PBKDF2-HMAC-SHA256) ─────────────────────────────

  @ParameterizedTest
  @CsvSource({
      "1,    120fb6cffcf8b32c43e7225256c4f837a86548c92ccc35480805987cb70be17b",
      "4096, c5e478d59288c841aa530db6845c4c8d962893a001ce4e11a4963873aa98134a"
  })
  void derive_matchesPublishedVectors(int iterations, String expectedHex) {
    assertThat(Hex.toHexString(KeyDerivation.derive(PASSWORD, SALT, iterations, 32)))
        .isEqualTo(expectedHex);
  }

  @Test
  void derive_matchesJcaImplementationAtContainerCost() throws Exception {
    byte[] salt = new byte[32];
    for (int i = 0; i < salt.length; i++) {
      salt[i] = (byte) (i * 7);
    }
    SecretKeyFactory factory = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256");
    byte[] expected = factory.generateSecret(
        new PBEKeySpec("hunter2".toCharArray(), salt, 10_000, 64 * 8)).getEncoded();

    byte[] actual = KeyDerivation.derive("hunter2".getBytes(StandardCharsets.UTF_8), salt, 10_000, 64);

    assertThat(actual).isEqualTo(expected);
  }

  @Test
  void derive_isDeterministic() {
    assertThat(KeyDerivation.derive(PASSWORD, SALT, 2, 64))
        .isEqualTo(KeyDerivation.derive(PASSWORD, SALT, 2, 64));
  }

  @Test
  void derive_shorterOutputIsPrefixOfLonger() {
    byte[] longer = KeyDerivation.derive(PASSWORD, SALT, 3, 64);
    byte[] shorter = KeyDerivation.derive(PASSWORD, SALT, 3, 32);
    assertThat(longer).startsWith(shorter);
  }

  @Test
  void derive_differentSaltChangesOutput() {
    byte[] other = "pepper".getBytes(StandardCharsets.US_ASCII);
    assertThat(KeyDerivation.derive(PASSWORD, SALT, 2, 32))
        .isNotEqualTo(KeyDerivation.derive(PASSWORD, other, 2, 32));
  }

  // ─── Argument validation ──────────────────────────────────────────────────

  @Test
  void derive_zeroIterationsThrows() {
    assertThatThrownBy(() -> KeyDerivation.derive(PASSWORD, SALT, 0, 32))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Iterations");
  }

  @Test
  void derive_zeroOutputThrows() {
    assertThatThrownBy(() -> KeyDerivation.derive(PASSWORD, SALT, 1, 0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Output length");
  }

  @Test
  void derive_nullSaltThrows() {
    assertThatThrownBy(() -> KeyDerivation.derive(PASSWORD, null, 1, 32))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
