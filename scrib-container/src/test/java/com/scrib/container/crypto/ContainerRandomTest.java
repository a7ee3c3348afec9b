package com.scrib.container.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scrib.common.ByteUtils;
import com.scrib.container.ContainerCodec;
import com.scrib.container.ContainerFormat;
import java.security.SecureRandom;
import org.junit.jupiter.api.Test;

class ContainerRandomTest {

  /** Hands out 1, 2, 3... so every drawn byte is predictable. */
  private static final class CountingRandom extends SecureRandom {
    private byte next = 1;

    @Override
    public void nextBytes(byte[] bytes) {
      for (int i = 0; i < bytes.length; i++) {
        bytes[i] = next++;
      }
    }
  }

  @Test
  void iv_andSalt_haveFormatLengths() {
    ContainerRandom random = new ContainerRandom();
    assertThat(random.iv()).hasSize(ContainerFormat.IV_LENGTH);
    assertThat(random.salt()).hasSize(ContainerFormat.SALT_LENGTH);
  }

  @Test
  void successiveDraws_differ() {
    ContainerRandom random = new ContainerRandom();
    assertThat(random.iv()).isNotEqualTo(random.iv());
    assertThat(random.salt()).isNotEqualTo(random.salt());
  }

  @Test
  void nullSource_isRejected() {
    assertThatThrownBy(() -> new ContainerRandom(null)).isInstanceOf(NullPointerException.class);
  }

  @Test
  void codec_writesDrawnIvThenSaltIntoHeader() {
    ContainerRandom expected = new ContainerRandom(new CountingRandom());
    byte[] iv = expected.iv();
    byte[] salt = expected.salt();

    byte[] container = new ContainerCodec(new ContainerRandom(new CountingRandom())).encode("x", "pw");

    assertThat(ByteUtils.slice(container, ContainerFormat.IV_OFFSET, ContainerFormat.IV_LENGTH))
        .isEqualTo(iv);
    assertThat(ByteUtils.slice(container, ContainerFormat.SALT_OFFSET, ContainerFormat.SALT_LENGTH))
        .isEqualTo(salt);
  }
}
