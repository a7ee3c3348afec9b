package com.scrib.files.config;

/**
 * Settings for {@link com.scrib.files.FileService} and its atomic writer.
 * <p>
 * The container's key-derivation cost is part of the file format and is not configurable here.
 *
 * @param cryptoThreads  number of worker threads running file and crypto work off the caller's thread
 * @param tempSuffix     suffix appended to the destination file name for the sibling temp file
 * @param latin1Fallback re-read markup files as ISO-8859-1 when they are not valid UTF-8
 */
public record FileServiceConfig(int cryptoThreads, String tempSuffix, boolean latin1Fallback) {

  public static final FileServiceConfig DEFAULT = new FileServiceConfig(2, ".tmp", true);

  public FileServiceConfig {
    if (cryptoThreads < 1) {
      throw new IllegalArgumentException("cryptoThreads must be at least 1: " + cryptoThreads);
    }
    if (tempSuffix == null || tempSuffix.isEmpty() || tempSuffix.contains("/") || tempSuffix.contains("\\")) {
      throw new IllegalArgumentException("tempSuffix must be a non-empty file name suffix");
    }
  }

  /**
   * Single worker thread, so test callbacks run in submission order.
   *
   * @return the file service config
   */
  public static FileServiceConfig forTesting() {
    return new FileServiceConfig(1, ".tmp", true);
  }

  public FileServiceConfig withLatin1Fallback(boolean enabled) {
    return new FileServiceConfig(cryptoThreads, tempSuffix, enabled);
  }
}
