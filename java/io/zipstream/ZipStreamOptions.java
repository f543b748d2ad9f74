// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package io.zipstream;

import static com.google.common.base.Preconditions.checkArgument;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.auto.value.AutoValue;
import java.nio.charset.Charset;
import java.time.Clock;
import java.util.zip.Deflater;

/** Settings for a {@link ZipStreamWriter}. */
@AutoValue
public abstract class ZipStreamOptions {

  /** Default bound, in encoded bytes, on the length of an entry name. */
  public static final int DEFAULT_MAX_NAME_LENGTH = 127;

  /** Default size of the compressed output buffer. */
  public static final int DEFAULT_BUFFER_SIZE = 4 << 10;

  /**
   * Maximum length of an entry name in bytes, once encoded with {@link #charset()}. Longer names
   * are truncated.
   */
  public abstract int maxNameLength();

  /** The {@link Charset} used to encode entry names. */
  public abstract Charset charset();

  /** The {@link Deflater} compression level. */
  public abstract int compressionLevel();

  /** Size of the buffer that holds compressed output before it is passed to the sink. */
  public abstract int bufferSize();

  /** Clock for entries added without an explicit time. */
  public abstract Clock clock();

  public abstract Builder toBuilder();

  public static ZipStreamOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_ZipStreamOptions.Builder()
        .setMaxNameLength(DEFAULT_MAX_NAME_LENGTH)
        .setCharset(UTF_8)
        .setCompressionLevel(Deflater.DEFAULT_COMPRESSION)
        .setBufferSize(DEFAULT_BUFFER_SIZE)
        .setClock(Clock.systemDefaultZone());
  }

  /** Builder for {@link ZipStreamOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setMaxNameLength(int maxNameLength);

    public abstract Builder setCharset(Charset charset);

    public abstract Builder setCompressionLevel(int compressionLevel);

    public abstract Builder setBufferSize(int bufferSize);

    public abstract Builder setClock(Clock clock);

    abstract ZipStreamOptions autoBuild();

    /**
     * Builds the options.
     *
     * @throws IllegalArgumentException if a value is out of range
     */
    public ZipStreamOptions build() {
      ZipStreamOptions options = autoBuild();
      checkArgument(options.maxNameLength() > 0 && options.maxNameLength() <= 0xffff,
          "Maximum name length must be between 1 and 65535: %s", options.maxNameLength());
      checkArgument(options.compressionLevel() >= Deflater.DEFAULT_COMPRESSION
          && options.compressionLevel() <= Deflater.BEST_COMPRESSION,
          "Invalid compression level: %s", options.compressionLevel());
      checkArgument(options.bufferSize() > 0,
          "Buffer size must be positive: %s", options.bufferSize());
      return options;
    }
  }
}
