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
import static com.google.common.base.Preconditions.checkPositionIndexes;

import java.io.IOException;
import java.util.zip.Deflater;

/**
 * {@link CompressionEngine} producing raw DEFLATE data (no zlib header or trailer) with
 * {@link Deflater}.
 */
public final class DeflateEngine implements CompressionEngine {
  /** Compression method id of DEFLATE. */
  static final short METHOD_DEFLATED = 8;

  private final Deflater deflater;
  private final byte[] buffer;

  /**
   * Creates an engine with the given {@link Deflater} level and scratch buffer size.
   *
   * @throws IllegalArgumentException if the level or the buffer size is invalid
   */
  public DeflateEngine(int level, int bufferSize) {
    checkArgument(level == Deflater.DEFAULT_COMPRESSION
        || (level >= Deflater.NO_COMPRESSION && level <= Deflater.BEST_COMPRESSION),
        "Invalid compression level: %s", level);
    checkArgument(bufferSize > 0, "Buffer size must be positive: %s", bufferSize);
    this.buffer = new byte[bufferSize];
    this.deflater = new Deflater(level, true);
  }

  /** Creates an engine configured from {@code options}. */
  static DeflateEngine create(ZipStreamOptions options) {
    return new DeflateEngine(options.compressionLevel(), options.bufferSize());
  }

  @Override
  public short getMethod() {
    return METHOD_DEFLATED;
  }

  @Override
  public void reset() {
    deflater.reset();
  }

  @Override
  public void feed(FlushMode mode, byte[] input, int off, int len, ChunkConsumer out)
      throws IOException {
    checkPositionIndexes(off, off + len, input.length);
    if (len > 0) {
      deflater.setInput(input, off, len);
    }
    if (mode == FlushMode.FINISH) {
      deflater.finish();
    }
    // Drain until the deflater has consumed all input, or has ended the stream when finishing.
    while (mode == FlushMode.FINISH ? !deflater.finished() : !deflater.needsInput()) {
      int count = deflater.deflate(buffer, 0, buffer.length, Deflater.NO_FLUSH);
      if (count > 0) {
        out.accept(buffer, 0, count);
      }
    }
  }

  @Override
  public void close() {
    deflater.end();
  }
}
