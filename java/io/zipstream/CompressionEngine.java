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

import java.io.IOException;

/**
 * A stateful streaming compressor. Input is pushed in with {@link #feed}; compressed output is
 * handed to a {@link ChunkConsumer} as soon as the engine's internal buffer has something to
 * give.
 *
 * <p>An engine compresses one entry at a time. {@link #reset()} restarts it for the next entry
 * without reallocating.
 */
public interface CompressionEngine extends AutoCloseable {

  /** How much of its pending output a call to {@link #feed} must emit. */
  enum FlushMode {
    /** The engine may keep input and output buffered. */
    NO_FLUSH,

    /** All pending output is emitted and the compressed stream for the entry is terminated. */
    FINISH,
  }

  /** Receives compressed output. The buffer is only valid for the duration of the call. */
  @FunctionalInterface
  interface ChunkConsumer {
    void accept(byte[] chunk, int off, int len) throws IOException;
  }

  /** Compression method id written into the ZIP headers for this engine's output. */
  short getMethod();

  /** Discards all state so that the next {@link #feed} starts a new compressed stream. */
  void reset();

  /**
   * Compresses {@code len} bytes of {@code input} starting at {@code off}, passing every
   * produced chunk to {@code out} before returning.
   *
   * @throws IOException if {@code out} fails; the engine's state is then undefined
   */
  void feed(FlushMode mode, byte[] input, int off, int len, ChunkConsumer out)
      throws IOException;

  /** Releases the engine's resources. Later calls to other methods are invalid. */
  @Override
  void close();
}
