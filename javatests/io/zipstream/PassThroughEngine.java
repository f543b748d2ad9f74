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
 * A {@link CompressionEngine} that emits its input unchanged, so that tests can predict every
 * byte of an archive. Records how it was used.
 */
class PassThroughEngine implements CompressionEngine {
  int resets;
  int finishes;
  boolean closed;

  @Override
  public short getMethod() {
    return 0;
  }

  @Override
  public void reset() {
    resets++;
  }

  @Override
  public void feed(FlushMode mode, byte[] input, int off, int len, ChunkConsumer out)
      throws IOException {
    if (len > 0) {
      out.accept(input, off, len);
    }
    if (mode == FlushMode.FINISH) {
      finishes++;
    }
  }

  @Override
  public void close() {
    closed = true;
  }
}
