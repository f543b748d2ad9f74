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

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.IOException;
import java.io.OutputStream;

/** Presents a {@link ZipSink} as an {@link OutputStream}. {@link #close()} does nothing. */
final class SinkOutputStream extends OutputStream {
  private final ZipSink sink;

  SinkOutputStream(ZipSink sink) {
    this.sink = checkNotNull(sink);
  }

  @Override public void write(int b) throws IOException {
    write(new byte[] { (byte) b }, 0, 1);
  }

  @Override public void write(byte[] b, int off, int len) throws IOException {
    if (len > 0) {
      sink.write(b, off, len);
    }
  }

  @Override public void close() {
    // The sink belongs to the caller.
  }
}
