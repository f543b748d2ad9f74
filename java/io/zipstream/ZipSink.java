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

/**
 * Destination for the bytes of an archive. Implementations adapt files, sockets or in-memory
 * buffers; the writer never learns which.
 *
 * <p>A call must either accept all {@code len} bytes or throw. There is no partial success, and a
 * failure is terminal for the {@link ZipStreamWriter} that made the call.
 */
@FunctionalInterface
public interface ZipSink {

  /**
   * Writes {@code len} bytes from {@code b} starting at {@code off}.
   *
   * @throws IOException if the bytes could not all be delivered
   */
  void write(byte[] b, int off, int len) throws IOException;

  /**
   * Returns a sink that writes to {@code out}. Closing the writer does not close {@code out}.
   */
  static ZipSink of(OutputStream out) {
    checkNotNull(out);
    return out::write;
  }
}
