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

import java.io.ByteArrayOutputStream;
import java.io.IOException;

/** A {@link ZipSink} that accepts a fixed number of bytes and then fails every write. */
class FailingSink implements ZipSink {
  private final ByteArrayOutputStream accepted = new ByteArrayOutputStream();
  private final long limit;

  FailingSink(long limit) {
    this.limit = limit;
  }

  @Override
  public void write(byte[] b, int off, int len) throws IOException {
    if (accepted.size() + len > limit) {
      throw new IOException("sink full");
    }
    accepted.write(b, off, len);
  }

  byte[] toByteArray() {
    return accepted.toByteArray();
  }
}
