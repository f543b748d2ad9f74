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

import com.google.common.io.CountingOutputStream;
import java.io.IOException;

class CentralDirectory {
  /**
   * Writes the central directory and the end of central directory record for the specified
   * {@link ZipStreamData}, starting at the current position of {@code stream}.
   */
  static void write(ZipStreamData file, CountingOutputStream stream) throws IOException {
    file.setCentralDirectoryOffset(stream.getCount());
    byte[] buf = new byte[CentralDirectoryFileHeader.FIXED_DATA_SIZE];
    for (ZipStreamEntry entry : file.getEntries()) {
      CentralDirectoryFileHeader.write(entry, buf, stream);
    }
    // The end of central directory record is not part of the directory.
    file.setCentralDirectorySize(stream.getCount() - file.getCentralDirectoryOffset());
    EndOfCentralDirectoryRecord.write(file, stream);
  }
}
