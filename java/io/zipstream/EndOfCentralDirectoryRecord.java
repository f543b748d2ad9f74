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
import java.io.OutputStream;
import java.util.zip.ZipException;

/** The record that ends the archive and locates the central directory. */
class EndOfCentralDirectoryRecord {
  static final int SIGNATURE = 0x06054b50;
  static final int FIXED_DATA_SIZE = 22;
  static final int SIGNATURE_OFFSET = 0;
  static final int DISK_NUMBER_OFFSET = 4;
  static final int CD_DISK_OFFSET = 6;
  static final int DISK_ENTRIES_OFFSET = 8;
  static final int TOTAL_ENTRIES_OFFSET = 10;
  static final int CD_SIZE_OFFSET = 12;
  static final int CD_OFFSET_OFFSET = 16;
  static final int COMMENT_LENGTH_OFFSET = 20;

  /**
   * Generates the raw byte data of the end of central directory record for the specified
   * {@link ZipStreamData}. The central directory offset and size must already be set.
   *
   * @throws ZipException if a value does not fit without Zip64 extensions
   */
  static byte[] create(ZipStreamData file) throws ZipException {
    int numEntries = ZipUtil.checkShortField(file.getNumEntries(), "entry count");
    long cdSize = ZipUtil.checkIntField(file.getCentralDirectorySize(), "central directory size");
    long cdOffset =
        ZipUtil.checkIntField(file.getCentralDirectoryOffset(), "central directory offset");
    byte[] buf = new byte[FIXED_DATA_SIZE];
    ZipUtil.intToLittleEndian(buf, SIGNATURE_OFFSET, SIGNATURE);
    ZipUtil.shortToLittleEndian(buf, DISK_NUMBER_OFFSET, 0);
    ZipUtil.shortToLittleEndian(buf, CD_DISK_OFFSET, 0);
    // Single disk archive: the entries on this disk are all the entries.
    ZipUtil.shortToLittleEndian(buf, DISK_ENTRIES_OFFSET, numEntries);
    ZipUtil.shortToLittleEndian(buf, TOTAL_ENTRIES_OFFSET, numEntries);
    ZipUtil.intToLittleEndian(buf, CD_SIZE_OFFSET, cdSize);
    ZipUtil.intToLittleEndian(buf, CD_OFFSET_OFFSET, cdOffset);
    ZipUtil.shortToLittleEndian(buf, COMMENT_LENGTH_OFFSET, 0);
    return buf;
  }

  /**
   * Writes the end of central directory record to an output stream and returns the number of
   * bytes written.
   */
  static int write(ZipStreamData file, OutputStream stream) throws IOException {
    byte[] buf = create(file);
    stream.write(buf);
    return buf.length;
  }
}
