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

/** The data descriptor that follows an entry's compressed data with its CRC-32 and sizes. */
class DataDescriptor {
  static final int SIGNATURE = 0x08074b50;
  static final int FIXED_DATA_SIZE = 16;
  static final int SIGNATURE_OFFSET = 0;
  static final int CRC_OFFSET = 4;
  static final int COMPRESSED_SIZE_OFFSET = 8;
  static final int UNCOMPRESSED_SIZE_OFFSET = 12;

  /**
   * Generates the raw byte data of the data descriptor for the closed {@link ZipStreamEntry}.
   *
   * @throws ZipException if a size does not fit without Zip64 extensions
   */
  static byte[] create(ZipStreamEntry entry) throws ZipException {
    long csize = ZipUtil.checkIntField(entry.getCompressedSize(), "compressed size");
    long size = ZipUtil.checkIntField(entry.getSize(), "size");
    byte[] buf = new byte[FIXED_DATA_SIZE];
    ZipUtil.intToLittleEndian(buf, SIGNATURE_OFFSET, SIGNATURE);
    ZipUtil.intToLittleEndian(buf, CRC_OFFSET, entry.getCrc());
    ZipUtil.intToLittleEndian(buf, COMPRESSED_SIZE_OFFSET, csize);
    ZipUtil.intToLittleEndian(buf, UNCOMPRESSED_SIZE_OFFSET, size);
    return buf;
  }

  /**
   * Writes the data descriptor for the entry to an output stream and returns the number of bytes
   * written.
   */
  static int write(ZipStreamEntry entry, OutputStream stream) throws IOException {
    byte[] buf = create(entry);
    stream.write(buf);
    return buf.length;
  }
}
