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

/**
 * The local file header written in front of each entry's data. The CRC-32 and sizes are not
 * known yet, so they are zero here and the data descriptor bit is set.
 */
class LocalFileHeader {
  static final int SIGNATURE = 0x04034b50;
  static final int FIXED_DATA_SIZE = 30;
  static final int SIGNATURE_OFFSET = 0;
  static final int VERSION_OFFSET = 4;
  static final int FLAGS_OFFSET = 6;
  static final int METHOD_OFFSET = 8;
  static final int MOD_TIME_OFFSET = 10;
  static final int MOD_DATE_OFFSET = 12;
  static final int CRC_OFFSET = 14;
  static final int COMPRESSED_SIZE_OFFSET = 18;
  static final int UNCOMPRESSED_SIZE_OFFSET = 22;
  static final int FILENAME_LENGTH_OFFSET = 26;
  static final int EXTRA_FIELD_LENGTH_OFFSET = 28;
  static final int VARIABLE_DATA_OFFSET = 30;

  /**
   * Generates the raw byte data of the local file header for the {@link ZipStreamEntry}.
   */
  static byte[] create(ZipStreamEntry entry) {
    byte[] name = entry.rawNameBytes();
    byte[] buf = new byte[FIXED_DATA_SIZE + name.length];
    ZipUtil.intToLittleEndian(buf, SIGNATURE_OFFSET, SIGNATURE);
    ZipUtil.shortToLittleEndian(buf, VERSION_OFFSET, ZipStreamEntry.VERSION_NEEDED);
    ZipUtil.shortToLittleEndian(buf, FLAGS_OFFSET, ZipStreamEntry.FLAGS);
    ZipUtil.shortToLittleEndian(buf, METHOD_OFFSET, entry.getMethod());
    ZipUtil.shortToLittleEndian(buf, MOD_TIME_OFFSET, entry.getDosTime());
    ZipUtil.shortToLittleEndian(buf, MOD_DATE_OFFSET, entry.getDosDate());
    // Streamed entries carry these in the data descriptor.
    ZipUtil.intToLittleEndian(buf, CRC_OFFSET, 0);
    ZipUtil.intToLittleEndian(buf, COMPRESSED_SIZE_OFFSET, 0);
    ZipUtil.intToLittleEndian(buf, UNCOMPRESSED_SIZE_OFFSET, 0);
    ZipUtil.shortToLittleEndian(buf, FILENAME_LENGTH_OFFSET, name.length);
    ZipUtil.shortToLittleEndian(buf, EXTRA_FIELD_LENGTH_OFFSET, 0);
    System.arraycopy(name, 0, buf, VARIABLE_DATA_OFFSET, name.length);
    return buf;
  }

  /**
   * Writes the local file header for the entry to an output stream and returns the number of
   * bytes written.
   */
  static int write(ZipStreamEntry entry, OutputStream stream) throws IOException {
    byte[] buf = create(entry);
    stream.write(buf);
    return buf.length;
  }
}
