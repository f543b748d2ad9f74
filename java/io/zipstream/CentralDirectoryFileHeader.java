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

/** An entry's record in the central directory. */
class CentralDirectoryFileHeader {
  static final int SIGNATURE = 0x02014b50;
  static final int FIXED_DATA_SIZE = 46;
  static final int SIGNATURE_OFFSET = 0;
  static final int VERSION_OFFSET = 4;
  static final int VERSION_NEEDED_OFFSET = 6;
  static final int FLAGS_OFFSET = 8;
  static final int METHOD_OFFSET = 10;
  static final int MOD_TIME_OFFSET = 12;
  static final int MOD_DATE_OFFSET = 14;
  static final int CRC_OFFSET = 16;
  static final int COMPRESSED_SIZE_OFFSET = 20;
  static final int UNCOMPRESSED_SIZE_OFFSET = 24;
  static final int FILENAME_LENGTH_OFFSET = 28;
  static final int EXTRA_FIELD_LENGTH_OFFSET = 30;
  static final int COMMENT_LENGTH_OFFSET = 32;
  static final int DISK_START_OFFSET = 34;
  static final int INTERNAL_ATTRIBUTES_OFFSET = 36;
  static final int EXTERNAL_ATTRIBUTES_OFFSET = 38;
  static final int LOCAL_HEADER_OFFSET_OFFSET = 42;

  /** "Version made by" value: MS-DOS host, version 0. */
  static final short VERSION_MADE_BY = 0;

  /**
   * Writes the central directory file header for the entry to an output stream, reusing
   * {@code buf} for the fixed size data when it is large enough. Returns the number of bytes
   * written.
   *
   * @throws ZipException if a value does not fit without Zip64 extensions
   */
  static int write(ZipStreamEntry entry, byte[] buf, OutputStream stream) throws IOException {
    if (buf == null || buf.length < FIXED_DATA_SIZE) {
      buf = new byte[FIXED_DATA_SIZE];
    }
    byte[] name = entry.rawNameBytes();
    fillFixedSizeData(buf, entry, name.length);
    stream.write(buf, 0, FIXED_DATA_SIZE);
    stream.write(name);
    return FIXED_DATA_SIZE + name.length;
  }

  /**
   * Write the fixed size data portion for the specified ZIP entry to the buffer.
   */
  private static void fillFixedSizeData(byte[] buf, ZipStreamEntry entry, int nameLength)
      throws ZipException {
    long csize = ZipUtil.checkIntField(entry.getCompressedSize(), "compressed size");
    long size = ZipUtil.checkIntField(entry.getSize(), "size");
    long offset = ZipUtil.checkIntField(entry.getLocalHeaderOffset(), "local header offset");
    ZipUtil.intToLittleEndian(buf, SIGNATURE_OFFSET, SIGNATURE);
    ZipUtil.shortToLittleEndian(buf, VERSION_OFFSET, VERSION_MADE_BY);
    ZipUtil.shortToLittleEndian(buf, VERSION_NEEDED_OFFSET, ZipStreamEntry.VERSION_NEEDED);
    ZipUtil.shortToLittleEndian(buf, FLAGS_OFFSET, ZipStreamEntry.FLAGS);
    ZipUtil.shortToLittleEndian(buf, METHOD_OFFSET, entry.getMethod());
    ZipUtil.shortToLittleEndian(buf, MOD_TIME_OFFSET, entry.getDosTime());
    ZipUtil.shortToLittleEndian(buf, MOD_DATE_OFFSET, entry.getDosDate());
    ZipUtil.intToLittleEndian(buf, CRC_OFFSET, entry.getCrc());
    ZipUtil.intToLittleEndian(buf, COMPRESSED_SIZE_OFFSET, csize);
    ZipUtil.intToLittleEndian(buf, UNCOMPRESSED_SIZE_OFFSET, size);
    ZipUtil.shortToLittleEndian(buf, FILENAME_LENGTH_OFFSET, nameLength);
    ZipUtil.shortToLittleEndian(buf, EXTRA_FIELD_LENGTH_OFFSET, 0);
    ZipUtil.shortToLittleEndian(buf, COMMENT_LENGTH_OFFSET, 0);
    ZipUtil.shortToLittleEndian(buf, DISK_START_OFFSET, 0);
    ZipUtil.shortToLittleEndian(buf, INTERNAL_ATTRIBUTES_OFFSET, 0);
    ZipUtil.intToLittleEndian(buf, EXTERNAL_ATTRIBUTES_OFFSET, 0);
    ZipUtil.intToLittleEndian(buf, LOCAL_HEADER_OFFSET_OFFSET, offset);
  }
}
