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

import java.util.zip.ZipException;

/**
 * Little endian encoding and decoding of the fixed width integer fields that make up ZIP records.
 *
 * <p>See <a href="http://www.pkware.com/documents/casestudies/APPNOTE.TXT">ZIP Format</a>
 * section 4.4 for the field layouts.
 */
public class ZipUtil {

  /** Largest value of a 2-byte record field. */
  static final int MAX_SHORT_FIELD = 0xffff;

  /** Largest value of a 4-byte record field. */
  static final long MAX_INT_FIELD = 0xffffffffL;

  private ZipUtil() {}

  /** Writes the low numBytes bytes of value to the buffer in little endian order. */
  private static void integerToLittleEndian(byte[] buf, int offset, long value, int numBytes) {
    for (int i = 0; i < numBytes; i++) {
      buf[i + offset] = (byte) ((value & (0xffL << (i * 8))) >> (i * 8));
    }
  }

  /**
   * Writes the low 16 bits of value to the buffer as a 2-byte little endian array starting at
   * offset. Returns the number of bytes encoded.
   */
  static int shortToLittleEndian(byte[] buf, int offset, int value) {
    integerToLittleEndian(buf, offset, value & 0xffff, 2);
    return 2;
  }

  /**
   * Writes the low 32 bits of value to the buffer as a 4-byte little endian array starting at
   * offset. Returns the number of bytes encoded.
   */
  static int intToLittleEndian(byte[] buf, int offset, long value) {
    integerToLittleEndian(buf, offset, value & 0xffffffffL, 4);
    return 4;
  }

  /**
   * Writes a long to the buffer as a 8-byte little endian array starting at offset. Returns the
   * number of bytes encoded.
   */
  static int longToLittleEndian(byte[] buf, int offset, long value) {
    integerToLittleEndian(buf, offset, value, 8);
    return 8;
  }

  /** Reads 16 bits in little-endian byte order from the buffer at the given offset. */
  static short get16(byte[] source, int offset) {
    int a = source[offset + 0] & 0xff;
    int b = source[offset + 1] & 0xff;
    return (short) ((b << 8) | a);
  }

  /** Reads 32 bits in little-endian byte order from the buffer at the given offset. */
  static int get32(byte[] source, int offset) {
    int a = source[offset + 0] & 0xff;
    int b = source[offset + 1] & 0xff;
    int c = source[offset + 2] & 0xff;
    int d = source[offset + 3] & 0xff;
    return (d << 24) | (c << 16) | (b << 8) | a;
  }

  /** Reads 64 bits in little-endian byte order from the buffer at the given offset. */
  static long get64(byte[] source, int offset) {
    long a = source[offset + 0] & 0xffL;
    long b = source[offset + 1] & 0xffL;
    long c = source[offset + 2] & 0xffL;
    long d = source[offset + 3] & 0xffL;
    long e = source[offset + 4] & 0xffL;
    long f = source[offset + 5] & 0xffL;
    long g = source[offset + 6] & 0xffL;
    long h = source[offset + 7] & 0xffL;
    return (h << 56) | (g << 48) | (f << 40) | (e << 32) | (d << 24) | (c << 16) | (b << 8) | a;
  }

  /**
   * Reads an unsigned short in little-endian byte order from the buffer at the given offset.
   * Casts to an int to allow proper numerical comparison.
   */
  static int getUnsignedShort(byte[] source, int offset) {
    return get16(source, offset) & 0xffff;
  }

  /**
   * Reads an unsigned int in little-endian byte order from the buffer at the given offset.
   * Casts to a long to allow proper numerical comparison.
   */
  static long getUnsignedInt(byte[] source, int offset) {
    return get32(source, offset) & 0xffffffffL;
  }

  /**
   * Checks that value fits an unsigned 2-byte record field, as there is no Zip64 fallback.
   *
   * @throws ZipException if the value is out of range
   */
  static int checkShortField(long value, String field) throws ZipException {
    if (value < 0 || value > MAX_SHORT_FIELD) {
      throw new ZipException(
          String.format("Cannot write %s %d without Zip64 extensions.", field, value));
    }
    return (int) value;
  }

  /**
   * Checks that value fits an unsigned 4-byte record field, as there is no Zip64 fallback.
   *
   * @throws ZipException if the value is out of range
   */
  static long checkIntField(long value, String field) throws ZipException {
    if (value < 0 || value > MAX_INT_FIELD) {
      throw new ZipException(
          String.format("Cannot write %s %d without Zip64 extensions.", field, value));
    }
    return value;
  }
}
