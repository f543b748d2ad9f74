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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import java.nio.charset.Charset;
import java.util.Arrays;

/**
 * A ZIP entry as written by {@link ZipStreamWriter}.
 *
 * <p>The name, offset and timestamp are fixed when the entry is opened. The CRC-32 and the sizes
 * grow while entry data is written and are final once the entry is closed. Only the writer may
 * change an entry.
 *
 * <p>See <a href="http://www.pkware.com/documents/casestudies/APPNOTE.TXT">ZIP Format</a> for
 * a description of the entry fields. (Section 4.3.7 and 4.4)
 */
public final class ZipStreamEntry {

  /** General purpose flag bit: the sizes and CRC-32 follow the data in a data descriptor. */
  static final int DATA_DESCRIPTOR_BIT = 3;

  /** Minimum version needed to extract DEFLATE entries (2.0). */
  static final short VERSION_NEEDED = 0x14;

  /** Flags of every entry. */
  static final short FLAGS = (short) (1 << DATA_DESCRIPTOR_BIT);

  private final String name;
  private final byte[] nameBytes;
  private final long localHeaderOffset;
  private final int dosTime;
  private final int dosDate;
  private final short method;
  private long crc;
  private long size;
  private long csize;

  ZipStreamEntry(byte[] nameBytes, Charset charset, long localHeaderOffset,
      ZipDateTime time, short method) {
    checkNotNull(nameBytes);
    checkArgument(localHeaderOffset >= 0, "invalid local header offset");
    this.nameBytes = nameBytes.clone();
    this.name = new String(nameBytes, charset);
    this.localHeaderOffset = localHeaderOffset;
    this.dosTime = time.dosTime();
    this.dosDate = time.dosDate();
    this.method = method;
  }

  /**
   * Creates the entry for {@code name} encoded with {@code charset}, truncating the encoded name
   * to at most {@code maxNameLength} bytes.
   */
  static ZipStreamEntry create(String name, Charset charset, int maxNameLength,
      long localHeaderOffset, ZipDateTime time, short method) {
    byte[] encoded = name.getBytes(charset);
    if (encoded.length > maxNameLength) {
      encoded = Arrays.copyOf(encoded, maxNameLength);
    }
    return new ZipStreamEntry(encoded, charset, localHeaderOffset, time, method);
  }

  /** Returns the name of the entry, after truncation. */
  public String getName() {
    return name;
  }

  /** Returns the encoded name exactly as stored in the archive headers. */
  public byte[] getNameBytes() {
    return nameBytes.clone();
  }

  /** Returns the length of the stored name in bytes. */
  public int getNameLength() {
    return nameBytes.length;
  }

  /** Shares the name bytes with the record writers, which do not modify them. */
  byte[] rawNameBytes() {
    return nameBytes;
  }

  /** Returns the offset of the entry's local file header from the start of the archive. */
  public long getLocalHeaderOffset() {
    return localHeaderOffset;
  }

  /** Returns the 16-bit DOS modification time. */
  public int getDosTime() {
    return dosTime;
  }

  /** Returns the 16-bit DOS modification date. */
  public int getDosDate() {
    return dosDate;
  }

  /** Returns the compression method id. */
  public short getMethod() {
    return method;
  }

  /** Returns the CRC-32 of the uncompressed data written so far. */
  public long getCrc() {
    return crc;
  }

  /**
   * Sets the CRC-32 checksum of the uncompressed entry data.
   *
   * @throws IllegalArgumentException if the specified CRC-32 value is less than 0 or greater than
   *     0xFFFFFFFF
   */
  void setCrc(long crc) {
    if (crc < 0 || crc > 0xffffffffL) {
      throw new IllegalArgumentException("invalid entry crc-32");
    }
    this.crc = crc;
  }

  /** Returns the number of uncompressed bytes written so far. */
  public long getSize() {
    return size;
  }

  /** Returns the number of compressed bytes written so far. */
  public long getCompressedSize() {
    return csize;
  }

  /** Accounts for {@code count} more uncompressed bytes. */
  void addSize(long count) {
    checkArgument(count >= 0, "invalid entry size increment");
    size += count;
  }

  /** Accounts for {@code count} more compressed bytes. */
  void addCompressedSize(long count) {
    checkArgument(count >= 0, "invalid entry compressed size increment");
    csize += count;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("offset", localHeaderOffset)
        .add("crc", Long.toHexString(crc))
        .add("size", size)
        .add("csize", csize)
        .toString();
  }
}
