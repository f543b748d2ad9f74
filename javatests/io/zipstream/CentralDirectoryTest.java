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

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.common.io.CountingOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.zip.ZipException;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CentralDirectoryTest {
  private static final ZipDateTime TIME = ZipDateTime.create(2010, 6, 1, 12, 0, 0);

  private ZipStreamData zipData;
  private ByteArrayOutputStream out;
  private CountingOutputStream stream;

  @Before public void setup() throws IOException {
    zipData = new ZipStreamData();
    out = new ByteArrayOutputStream();
    stream = new CountingOutputStream(out);
    // Pretend the entries take up the first 1000 bytes of the archive.
    stream.write(new byte[1000]);
  }

  private ZipStreamEntry entry(String name, long offset, long size, long csize, long crc) {
    ZipStreamEntry entry = ZipStreamEntry.create(name, UTF_8, 127, offset, TIME, (short) 8);
    entry.addSize(size);
    entry.addCompressedSize(csize);
    entry.setCrc(crc);
    return entry;
  }

  @Test public void testWrite() throws IOException {
    zipData.addEntry(entry("first", 0, 100, 50, 0x12345678L));
    zipData.addEntry(entry("second/entry", 500, 0, 2, 0));
    CentralDirectory.write(zipData, stream);

    byte[] zip = out.toByteArray();
    int first = 1000;
    int second = first + CentralDirectoryFileHeader.FIXED_DATA_SIZE + 5;
    int eocd = second + CentralDirectoryFileHeader.FIXED_DATA_SIZE + 12;
    assertThat(zip).hasLength(eocd + EndOfCentralDirectoryRecord.FIXED_DATA_SIZE);
    assertThat(zipData.getCentralDirectoryOffset()).isEqualTo(1000);
    assertThat(zipData.getCentralDirectorySize()).isEqualTo(eocd - first);

    assertThat(ZipUtil.get32(zip, first)).isEqualTo(CentralDirectoryFileHeader.SIGNATURE);
    assertThat(ZipUtil.getUnsignedInt(zip, first + CentralDirectoryFileHeader.CRC_OFFSET))
        .isEqualTo(0x12345678L);
    assertThat(ZipUtil.get32(zip, first + CentralDirectoryFileHeader.COMPRESSED_SIZE_OFFSET))
        .isEqualTo(50);
    assertThat(ZipUtil.get32(zip, first + CentralDirectoryFileHeader.UNCOMPRESSED_SIZE_OFFSET))
        .isEqualTo(100);
    assertThat(ZipUtil.getUnsignedShort(zip, first + CentralDirectoryFileHeader.MOD_TIME_OFFSET))
        .isEqualTo(TIME.dosTime());
    assertThat(ZipUtil.getUnsignedShort(zip, first + CentralDirectoryFileHeader.MOD_DATE_OFFSET))
        .isEqualTo(TIME.dosDate());
    assertThat(ZipUtil.get16(zip, first + CentralDirectoryFileHeader.METHOD_OFFSET))
        .isEqualTo((short) 8);

    assertThat(ZipUtil.get32(zip, second)).isEqualTo(CentralDirectoryFileHeader.SIGNATURE);
    assertThat(ZipUtil.get32(zip, second + CentralDirectoryFileHeader.LOCAL_HEADER_OFFSET_OFFSET))
        .isEqualTo(500);
    assertThat(ZipUtil.get16(zip, second + CentralDirectoryFileHeader.FILENAME_LENGTH_OFFSET))
        .isEqualTo((short) 12);
    assertThat(new String(zip, second + CentralDirectoryFileHeader.FIXED_DATA_SIZE, 12, UTF_8))
        .isEqualTo("second/entry");

    assertThat(ZipUtil.get32(zip, eocd)).isEqualTo(EndOfCentralDirectoryRecord.SIGNATURE);
    assertThat(ZipUtil.get16(zip, eocd + EndOfCentralDirectoryRecord.DISK_NUMBER_OFFSET))
        .isEqualTo((short) 0);
    assertThat(ZipUtil.get16(zip, eocd + EndOfCentralDirectoryRecord.CD_DISK_OFFSET))
        .isEqualTo((short) 0);
    assertThat(ZipUtil.get16(zip, eocd + EndOfCentralDirectoryRecord.DISK_ENTRIES_OFFSET))
        .isEqualTo((short) 2);
    assertThat(ZipUtil.get16(zip, eocd + EndOfCentralDirectoryRecord.TOTAL_ENTRIES_OFFSET))
        .isEqualTo((short) 2);
    assertThat(ZipUtil.get32(zip, eocd + EndOfCentralDirectoryRecord.CD_SIZE_OFFSET))
        .isEqualTo(eocd - first);
    assertThat(ZipUtil.get32(zip, eocd + EndOfCentralDirectoryRecord.CD_OFFSET_OFFSET))
        .isEqualTo(1000);
  }

  @Test public void testEntrySizeRequiresZip64() {
    zipData.addEntry(entry("big", 0, 0x100000000L, 10, 0));
    ZipException e = assertThrows(ZipException.class,
        () -> CentralDirectory.write(zipData, stream));
    assertThat(e).hasMessageThat().contains("without Zip64 extensions");
  }

  @Test public void testEntryCountRequiresZip64() throws IOException {
    ZipStreamEntry template = entry("e", 0, 0, 2, 0);
    for (int i = 0; i < 0x10000; i++) {
      zipData.addEntry(template);
    }
    zipData.setCentralDirectoryOffset(0);
    zipData.setCentralDirectorySize(0);
    ZipException e = assertThrows(ZipException.class,
        () -> EndOfCentralDirectoryRecord.create(zipData));
    assertThat(e).hasMessageThat().contains("entry count 65536");
  }

  @Test public void testDataDescriptor() throws IOException {
    ZipStreamEntry entry = entry("foo", 0, 70000, 1234, 0xcafebabeL);
    ByteArrayOutputStream descriptor = new ByteArrayOutputStream();
    assertThat(DataDescriptor.write(entry, descriptor)).isEqualTo(DataDescriptor.FIXED_DATA_SIZE);

    byte[] buf = descriptor.toByteArray();
    assertThat(ZipUtil.get32(buf, DataDescriptor.SIGNATURE_OFFSET))
        .isEqualTo(DataDescriptor.SIGNATURE);
    assertThat(ZipUtil.getUnsignedInt(buf, DataDescriptor.CRC_OFFSET)).isEqualTo(0xcafebabeL);
    assertThat(ZipUtil.get32(buf, DataDescriptor.COMPRESSED_SIZE_OFFSET)).isEqualTo(1234);
    assertThat(ZipUtil.get32(buf, DataDescriptor.UNCOMPRESSED_SIZE_OFFSET)).isEqualTo(70000);

    entry.addCompressedSize(0xffffffffL);
    assertThrows(ZipException.class, () -> DataDescriptor.create(entry));
  }

  @Test public void testLocalFileHeader() throws IOException {
    ZipStreamEntry entry = entry("dir/name.txt", 0, 0, 0, 0);
    byte[] buf = LocalFileHeader.create(entry);
    assertThat(buf).hasLength(LocalFileHeader.FIXED_DATA_SIZE + 12);
    assertThat(ZipUtil.get32(buf, LocalFileHeader.SIGNATURE_OFFSET))
        .isEqualTo(LocalFileHeader.SIGNATURE);
    assertThat(ZipUtil.get16(buf, LocalFileHeader.VERSION_OFFSET)).isEqualTo((short) 20);
    assertThat(ZipUtil.get16(buf, LocalFileHeader.FLAGS_OFFSET)).isEqualTo((short) 8);
    assertThat(ZipUtil.get16(buf, LocalFileHeader.METHOD_OFFSET)).isEqualTo((short) 8);
    assertThat(ZipUtil.getUnsignedShort(buf, LocalFileHeader.MOD_TIME_OFFSET))
        .isEqualTo(TIME.dosTime());
    assertThat(ZipUtil.getUnsignedShort(buf, LocalFileHeader.MOD_DATE_OFFSET))
        .isEqualTo(TIME.dosDate());
    assertThat(ZipUtil.get16(buf, LocalFileHeader.FILENAME_LENGTH_OFFSET)).isEqualTo((short) 12);
    assertThat(new String(buf, LocalFileHeader.VARIABLE_DATA_OFFSET, 12, UTF_8))
        .isEqualTo("dir/name.txt");
  }
}
