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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * The entries of an archive in the order they were written, plus the location of the central
 * directory once it has been started.
 */
class ZipStreamData {
  private final List<ZipStreamEntry> entries = new ArrayList<>();

  private long centralDirectoryOffset = -1;
  private long centralDirectorySize = -1;

  /**
   * Appends an entry. Entries appear in the central directory in the order they were added.
   */
  void addEntry(ZipStreamEntry entry) {
    entries.add(checkNotNull(entry));
  }

  /**
   * Returns the entries in insertion order. The list is live and must not be modified.
   */
  List<ZipStreamEntry> getEntries() {
    return entries;
  }

  /**
   * Returns an immutable copy of the entries in insertion order.
   */
  ImmutableList<ZipStreamEntry> snapshot() {
    return ImmutableList.copyOf(entries);
  }

  /**
   * Returns the number of entries.
   */
  long getNumEntries() {
    return entries.size();
  }

  /**
   * Returns the file offset of the start of the central directory, or -1 if it has not been
   * started.
   */
  long getCentralDirectoryOffset() {
    return centralDirectoryOffset;
  }

  /**
   * Sets the file offset of the start of the central directory. May only be set once.
   */
  void setCentralDirectoryOffset(long offset) {
    checkState(centralDirectoryOffset == -1, "Central directory offset already set");
    this.centralDirectoryOffset = offset;
  }

  /**
   * Returns the size of the central directory in bytes, or -1 if it has not been written.
   */
  long getCentralDirectorySize() {
    return centralDirectorySize;
  }

  /**
   * Sets the size of the central directory in bytes, excluding the end of central directory
   * record.
   */
  void setCentralDirectorySize(long size) {
    this.centralDirectorySize = size;
  }

  /**
   * Drops all entries.
   */
  void clear() {
    entries.clear();
  }
}
