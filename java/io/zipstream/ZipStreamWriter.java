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
import static com.google.common.base.Preconditions.checkPositionIndexes;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import com.google.common.io.ByteStreams;
import com.google.common.io.CountingOutputStream;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import io.zipstream.CompressionEngine.FlushMode;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.zip.CRC32;
import java.util.zip.ZipException;
import javax.annotation.Nullable;

/**
 * Writes a ZIP archive to a {@link ZipSink} as the data for its entries arrives. Neither the
 * archive nor any single entry is held in memory: entry data is compressed and passed to the sink
 * as it is written, and the sizes and CRC-32 of each entry follow its data in a data descriptor.
 *
 * <p>Usage:
 * <pre>
 *   ZipStreamWriter writer = new ZipStreamWriter(sink);
 *   try {
 *     writer.putNextEntry("a.txt", ZipDateTime.now(clock));
 *     writer.write(data);
 *     writer.closeEntry();
 *     writer.finish();
 *   } finally {
 *     writer.close();
 *   }
 * </pre>
 *
 * <p>Only one entry can be open at a time. Calls made in the wrong order throw a
 * {@link ZipException} and leave the writer unchanged. If the sink throws, the archive is
 * truncated and the writer refuses any further work with an {@link IllegalStateException}.
 *
 * <p>{@link #close()} releases the writer's resources. It neither finishes the archive nor
 * closes the sink, so an archive that was not finished first is left incomplete.
 *
 * <p>This class is not thread safe.
 */
public class ZipStreamWriter extends OutputStream {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private static final byte[] NO_INPUT = new byte[0];

  private enum State {
    IDLE,
    ENTRY_OPEN,
    FINISHED,
    FAILED,
    RELEASED,
  }

  private final CountingOutputStream stream;
  private final ZipStreamOptions options;
  private final CompressionEngine engine;
  private final ZipStreamData zipData;
  private final CRC32 crc;
  private final CompressionEngine.ChunkConsumer compressedOutput;
  @Nullable private ZipStreamEntry entry;
  private State state;

  /**
   * Creates a writer with the default {@link ZipStreamOptions}.
   *
   * @param sink receives the archive bytes
   */
  public ZipStreamWriter(ZipSink sink) {
    this(sink, ZipStreamOptions.defaults());
  }

  /**
   * Creates a writer.
   *
   * @param sink receives the archive bytes
   * @param options the writer settings
   */
  public ZipStreamWriter(ZipSink sink, ZipStreamOptions options) {
    this(checkNotNull(sink), checkNotNull(options), DeflateEngine.create(options));
  }

  /**
   * Creates a writer that writes to {@code out}. The stream is not closed by the writer.
   */
  public ZipStreamWriter(OutputStream out) {
    this(ZipSink.of(out));
  }

  /**
   * Creates a writer that compresses with {@code engine}. The writer takes ownership of the
   * engine and closes it on {@link #close()}, or right away if construction fails.
   */
  @VisibleForTesting
  ZipStreamWriter(ZipSink sink, ZipStreamOptions options, CompressionEngine engine) {
    checkNotNull(engine);
    try {
      this.stream = new CountingOutputStream(new SinkOutputStream(sink));
      this.options = checkNotNull(options);
      this.zipData = new ZipStreamData();
    } catch (RuntimeException e) {
      engine.close();
      throw e;
    }
    this.engine = engine;
    this.crc = new CRC32();
    this.compressedOutput = this::writeCompressed;
    this.state = State.IDLE;
  }

  /**
   * Begins a new entry stamped with the current time of the configured clock.
   *
   * @see #putNextEntry(String, ZipDateTime)
   */
  public void putNextEntry(String name) throws IOException {
    putNextEntry(name, ZipDateTime.now(options.clock()));
  }

  /**
   * Begins a new entry and writes its local file header. The name is truncated to
   * {@link ZipStreamOptions#maxNameLength()} bytes once encoded.
   *
   * @param name the entry name
   * @param time the entry modification time
   * @throws ZipException if an entry is already open
   * @throws IOException if the sink fails
   */
  public void putNextEntry(String name, ZipDateTime time) throws IOException {
    checkNotNull(name);
    checkNotNull(time);
    checkUsable();
    if (entry != null) {
      throw new ZipException(String.format(
          "Cannot start entry %s while entry %s is still open.", name, entry.getName()));
    }
    ZipStreamEntry e = ZipStreamEntry.create(name, options.charset(), options.maxNameLength(),
        stream.getCount(), time, engine.getMethod());
    try {
      LocalFileHeader.write(e, stream);
    } catch (IOException ex) {
      throw failed(ex);
    }
    zipData.addEntry(e);
    crc.reset();
    engine.reset();
    entry = e;
    state = State.ENTRY_OPEN;
    logger.atFine().log("Opened entry %s at offset %d", e.getName(), e.getLocalHeaderOffset());
  }

  @Override public void write(int b) throws IOException {
    byte[] buf = new byte[1];
    buf[0] = (byte) (b & 0xff);
    write(buf);
  }

  @Override public void write(byte[] b) throws IOException {
    write(b, 0, b.length);
  }

  /**
   * Adds data to the open entry. The data is checksummed, compressed and any compressed output
   * that is ready is passed to the sink before this method returns.
   *
   * @throws ZipException if no entry is open
   * @throws IOException if the sink fails
   */
  @Override public void write(byte[] b, int off, int len) throws IOException {
    checkNotNull(b);
    checkPositionIndexes(off, off + len, b.length);
    checkUsable();
    if (entry == null) {
      throw new ZipException("Cannot write zip contents without first starting an entry.");
    }
    if (len == 0) {
      return;
    }
    crc.update(b, off, len);
    entry.setCrc(crc.getValue());
    entry.addSize(len);
    try {
      engine.feed(FlushMode.NO_FLUSH, b, off, len, compressedOutput);
    } catch (IOException e) {
      throw failed(e);
    }
  }

  /**
   * Adds an entry holding all remaining bytes of {@code content}: starts the entry, copies the
   * stream into it and closes it. The input stream is not closed.
   *
   * @return the number of uncompressed bytes in the entry
   * @throws ZipException if an entry is already open
   * @throws IOException if reading {@code content} or writing to the sink fails
   */
  @CanIgnoreReturnValue
  public long addEntry(String name, ZipDateTime time, InputStream content) throws IOException {
    checkNotNull(content);
    putNextEntry(name, time);
    long count = ByteStreams.copy(content, this);
    closeEntry();
    return count;
  }

  /**
   * Closes the current entry: flushes the remaining compressed data and writes the data
   * descriptor. Does nothing if no entry is open.
   *
   * @throws IOException if the sink fails
   */
  public void closeEntry() throws IOException {
    if (entry == null) {
      return;
    }
    checkUsable();
    try {
      engine.feed(FlushMode.FINISH, NO_INPUT, 0, 0, compressedOutput);
      entry.setCrc(crc.getValue());
      DataDescriptor.write(entry, stream);
    } catch (IOException e) {
      throw failed(e);
    }
    logger.atFine().log("Closed entry %s", entry);
    entry = null;
    state = State.IDLE;
  }

  /**
   * Writes the central directory and the end of central directory record. The writer can not be
   * used for anything but {@link #close()} afterwards. The sink is not closed.
   *
   * @throws ZipException if an entry is still open
   * @throws IOException if the sink fails
   */
  public void finish() throws IOException {
    checkUsable();
    if (entry != null) {
      throw new ZipException(String.format(
          "Cannot finish the archive while entry %s is still open.", entry.getName()));
    }
    try {
      CentralDirectory.write(zipData, stream);
    } catch (IOException e) {
      throw failed(e);
    }
    state = State.FINISHED;
    logger.atFine().log("Finished archive: %d entries, %d bytes",
        zipData.getNumEntries(), stream.getCount());
  }

  /**
   * Releases the compression engine and the entries. Does not finish the archive and does not
   * close the sink. Calling this more than once has no effect.
   */
  @Override public void close() {
    if (state == State.RELEASED) {
      return;
    }
    if (state != State.FINISHED) {
      logger.atFine().log("Released unfinished archive after %d bytes", stream.getCount());
    }
    engine.close();
    zipData.clear();
    state = State.RELEASED;
  }

  /** Returns the number of entries started so far. */
  public long getNumEntries() {
    return zipData.getNumEntries();
  }

  /** Returns the number of bytes passed to the sink so far. */
  public long getBytesWritten() {
    return stream.getCount();
  }

  /** Returns whether an entry is open. */
  public boolean isEntryOpen() {
    return entry != null;
  }

  /** Returns the entries started so far, in archive order. */
  public ImmutableList<ZipStreamEntry> getEntries() {
    return zipData.snapshot();
  }

  /** Passes a chunk of compressed output for the open entry to the sink. */
  private void writeCompressed(byte[] chunk, int off, int len) throws IOException {
    stream.write(chunk, off, len);
    entry.addCompressedSize(len);
  }

  /** Marks the archive as unusable after the sink failed. */
  private IOException failed(IOException e) {
    state = State.FAILED;
    logger.atWarning().withCause(e).log(
        "ZIP output failed after %d bytes; archive is incomplete", stream.getCount());
    return e;
  }

  /** Checks that the writer has not been finished, failed or released. */
  private void checkUsable() {
    switch (state) {
      case FINISHED:
        throw new IllegalStateException("The archive has already been finished.");
      case FAILED:
        throw new IllegalStateException("The archive is unusable after an output failure.");
      case RELEASED:
        throw new IllegalStateException("The writer has been closed.");
      default:
        break;
    }
  }
}
