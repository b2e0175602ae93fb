/*
 * ao-seekbuffer - Seekable, transactional and file-synchronized byte buffers for Java.
 * Copyright (C) 2026  AO Industries, Inc.
 *     support@aoindustries.com
 *     7262 Bull Pen Cir
 *     Mobile, AL 36695
 *
 * This file is part of ao-seekbuffer.
 *
 * ao-seekbuffer is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * ao-seekbuffer is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with ao-seekbuffer.  If not, see <https://www.gnu.org/licenses/>.
 */
package com.aoapps.seekbuffer;

import com.aoapps.collections.AoArrays;
import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.lang3.ArrayUtils;

/**
 * Wraps any {@link SeekableBuffer} and mirrors its content to a file.  Once
 * {@link #enableSync(File) enabled}, the file always starts out as an exact copy of the
 * buffer's content and each write appends only the bytes not yet in the file.
 * Previously written bytes are only rewritten when the wrapped content no longer
 * matches them.
 *
 * <p>The file pointer follows the buffer's offset on {@link #seek(long)} and
 * {@link #rewind()}.  Reads never consult the file.</p>
 *
 * <p>The wrapped content may change behind this buffer, such as when a wrapped
 * {@link TransactionBuffer} rolls back bytes that were already mirrored.  The file is
 * then truncated to the first byte that differs by the next write, append, seek,
 * rewind, clear, or {@link #sync()}, and rewritten from there by the next write,
 * append, or {@link #sync()}.</p>
 *
 * <p>A write or append always changes the wrapped buffer first.  When mirroring the new
 * bytes then fails, the {@link IOException} is thrown, the bytes remain in memory, and
 * the next successful synchronization writes them to the file.</p>
 *
 * <p>The file is held open until sync is disabled or this buffer is closed.  No other
 * writer may use the file meanwhile.  This class is not thread safe.</p>
 *
 * @author  AO Industries, Inc.
 */
public class FileSyncBuffer extends AbstractSeekableBuffer {

  private static final Logger logger = Logger.getLogger(FileSyncBuffer.class.getName());

  private final SeekableBuffer wrapped;
  private final ProtectionLevel protectionLevel;
  private boolean isClosed;

  // All null or zero while sync is disabled
  private File file;
  private RandomAccessFile raf;
  /**
   * The number of leading bytes of the wrapped content already in the file.
   */
  private int syncedLength;
  /**
   * The bytes last written to the file, only the first {@link #syncedLength} are valid.
   */
  private byte[] mirrored = ArrayUtils.EMPTY_BYTE_ARRAY;

  /**
   * Creates a buffer with sync disabled and protection level {@link ProtectionLevel#NONE}.
   */
  public FileSyncBuffer(SeekableBuffer wrapped) {
    this(wrapped, ProtectionLevel.NONE);
  }

  /**
   * Creates a buffer with sync disabled.
   */
  public FileSyncBuffer(SeekableBuffer wrapped, ProtectionLevel protectionLevel) {
    this.wrapped = wrapped;
    this.protectionLevel = protectionLevel;
  }

  /**
   * Checks if closed and throws IOException if so.
   */
  private void checkClosed() throws IOException {
    if (isClosed) {
      throw new IOException("FileSyncBuffer closed");
    }
  }

  public ProtectionLevel getProtectionLevel() {
    return protectionLevel;
  }

  /**
   * Starts mirroring to the named file.
   *
   * @see  #enableSync(File)
   */
  public void enableSync(String name) throws IOException {
    enableSync(new File(name));
  }

  /**
   * Starts mirroring to the file, which is created when missing.  Any file currently
   * mirrored to is closed first.  The file is truncated and the full current content
   * is written to it.
   *
   * <p>Sync is left disabled when this fails.</p>
   */
  public void enableSync(File file) throws IOException {
    checkClosed();
    closeFile();
    RandomAccessFile newRaf = new RandomAccessFile(file, "rw");
    try {
      newRaf.setLength(0);
      this.file = file;
      this.raf = newRaf;
      syncedLength = 0;
      mirrored = ArrayUtils.EMPTY_BYTE_ARRAY;
      syncNewData();
    } catch (IOException | RuntimeException e) {
      this.file = null;
      this.raf = null;
      syncedLength = 0;
      mirrored = ArrayUtils.EMPTY_BYTE_ARRAY;
      try {
        newRaf.close();
      } catch (IOException e2) {
        e.addSuppressed(e2);
      }
      throw e;
    }
    logger.log(Level.FINE, "Enabled sync to {0}", file);
  }

  /**
   * Stops mirroring and closes the file.  The buffer content is not changed.  Does
   * nothing when sync is already disabled.
   */
  public void disableSync() throws IOException {
    File oldFile = file;
    closeFile();
    if (oldFile != null) {
      logger.log(Level.FINE, "Disabled sync to {0}", oldFile);
    }
  }

  private void closeFile() throws IOException {
    RandomAccessFile oldRaf = raf;
    file = null;
    raf = null;
    syncedLength = 0;
    mirrored = ArrayUtils.EMPTY_BYTE_ARRAY;
    if (oldRaf != null) {
      oldRaf.close();
    }
  }

  public boolean isSyncEnabled() {
    return raf != null;
  }

  /**
   * Gets the path of the file being mirrored to, or {@code ""} when sync is disabled.
   */
  public String getSyncPath() {
    return file == null ? "" : file.getPath();
  }

  /**
   * Gets the number of leading bytes of the content already in the file, zero when
   * sync is disabled.
   */
  public long getSyncedLength() {
    return syncedLength;
  }

  /**
   * Brings the file up to date with the content: truncates it where the content no
   * longer matches, then writes any bytes not yet mirrored.  Does nothing when sync is
   * disabled.
   */
  public void sync() throws IOException {
    checkClosed();
    syncNewData();
  }

  /**
   * Truncates the file when the wrapped content no longer matches what was already
   * mirrored.
   */
  private void reconcile() throws IOException {
    if (raf != null) {
      reconcile(wrapped.getContent());
    }
  }

  /**
   * Truncates the file to the longest prefix shared by the mirrored bytes and the
   * content.
   */
  private void reconcile(byte[] content) throws IOException {
    int common = Math.min(syncedLength, content.length);
    if (!AoArrays.equals(mirrored, content, 0, common)) {
      int i = 0;
      while (mirrored[i] == content[i]) {
        i++;
      }
      common = i;
    }
    if (common < syncedLength) {
      if (logger.isLoggable(Level.FINE)) {
        logger.fine("Content no longer matches " + file + " from byte " + common + ", truncating from " + syncedLength + " bytes");
      }
      raf.setLength(common);
      syncedLength = common;
      force();
    }
  }

  /**
   * Writes the bytes past {@link #syncedLength} to the file, after reconciling.  The
   * file pointer is restored afterwards.
   */
  private void syncNewData() throws IOException {
    if (raf != null) {
      byte[] content = wrapped.getContent();
      reconcile(content);
      if (syncedLength < content.length) {
        int from = syncedLength;
        int count = content.length - from;
        long currentPosition = raf.getFilePointer();
        try {
          raf.seek(from);
          try {
            raf.write(content, from, count);
          } catch (IOException e) {
            // Drop any partially written tail
            try {
              raf.setLength(from);
            } catch (IOException e2) {
              e.addSuppressed(e2);
            }
            throw e;
          }
          mirrored = content;
          syncedLength += count;
        } finally {
          raf.seek(currentPosition);
        }
        force();
      }
    }
  }

  private void force() throws IOException {
    switch (protectionLevel) {
      case NONE:
        break;
      case BARRIER:
        raf.getChannel().force(false);
        break;
      case FORCE:
        raf.getChannel().force(true);
        break;
      default:
        throw new AssertionError("Unexpected protection level: " + protectionLevel);
    }
  }

  @Override
  public boolean isClosed() {
    return isClosed;
  }

  /**
   * Closes both the wrapped buffer and the file.  When both fail, the file error is
   * thrown with the buffer error suppressed.
   */
  @Override
  public void close() throws IOException {
    isClosed = true;
    IOException bufferErr = null;
    try {
      wrapped.close();
    } catch (IOException e) {
      bufferErr = e;
    }
    IOException fileErr = null;
    try {
      closeFile();
    } catch (IOException e) {
      fileErr = e;
    }
    if (fileErr != null) {
      if (bufferErr != null) {
        fileErr.addSuppressed(bufferErr);
      }
      throw fileErr;
    }
    if (bufferErr != null) {
      throw bufferErr;
    }
  }

  @Override
  public int write(byte[] buff, int off, int len) throws IOException {
    checkClosed();
    int count = wrapped.write(buff, off, len);
    syncNewData();
    return count;
  }

  @Override
  public void append(byte[] buff, int off, int len) throws IOException {
    checkClosed();
    wrapped.append(buff, off, len);
    syncNewData();
  }

  @Override
  public int read(byte[] buff, int off, int len) throws IOException {
    checkClosed();
    return wrapped.read(buff, off, len);
  }

  @Override
  public byte[] readUntil(byte delimiter) throws IOException {
    checkClosed();
    return wrapped.readUntil(delimiter);
  }

  /**
   * Also moves the file pointer to {@code offset}.  Does not write anything new to the
   * file.
   */
  @Override
  public void seek(long offset) throws IOException {
    checkClosed();
    wrapped.seek(offset);
    if (raf != null) {
      reconcile();
      raf.seek(offset);
    }
  }

  /**
   * Also moves the file pointer to the beginning of the file.
   */
  @Override
  public void rewind() throws IOException {
    checkClosed();
    wrapped.rewind();
    if (raf != null) {
      reconcile();
      raf.seek(0);
    }
  }

  @Override
  public long getOffset() throws IOException {
    checkClosed();
    return wrapped.getOffset();
  }

  @Override
  public int getUnreadLength() throws IOException {
    checkClosed();
    return wrapped.getUnreadLength();
  }

  @Override
  public int getContentLength() throws IOException {
    checkClosed();
    return wrapped.getContentLength();
  }

  @Override
  public byte[] getContent() throws IOException {
    checkClosed();
    return wrapped.getContent();
  }

  /**
   * Also truncates the file when sync is enabled.
   */
  @Override
  public void clear() throws IOException {
    checkClosed();
    wrapped.clear();
    reconcile();
  }

  /**
   * Gets the current position of the file pointer, for tests.
   */
  long getFilePointer() throws IOException {
    return raf == null ? 0 : raf.getFilePointer();
  }
}
