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
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wraps any {@link SeekableBuffer} and groups operations into transactions that
 * are committed or rolled back atomically.
 *
 * <p>While a transaction is open, every operation works on a private working copy of
 * the wrapped buffer's content and offset, and the wrapped buffer is not touched.  Only
 * the outermost {@link #commit()} writes the working copy to the wrapped buffer.</p>
 *
 * <p>Transactions nest: each {@link #begin()} beyond the first pushes a savepoint of the
 * working copy, restored by the matching {@link #rollback()} or discarded by the
 * matching {@link #commit()}.</p>
 *
 * <p>Wrapping order matters.  When this buffer wraps a {@link FileSyncBuffer}, nothing
 * reaches the file before the outermost commit.  When a {@link FileSyncBuffer} wraps
 * this buffer, writes inside a transaction are mirrored immediately and a rollback is
 * undone in the file by the next operation on the {@link FileSyncBuffer}.</p>
 *
 * <p>This buffer does not own the wrapped buffer: {@link #close()} leaves it open.</p>
 *
 * <p>This class is not thread safe.</p>
 *
 * @author  AO Industries, Inc.
 */
public class TransactionBuffer extends AbstractSeekableBuffer {

  private static final Logger logger = Logger.getLogger(TransactionBuffer.class.getName());

  /**
   * The working copy captured by a nested {@link #begin()}.
   */
  private static class Savepoint {
    private final byte[] content;
    private final long offset;
    private final int level;

    private Savepoint(byte[] content, long offset, int level) {
      this.content = content;
      this.offset = offset;
      this.level = level;
    }
  }

  private final SeekableBuffer wrapped;
  private boolean isClosed;

  // All of the following are only meaningful while level > 0
  private int level;
  private SeekBuffer workingCopy;
  private byte[] baseContent;
  private long baseOffset;
  private final Deque<Savepoint> savepoints = new ArrayDeque<>();

  public TransactionBuffer(SeekableBuffer wrapped) {
    this.wrapped = wrapped;
  }

  /**
   * Checks if closed and throws IOException if so.
   */
  private void checkClosed() throws IOException {
    if (isClosed) {
      throw new IOException("TransactionBuffer closed");
    }
  }

  /**
   * Gets the buffer that operations currently act on.
   */
  private SeekableBuffer target() throws IOException {
    checkClosed();
    return level > 0 ? workingCopy : wrapped;
  }

  /**
   * Starts a transaction, or a nested transaction when one is already in progress.
   */
  public void begin() throws IOException {
    checkClosed();
    if (level == 0) {
      baseContent = wrapped.getContent();
      baseOffset = wrapped.getOffset();
      workingCopy = new SeekBuffer(baseContent, baseOffset);
    } else {
      savepoints.push(new Savepoint(workingCopy.getContent(), workingCopy.getOffset(), level));
    }
    level++;
    assert savepoints.size() == level - 1;
  }

  /**
   * Commits the current transaction.  A nested commit accepts the changes into the
   * enclosing transaction.  The outermost commit replaces the wrapped buffer's content
   * and offset with the working copy.  When the wrapped content is still a prefix of
   * the working copy, only the new bytes are written to it; otherwise it is cleared and
   * fully rewritten.
   *
   * <p>When the wrapped content cannot be read, the transaction stays open and
   * unchanged.  Once writing the working copy to the wrapped buffer has started, the
   * transaction is finished even when the wrapped buffer fails.</p>
   *
   * @exception  NoActiveTransactionException  when no transaction is in progress
   */
  public void commit() throws IOException, NoActiveTransactionException {
    checkClosed();
    if (level == 0) {
      throw new NoActiveTransactionException("commit: no transaction in progress");
    }
    if (level > 1) {
      Savepoint savepoint = savepoints.pop();
      assert savepoint.level == level - 1;
      level--;
      return;
    }
    byte[] committed = workingCopy.getContent();
    long committedOffset = workingCopy.getOffset();
    // Still in the transaction when the wrapped buffer cannot be read
    byte[] current = wrapped.getContent();
    reset();
    if (
      current.length <= committed.length
      && AoArrays.equals(current, committed, 0, current.length)
    ) {
      if (committed.length > current.length) {
        wrapped.write(committed, current.length, committed.length - current.length);
      }
    } else {
      logger.log(Level.FINE, "Wrapped buffer changed during transaction, rewriting {0} bytes", committed.length);
      wrapped.clear();
      wrapped.write(committed);
    }
    wrapped.seek(committedOffset);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Committed transaction: " + committed.length + " bytes, offset " + committedOffset);
    }
  }

  /**
   * Rolls back the current transaction.  A nested rollback restores the working copy
   * saved by the matching {@link #begin()}.  The outermost rollback discards the working
   * copy; the wrapped buffer is left as it was before the transaction started.
   *
   * @exception  NoActiveTransactionException  when no transaction is in progress
   */
  public void rollback() throws IOException, NoActiveTransactionException {
    checkClosed();
    if (level == 0) {
      throw new NoActiveTransactionException("rollback: no transaction in progress");
    }
    if (level > 1) {
      Savepoint savepoint = savepoints.pop();
      assert savepoint.level == level - 1;
      workingCopy = new SeekBuffer(savepoint.content, savepoint.offset);
      level--;
      return;
    }
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Rolled back transaction to " + baseContent.length + " bytes, offset " + baseOffset);
    }
    reset();
  }

  /**
   * Returns to the idle state, discarding all transaction state.
   */
  private void reset() {
    level = 0;
    workingCopy = null;
    baseContent = null;
    baseOffset = 0;
    savepoints.clear();
  }

  /**
   * Checks if a transaction is in progress.
   */
  public boolean isInTransaction() {
    return level > 0;
  }

  /**
   * Gets the current nesting depth, zero when no transaction is in progress.
   */
  public int getTransactionLevel() {
    return level;
  }

  @Override
  public boolean isClosed() {
    return isClosed;
  }

  /**
   * Rolls back any transaction in progress, at every nesting level.  The wrapped buffer
   * is not closed; it belongs to whoever created it.
   */
  @Override
  public void close() {
    if (level > 0) {
      logger.log(Level.FINE, "Closed with {0} open transaction level(s), rolling back", level);
      reset();
    }
    isClosed = true;
  }

  @Override
  public int write(byte[] buff, int off, int len) throws IOException {
    return target().write(buff, off, len);
  }

  @Override
  public void append(byte[] buff, int off, int len) throws IOException {
    target().append(buff, off, len);
  }

  @Override
  public int read(byte[] buff, int off, int len) throws IOException {
    return target().read(buff, off, len);
  }

  @Override
  public byte[] readUntil(byte delimiter) throws IOException {
    return target().readUntil(delimiter);
  }

  @Override
  public void seek(long offset) throws IOException {
    target().seek(offset);
  }

  @Override
  public void rewind() throws IOException {
    target().rewind();
  }

  @Override
  public long getOffset() throws IOException {
    return target().getOffset();
  }

  @Override
  public int getUnreadLength() throws IOException {
    return target().getUnreadLength();
  }

  @Override
  public int getContentLength() throws IOException {
    return target().getContentLength();
  }

  @Override
  public byte[] getContent() throws IOException {
    return target().getContent();
  }

  @Override
  public void clear() throws IOException {
    target().clear();
  }
}
