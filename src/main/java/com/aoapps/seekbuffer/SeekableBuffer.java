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

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * A seekable buffer behaves like a tiny single-writer file held in memory.  Data is
 * only ever added at the end, while a single cursor (the offset) tracks where the
 * next read will start.
 *
 * <p>This is the contract shared by the in-memory {@link SeekBuffer} and every
 * wrapping buffer ({@link TransactionBuffer}, {@link FileSyncBuffer},
 * {@link LoggingBuffer}).  Any implementation may be wrapped by any other, and the
 * order of wrapping is significant.</p>
 *
 * <p>Implementations are not thread safe unless documented otherwise.  See
 * {@link SeekableBuffers#synchronizedBuffer(SeekableBuffer)}.</p>
 *
 * @author  AO Industries, Inc.
 */
public interface SeekableBuffer extends Closeable {

  /**
   * Checks if this buffer is closed.
   */
  boolean isClosed();

  /**
   * Closes this buffer.  It is OK to close an already closed buffer.
   */
  @Override
  void close() throws IOException;

  /**
   * Appends the bytes to the end of this buffer.  The offset is not changed.
   *
   * @return  the number of bytes accepted, always {@code len}
   */
  int write(byte[] buff, int off, int len) throws IOException;

  /**
   * Appends all the bytes to the end of this buffer.
   *
   * @return  the number of bytes accepted, always {@code buff.length}
   */
  int write(byte[] buff) throws IOException;

  /**
   * Same effect as {@link #write(byte[], int, int)}, without a result.
   */
  void append(byte[] buff, int off, int len) throws IOException;

  /**
   * Same effect as {@link #write(byte[])}, without a result.
   */
  void append(byte[] buff) throws IOException;

  /**
   * Reads up to {@code len} bytes starting at the current offset and advances the
   * offset by the number of bytes read.  Reading fewer bytes than requested is
   * normal and is not an error.
   *
   * @return  the number of bytes read or {@code -1} when the offset is at or beyond
   *          the end of the content
   */
  int read(byte[] buff, int off, int len) throws IOException;

  /**
   * Reads into the entire array.
   *
   * @see  #read(byte[], int, int)
   */
  int read(byte[] buff) throws IOException;

  /**
   * Scans forward from the current offset for the first occurrence of
   * {@code delimiter}.  When found, returns everything up to and including the
   * delimiter and moves the offset just past it.  When not found, returns all the
   * remaining bytes and moves the offset to the end of the content.
   *
   * <p>The delimiter was found if and only if the result is not empty and its last
   * byte is the delimiter.  An empty result means the end of the content had
   * already been reached.</p>
   */
  byte[] readUntil(byte delimiter) throws IOException;

  /**
   * Moves the offset.  Seeking beyond the end of the content is allowed; the next
   * read will report the end of the content.
   *
   * @exception  IllegalArgumentException  if {@code offset} is negative
   */
  void seek(long offset) throws IOException;

  /**
   * Moves the offset back to the beginning.  Same as {@code seek(0)}.
   */
  void rewind() throws IOException;

  /**
   * Gets the current offset.
   */
  long getOffset() throws IOException;

  /**
   * Gets the number of bytes between the offset and the end of the content, zero
   * when the offset is at or beyond the end.
   */
  int getUnreadLength() throws IOException;

  /**
   * Gets the total number of bytes in this buffer, regardless of the offset.
   */
  int getContentLength() throws IOException;

  /**
   * Gets a copy of the full content from index zero, regardless of the offset.
   */
  byte[] getContent() throws IOException;

  /**
   * Discards all content and resets the offset to zero.  Unlike {@link #close()},
   * the buffer remains usable.
   */
  void clear() throws IOException;

  /**
   * Gets an input stream that reads from the current offset, advancing it.
   */
  InputStream getInputStream() throws IOException;

  /**
   * Gets an output stream that appends to this buffer.
   */
  OutputStream getOutputStream() throws IOException;
}
