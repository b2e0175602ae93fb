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

import java.io.EOFException;
import java.util.Arrays;
import org.apache.commons.lang3.ArrayUtils;

/**
 * A random-access byte array with independent read and write offsets.  Unlike
 * {@link SeekBuffer}, writes go to the write offset and may overwrite existing bytes,
 * reads are all-or-nothing, and neither offset may move past the end of the content.
 *
 * <p>This is not a {@link SeekableBuffer} and cannot be wrapped by the overlays.</p>
 *
 * <p>This class is not thread safe.</p>
 *
 * @author  AO Industries, Inc.
 */
public class RandomBuffer {

  private byte[] content;
  private int length;
  private int readOffset;
  private int writeOffset;

  /**
   * Creates an empty buffer with no capacity.
   */
  public RandomBuffer() {
    this(0);
  }

  public RandomBuffer(int initialCapacity) {
    if (initialCapacity < 0) {
      throw new IllegalArgumentException("initialCapacity<0: " + initialCapacity);
    }
    content = new byte[initialCapacity];
  }

  /**
   * Creates a buffer holding a copy of {@code src}.  The read offset is at the start and
   * the write offset at the end.
   */
  public RandomBuffer(byte[] src) {
    content = src.clone();
    length = src.length;
    writeOffset = length;
  }

  private void ensureCapacity(int minCapacity) {
    if (minCapacity < 0) {
      throw new IndexOutOfBoundsException("Capacity overflow: " + Integer.toUnsignedString(minCapacity));
    }
    if (minCapacity > content.length) {
      int newCapacity = content.length << 1;
      if (newCapacity < 0 || newCapacity < minCapacity) {
        newCapacity = minCapacity;
      }
      content = Arrays.copyOf(content, newCapacity);
    }
  }

  /**
   * Adds bytes after the end of the content.  The write offset moves to the new end.
   */
  public void append(byte[] buff, int off, int len) {
    AbstractSeekableBuffer.checkRange(buff, off, len);
    ensureCapacity(length + len);
    System.arraycopy(buff, off, content, length, len);
    length += len;
    writeOffset = length;
  }

  public void append(byte[] buff) {
    append(buff, 0, buff.length);
  }

  /**
   * Writes bytes at the write offset, overwriting what is there and growing the
   * content when the write runs past its end.  The write offset advances by
   * {@code len}.
   */
  public void write(byte[] buff, int off, int len) {
    AbstractSeekableBuffer.checkRange(buff, off, len);
    int end = writeOffset + len;
    ensureCapacity(end);
    System.arraycopy(buff, off, content, writeOffset, len);
    if (end > length) {
      length = end;
    }
    writeOffset = end;
  }

  public void write(byte[] buff) {
    write(buff, 0, buff.length);
  }

  /**
   * Reads exactly {@code len} bytes from the read offset.
   *
   * @throws  EOFException  when fewer than {@code len} bytes remain, the read offset is
   *                        not moved
   */
  public void readFully(byte[] buff, int off, int len) throws EOFException {
    AbstractSeekableBuffer.checkRange(buff, off, len);
    int available = getUnreadLength();
    if (len > available) {
      throw new EOFException("Not enough bytes to read: need " + len + " bytes but only " + available + " available");
    }
    System.arraycopy(content, readOffset, buff, off, len);
    readOffset += len;
  }

  public void readFully(byte[] buff) throws EOFException {
    readFully(buff, 0, buff.length);
  }

  private void checkSeek(int offset) {
    if (offset < 0) {
      throw new IllegalArgumentException("offset<0: " + offset);
    }
    if (offset > length) {
      throw new IndexOutOfBoundsException("offset>length: " + offset + ">" + length);
    }
  }

  /**
   * Moves the read offset.  The end of the content is a valid position.
   *
   * @throws  IllegalArgumentException   when {@code offset} is negative
   * @throws  IndexOutOfBoundsException  when {@code offset} is past the end
   */
  public void seek(int offset) {
    checkSeek(offset);
    readOffset = offset;
  }

  /**
   * Moves the write offset, with the same bounds as {@link #seek(int)}.
   */
  public void seekWrite(int offset) {
    checkSeek(offset);
    writeOffset = offset;
  }

  public void rewind() {
    readOffset = 0;
  }

  /**
   * Gets the total number of bytes held, regardless of either offset.
   */
  public int getLength() {
    return length;
  }

  public int getUnreadLength() {
    return length - readOffset;
  }

  public int getReadOffset() {
    return readOffset;
  }

  public int getWriteOffset() {
    return writeOffset;
  }

  public int getCapacity() {
    return content.length;
  }

  /**
   * Gets a copy of the bytes from the read offset to the end.
   */
  public byte[] getUnread() {
    if (readOffset == length) {
      return ArrayUtils.EMPTY_BYTE_ARRAY;
    }
    return Arrays.copyOfRange(content, readOffset, length);
  }
}
