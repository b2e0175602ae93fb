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

import com.aoapps.lang.util.BufferManager;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.BufferOverflowException;
import java.util.Arrays;
import org.apache.commons.lang3.ArrayUtils;

/**
 * The in-memory seekable buffer.  Owns a growable {@code byte[]} and a single
 * offset.  Writes always append at the end of the content and never move the
 * offset; reads start at the offset and advance it.
 *
 * <p>The file methods ({@link #saveToFile(File)}, {@link #appendToFile(File)},
 * {@link #appendUnreadToFile(File)} and {@link #loadFromFile(File)}) work directly
 * on the content of this buffer.  They know nothing about any transaction or file
 * synchronization wrapping this buffer.</p>
 *
 * <p>This class is not thread safe.</p>
 *
 * @author  AO Industries, Inc.
 */
public class SeekBuffer extends AbstractSeekableBuffer {

  private static final int DEFAULT_INITIAL_CAPACITY = 64;

  private byte[] content;
  private int size;
  private long offset;
  private boolean isClosed;

  /**
   * Creates an empty buffer.
   */
  public SeekBuffer() {
    this(DEFAULT_INITIAL_CAPACITY);
  }

  /**
   * Creates an empty buffer with room for {@code initialCapacity} bytes before the
   * first growth.
   */
  public SeekBuffer(int initialCapacity) {
    if (initialCapacity < 0) {
      throw new IllegalArgumentException("initialCapacity<0: " + initialCapacity);
    }
    content = new byte[initialCapacity];
  }

  /**
   * Creates a buffer holding a copy of {@code src}, with the offset at zero.
   */
  public SeekBuffer(byte[] src) {
    content = Arrays.copyOf(src, Math.max(src.length, DEFAULT_INITIAL_CAPACITY));
    size = src.length;
  }

  /**
   * Creates a buffer holding a copy of {@code src} with the given offset.
   */
  SeekBuffer(byte[] src, long offset) {
    this(src);
    checkOffset(offset);
    this.offset = offset;
  }

  /**
   * Creates a buffer holding the bytes of the given file, with the offset at zero.
   */
  public static SeekBuffer fromFile(File file) throws IOException {
    SeekBuffer buffer = new SeekBuffer();
    buffer.loadFromFile(file);
    return buffer;
  }

  /**
   * Checks if closed and throws IOException if so.
   */
  private void checkClosed() throws IOException {
    if (isClosed) {
      throw new IOException("SeekBuffer closed");
    }
  }

  private void ensureCapacity(int minCapacity) {
    if (minCapacity > content.length) {
      int newCapacity = content.length << 1;
      if (newCapacity < 0 || newCapacity < minCapacity) {
        newCapacity = minCapacity;
      }
      content = Arrays.copyOf(content, newCapacity);
    }
  }

  @Override
  public boolean isClosed() {
    return isClosed;
  }

  /**
   * Releases the content and resets the offset.  Any further use, other than
   * {@link #close()} or {@link #isClosed()}, throws {@link IOException}.
   */
  @Override
  public void close() {
    content = ArrayUtils.EMPTY_BYTE_ARRAY;
    size = 0;
    offset = 0;
    isClosed = true;
  }

  /**
   * Never writes partially.
   *
   * @exception  BufferOverflowException  when the content would exceed the maximum array size
   */
  @Override
  public int write(byte[] buff, int off, int len) throws IOException {
    checkClosed();
    checkRange(buff, off, len);
    if (len > Integer.MAX_VALUE - size) {
      throw new BufferOverflowException();
    }
    ensureCapacity(size + len);
    System.arraycopy(buff, off, content, size, len);
    size += len;
    return len;
  }

  @Override
  public int read(byte[] buff, int off, int len) throws IOException {
    checkClosed();
    checkRange(buff, off, len);
    if (offset >= size) {
      return -1;
    }
    int position = (int) offset;
    int count = Math.min(len, size - position);
    System.arraycopy(content, position, buff, off, count);
    offset += count;
    return count;
  }

  @Override
  public byte[] readUntil(byte delimiter) throws IOException {
    checkClosed();
    if (offset >= size) {
      return ArrayUtils.EMPTY_BYTE_ARRAY;
    }
    int start = (int) offset;
    int index = ArrayUtils.indexOf(content, delimiter, start);
    // Unused capacity past size is not content
    int end = (index == ArrayUtils.INDEX_NOT_FOUND || index >= size) ? size : (index + 1);
    offset = end;
    return Arrays.copyOfRange(content, start, end);
  }

  @Override
  public void seek(long offset) throws IOException {
    checkClosed();
    checkOffset(offset);
    this.offset = offset;
  }

  @Override
  public long getOffset() throws IOException {
    checkClosed();
    return offset;
  }

  @Override
  public int getUnreadLength() throws IOException {
    checkClosed();
    return offset >= size ? 0 : (size - (int) offset);
  }

  @Override
  public int getContentLength() throws IOException {
    checkClosed();
    return size;
  }

  @Override
  public byte[] getContent() throws IOException {
    checkClosed();
    return Arrays.copyOf(content, size);
  }

  @Override
  public void clear() throws IOException {
    checkClosed();
    size = 0;
    offset = 0;
  }

  /**
   * Writes the full content to the file, replacing anything already there.
   */
  public void saveToFile(File file) throws IOException {
    writeToFile(file, 0, false);
  }

  /**
   * Appends the full content to the end of the file, creating the file when missing.
   */
  public void appendToFile(File file) throws IOException {
    writeToFile(file, 0, true);
  }

  /**
   * Appends only the bytes between the offset and the end of the content to the
   * file, creating the file when missing.  The offset is not changed.
   */
  public void appendUnreadToFile(File file) throws IOException {
    checkClosed();
    writeToFile(file, offset >= size ? size : (int) offset, true);
  }

  private void writeToFile(File file, int from, boolean append) throws IOException {
    checkClosed();
    try (OutputStream out = new FileOutputStream(file, append)) {
      out.write(content, from, size - from);
    }
  }

  /**
   * Replaces the content with the bytes of the file and resets the offset to zero.
   * The content is left unchanged when the file cannot be opened.
   */
  public void loadFromFile(File file) throws IOException {
    checkClosed();
    try (InputStream in = new FileInputStream(file)) {
      clear();
      long length = file.length();
      if (length > 0 && length <= Integer.MAX_VALUE) {
        ensureCapacity((int) length);
      }
      byte[] buff = BufferManager.getBytes();
      try {
        int count;
        while ((count = in.read(buff, 0, BufferManager.BUFFER_SIZE)) != -1) {
          write(buff, 0, count);
        }
      } finally {
        BufferManager.release(buff, false);
      }
    }
  }
}
