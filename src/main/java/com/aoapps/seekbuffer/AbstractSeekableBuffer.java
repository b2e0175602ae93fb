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

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Provides a base implementation of {@link SeekableBuffer} in terms of the basic
 * ranged read/write methods.  This class is not thread safe.
 *
 * @author  AO Industries, Inc.
 */
public abstract class AbstractSeekableBuffer implements SeekableBuffer {

  protected AbstractSeekableBuffer() {
    // Nothing to initialize
  }

  /**
   * Checks the bounds of a {@code byte[]} range the same way as
   * {@link InputStream#read(byte[], int, int)}.
   */
  protected static void checkRange(byte[] buff, int off, int len) {
    if (off < 0) {
      throw new IllegalArgumentException("off<0: " + off);
    }
    if (len < 0) {
      throw new IllegalArgumentException("len<0: " + len);
    }
    if (len > buff.length - off) {
      throw new IndexOutOfBoundsException("off+len>buff.length: " + off + "+" + len + ">" + buff.length);
    }
  }

  /**
   * Checks a seek offset.
   */
  protected static void checkOffset(long offset) {
    if (offset < 0) {
      throw new IllegalArgumentException("offset<0: " + offset);
    }
  }

  /**
   * Implemented as call to {@code write(byte[],int,int)}.
   *
   * @see  #write(byte[], int, int)
   */
  @Override
  public int write(byte[] buff) throws IOException {
    return write(buff, 0, buff.length);
  }

  /**
   * Implemented as call to {@code write(byte[],int,int)}.
   *
   * @see  #write(byte[], int, int)
   */
  @Override
  public void append(byte[] buff, int off, int len) throws IOException {
    write(buff, off, len);
  }

  /**
   * Implemented as call to {@code append(byte[],int,int)}.
   *
   * @see  #append(byte[], int, int)
   */
  @Override
  public void append(byte[] buff) throws IOException {
    append(buff, 0, buff.length);
  }

  /**
   * Implemented as call to {@code read(byte[],int,int)}.
   *
   * @see  #read(byte[], int, int)
   */
  @Override
  public int read(byte[] buff) throws IOException {
    return read(buff, 0, buff.length);
  }

  /**
   * Implemented as call to {@code seek(0)}.
   *
   * @see  #seek(long)
   */
  @Override
  public void rewind() throws IOException {
    seek(0);
  }

  /**
   * Implemented as calls to {@code read(byte[],int,int)}.  Closing the stream does
   * not close this buffer.
   *
   * @see  #read(byte[], int, int)
   */
  @Override
  public InputStream getInputStream() throws IOException {
    return new InputStream() {
      private boolean closed = false;
      private final byte[] single = new byte[1];

      @Override
      public int read() throws IOException {
        if (closed) {
          throw new IOException("Stream closed");
        }
        int count = AbstractSeekableBuffer.this.read(single, 0, 1);
        return count == -1 ? -1 : (single[0] & 255);
      }

      @Override
      public int read(byte[] b, int off, int len) throws IOException {
        if (closed) {
          throw new IOException("Stream closed");
        }
        checkRange(b, off, len);
        if (len == 0) {
          return 0;
        }
        return AbstractSeekableBuffer.this.read(b, off, len);
      }

      @Override
      public long skip(long n) throws IOException {
        if (closed) {
          throw new IOException("Stream closed");
        }
        if (n <= 0) {
          return 0;
        }
        int unread = getUnreadLength();
        if (unread < n) {
          n = unread;
        }
        seek(getOffset() + n);
        return n;
      }

      @Override
      public int available() throws IOException {
        if (closed) {
          throw new IOException("Stream closed");
        }
        return getUnreadLength();
      }

      @Override
      public void close() {
        closed = true;
      }
    };
  }

  /**
   * Implemented as calls to {@code write(byte[],int,int)}.  Closing the stream does
   * not close this buffer.
   *
   * @see  #write(byte[], int, int)
   */
  @Override
  public OutputStream getOutputStream() throws IOException {
    return new OutputStream() {
      private boolean closed = false;

      @Override
      public void write(int b) throws IOException {
        if (closed) {
          throw new IOException("Stream closed");
        }
        AbstractSeekableBuffer.this.write(new byte[]{(byte) b}, 0, 1);
      }

      @Override
      public void write(byte[] b, int off, int len) throws IOException {
        if (closed) {
          throw new IOException("Stream closed");
        }
        AbstractSeekableBuffer.this.write(b, off, len);
      }

      @Override
      public void close() {
        closed = true;
      }
    };
  }
}
