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

/**
 * A set of static utility methods to help in the creation and wrapping of
 * seekable buffers.
 *
 * @author  AO Industries, Inc.
 */
public final class SeekableBuffers {

  /** Make no instances. */
  private SeekableBuffers() {
    throw new AssertionError();
  }

  /**
   * Gets a thread-safe view of the provided buffer.  Every call holds a single lock for
   * its duration; there is no atomicity across calls, so a seek followed by a read from
   * another thread may interleave.  The wrapped buffer must not be used directly
   * afterwards.
   */
  public static SeekableBuffer synchronizedBuffer(SeekableBuffer buffer) {
    if (buffer instanceof SynchronizedBuffer) {
      return buffer;
    }
    return new SynchronizedBuffer(buffer);
  }

  private static final class SynchronizedBuffer extends AbstractSeekableBuffer {

    private final SeekableBuffer wrapped;
    private final Object lock = new Object();

    private SynchronizedBuffer(SeekableBuffer wrapped) {
      this.wrapped = wrapped;
    }

    @Override
    public boolean isClosed() {
      synchronized (lock) {
        return wrapped.isClosed();
      }
    }

    @Override
    public void close() throws IOException {
      synchronized (lock) {
        wrapped.close();
      }
    }

    @Override
    public int write(byte[] buff, int off, int len) throws IOException {
      synchronized (lock) {
        return wrapped.write(buff, off, len);
      }
    }

    @Override
    public void append(byte[] buff, int off, int len) throws IOException {
      synchronized (lock) {
        wrapped.append(buff, off, len);
      }
    }

    @Override
    public int read(byte[] buff, int off, int len) throws IOException {
      synchronized (lock) {
        return wrapped.read(buff, off, len);
      }
    }

    @Override
    public byte[] readUntil(byte delimiter) throws IOException {
      synchronized (lock) {
        return wrapped.readUntil(delimiter);
      }
    }

    @Override
    public void seek(long offset) throws IOException {
      synchronized (lock) {
        wrapped.seek(offset);
      }
    }

    @Override
    public void rewind() throws IOException {
      synchronized (lock) {
        wrapped.rewind();
      }
    }

    @Override
    public long getOffset() throws IOException {
      synchronized (lock) {
        return wrapped.getOffset();
      }
    }

    @Override
    public int getUnreadLength() throws IOException {
      synchronized (lock) {
        return wrapped.getUnreadLength();
      }
    }

    @Override
    public int getContentLength() throws IOException {
      synchronized (lock) {
        return wrapped.getContentLength();
      }
    }

    @Override
    public byte[] getContent() throws IOException {
      synchronized (lock) {
        return wrapped.getContent();
      }
    }

    @Override
    public void clear() throws IOException {
      synchronized (lock) {
        wrapped.clear();
      }
    }
  }
}
