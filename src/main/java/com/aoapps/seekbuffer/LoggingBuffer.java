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
import java.math.BigDecimal;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.lang3.StringUtils;

/**
 * Wraps any {@link SeekableBuffer} and logs every operation along with how long it
 * took.  Operations are forwarded unchanged.  Messages are prefixed with the buffer
 * name in brackets and logged at a configurable level, {@link Level#FINE} by default.
 * Failures are logged at {@link Level#WARNING} and rethrown.
 *
 * <p>This class is not thread safe.</p>
 *
 * @author  AO Industries, Inc.
 */
public class LoggingBuffer extends AbstractSeekableBuffer {

  /**
   * The name used when none is provided.
   */
  public static final String DEFAULT_NAME = "SeekBuffer";

  private static final Logger defaultLogger = Logger.getLogger(LoggingBuffer.class.getName());

  private final SeekableBuffer wrapped;
  private Logger logger;
  private String name;
  private Level level;

  /**
   * Logs to this class' logger with the default name at {@link Level#FINE}.
   */
  public LoggingBuffer(SeekableBuffer wrapped) {
    this(wrapped, null, null, Level.FINE);
  }

  /**
   * Logs at {@link Level#FINE}.
   */
  public LoggingBuffer(SeekableBuffer wrapped, Logger logger, String name) {
    this(wrapped, logger, name, Level.FINE);
  }

  /**
   * @param logger  the logger to use, or {@code null} for this class' logger
   * @param name    the message prefix, or {@code null} or empty for {@link #DEFAULT_NAME}
   */
  public LoggingBuffer(SeekableBuffer wrapped, Logger logger, String name, Level level) {
    this.wrapped = wrapped;
    this.logger = logger == null ? defaultLogger : logger;
    this.name = StringUtils.defaultIfEmpty(name, DEFAULT_NAME);
    this.level = level;
  }

  public Logger getLogger() {
    return logger;
  }

  /**
   * Changes the logger, ignoring {@code null}.
   */
  public void setLogger(Logger logger) {
    if (logger != null) {
      this.logger = logger;
    }
  }

  public String getName() {
    return name;
  }

  /**
   * Changes the message prefix, ignoring {@code null} or empty.
   */
  public void setName(String name) {
    if (StringUtils.isNotEmpty(name)) {
      this.name = name;
    }
  }

  public Level getLevel() {
    return level;
  }

  public void setLevel(Level level) {
    this.level = level;
  }

  private static String elapsed(long startNanos) {
    return BigDecimal.valueOf(System.nanoTime() - startNanos, 6).toPlainString() + " ms";
  }

  private void logSuccess(String message, long startNanos) {
    if (logger.isLoggable(level)) {
      logger.log(level, "[" + name + "] " + message + ", duration: " + elapsed(startNanos));
    }
  }

  private void logFailure(String operation, long startNanos, Exception e) {
    if (logger.isLoggable(Level.WARNING)) {
      logger.log(Level.WARNING, "[" + name + "] " + operation + ": error: " + e + ", duration: " + elapsed(startNanos), e);
    }
  }

  private static String toHex(byte delimiter) {
    return String.format("0x%02x", delimiter & 0xff);
  }

  /**
   * Logs the total, read and unread byte counts of the wrapped buffer.
   */
  public void logSummary() throws IOException {
    int total = wrapped.getContentLength();
    int unread = wrapped.getUnreadLength();
    log("Summary: total=" + total + " bytes, read=" + (total - unread) + " bytes, unread=" + unread + " bytes");
  }

  /**
   * Logs a message prefixed with the buffer name.
   */
  public void log(String message) {
    logger.log(level, "[" + name + "] " + message);
  }

  @Override
  public boolean isClosed() {
    return wrapped.isClosed();
  }

  @Override
  public void close() throws IOException {
    long startNanos = System.nanoTime();
    try {
      wrapped.close();
    } catch (IOException | RuntimeException e) {
      logFailure("Close", startNanos, e);
      throw e;
    }
    logSuccess("Close: success", startNanos);
  }

  @Override
  public int write(byte[] buff, int off, int len) throws IOException {
    long startNanos = System.nanoTime();
    int count;
    try {
      count = wrapped.write(buff, off, len);
    } catch (IOException | RuntimeException e) {
      logFailure("Write", startNanos, e);
      throw e;
    }
    logSuccess("Write: " + count + " bytes", startNanos);
    return count;
  }

  @Override
  public void append(byte[] buff, int off, int len) throws IOException {
    long startNanos = System.nanoTime();
    try {
      wrapped.append(buff, off, len);
    } catch (IOException | RuntimeException e) {
      logFailure("Append", startNanos, e);
      throw e;
    }
    logSuccess("Append: " + len + " bytes", startNanos);
  }

  @Override
  public int read(byte[] buff, int off, int len) throws IOException {
    long startNanos = System.nanoTime();
    int count;
    try {
      count = wrapped.read(buff, off, len);
    } catch (IOException | RuntimeException e) {
      logFailure("Read", startNanos, e);
      throw e;
    }
    logSuccess(count == -1 ? "Read: 0 bytes, EOF" : ("Read: " + count + " bytes"), startNanos);
    return count;
  }

  @Override
  public byte[] readUntil(byte delimiter) throws IOException {
    long startNanos = System.nanoTime();
    byte[] result;
    try {
      result = wrapped.readUntil(delimiter);
    } catch (IOException | RuntimeException e) {
      logFailure("ReadUntil", startNanos, e);
      throw e;
    }
    boolean found = result.length > 0 && result[result.length - 1] == delimiter;
    logSuccess(
      "ReadUntil: delimiter=" + toHex(delimiter) + ", read " + result.length + " bytes" + (found ? "" : ", EOF"),
      startNanos
    );
    return result;
  }

  @Override
  public void seek(long offset) throws IOException {
    long startNanos = System.nanoTime();
    try {
      wrapped.seek(offset);
    } catch (IOException | RuntimeException e) {
      logFailure("Seek", startNanos, e);
      throw e;
    }
    logSuccess("Seek: moved to offset " + offset, startNanos);
  }

  @Override
  public void rewind() throws IOException {
    long startNanos = System.nanoTime();
    try {
      wrapped.rewind();
    } catch (IOException | RuntimeException e) {
      logFailure("Rewind", startNanos, e);
      throw e;
    }
    logSuccess("Rewind: offset reset to 0", startNanos);
  }

  @Override
  public long getOffset() throws IOException {
    long startNanos = System.nanoTime();
    long offset;
    try {
      offset = wrapped.getOffset();
    } catch (IOException | RuntimeException e) {
      logFailure("Offset", startNanos, e);
      throw e;
    }
    logSuccess("Offset: " + offset, startNanos);
    return offset;
  }

  @Override
  public int getUnreadLength() throws IOException {
    long startNanos = System.nanoTime();
    int unread;
    try {
      unread = wrapped.getUnreadLength();
    } catch (IOException | RuntimeException e) {
      logFailure("UnreadLength", startNanos, e);
      throw e;
    }
    logSuccess("UnreadLength: " + unread + " unread bytes", startNanos);
    return unread;
  }

  @Override
  public int getContentLength() throws IOException {
    long startNanos = System.nanoTime();
    int length;
    try {
      length = wrapped.getContentLength();
    } catch (IOException | RuntimeException e) {
      logFailure("ContentLength", startNanos, e);
      throw e;
    }
    logSuccess("ContentLength: " + length + " bytes", startNanos);
    return length;
  }

  @Override
  public byte[] getContent() throws IOException {
    long startNanos = System.nanoTime();
    byte[] content;
    try {
      content = wrapped.getContent();
    } catch (IOException | RuntimeException e) {
      logFailure("Content", startNanos, e);
      throw e;
    }
    logSuccess("Content: retrieved " + content.length + " bytes", startNanos);
    return content;
  }

  @Override
  public void clear() throws IOException {
    long startNanos = System.nanoTime();
    try {
      wrapped.clear();
    } catch (IOException | RuntimeException e) {
      logFailure("Clear", startNanos, e);
      throw e;
    }
    logSuccess("Clear: content discarded", startNanos);
  }
}
