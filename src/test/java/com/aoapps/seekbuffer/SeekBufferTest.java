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

import com.aoapps.lang.io.IoUtils;
import com.aoapps.tempfiles.TempFile;
import com.aoapps.tempfiles.TempFileContext;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Random;
import junit.framework.Test;
import junit.framework.TestCase;
import junit.framework.TestSuite;

/**
 * Tests the <code>SeekBuffer</code> class.
 *
 * @author  AO Industries, Inc.
 */
public class SeekBufferTest extends TestCase {

  private static final int ITERATIONS = 1000;

  /**
   * A fast pseudo-random number generator for non-cryptographic purposes.
   */
  private static final Random fastRandom = new Random(IoUtils.bufferToLong(new SecureRandom().generateSeed(Long.BYTES)));

  public static Test suite() {
    TestSuite suite = new TestSuite(SeekBufferTest.class);
    return suite;
  }

  public SeekBufferTest(String testName) {
    super(testName);
  }

  static byte[] bytes(String s) {
    return s.getBytes(StandardCharsets.UTF_8);
  }

  static String string(byte[] b) {
    return new String(b, StandardCharsets.UTF_8);
  }

  public void testEmptyBuffer() throws Exception {
    SeekBuffer buffer = new SeekBuffer();
    assertEquals(0, buffer.getContentLength());
    assertEquals(0, buffer.getOffset());
    assertEquals(0, buffer.getUnreadLength());
    assertEquals(-1, buffer.read(new byte[4]));
    assertEquals(0, buffer.readUntil((byte) '\n').length);
  }

  public void testConstructorCopiesSource() throws Exception {
    byte[] src = {1, 2, 3};
    SeekBuffer buffer = new SeekBuffer(src);
    src[0] = 9;
    assertTrue(Arrays.equals(new byte[]{1, 2, 3}, buffer.getContent()));
    assertEquals(0, buffer.getOffset());
  }

  public void testWriteAppendsWithoutMovingOffset() throws Exception {
    SeekBuffer buffer = new SeekBuffer(bytes("Hello"));
    buffer.seek(2);
    assertEquals(5, buffer.write(bytes(", Wor")));
    buffer.append(bytes("ld!"));
    assertEquals("Hello, World!", string(buffer.getContent()));
    assertEquals(2, buffer.getOffset());
    assertEquals(11, buffer.getUnreadLength());
  }

  public void testWriteRange() throws Exception {
    SeekBuffer buffer = new SeekBuffer();
    assertEquals(3, buffer.write(bytes("abcdef"), 1, 3));
    buffer.append(bytes("xyz"), 2, 1);
    assertEquals("bcdz", string(buffer.getContent()));
  }

  public void testWriteGrowsPastInitialCapacity() throws Exception {
    SeekBuffer buffer = new SeekBuffer(1);
    byte[] expected = new byte[10000];
    fastRandom.nextBytes(expected);
    for (int i = 0; i < expected.length; i += 100) {
      buffer.write(expected, i, 100);
    }
    assertTrue(Arrays.equals(expected, buffer.getContent()));
  }

  public void testShortRead() throws Exception {
    SeekBuffer buffer = new SeekBuffer(bytes("ABC"));
    byte[] dst = new byte[10];
    assertEquals(3, buffer.read(dst));
    assertEquals("ABC", new String(dst, 0, 3, StandardCharsets.UTF_8));
    assertEquals(3, buffer.getOffset());
    assertEquals(-1, buffer.read(dst));
  }

  public void testReadRepeatAndRewind() throws Exception {
    SeekBuffer buffer = new SeekBuffer();
    buffer.append(new byte[]{1, 2, 3, 4, 5, 6, 7, 8, 9});
    byte[] dst = new byte[2];
    assertEquals(2, buffer.read(dst));
    assertEquals(2, buffer.getOffset());
    byte[] dst2 = new byte[3];
    assertEquals(3, buffer.read(dst2));
    assertEquals(5, buffer.getOffset());
    assertTrue(Arrays.equals(new byte[]{3, 4, 5}, dst2));
    buffer.rewind();
    assertEquals(0, buffer.getOffset());
    assertEquals(2, buffer.read(dst));
    assertTrue(Arrays.equals(new byte[]{1, 2}, dst));
  }

  public void testEndOfDataIsRepeatedUntilAppend() throws Exception {
    SeekBuffer buffer = new SeekBuffer(bytes("xy"));
    byte[] dst = new byte[8];
    assertEquals(2, buffer.read(dst));
    for (int i = 0; i < 10; i++) {
      assertEquals(-1, buffer.read(dst));
      assertEquals(2, buffer.getOffset());
    }
    buffer.append(bytes("z"));
    assertEquals(1, buffer.read(dst));
    assertEquals('z', dst[0]);
  }

  public void testReadMatchesContentAfterRandomSeeks() throws Exception {
    byte[] content = new byte[4096];
    fastRandom.nextBytes(content);
    SeekBuffer buffer = new SeekBuffer(content);
    byte[] dst = new byte[64];
    for (int i = 0; i < ITERATIONS; i++) {
      int position = fastRandom.nextInt(content.length + 1);
      buffer.seek(position);
      int count = buffer.read(dst, 0, 1 + fastRandom.nextInt(dst.length));
      if (position == content.length) {
        assertEquals(-1, count);
        assertEquals(position, buffer.getOffset());
      } else {
        assertTrue(count > 0);
        assertTrue(Arrays.equals(Arrays.copyOfRange(content, position, position + count), Arrays.copyOf(dst, count)));
        assertEquals(position + count, buffer.getOffset());
      }
    }
  }

  public void testSeekPastEnd() throws Exception {
    SeekBuffer buffer = new SeekBuffer(bytes("0123456789"));
    buffer.seek(100);
    assertEquals(100, buffer.getOffset());
    assertEquals(0, buffer.getUnreadLength());
    assertEquals(-1, buffer.read(new byte[1]));
    assertEquals(0, buffer.readUntil((byte) '5').length);
    buffer.seek(5);
    byte[] dst = new byte[3];
    assertEquals(3, buffer.read(dst));
    assertEquals("567", string(dst));
  }

  public void testSeekNegativeRejected() throws Exception {
    SeekBuffer buffer = new SeekBuffer(bytes("abc"));
    buffer.seek(1);
    try {
      buffer.seek(-1);
      fail("IllegalArgumentException expected");
    } catch (IllegalArgumentException e) {
      // Expected
    }
    assertEquals(1, buffer.getOffset());
  }

  public void testReadRangeChecked() throws Exception {
    SeekBuffer buffer = new SeekBuffer(bytes("abc"));
    try {
      buffer.read(new byte[2], 1, 2);
      fail("IndexOutOfBoundsException expected");
    } catch (IndexOutOfBoundsException e) {
      // Expected
    }
    assertEquals(0, buffer.getOffset());
  }

  public void testReadUntil() throws Exception {
    SeekBuffer buffer = new SeekBuffer(bytes("line one\nline two\nrest"));
    assertEquals("line one\n", string(buffer.readUntil((byte) '\n')));
    assertEquals(9, buffer.getOffset());
    assertEquals("line two\n", string(buffer.readUntil((byte) '\n')));
    byte[] rest = buffer.readUntil((byte) '\n');
    assertEquals("rest", string(rest));
    assertEquals(22, buffer.getOffset());
    assertEquals(0, buffer.readUntil((byte) '\n').length);
  }

  public void testReadUntilIgnoresUnusedCapacity() throws Exception {
    // Unused capacity holds zeros, which must not be found as a delimiter
    SeekBuffer buffer = new SeekBuffer(1024);
    buffer.write(new byte[]{1, 2, 3});
    byte[] result = buffer.readUntil((byte) 0);
    assertTrue(Arrays.equals(new byte[]{1, 2, 3}, result));
    assertEquals(3, buffer.getOffset());
  }

  public void testGetContentIsSnapshot() throws Exception {
    SeekBuffer buffer = new SeekBuffer(bytes("abc"));
    buffer.seek(2);
    byte[] content = buffer.getContent();
    content[0] = 'z';
    assertEquals("abc", string(buffer.getContent()));
  }

  public void testClear() throws Exception {
    SeekBuffer buffer = new SeekBuffer(bytes("abc"));
    buffer.seek(2);
    buffer.clear();
    assertEquals(0, buffer.getContentLength());
    assertEquals(0, buffer.getOffset());
    assertFalse(buffer.isClosed());
    buffer.write(bytes("new"));
    assertEquals("new", string(buffer.getContent()));
  }

  public void testClose() throws Exception {
    SeekBuffer buffer = new SeekBuffer(bytes("abc"));
    buffer.close();
    assertTrue(buffer.isClosed());
    buffer.close();
    try {
      buffer.write(bytes("x"));
      fail("IOException expected");
    } catch (IOException e) {
      assertEquals("SeekBuffer closed", e.getMessage());
    }
  }

  public void testStreams() throws Exception {
    SeekBuffer buffer = new SeekBuffer();
    try (OutputStream out = buffer.getOutputStream()) {
      out.write('a');
      out.write(bytes("bcdef"));
    }
    assertEquals("abcdef", string(buffer.getContent()));
    try (InputStream in = buffer.getInputStream()) {
      assertEquals('a', in.read());
      assertEquals(2, in.skip(2));
      assertEquals(3, in.available());
      byte[] dst = new byte[10];
      assertEquals(3, in.read(dst, 0, dst.length));
      assertEquals("def", new String(dst, 0, 3, StandardCharsets.UTF_8));
      assertEquals(-1, in.read());
    }
    assertEquals(6, buffer.getOffset());
  }

  public void testSaveAndLoadFile() throws Exception {
    try (
      TempFileContext tempFileContext = new TempFileContext();
      TempFile tempFile = tempFileContext.createTempFile("SeekBufferTest_")
    ) {
      File file = tempFile.getFile();
      SeekBuffer original = new SeekBuffer(new byte[]{1, 2, 3, 4, 5, 6, 7, 8, 9, 10});
      original.seek(5);
      original.saveToFile(file);
      assertTrue(Arrays.equals(original.getContent(), Files.readAllBytes(file.toPath())));

      SeekBuffer loaded = new SeekBuffer(bytes("replaced"));
      loaded.seek(3);
      loaded.loadFromFile(file);
      assertTrue(Arrays.equals(original.getContent(), loaded.getContent()));
      assertEquals(0, loaded.getOffset());

      SeekBuffer fromFile = SeekBuffer.fromFile(file);
      assertTrue(Arrays.equals(original.getContent(), fromFile.getContent()));
    }
  }

  public void testLoadLargeFile() throws Exception {
    try (
      TempFileContext tempFileContext = new TempFileContext();
      TempFile tempFile = tempFileContext.createTempFile("SeekBufferTest_")
    ) {
      byte[] expected = new byte[100000];
      fastRandom.nextBytes(expected);
      Files.write(tempFile.getFile().toPath(), expected);
      assertTrue(Arrays.equals(expected, SeekBuffer.fromFile(tempFile.getFile()).getContent()));
    }
  }

  public void testLoadMissingFile() throws Exception {
    try (TempFileContext tempFileContext = new TempFileContext()) {
      File missing;
      try (TempFile tempFile = tempFileContext.createTempFile("SeekBufferTest_")) {
        missing = tempFile.getFile();
      }
      Files.deleteIfExists(missing.toPath());
      SeekBuffer buffer = new SeekBuffer(bytes("kept"));
      try {
        buffer.loadFromFile(missing);
        fail("FileNotFoundException expected");
      } catch (FileNotFoundException e) {
        // Expected
      }
      assertEquals("kept", string(buffer.getContent()));
      try {
        SeekBuffer.fromFile(missing);
        fail("FileNotFoundException expected");
      } catch (FileNotFoundException e) {
        // Expected
      }
    }
  }

  public void testMixedSaveAndAppend() throws Exception {
    try (
      TempFileContext tempFileContext = new TempFileContext();
      TempFile tempFile = tempFileContext.createTempFile("SeekBufferTest_")
    ) {
      File file = tempFile.getFile();
      new SeekBuffer(bytes("Initial")).saveToFile(file);
      new SeekBuffer(bytes(" + Appended")).appendToFile(file);
      assertEquals("Initial + Appended", string(Files.readAllBytes(file.toPath())));
      new SeekBuffer(bytes("Replaced")).saveToFile(file);
      new SeekBuffer(bytes(" + More")).appendToFile(file);
      assertEquals("Replaced + More", string(Files.readAllBytes(file.toPath())));
    }
  }

  public void testAppendToNewFile() throws Exception {
    try (TempFileContext tempFileContext = new TempFileContext()) {
      File file;
      try (TempFile tempFile = tempFileContext.createTempFile("SeekBufferTest_")) {
        file = tempFile.getFile();
      }
      Files.deleteIfExists(file.toPath());
      assertFalse(file.exists());
      try {
        new SeekBuffer(bytes("New file content")).appendToFile(file);
        assertEquals("New file content", string(Files.readAllBytes(file.toPath())));
      } finally {
        Files.deleteIfExists(file.toPath());
      }
    }
  }

  public void testAppendUnreadToFile() throws Exception {
    try (
      TempFileContext tempFileContext = new TempFileContext();
      TempFile tempFile = tempFileContext.createTempFile("SeekBufferTest_")
    ) {
      File file = tempFile.getFile();
      new SeekBuffer(bytes("Start: ")).saveToFile(file);

      SeekBuffer buffer = new SeekBuffer(bytes("SKIP_THIS_PART|Include this part"));
      buffer.seek(15);
      buffer.appendUnreadToFile(file);
      assertEquals("Start: Include this part", string(Files.readAllBytes(file.toPath())));
      assertEquals(15, buffer.getOffset());

      // Nothing unread, nothing appended
      buffer.seek(buffer.getContentLength());
      buffer.appendUnreadToFile(file);
      buffer.seek(1000);
      buffer.appendUnreadToFile(file);
      assertEquals("Start: Include this part", string(Files.readAllBytes(file.toPath())));
    }
  }
}
