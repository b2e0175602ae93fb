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

/**
 * Thrown when a transaction is committed or rolled back while none is in progress.
 *
 * @author  AO Industries, Inc.
 */
public class NoActiveTransactionException extends IllegalStateException {

  private static final long serialVersionUID = 1L;

  public NoActiveTransactionException(String message) {
    super(message);
  }
}
