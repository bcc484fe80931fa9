/*
 * Copyright (c) 2015 LCMS Project Authors.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package net.larse.insights.timeseries;

import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * A failure caught at an algorithm boundary. Results carry one of these next to their
 * fallback output instead of the exception itself.
 */
public final class ComputationError {
  public enum Kind {
    /** The input broke a precondition: null, non-finite, mismatched or out of range. */
    INVALID_INPUT,
    /** Any other failure while computing. */
    NUMERIC_FAILURE
  }

  private final Kind kind;
  private final String message;

  public ComputationError(Kind kind, String message) {
    this.kind = Preconditions.checkNotNull(kind);
    this.message = message == null ? "" : message;
  }

  /** Classifies a caught exception. */
  public static ComputationError from(RuntimeException e) {
    Kind kind = e instanceof IllegalArgumentException || e instanceof NullPointerException
        ? Kind.INVALID_INPUT
        : Kind.NUMERIC_FAILURE;
    String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    return new ComputationError(kind, message);
  }

  public Kind getKind() {
    return kind;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ComputationError)) {
      return false;
    }
    ComputationError that = (ComputationError) o;
    return kind == that.kind && message.equals(that.message);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, message);
  }

  @Override
  public String toString() {
    return kind + ": " + message;
  }
}
