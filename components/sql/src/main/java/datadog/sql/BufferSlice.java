package datadog.sql;

/**
 * A half-open range of byte offsets into the UTF-8 buffer of a {@link TokenizedSql}. Slices
 * produced by the {@link SqlLexer} always start and end on character boundaries. The slice of a
 * quoted token is empty for {@code ''} or a quote left open at the end of the statement.
 */
public final class BufferSlice {
  public final int start;
  public final int end;

  public BufferSlice(int start, int end) {
    this.start = start;
    this.end = end;
  }

  /** @return The number of bytes covered, {@code 0} for an inverted slice. */
  public int length() {
    return Math.max(0, this.end - this.start);
  }

  /**
   * Checks whether the slice can be resolved against a buffer.
   *
   * @param bufferLength The length of the buffer in bytes.
   * @return {@code true} if the slice is not inverted and lies within the buffer.
   */
  public boolean isWithin(int bufferLength) {
    return this.start >= 0 && this.start <= this.end && this.end <= bufferLength;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof BufferSlice)) {
      return false;
    }
    BufferSlice that = (BufferSlice) o;
    return this.start == that.start && this.end == that.end;
  }

  @Override
  public int hashCode() {
    return 31 * this.start + this.end;
  }

  @Override
  public String toString() {
    return "[" + this.start + ", " + this.end + ")";
  }
}
