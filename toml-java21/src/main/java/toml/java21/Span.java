package toml.java21;

/// Half-open range `[start, end)` of char offsets into a TOML source.
public record Span(int start, int end) {

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    /// @return true if `offset` lies inside this span
    public boolean contains(int offset) {
        return start <= offset && offset < end;
    }

    /// @return true if `other` lies entirely inside this span
    public boolean contains(Span other) {
        return start <= other.start && other.end <= end;
    }

    /// Two spans overlap when either contains the other, or when either one
    /// contains the start or the end of the other.
    public boolean overlaps(Span other) {
        return contains(other)
                || other.contains(this)
                || contains(other.start)
                || contains(other.end)
                || other.contains(start)
                || other.contains(end);
    }

    /// @return the slice of `source` covered by this span
    public String text(String source) {
        return source.substring(start, end);
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
