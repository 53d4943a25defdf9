package nl.nfi.djcyk.cyk;

// tokens[start, start + length)
public record Span(int start, int length) {

    public Span {
        if (start < 0 || length < 1) {
            throw new IllegalArgumentException("Invalid span: start %d, length %d".formatted(start, length));
        }
    }

    public static Span of(final int start, final int length) {
        return new Span(start, length);
    }

    public int end() {
        return start + length;
    }

    public Span left(final int split) {
        return new Span(start, split);
    }

    public Span right(final int split) {
        return new Span(start + split, length - split);
    }
}
