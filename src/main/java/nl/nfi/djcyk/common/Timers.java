package nl.nfi.djcyk.common;

import java.time.Duration;

public final class Timers {

    private Timers() {
    }

    public static <T, X extends Exception> Timed<T> time(final Expression<T, X> expression) throws X {
        final long start = System.nanoTime();
        final T value = expression.evaluate();
        return new Timed<>(value, Duration.ofNanos(System.nanoTime() - start));
    }

    @FunctionalInterface
    public interface Expression<T, X extends Exception> {
        T evaluate() throws X;
    }

    public record Timed<T>(T value, Duration duration) {

        public double seconds() {
            return duration.toNanos() / 1_000_000_000.0;
        }
    }
}
