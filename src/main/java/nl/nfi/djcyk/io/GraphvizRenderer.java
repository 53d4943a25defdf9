package nl.nfi.djcyk.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.charset.StandardCharsets.UTF_8;

// renders DOT sources through the external Graphviz 'dot' executable
public final class GraphvizRenderer {

    private static final Logger LOG = LoggerFactory.getLogger(GraphvizRenderer.class);

    private final String executable;

    private GraphvizRenderer(final String executable) {
        this.executable = executable;
    }

    public static GraphvizRenderer onPath() {
        return new GraphvizRenderer("dot");
    }

    public static GraphvizRenderer using(final String executable) {
        return new GraphvizRenderer(executable);
    }

    public boolean isAvailable() {
        try {
            final Process process = new ProcessBuilder(executable, "-V").redirectErrorStream(true).start();
            process.getInputStream().readAllBytes();
            return process.waitFor() == 0;
        } catch (final IOException e) {
            LOG.debug("Graphviz executable not available: {}", executable, e);
            return false;
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // output of 'dot' goes to a temporary file, so a chatty process never blocks on a full pipe
    // while its input is still being written
    public void renderPng(final String dot, final Path output) throws IOException, InterruptedException {
        LOG.debug("Rendering PNG to {}", output);

        final Path messages = Files.createTempFile("dj-cyk-graphviz", ".log");
        try {
            final Process process;
            try {
                process = new ProcessBuilder(executable, "-Tpng", "-o", output.toString())
                        .redirectErrorStream(true)
                        .redirectOutput(messages.toFile())
                        .start();
            } catch (final IOException e) {
                throw new IOException("Could not invoke Graphviz (%s), make sure it is installed and on the PATH".formatted(executable), e);
            }

            IOException writeFailure = null;
            try (final OutputStream input = process.getOutputStream()) {
                input.write(dot.getBytes(UTF_8));
            } catch (final IOException e) {
                // the process closed its input early, its exit code tells why
                writeFailure = e;
            }

            final int exitCode = process.waitFor();
            if (exitCode != 0) {
                final IOException failure = new IOException("Graphviz exited with code %d: %s".formatted(exitCode, Files.readString(messages, UTF_8).strip()));
                if (writeFailure != null) {
                    failure.addSuppressed(writeFailure);
                }
                throw failure;
            }
            if (writeFailure != null) {
                throw writeFailure;
            }
        } finally {
            Files.deleteIfExists(messages);
        }
    }
}
