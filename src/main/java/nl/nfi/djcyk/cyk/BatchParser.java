package nl.nfi.djcyk.cyk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;

// parses many sentences against one shared grammar, results are in input order
public final class BatchParser {

    private static final Logger LOG = LoggerFactory.getLogger(BatchParser.class);

    private final CykParser parser;
    private final int threadCount;

    private BatchParser(final CykParser parser, final int threadCount) {
        this.parser = parser;
        this.threadCount = threadCount;
    }

    public static BatchParser using(final CykParser parser) {
        return new BatchParser(parser, 1);
    }

    public BatchParser threadCount(final int threadCount) {
        if (threadCount < 1) {
            throw new IllegalArgumentException("Thread count must be positive: %d".formatted(threadCount));
        }
        return new BatchParser(parser, threadCount);
    }

    public List<ParseResult> parseAll(final List<List<String>> sentences) throws InterruptedException {
        LOG.info("Parsing {} sentences using {} threads", sentences.size(), threadCount);

        if (threadCount == 1) {
            return sentences.stream().map(parser::parse).toList();
        }

        final ForkJoinPool pool = new ForkJoinPool(threadCount);
        try {
            return pool.submit(() -> sentences.parallelStream().map(parser::parse).toList()).get();
        } catch (final ExecutionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new IllegalStateException("Batch parse failed", e.getCause());
        } finally {
            pool.shutdown();
        }
    }
}
