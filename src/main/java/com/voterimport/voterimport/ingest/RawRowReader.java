package com.voterimport.voterimport.ingest;

import java.util.List;
import java.util.stream.Stream;

/**
 * Forward-only source of raw rows. Rows are produced lazily; the stream may be consumed once.
 */
public interface RawRowReader extends AutoCloseable {

    List<String> headers();

    Stream<RawRow> rows();

    /**
     * Field delimiter of the source, or {@code null} for formats without one.
     */
    String delimiter();

    @Override
    void close();
}
