package com.pagerwatch.service.ingest;

import java.io.IOException;
import java.io.InputStream;

public interface DecoderSource extends AutoCloseable {
    /**
     * Opens the decoder output. Failure here is a startup error.
     */
    InputStream open() throws IOException;

    String describe();

    @Override
    void close();
}
