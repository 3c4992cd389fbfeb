package io.harvest.financial.symbols;

import java.io.IOException;
import java.net.URI;

@FunctionalInterface
public interface PageFetcher {
    String fetch(URI uri) throws IOException, InterruptedException;
}
