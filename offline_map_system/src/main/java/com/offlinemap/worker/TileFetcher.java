package com.offlinemap.worker;

import java.io.IOException;

/**
 * Fetches one tile image by URL. Anything but a successful response is an IOException.
 */
@FunctionalInterface
public interface TileFetcher {

    byte[] fetch(String url) throws IOException;
}
