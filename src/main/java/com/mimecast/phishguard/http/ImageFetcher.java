package com.mimecast.phishguard.http;

import java.io.IOException;

/**
 * Remote image download collaborator.
 */
public interface ImageFetcher {

    /**
     * Downloads a URL.
     *
     * @param url http or https URL.
     * @return Raw bytes.
     * @throws IOException Download failed, was refused or is too large.
     */
    byte[] fetch(String url) throws IOException;
}
