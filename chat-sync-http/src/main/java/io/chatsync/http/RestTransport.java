package io.chatsync.http;

import java.io.InputStream;

/**
 * HTTP seam of the REST and SSE adapters.
 */
public interface RestTransport {
    TransportResponse<byte[]> sendBytes(TransportRequest request) throws Exception;

    /**
     * Sends a request and returns the body as an open stream. The caller closes it.
     */
    TransportResponse<InputStream> sendStream(TransportRequest request) throws Exception;
}
