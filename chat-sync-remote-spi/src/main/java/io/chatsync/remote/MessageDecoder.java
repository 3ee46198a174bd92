package io.chatsync.remote;

import io.chatsync.core.Message;

/**
 * Turns backend rows into {@link Message} values.
 *
 * <p>Implementations are discovered with {@link java.util.ServiceLoader}, see {@link MessageDecoders}.
 */
public interface MessageDecoder {

    /**
     * @throws MessageDecodeException if a required column is missing or malformed
     */
    Message decode(RawMessage raw) throws MessageDecodeException;
}
