package io.chatsync.remote;

import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * {@link MessageDecoder} lookup backed by {@link ServiceLoader}.
 */
public final class MessageDecoders {
    private MessageDecoders() {}

    public static Optional<MessageDecoder> find(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        Iterator<MessageDecoder> it = ServiceLoader.load(MessageDecoder.class, cl).iterator();
        return it.hasNext() ? Optional.of(it.next()) : Optional.empty();
    }

    /**
     * Returns the first decoder installed on the context class loader.
     *
     * @throws IllegalStateException if no decoder module is on the class path
     */
    public static MessageDecoder load() {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) cl = MessageDecoders.class.getClassLoader();
        return find(cl).orElseThrow(() ->
                new IllegalStateException("no MessageDecoder installed; add chat-sync-json-jackson or pass a decoder"));
    }
}
