package io.chatsync.remote;

/**
 * Supplies the signed-in user.
 */
@FunctionalInterface
public interface SessionProvider {

    /**
     * @return the current user id, or {@code null} when nobody is signed in
     */
    String currentUserId();
}
