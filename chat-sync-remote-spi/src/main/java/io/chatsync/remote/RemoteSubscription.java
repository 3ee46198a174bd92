package io.chatsync.remote;

import java.util.concurrent.Flow;

/**
 * Push-based subscription to rows inserted into one conversation.
 *
 * <p>Each {@link Flow.Publisher#subscribe subscribe} opens one channel. Cancelling the
 * {@link Flow.Subscription} closes it. A transport failure is signalled through
 * {@code onError}; {@code onComplete} means the server closed the channel.
 */
@FunctionalInterface
public interface RemoteSubscription {

    Flow.Publisher<SubscriptionEvent> open(String conversationId);
}
