package herald.sse;

import java.util.concurrent.CompletionStage;

import herald.api.request.SubscribeRequest;

/**
 * Runs before a subscriber is registered, e.g. to authorize the request. Throwing, or completing the returned stage exceptionally, rejects the
 * request and no subscription is created. A {@link herald.api.response.HeraldException} failure carries the status code returned to the client.
 */
@FunctionalInterface
public interface SubscribeHook {

    CompletionStage<Void> beforeSubscribe(SubscribeRequest request) throws Exception;
}
