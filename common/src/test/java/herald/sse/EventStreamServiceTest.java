package herald.sse;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import herald.api.request.SubscribeRequest;
import herald.common.configuration.SseProperties;
import herald.subscription.DuplicateSubscriptionException;
import herald.subscription.Subscription;
import herald.subscription.SubscriptionClosedException;
import herald.subscription.SubscriptionRegistry;

public class EventStreamServiceTest {

    private SubscriptionRegistry registry;
    private EventStreamService service;

    @Before
    public void setup() {
        registry = new SubscriptionRegistry();
        service = new EventStreamService(registry, 1, TimeUnit.HOURS, 1000);
    }

    @After
    public void tearDown() {
        service.stop();
    }

    private static String text(byte[] frame) {
        return new String(frame, StandardCharsets.UTF_8);
    }

    @Test
    public void testSendToChannel() throws Exception {
        Subscription one = service.subscribe(new SubscribeRequest("1")).get();
        Subscription two = service.subscribe(new SubscribeRequest("2")).get();
        Assert.assertEquals(1, service.send("hello", "1", "7", "msg", 100));
        Assert.assertEquals("id: 7\r\nevent: msg\r\ndata: hello\r\nretry: 100\r\n\r\n", text(registry.receive(one.getSubscriberId())));
        Assert.assertEquals(0, registry.pending(two.getSubscriberId()));
        Assert.assertEquals(2, service.send("all"));
    }

    @Test
    public void testSendAsyncKeepsOrder() throws Exception {
        service.start();
        Subscription subscription = service.subscribe(new SubscribeRequest(null)).get();
        CompletableFuture<Integer> last = null;
        for (int i = 0; i < 20; i++) {
            last = service.sendAsync(Integer.toString(i), null, null, null, null);
        }
        Assert.assertEquals(Integer.valueOf(1), last.get(5, TimeUnit.SECONDS));
        for (int i = 0; i < 20; i++) {
            Assert.assertEquals("data: " + i + "\r\n\r\n", text(registry.receive(subscription.getSubscriberId())));
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testSendAsyncRequiresStart() throws Exception {
        service.sendAsync("x", null, null, null, null);
    }

    @Test
    public void testDuplicateSubscribeFails() throws Exception {
        service.subscribe(new SubscribeRequest("1")).get();
        try {
            service.subscribe(new SubscribeRequest("1")).get();
            Assert.fail("expected duplicate failure");
        } catch (ExecutionException e) {
            Assert.assertTrue(e.getCause() instanceof DuplicateSubscriptionException);
        }
        Assert.assertEquals(1, registry.size());
    }

    @Test
    public void testHookRejectionPreventsRegister() throws Exception {
        service.setBeforeSubscribeHook(request -> {
            throw new SecurityException("denied");
        });
        CompletableFuture<Subscription> future = service.subscribe(new SubscribeRequest("1"));
        Assert.assertTrue(future.isCompletedExceptionally());
        Assert.assertEquals(0, registry.size());
    }

    @Test
    public void testAsyncHookFailurePreventsRegister() throws Exception {
        CompletableFuture<Void> gate = new CompletableFuture<>();
        service.setBeforeSubscribeHook(request -> gate);
        CompletableFuture<Subscription> future = service.subscribe(new SubscribeRequest("1"));
        Assert.assertFalse(future.isDone());
        Assert.assertEquals(0, registry.size());
        gate.completeExceptionally(new SecurityException("denied"));
        try {
            future.get(5, TimeUnit.SECONDS);
            Assert.fail("expected hook failure");
        } catch (ExecutionException e) {
            Assert.assertTrue(e.getCause() instanceof SecurityException);
        }
        Assert.assertEquals(0, registry.size());
    }

    @Test
    public void testHookSeesRequest() throws Exception {
        AtomicReference<SubscribeRequest> seen = new AtomicReference<>();
        service.setBeforeSubscribeHook(request -> {
            seen.set(request);
            return CompletableFuture.completedFuture(null);
        });
        SubscribeRequest request = new SubscribeRequest("abc");
        Subscription subscription = service.subscribe(request).get(5, TimeUnit.SECONDS);
        Assert.assertSame(request, seen.get());
        Assert.assertEquals("abc", subscription.getSubscriberId());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullHookRejected() throws Exception {
        service.setBeforeSubscribeHook(null);
    }

    @Test
    public void testStartAndStop() throws Exception {
        Subscription subscription = service.subscribe(new SubscribeRequest(null)).get();
        service.start();
        Assert.assertTrue(service.isStarted());
        Assert.assertTrue(service.isKeepAliveRunning());
        service.stop();
        Assert.assertFalse(service.isStarted());
        Assert.assertFalse(service.isKeepAliveRunning());
        try {
            registry.receive(subscription.getSubscriberId());
            Assert.fail("expected close");
        } catch (SubscriptionClosedException e) {
            Assert.assertEquals(0, registry.size());
        }
    }

    @Test
    public void testPropertiesConstructor() throws Exception {
        SseProperties properties = new SseProperties();
        EventStreamService fromProperties = new EventStreamService(registry, properties);
        Assert.assertSame(registry, fromProperties.getRegistry());
        Assert.assertNull(fromProperties.getBeforeSubscribeHook());
    }
}
