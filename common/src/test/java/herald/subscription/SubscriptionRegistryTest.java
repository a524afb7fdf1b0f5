package herald.subscription;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

public class SubscriptionRegistryTest {

    private static final byte[] X = "x".getBytes(StandardCharsets.UTF_8);

    private SubscriptionRegistry registry;

    @Before
    public void setup() {
        registry = new SubscriptionRegistry();
    }

    @Test
    public void testRegisterGeneratesDistinctIds() throws Exception {
        String first = registry.register();
        String second = registry.register();
        Assert.assertNotEquals(first, second);
        Assert.assertEquals(2, registry.size());
        Assert.assertEquals(2, registry.channelCount());
    }

    @Test
    public void testExplicitChannelIsSubscriberId() throws Exception {
        Assert.assertEquals("1", registry.register("1"));
        Assert.assertTrue(registry.isRegistered("1"));
        Assert.assertEquals("1", registry.get("1").getChannelId());
    }

    @Test
    public void testBlankChannelIsUnnamed() throws Exception {
        String id = registry.register("  ");
        Assert.assertNotEquals("  ", id);
        Assert.assertEquals(id, registry.get(id).getChannelId());
    }

    @Test
    public void testDuplicateChannelRejected() throws Exception {
        registry.register("1");
        try {
            registry.register("1");
            Assert.fail("expected DuplicateSubscriptionException");
        } catch (DuplicateSubscriptionException e) {
            Assert.assertEquals("1", e.getChannelId());
            Assert.assertEquals(400, e.getCode());
        }
        Assert.assertEquals(1, registry.size());
    }

    @Test
    public void testChannelReusableAfterUnregister() throws Exception {
        registry.register("1");
        Assert.assertTrue(registry.unregister("1"));
        Assert.assertEquals("1", registry.register("1"));
    }

    @Test
    public void testChannelScopedAndUnscopedPublish() throws Exception {
        registry.register("1");
        registry.register("2");

        Assert.assertEquals(1, registry.publish(X, "1"));
        Assert.assertEquals(1, registry.pending("1"));
        Assert.assertEquals(0, registry.pending("2"));

        Assert.assertArrayEquals(X, registry.receive("1"));
        Assert.assertTrue(registry.taskDone("1"));
        Assert.assertEquals(0, registry.pending("1"));

        Assert.assertEquals(2, registry.publish(X));
        Assert.assertEquals(1, registry.pending("1"));
        Assert.assertEquals(1, registry.pending("2"));
    }

    @Test
    public void testUnregisterBySubscriptionKeepsSuccessor() throws Exception {
        Subscription first = registry.subscribe("1");
        Assert.assertTrue(registry.unregister(first));
        Subscription second = registry.subscribe("1");
        Assert.assertFalse(registry.unregister(first));
        Assert.assertFalse(registry.taskDone(first));
        Assert.assertSame(second, registry.get("1"));
        try {
            registry.receive(first);
            Assert.fail("expected SubscriptionClosedException");
        } catch (SubscriptionClosedException e) {
            Assert.assertEquals("1", e.getSubscriberId());
        }
        Assert.assertTrue(registry.unregister(second));
        Assert.assertEquals(0, registry.size());
    }

    @Test
    public void testReceiversGetSeparateCopies() throws Exception {
        registry.register("1");
        registry.register("2");
        registry.publish(X);
        byte[] first = registry.receive("1");
        first[0] = 'y';
        Assert.assertArrayEquals(X, registry.receive("2"));
    }

    @Test
    public void testPublishToUnknownChannel() throws Exception {
        registry.register("1");
        Assert.assertEquals(0, registry.publish(X, "nobody"));
        Assert.assertEquals(0, registry.pending("1"));
    }

    @Test
    public void testUnregisterIsIdempotent() throws Exception {
        String id = registry.register();
        Assert.assertTrue(registry.unregister(id));
        Assert.assertFalse(registry.unregister(id));
        Assert.assertFalse(registry.unregister((String) null));
        Assert.assertEquals(0, registry.size());
        Assert.assertEquals(0, registry.channelCount());
    }

    @Test
    public void testUnregisterWithWrongChannel() throws Exception {
        registry.register("1");
        Assert.assertFalse(registry.unregister("1", "2"));
        Assert.assertTrue(registry.isRegistered("1"));
        Assert.assertTrue(registry.unregister("1", "1"));
    }

    @Test
    public void testSizeTracksRegisterAndUnregister() throws Exception {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            ids.add(registry.register());
        }
        Assert.assertEquals(10, registry.size());
        for (int i = 0; i < 4; i++) {
            registry.unregister(ids.get(i));
        }
        Assert.assertEquals(6, registry.size());
    }

    @Test
    public void testSharedChannels() throws Exception {
        registry = new SubscriptionRegistry(false);
        Subscription first = registry.subscribe("news");
        Subscription second = registry.subscribe("news");
        Assert.assertNotEquals(first.getSubscriberId(), second.getSubscriberId());
        Assert.assertEquals("news", first.getChannelId());
        Assert.assertEquals(1, registry.channelCount());

        Assert.assertEquals(2, registry.publish(X, "news"));

        registry.unregister(first.getSubscriberId());
        Assert.assertEquals(1, registry.channelCount());
        registry.unregister(second.getSubscriberId());
        Assert.assertEquals(0, registry.channelCount());
    }

    @Test
    public void testCloseEndsEveryReceive() throws Exception {
        String first = registry.register("1");
        String second = registry.register();
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            CountDownLatch waiting = new CountDownLatch(2);
            List<Future<Boolean>> results = new ArrayList<>();
            for (String id : new String[] {first, second}) {
                results.add(executor.submit(() -> {
                    waiting.countDown();
                    try {
                        registry.receive(id);
                        return false;
                    } catch (SubscriptionClosedException e) {
                        return true;
                    }
                }));
            }
            Assert.assertTrue(waiting.await(5, TimeUnit.SECONDS));
            Assert.assertEquals(2, registry.close());
            for (Future<Boolean> result : results) {
                Assert.assertTrue(result.get(5, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
        Assert.assertEquals(0, registry.size());
        Assert.assertEquals(0, registry.publish(X));
    }

    @Test
    public void testFramesQueuedBeforeCloseAreDelivered() throws Exception {
        String id = registry.register();
        registry.publish(X);
        registry.close();
        Assert.assertArrayEquals(X, registry.receive(id));
        try {
            registry.receive(id);
            Assert.fail("expected SubscriptionClosedException");
        } catch (SubscriptionClosedException e) {
            Assert.assertEquals(id, e.getSubscriberId());
        }
        Assert.assertFalse(registry.isRegistered(id));
    }

    @Test(expected = SubscriptionClosedException.class)
    public void testReceiveUnknownSubscriber() throws Exception {
        registry.receive("missing");
    }

    @Test
    public void testPollTimesOut() throws Exception {
        String id = registry.register();
        Assert.assertNull(registry.poll(id, 10, TimeUnit.MILLISECONDS));
        registry.publish(X, id);
        Assert.assertArrayEquals(X, registry.poll(id, 1, TimeUnit.SECONDS));
    }

    @Test
    public void testConcurrentRegisterAndPublish() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 250; i++) {
                        String id = registry.register();
                        registry.publish(X);
                        registry.unregister(id);
                    }
                    return null;
                }));
            }
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
        Assert.assertEquals(0, registry.size());
        Assert.assertEquals(0, registry.channelCount());
    }
}
