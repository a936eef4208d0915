package alpha.grouprouter.core;

import alpha.grouprouter.Config;
import alpha.grouprouter.Group;
import alpha.grouprouter.handler.Handler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Asserts that naming is serialized across the groups of an application.
 */
final class NamingConcurrencyTest
{
    private static final Handler H = ctx -> {};
    
    private static final int THREADS = 4, ROUNDS = 200;
    
    private final DefaultApp app = new DefaultApp(Config.DEFAULT);
    
    private final AtomicInteger active = new AtomicInteger(),
                                maxActive = new AtomicInteger(),
                                calls = new AtomicInteger();
    
    private ExecutorService exec;
    
    @AfterEach
    void shutdown() {
        if (exec != null) {
            exec.shutdownNow();
        }
    }
    
    @Test
    @Timeout(10)
    void group_and_route_naming_never_overlap() throws Exception {
        app.hooks().onGroupName(s -> observe())
                   .onName(r -> observe());
        
        var groups = new ArrayList<Group>();
        for (int i = 0; i < THREADS; ++i) {
            groups.add(app.group("/g" + i));
        }
        // Route naming in one group, group naming in all others
        Group routes = groups.get(0);
        routes.get("/x", H);
        
        var start = new CountDownLatch(1);
        List<Callable<Void>> tasks = new ArrayList<>();
        for (Group g : groups) {
            tasks.add(() -> {
                start.await();
                for (int r = 0; r < ROUNDS; ++r) {
                    g.name("n" + r + ".");
                }
                return null;
            });
        }
        
        exec = Executors.newFixedThreadPool(THREADS);
        List<Future<Void>> futures = new ArrayList<>();
        for (var t : tasks) {
            futures.add(exec.submit(t));
        }
        start.countDown();
        for (var f : futures) {
            f.get(5, SECONDS);
        }
        
        assertThat(calls.get()).isEqualTo(THREADS * ROUNDS);
        assertThat(maxActive.get()).isEqualTo(1);
        assertThat(routes.name()).isEmpty();
        assertThat(app.routes().get(0).name()).contains("n" + (ROUNDS - 1) + ".");
        for (Group g : groups.subList(1, THREADS)) {
            assertThat(g.name()).contains("n" + (ROUNDS - 1) + ".");
        }
    }
    
    private void observe() {
        calls.incrementAndGet();
        int now = active.incrementAndGet();
        maxActive.accumulateAndGet(now, Math::max);
        Thread.yield();
        active.decrementAndGet();
    }
}
