package io.enumeris.registry;

import io.enumeris.core.DeclaredName;
import io.enumeris.core.EnumerisConfiguration;
import io.enumeris.core.NameSource;
import io.enumeris.testutil.Token;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Concurrency tests for declaration and lookup.
 */
class EnumerationConcurrencyTest {

    private static final int THREADS = 8;
    private static final int PER_THREAD = 250;

    @Test
    void shouldHandOutUniqueIdsUnderConcurrentDeclaration() throws Exception {
        var tokens = Enumeration.of(Token.class, EnumerisConfiguration.builder()
                .nameSource(NameSource.none())
                .build());
        var start = new CountDownLatch(1);
        Set<Integer> ids = ConcurrentHashMap.newKeySet();

        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        try {
            var futures = new ArrayList<Future<?>>();
            for (int t = 0; t < THREADS; t++) {
                var thread = t;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < PER_THREAD; i++) {
                        var token = tokens.declare("t" + thread + "-" + i, Token::new);
                        ids.add(token.id());
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            shutdown(executor);
        }

        var total = THREADS * PER_THREAD;
        assertThat(ids).hasSize(total);
        assertThat(tokens.size()).isEqualTo(total);
        assertThat(tokens.maxId()).isEqualTo(total);
        assertThat(tokens.values()).hasSize(total);
        assertThat(tokens.values().last().id()).isEqualTo(total - 1);
    }

    @Test
    void shouldNeverServeStaleValuesToReaders() throws Exception {
        var tokens = Enumeration.of(Token.class, EnumerisConfiguration.builder()
                .nameSource(NameSource.none())
                .build());
        var start = new CountDownLatch(1);
        var declared = new CountDownLatch(PER_THREAD);
        List<String> violations = new CopyOnWriteArrayList<>();

        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        try {
            var writer = executor.submit(() -> {
                start.await();
                for (int i = 0; i < PER_THREAD; i++) {
                    var token = tokens.declare("w" + i, Token::new);
                    if (!tokens.values().contains(token)) {
                        violations.add("missing " + token.id());
                    }
                    declared.countDown();
                }
                return null;
            });
            var readers = new ArrayList<Future<?>>();
            for (int r = 1; r < THREADS; r++) {
                readers.add(executor.submit(() -> {
                    start.await();
                    var lastSize = 0;
                    while (declared.getCount() > 0) {
                        var size = tokens.values().size();
                        if (size < lastSize) {
                            violations.add("shrunk from " + lastSize + " to " + size);
                        }
                        lastSize = size;
                    }
                    return null;
                }));
            }
            start.countDown();
            writer.get(30, TimeUnit.SECONDS);
            for (Future<?> reader : readers) {
                reader.get(30, TimeUnit.SECONDS);
            }
        } finally {
            shutdown(executor);
        }

        assertThat(violations).isEmpty();
        assertThat(tokens.values()).hasSize(PER_THREAD);
    }

    @Test
    void shouldResolveNamesConsistentlyFromManyThreads() throws Exception {
        var names = new ArrayList<DeclaredName>();
        var tokens = Enumeration.of(Token.class, EnumerisConfiguration.builder()
                .nameSource((declaringClass, valueType) -> List.copyOf(names))
                .build());
        for (int i = 0; i < 64; i++) {
            names.add(new DeclaredName("N" + i, tokens.declare(Token::new)));
        }
        var start = new CountDownLatch(1);
        Set<String> seen = ConcurrentHashMap.newKeySet();

        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        try {
            var futures = new ArrayList<Future<?>>();
            for (int t = 0; t < THREADS; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (Token token : tokens.values()) {
                        seen.add(token.toString());
                        if (tokens.valueByName(token.toString()) != token) {
                            throw new AssertionError("name lookup mismatch for " + token.id());
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            shutdown(executor);
        }

        var expected = new HashSet<String>();
        for (int i = 0; i < 64; i++) {
            expected.add("N" + i);
        }
        assertThat(seen).isEqualTo(expected);
    }

    private static void shutdown(ExecutorService executor) throws InterruptedException {
        executor.shutdownNow();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
    }
}
