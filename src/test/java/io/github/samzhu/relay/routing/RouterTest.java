package io.github.samzhu.relay.routing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.relay.config.ProviderProperties;
import io.github.samzhu.relay.config.RelayProperties;
import io.github.samzhu.relay.config.RoutingProperties;

class RouterTest {

    private ProviderRegistry registry;
    private Router router;

    @BeforeEach
    void setUp() {
        RelayProperties properties = new RelayProperties(
            List.of(provider("p1"), provider("p2"), provider("p3")),
            new RoutingProperties(null, null, null, Map.of(
                "default", List.of(
                    new RoutingProperties.Target("p1", "m1", 1),
                    new RoutingProperties.Target("p2", "m2", 1),
                    new RoutingProperties.Target("p3", "m3", 2)),
                "background", List.of(
                    new RoutingProperties.Target("p3", "small", 1)))),
            null, null, null);
        registry = new ProviderRegistry(properties);
        router = new Router(properties, registry);
    }

    @Test
    void shouldRoundRobinWithinLowestWeightTier() {
        Map<String, Integer> counts = new HashMap<>();
        for (int i = 0; i < 1000; i++) {
            RoutingDecision decision = router.select(defaultClassification(), Set.of());
            counts.merge(decision.providerId(), 1, Integer::sum);
            assertThat(decision.selectionMethod()).isEqualTo(SelectionMethod.ROUND_ROBIN);
        }

        assertThat(counts).containsEntry("p1", 500).containsEntry("p2", 500).doesNotContainKey("p3");
    }

    @Test
    void shouldFallThroughToNextTierWhenTierUnhealthy() {
        registry.updateHealth("p1", false);
        registry.updateHealth("p2", false);

        RoutingDecision decision = router.select(defaultClassification(), Set.of());

        assertThat(decision.providerId()).isEqualTo("p3");
        assertThat(decision.model()).isEqualTo("m3");
        assertThat(decision.selectionMethod()).isEqualTo(SelectionMethod.TIER_FALLTHROUGH);
    }

    @Test
    void shouldSkipExcludedProvidersOnFailover() {
        RoutingDecision decision = router.select(defaultClassification(), Set.of("p1"));

        assertThat(decision.providerId()).isEqualTo("p2");
        assertThat(decision.selectionMethod()).isEqualTo(SelectionMethod.FAILOVER);
    }

    @Test
    void shouldThrowWhenNoTargetAvailable() {
        assertThatThrownBy(() -> router.select(defaultClassification(), Set.of("p1", "p2", "p3")))
            .isInstanceOf(RoutingExhaustedException.class)
            .hasMessageContaining("default");
    }

    @Test
    void shouldFallBackToDefaultTargetsForUnconfiguredCategory() {
        RoutingDecision decision = router.select(
            new Classification(RoutingCategory.THINKING, "builtin:thinking", 10), Set.of());

        assertThat(decision.providerId()).isIn("p1", "p2");
        assertThat(decision.category()).isEqualTo(RoutingCategory.THINKING);
        assertThat(decision.ruleId()).isEqualTo("builtin:thinking");
    }

    @Test
    void shouldUseCategoryTargets() {
        RoutingDecision decision = router.select(
            new Classification(RoutingCategory.BACKGROUND, "background:.*haiku.*", 10), Set.of());

        assertThat(decision.providerId()).isEqualTo("p3");
        assertThat(decision.model()).isEqualTo("small");
    }

    @Test
    void shouldRejectUnknownProviderInRoutingTable() {
        RelayProperties properties = new RelayProperties(
            List.of(provider("p1")),
            new RoutingProperties(null, null, null, Map.of(
                "default", List.of(new RoutingProperties.Target("missing", "m", null)))),
            null, null, null);
        ProviderRegistry registry = new ProviderRegistry(properties);

        assertThatThrownBy(() -> new Router(properties, registry))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("missing");
    }

    @Test
    void shouldDistributeEvenlyUnderConcurrency() throws Exception {
        Map<String, AtomicInteger> counts = new ConcurrentHashMap<>();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(8);
        for (int t = 0; t < 8; t++) {
            executor.submit(() -> {
                try {
                    for (int i = 0; i < 250; i++) {
                        String id = router.select(defaultClassification(), Set.of()).providerId();
                        counts.computeIfAbsent(id, k -> new AtomicInteger()).incrementAndGet();
                    }
                } finally {
                    done.countDown();
                }
            });
        }
        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(counts.get("p1").get()).isEqualTo(1000);
        assertThat(counts.get("p2").get()).isEqualTo(1000);
        assertThat(counts).doesNotContainKey("p3");
    }

    private static Classification defaultClassification() {
        return new Classification(RoutingCategory.DEFAULT, "builtin:default", 10);
    }

    private static ProviderProperties provider(String id) {
        return new ProviderProperties(id, Protocol.OPENAI, "http://localhost/" + id, null, 1,
            null, null, null, null, null);
    }
}
