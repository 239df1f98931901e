package io.github.samzhu.relay.routing;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import io.github.samzhu.relay.config.RelayProperties;
import io.github.samzhu.relay.config.RoutingProperties;

/**
 * 路由器
 *
 * <p>選擇策略：
 * <ul>
 *   <li>該類別的目標依權重由小到大分層</li>
 *   <li>第一個有健康且未被排除之目標的層，以 Round Robin 選出下一個目標</li>
 *   <li>整層都不健康時落到下一層；全部都不可用時拋出 {@link RoutingExhaustedException}</li>
 *   <li>類別沒有設定任何目標時，改用 {@code default} 類別的路由表</li>
 * </ul>
 *
 * <p>執行緒安全：每個 (類別, 權重) 層有自己的 {@link AtomicInteger} 計數器，
 * 由此實例持有，不使用任何全域狀態。
 */
@Component
public class Router {

    private static final Logger log = LoggerFactory.getLogger(Router.class);

    private final ProviderRegistry registry;
    private final Map<RoutingCategory, List<RoutingTarget>> table;
    private final Map<String, AtomicInteger> counters = new ConcurrentHashMap<>();

    public Router(RelayProperties properties, ProviderRegistry registry) {
        this.registry = registry;
        this.table = buildTable(properties.routing(), registry);
        table.forEach((category, targets) ->
            log.info("Routing category {}: {} target(s) {}", category.value(), targets.size(),
                targets.stream().map(t -> t.providerId() + "/" + t.model()).toList()));
    }

    /**
     * 選出路由目標
     *
     * @param classification 分類結果
     * @param excluded       本次請求已失敗、需排除的 provider id
     * @return 路由決策
     * @throws RoutingExhaustedException 沒有可用目標
     */
    public RoutingDecision select(Classification classification, Set<String> excluded) {
        long start = System.nanoTime();
        RoutingCategory category = classification.category();
        List<RoutingTarget> targets = targetsFor(category);

        TreeMap<Integer, List<Candidate>> tiers = new TreeMap<>();
        for (RoutingTarget target : targets) {
            ProviderProfile provider = registry.find(target.providerId()).orElse(null);
            if (provider == null) {
                continue;
            }
            tiers.computeIfAbsent(target.effectiveWeight(provider), w -> new ArrayList<>())
                .add(new Candidate(target, provider));
        }

        boolean skippedTier = false;
        for (Map.Entry<Integer, List<Candidate>> tier : tiers.entrySet()) {
            List<Candidate> available = tier.getValue().stream()
                .filter(c -> c.provider().isHealthy())
                .filter(c -> !excluded.contains(c.provider().id()))
                .toList();
            if (available.isEmpty()) {
                skippedTier = true;
                continue;
            }
            AtomicInteger counter = counters.computeIfAbsent(
                category.value() + "#" + tier.getKey(), key -> new AtomicInteger(0));
            Candidate chosen = available.get(Math.floorMod(counter.getAndIncrement(), available.size()));

            SelectionMethod method = !excluded.isEmpty() ? SelectionMethod.FAILOVER
                : skippedTier ? SelectionMethod.TIER_FALLTHROUGH
                : SelectionMethod.ROUND_ROBIN;
            RoutingDecision decision = new RoutingDecision(
                chosen.provider(),
                chosen.target().model(),
                category,
                classification.ruleId(),
                method,
                Instant.now(),
                System.nanoTime() - start);
            log.debug("Selected provider={}, model={}, category={}, method={}, weight={}",
                decision.providerId(), decision.model(), category.value(), method.value(), tier.getKey());
            return decision;
        }

        log.warn("No healthy provider for category={}, excluded={}", category.value(), excluded);
        throw new RoutingExhaustedException(category,
            "No healthy target for category " + category.value() + " (excluded " + excluded + ")");
    }

    public List<RoutingTarget> targetsFor(RoutingCategory category) {
        List<RoutingTarget> targets = table.get(category);
        if (targets == null || targets.isEmpty()) {
            targets = table.getOrDefault(RoutingCategory.DEFAULT, List.of());
        }
        return targets;
    }

    private static Map<RoutingCategory, List<RoutingTarget>> buildTable(RoutingProperties routing,
                                                                       ProviderRegistry registry) {
        Map<RoutingCategory, List<RoutingTarget>> result = new EnumMap<>(RoutingCategory.class);
        routing.categories().forEach((name, entries) -> {
            RoutingCategory category = RoutingCategory.fromValue(name);
            List<RoutingTarget> targets = new ArrayList<>();
            for (RoutingProperties.Target entry : entries) {
                if (registry.find(entry.provider()).isEmpty()) {
                    throw new IllegalStateException(
                        "Routing category " + name + " references unknown provider: " + entry.provider());
                }
                targets.add(new RoutingTarget(entry.provider(), entry.model(), entry.weight()));
            }
            result.put(category, List.copyOf(targets));
        });
        return result;
    }

    private record Candidate(RoutingTarget target, ProviderProfile provider) {
    }
}
