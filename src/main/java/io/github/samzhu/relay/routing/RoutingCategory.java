package io.github.samzhu.relay.routing;

import java.util.Locale;

/**
 * 路由類別
 *
 * <p>每個類別對應路由表 {@code relay.routing.categories} 中的一組 provider 目標。
 */
public enum RoutingCategory {

    DEFAULT("default"),
    BACKGROUND("background"),
    THINKING("thinking"),
    LONG_CONTEXT("longcontext"),
    SEARCH("search");

    private final String value;

    RoutingCategory(String value) {
        this.value = value;
    }

    /**
     * 配置與 log 中使用的名稱
     */
    public String value() {
        return value;
    }

    /**
     * 由配置名稱解析類別
     *
     * @throws IllegalArgumentException 名稱不屬於任何類別
     */
    public static RoutingCategory fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
            for (RoutingCategory category : values()) {
                if (category.value.equals(normalized)) {
                    return category;
                }
            }
        }
        throw new IllegalArgumentException("Unknown routing category: " + value);
    }
}
