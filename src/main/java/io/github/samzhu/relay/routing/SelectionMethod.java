package io.github.samzhu.relay.routing;

/**
 * 路由目標的選擇方式
 */
public enum SelectionMethod {

    /**
     * 最低權重層內輪詢
     */
    ROUND_ROBIN("round-robin"),

    /**
     * 較低層沒有健康目標，落到下一層
     */
    TIER_FALLTHROUGH("tier-fallthrough"),

    /**
     * 排除了先前失敗的 provider 後重新選擇
     */
    FAILOVER("failover");

    private final String value;

    SelectionMethod(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
