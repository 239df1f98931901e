package io.github.samzhu.relay.routing;

import java.time.Duration;
import java.util.List;

import io.github.samzhu.relay.config.ProviderAuthConfig;
import io.github.samzhu.relay.config.ProviderProperties;

/**
 * 執行期的 provider 描述
 *
 * <p>除了 {@code healthy} 與 {@code weight} 之外全部在啟動時決定。
 * 這兩個欄位只由外部健康監控透過 {@link ProviderRegistry} 寫入，
 * 請求路徑只會讀取。
 */
public final class ProviderProfile {

    private final String id;
    private final Protocol protocol;
    private final String endpoint;
    private final ProviderAuthConfig auth;
    private final List<String> supportedModels;
    private final Duration timeout;
    private final int maxOutputTokens;
    private final String profileArn;

    private volatile boolean healthy;
    private volatile int weight;

    public ProviderProfile(String id, Protocol protocol, String endpoint, ProviderAuthConfig auth,
                           int weight, List<String> supportedModels, Duration timeout,
                           int maxOutputTokens, String profileArn, boolean healthy) {
        this.id = id;
        this.protocol = protocol;
        this.endpoint = endpoint;
        this.auth = auth;
        this.weight = weight;
        this.supportedModels = List.copyOf(supportedModels);
        this.timeout = timeout;
        this.maxOutputTokens = maxOutputTokens;
        this.profileArn = profileArn;
        this.healthy = healthy;
    }

    public static ProviderProfile from(ProviderProperties properties) {
        return new ProviderProfile(
            properties.id(),
            properties.protocol(),
            properties.endpoint(),
            properties.auth(),
            properties.weight(),
            properties.models(),
            properties.timeout(),
            properties.maxOutputTokens(),
            properties.profileArn(),
            properties.healthy());
    }

    public String id() {
        return id;
    }

    public Protocol protocol() {
        return protocol;
    }

    public String endpoint() {
        return endpoint;
    }

    public ProviderAuthConfig auth() {
        return auth;
    }

    public List<String> supportedModels() {
        return supportedModels;
    }

    public Duration timeout() {
        return timeout;
    }

    public int maxOutputTokens() {
        return maxOutputTokens;
    }

    public String profileArn() {
        return profileArn;
    }

    public boolean isHealthy() {
        return healthy;
    }

    public int weight() {
        return weight;
    }

    void setHealthy(boolean healthy) {
        this.healthy = healthy;
    }

    void setWeight(int weight) {
        this.weight = weight;
    }

    @Override
    public String toString() {
        return "ProviderProfile[id=" + id + ", protocol=" + protocol + ", endpoint=" + endpoint
            + ", weight=" + weight + ", healthy=" + healthy + "]";
    }
}
