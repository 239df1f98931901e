package io.github.samzhu.relay;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import io.github.samzhu.relay.config.RelayProperties;
import io.github.samzhu.relay.config.RoutingProperties;
import io.github.samzhu.relay.routing.ProviderRegistry;
import io.github.samzhu.relay.routing.RoutingCategory;
import jakarta.annotation.PostConstruct;

/**
 * 應用程式啟動處理器
 *
 * <p>啟動時檢查路由表是否可用，完全啟動後輸出存取網址、provider 與路由摘要。
 */
@Component
public class ApplicationStartup {

    private static final Logger log = LoggerFactory.getLogger(ApplicationStartup.class);

    private final Environment env;
    private final Optional<BuildProperties> buildProperties;
    private final ProviderRegistry providerRegistry;
    private final RelayProperties relayProperties;

    public ApplicationStartup(
            Environment env,
            Optional<BuildProperties> buildProperties,
            ProviderRegistry providerRegistry,
            RelayProperties relayProperties) {
        this.env = env;
        this.buildProperties = buildProperties;
        this.providerRegistry = providerRegistry;
        this.relayProperties = relayProperties;
    }

    /**
     * 沒有 provider 或 default 類別沒有目標時，所有請求都會回應 overloaded_error
     */
    @PostConstruct
    public void checkRoutingTable() {
        if (providerRegistry.size() == 0) {
            log.warn("No providers configured under relay.providers, every request will be rejected");
        }
        List<RoutingProperties.Target> defaults = relayProperties.routing().categories()
            .get(RoutingCategory.DEFAULT.value());
        if (defaults == null || defaults.isEmpty()) {
            log.warn("Routing category 'default' has no targets, unmatched categories cannot fall back");
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        String protocol = Optional.ofNullable(env.getProperty("server.ssl.key-store"))
            .map(key -> "https")
            .orElse("http");
        String applicationName = env.getProperty("spring.application.name");
        String serverPort = env.getProperty("local.server.port", env.getProperty("server.port", "8080"));
        String contextPath = Optional.ofNullable(env.getProperty("server.servlet.context-path"))
            .filter(StringUtils::isNotBlank)
            .orElse("/");
        String hostAddress = "localhost";
        try {
            hostAddress = InetAddress.getLocalHost().getHostAddress();
        } catch (UnknownHostException e) {
            log.warn("無法取得主機名稱，使用 `localhost` 作為預設值");
        }

        String version = buildProperties.map(BuildProperties::getVersion).orElse("N/A");

        String providers = providerRegistry.all().stream()
            .map(p -> String.format("%s(%s, weight=%d, %s)", p.id(), p.protocol().name().toLowerCase(),
                p.weight(), p.isHealthy() ? "healthy" : "unhealthy"))
            .collect(Collectors.joining(", "));
        String categories = relayProperties.routing().categories().entrySet().stream()
            .map(ApplicationStartup::describeCategory)
            .collect(Collectors.joining(", "));

        log.info("""

            ----------------------------------------------------------
            \t應用程式 '{}' 啟動完成！（版本 {}）
            ----------------------------------------------------------
            \t存取網址：
            \t  本機：   {}://localhost:{}{}
            \t  外部：   {}://{}:{}{}
            ----------------------------------------------------------
            \tProvider：{}
            \t路由類別：{}
            \t長上下文門檻：{} tokens（估算）
            \t安全：    JWT {}
            ----------------------------------------------------------""",
            applicationName,
            version,
            protocol,
            serverPort,
            contextPath,
            protocol,
            hostAddress,
            serverPort,
            contextPath,
            StringUtils.defaultIfBlank(providers, "none"),
            StringUtils.defaultIfBlank(categories, "none"),
            relayProperties.routing().longContextThreshold(),
            relayProperties.security().jwtEnabled() ? "enabled" : "disabled"
        );
    }

    private static String describeCategory(Map.Entry<String, List<RoutingProperties.Target>> entry) {
        return entry.getKey() + "=" + entry.getValue().stream()
            .map(t -> t.provider() + "/" + t.model())
            .collect(Collectors.joining("|"));
    }
}
