package io.github.samzhu.relay.config;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.relay.model.GatewayError;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Spring Security 安全配置
 *
 * <ul>
 *   <li>無狀態 Session、停用 CSRF</li>
 *   <li>{@code /actuator/**} 公開存取（健康檢查、指標）</li>
 *   <li>{@code relay.security.jwt-enabled=true} 時其他端點需要有效 JWT（OAuth2 Resource Server），
 *       公鑰由 {@code spring.security.oauth2.resourceserver.jwt.jwk-set-uri} 提供</li>
 *   <li>未啟用時全部放行，適合在本機或內網前置使用</li>
 * </ul>
 *
 * <p>認證與授權失敗同樣以 Anthropic 相容的錯誤信封回應。
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http, RelayProperties properties,
                                                   ObjectMapper objectMapper) throws Exception {
        http
            .csrf(csrf -> csrf.disable())
            .sessionManagement(session ->
                session.sessionCreationPolicy(SessionCreationPolicy.STATELESS));

        if (!properties.security().jwtEnabled()) {
            log.info("JWT authentication disabled, all endpoints are open");
            http.authorizeHttpRequests(auth -> auth.anyRequest().permitAll());
            return http.build();
        }

        log.info("Configuring OAuth2 Resource Server with JWT authentication");
        http
            .authorizeHttpRequests(auth -> auth
                .requestMatchers("/actuator/**").permitAll()
                .anyRequest().authenticated()
            )
            .oauth2ResourceServer(oauth2 -> oauth2
                .jwt(jwt -> {
                    // jwk-set-uri 由 application.yaml 提供
                })
                .authenticationEntryPoint((request, response, e) -> {
                    log.warn("Authentication failed: {}", e.getMessage());
                    writeError(response, HttpStatus.UNAUTHORIZED,
                        GatewayError.authenticationError("Invalid or expired access token"), objectMapper);
                })
                .accessDeniedHandler((request, response, e) -> {
                    log.warn("Access denied: {}", e.getMessage());
                    writeError(response, HttpStatus.FORBIDDEN,
                        GatewayError.permissionError("Access denied"), objectMapper);
                })
            );

        return http.build();
    }

    private static void writeError(HttpServletResponse response, HttpStatus status, GatewayError error,
                                   ObjectMapper objectMapper) throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), error);
    }
}
