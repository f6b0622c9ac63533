package com.yoursp.vkyc.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.util.Arrays;
import java.util.List;

/**
 * Security configuration.
 * <ul>
 * <li>Security headers: HSTS, X-Content-Type-Options, X-Frame-Options, CSP,
 * Cache-Control</li>
 * <li>Rate limiting filter on the token-only endpoints</li>
 * <li>/api/vkyc/**, /ws/vkyc/**, /actuator/health — permitAll. Customers hold
 * only a link token; staff authentication sits in front of this service</li>
 * <li>Everything else denied</li>
 * <li>CSRF disabled: stateless API, no cookies</li>
 * </ul>
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

        private final RateLimitFilter rateLimitFilter;
        private final VkycProperties properties;

        public SecurityConfig(RateLimitFilter rateLimitFilter, VkycProperties properties) {
                this.rateLimitFilter = rateLimitFilter;
                this.properties = properties;
        }

        @Bean
        public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
                http
                                .csrf(AbstractHttpConfigurer::disable)
                                .cors(cors -> cors.configurationSource(corsConfigurationSource()))
                                .sessionManagement(session -> session
                                                .sessionCreationPolicy(SessionCreationPolicy.STATELESS))

                                // ── Security Headers ──
                                .headers(headers -> headers
                                                .contentTypeOptions(opt -> {
                                                }) // X-Content-Type-Options: nosniff
                                                .frameOptions(frame -> frame.deny()) // X-Frame-Options: DENY
                                                .httpStrictTransportSecurity(hsts -> hsts
                                                                .includeSubDomains(true)
                                                                .maxAgeInSeconds(31536000)) // HSTS: 1 year
                                                .contentSecurityPolicy(csp -> csp
                                                                .policyDirectives(
                                                                                "default-src 'self'; frame-ancestors 'none'"))
                                                .cacheControl(cache -> {
                                                })) // Cache-Control: no-cache, no-store, must-revalidate

                                .authorizeHttpRequests(auth -> auth
                                                .requestMatchers("/api/vkyc/**").permitAll()
                                                .requestMatchers("/ws/vkyc/**").permitAll()
                                                .requestMatchers("/mock/**").permitAll()
                                                .requestMatchers("/actuator/health").permitAll()
                                                .requestMatchers("/actuator/info").permitAll()
                                                .anyRequest().denyAll())
                                .addFilterBefore(rateLimitFilter, UsernamePasswordAuthenticationFilter.class)
                                .formLogin(AbstractHttpConfigurer::disable)
                                .httpBasic(AbstractHttpConfigurer::disable);

                return http.build();
        }

        @Bean
        public CorsConfigurationSource corsConfigurationSource() {
                CorsConfiguration config = new CorsConfiguration();
                config.setAllowedOrigins(Arrays.asList(
                                "http://localhost:4200",
                                properties.getFrontendBaseUrl()));
                config.setAllowedMethods(List.of("GET", "POST", "OPTIONS"));
                config.setAllowedHeaders(List.of("*"));
                config.setExposedHeaders(List.of(CorrelationIdFilter.HEADER));
                config.setMaxAge(3600L);

                UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
                source.registerCorsConfiguration("/**", config);
                return source;
        }
}
