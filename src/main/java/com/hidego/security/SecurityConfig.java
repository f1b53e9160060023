package com.hidego.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * The relay exposes only the webhook endpoint and the public actuator probes.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    private final WebhookAuthFilter webhookAuthFilter;

    public SecurityConfig(WebhookAuthFilter webhookAuthFilter) {
        this.webhookAuthFilter = webhookAuthFilter;
    }

    @Bean
    public SecurityFilterChain relayFilterChain(HttpSecurity http) throws Exception {
        return http
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/actuator/health", "/actuator/info").permitAll()
                        .requestMatchers("/webhook/**").permitAll()
                        .anyRequest().denyAll()
                )
                .addFilterBefore(webhookAuthFilter, UsernamePasswordAuthenticationFilter.class)
                .sessionManagement(session -> session
                        .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
                )
                .csrf(AbstractHttpConfigurer::disable)
                .httpBasic(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)
                .build();
    }
}
