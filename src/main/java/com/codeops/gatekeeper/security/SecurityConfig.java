package com.codeops.gatekeeper.security;

import com.codeops.gatekeeper.middleware.MiddlewareChainFilter;
import com.codeops.gatekeeper.middleware.MiddlewarePipeline;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Servlet security setup: stateless, no sessions, no CSRF, no form or basic login, default
 * security headers. Authentication is done by the middleware pipeline, which runs inside this
 * chain; the route table decides which routes need an authenticated context.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http, MiddlewarePipeline middlewarePipeline)
            throws Exception {
        http.csrf(AbstractHttpConfigurer::disable)
                .httpBasic(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)
                .logout(AbstractHttpConfigurer::disable)
                .requestCache(AbstractHttpConfigurer::disable)
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(auth -> auth.anyRequest().permitAll())
                .addFilterBefore(new MiddlewareChainFilter(middlewarePipeline), UsernamePasswordAuthenticationFilter.class);
        return http.build();
    }
}
