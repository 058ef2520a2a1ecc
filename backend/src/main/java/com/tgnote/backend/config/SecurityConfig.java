package com.tgnote.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tgnote.backend.filter.TelegramAuthFilter;
import com.tgnote.backend.utils.TelegramInitDataVerifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

@Slf4j
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    private final TelegramInitDataVerifier verifier;
    private final ObjectMapper objectMapper;
    private final boolean enforceAuth;

    public SecurityConfig(TelegramInitDataVerifier verifier,
                          ObjectMapper objectMapper,
                          @Value("${application.config.auth.enforce:false}") boolean enforceAuth) {
        this.verifier = verifier;
        this.objectMapper = objectMapper;
        this.enforceAuth = enforceAuth;
    }

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .cors(Customizer.withDefaults())
                .httpBasic(basic -> basic.disable())
                .formLogin(form -> form.disable())
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(auth -> auth.anyRequest().permitAll());

        if (enforceAuth) {
            log.info("Telegram init data is required on note changes");
            http.addFilterBefore(new TelegramAuthFilter(verifier, objectMapper), UsernamePasswordAuthenticationFilter.class);
        } else {
            log.warn("Telegram init data verification is disabled (application.config.auth.enforce=false)");
        }

        return http.build();
    }
}
