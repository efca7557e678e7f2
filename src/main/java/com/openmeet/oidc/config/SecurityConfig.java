package com.openmeet.oidc.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;

/**
 * HTTP security for the OIDC endpoints.
 *
 * The endpoints authenticate callers themselves (session cookie, bootstrap token,
 * client secret, bearer token), so Spring Security only supplies the response
 * headers. No HttpSession is created: login state lives in the SessionStore.
 * CSRF is off because the browser-facing POSTs (/login, /logout) are form posts
 * from the login page and /token is called server to server.
 */
@Configuration
public class SecurityConfig {

    @Bean
    public SecurityFilterChain oidcSecurityFilterChain(HttpSecurity http) throws Exception {
        http
            .authorizeHttpRequests(auth -> auth.anyRequest().permitAll())
            .csrf(csrf -> csrf.disable())
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .requestCache(cache -> cache.disable())
            .httpBasic(basic -> basic.disable())
            .formLogin(form -> form.disable())
            .logout(logout -> logout.disable());
        return http.build();
    }
}
