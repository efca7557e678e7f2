package com.openmeet.oidc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;

/**
 * Tenant-aware OIDC Authorization Server.
 *
 * Endpoint users are authenticated by the server's own session, client and
 * token checks, so Spring Security's default in-memory user is not created.
 */
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
public class OidcServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(OidcServerApplication.class, args);
    }
}
