package com.openmeet.oidc.config;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.KeyUse;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.jwk.gen.RSAKeyGenerator;
import com.nimbusds.jose.jwk.source.ImmutableJWKSet;
import com.nimbusds.jose.jwk.source.JWKSource;
import com.nimbusds.jose.proc.SecurityContext;
import com.openmeet.oidc.authorize.AuthorizationService;
import com.openmeet.oidc.client.ClientRegistry;
import com.openmeet.oidc.client.PropertiesClientRegistry;
import com.openmeet.oidc.code.AuthCodeCodec;
import com.openmeet.oidc.config.properties.OidcProperties;
import com.openmeet.oidc.config.properties.SessionCookieProperties;
import com.openmeet.oidc.discovery.DiscoveryPublisher;
import com.openmeet.oidc.ratelimit.RateLimiter;
import com.openmeet.oidc.replay.ReplayGuard;
import com.openmeet.oidc.session.BootstrapTokenStore;
import com.openmeet.oidc.session.SessionCookies;
import com.openmeet.oidc.session.SessionStore;
import com.openmeet.oidc.token.ClientAuthenticator;
import com.openmeet.oidc.token.JwtSigner;
import com.openmeet.oidc.token.TokenExchangeService;
import com.openmeet.oidc.token.TokenIssuer;
import com.openmeet.oidc.token.UserInfoResolver;
import com.openmeet.oidc.user.InMemoryUserDirectory;
import com.openmeet.oidc.user.UserDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.security.crypto.factory.PasswordEncoderFactories;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtIssuerValidator;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;

import java.io.IOException;
import java.io.InputStream;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.time.Clock;

/**
 * OIDC Authorization Server wiring.
 *
 * Endpoints (see the web package):
 * - GET  /authorize                        (authorization code, 60-second single-use)
 * - POST /token                            (authorization_code grant only)
 * - GET  /userinfo                         (claims from the bearer token only)
 * - GET  /jwks                             (public signing key)
 * - GET  /.well-known/openid-configuration (discovery)
 *
 * Signing:
 * - One RS256 key, loaded from a PKCS12 keystore when oidc.signing.keystore.location is set
 * - Otherwise generated at startup (tokens do not survive a restart)
 *
 * Every service here is a plain class created via @Bean so tests can build the
 * same graph by hand with a controllable Clock. Stores live in {@link StoreConfig}.
 */
@Configuration
public class OidcAuthorizationServerConfig {

    private static final Logger log = LoggerFactory.getLogger(OidcAuthorizationServerConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RSAKey signingKey(OidcProperties properties, ResourceLoader resourceLoader) throws Exception {
        OidcProperties.Signing signing = properties.getSigning();
        String location = signing.getKeystore().getLocation();
        if (location != null && !location.isBlank()) {
            RSAKey key = loadFromKeystore(signing, resourceLoader.getResource(location));
            log.info("[STARTUP] Loaded RS256 signing key '{}' from {}", key.getKeyID(), location);
            return key;
        }
        log.warn("[STARTUP] No signing keystore configured, generating an ephemeral RS256 key '{}'",
            signing.getKeyId());
        return generate(signing.getKeyId());
    }

    static RSAKey generate(String keyId) throws JOSEException {
        return new RSAKeyGenerator(2048)
            .keyUse(KeyUse.SIGNATURE)
            .algorithm(JWSAlgorithm.RS256)
            .keyID(keyId)
            .generate();
    }

    private static RSAKey loadFromKeystore(OidcProperties.Signing signing, Resource resource)
            throws IOException, GeneralSecurityException {
        OidcProperties.Keystore config = signing.getKeystore();
        KeyStore keyStore = KeyStore.getInstance("PKCS12");
        try (InputStream is = resource.getInputStream()) {
            keyStore.load(is, config.getPassword() != null ? config.getPassword().toCharArray() : null);
        }
        String keyPassword = config.getKeyPassword() != null ? config.getKeyPassword() : config.getPassword();
        RSAPrivateKey privateKey = (RSAPrivateKey) keyStore.getKey(config.getAlias(),
            keyPassword != null ? keyPassword.toCharArray() : null);
        if (privateKey == null || keyStore.getCertificate(config.getAlias()) == null) {
            throw new IllegalStateException("Signing key '" + config.getAlias() + "' not found in keystore");
        }
        RSAPublicKey publicKey = (RSAPublicKey) keyStore.getCertificate(config.getAlias()).getPublicKey();
        return new RSAKey.Builder(publicKey)
            .privateKey(privateKey)
            .keyUse(KeyUse.SIGNATURE)
            .algorithm(JWSAlgorithm.RS256)
            .keyID(signing.getKeyId())
            .build();
    }

    /**
     * JWK Source: holds the signing key for the encoder.
     */
    @Bean
    public JWKSource<SecurityContext> jwkSource(RSAKey signingKey) {
        return new ImmutableJWKSet<>(new JWKSet(signingKey));
    }

    @Bean
    public JwtEncoder jwtEncoder(JWKSource<SecurityContext> jwkSource) {
        return new NimbusJwtEncoder(jwkSource);
    }

    /**
     * Signature and issuer only. Expiry is checked by the callers against the
     * injected Clock so that code and token lifetimes are exact.
     */
    @Bean
    public JwtDecoder jwtDecoder(RSAKey signingKey, OidcProperties properties) throws JOSEException {
        NimbusJwtDecoder decoder = NimbusJwtDecoder.withPublicKey(signingKey.toRSAPublicKey()).build();
        decoder.setJwtValidator(new JwtIssuerValidator(properties.getIssuer()));
        return decoder;
    }

    @Bean
    public JwtSigner jwtSigner(JwtEncoder jwtEncoder, RSAKey signingKey) {
        return new JwtSigner(jwtEncoder, signingKey.getKeyID());
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return PasswordEncoderFactories.createDelegatingPasswordEncoder();
    }

    @Bean
    public ClientRegistry clientRegistry(OidcProperties properties) {
        return new PropertiesClientRegistry(properties);
    }

    /**
     * Default user directory seeded from oidc.tenants[].users. A deployment backed
     * by a real user store replaces this bean.
     */
    @Bean
    @ConditionalOnMissingBean(UserDirectory.class)
    public UserDirectory userDirectory(PasswordEncoder passwordEncoder, OidcProperties properties) {
        return new InMemoryUserDirectory(passwordEncoder, properties);
    }

    @Bean
    public AuthCodeCodec authCodeCodec(JwtSigner signer, JwtDecoder decoder, OidcProperties properties, Clock clock) {
        return new AuthCodeCodec(signer, decoder, properties.getIssuer(), clock, properties.getAuthorizationCodeTtl());
    }

    @Bean
    public TokenIssuer tokenIssuer(JwtSigner signer, OidcProperties properties, Clock clock) {
        return new TokenIssuer(signer, properties.getIssuer(), clock,
            properties.getAccessTokenTtl(), properties.getIdTokenTtl());
    }

    @Bean
    public UserInfoResolver userInfoResolver(JwtDecoder decoder, OidcProperties properties, Clock clock) {
        return new UserInfoResolver(decoder, properties.getIssuer(), clock);
    }

    @Bean
    public ClientAuthenticator clientAuthenticator(PasswordEncoder passwordEncoder) {
        return new ClientAuthenticator(passwordEncoder);
    }

    @Bean
    public AuthorizationService authorizationService(ClientRegistry clientRegistry, SessionStore sessionStore,
                                                     BootstrapTokenStore bootstrapTokenStore,
                                                     AuthCodeCodec authCodeCodec, OidcProperties properties) {
        return new AuthorizationService(clientRegistry, sessionStore, bootstrapTokenStore, authCodeCodec,
            properties.getLoginPageUrl());
    }

    @Bean
    public TokenExchangeService tokenExchangeService(RateLimiter rateLimiter, AuthCodeCodec authCodeCodec,
                                                     ReplayGuard replayGuard, ClientRegistry clientRegistry,
                                                     ClientAuthenticator clientAuthenticator,
                                                     UserDirectory userDirectory, TokenIssuer tokenIssuer) {
        return new TokenExchangeService(rateLimiter, authCodeCodec, replayGuard, clientRegistry,
            clientAuthenticator, userDirectory, tokenIssuer);
    }

    @Bean
    public DiscoveryPublisher discoveryPublisher(OidcProperties properties, RSAKey signingKey) {
        return new DiscoveryPublisher(properties.getIssuer(), signingKey);
    }

    @Bean
    public SessionCookies sessionCookies(SessionCookieProperties cookieProperties) {
        return new SessionCookies(cookieProperties);
    }
}
