package com.openmeet.oidc.web;

import com.openmeet.oidc.token.IssuedTokens;
import com.openmeet.oidc.token.TokenExchangeService;
import com.openmeet.oidc.token.TokenRequest;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * POST /token (application/x-www-form-urlencoded)
 *
 * Client credentials are accepted as client_secret_post form fields or as
 * client_secret_basic; when both are present the Basic header wins. An
 * undecodable Basic header is still counted by the rate limiter before it is
 * refused.
 */
@RestController
public class TokenController {

    private static final String BASIC_PREFIX = "Basic ";

    private final TokenExchangeService tokenExchangeService;

    public TokenController(TokenExchangeService tokenExchangeService) {
        this.tokenExchangeService = tokenExchangeService;
    }

    @PostMapping(path = "/token", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> token(
            @RequestParam(name = "grant_type", required = false) String grantType,
            @RequestParam(name = "code", required = false) String code,
            @RequestParam(name = "redirect_uri", required = false) String redirectUri,
            @RequestParam(name = "client_id", required = false) String clientId,
            @RequestParam(name = "client_secret", required = false) String clientSecret,
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            HttpServletRequest request) {

        boolean malformedBasic = false;
        if (authorization != null && authorization.regionMatches(true, 0, BASIC_PREFIX, 0, BASIC_PREFIX.length())) {
            Optional<String[]> basic = decodeBasic(authorization.substring(BASIC_PREFIX.length()).trim());
            if (basic.isPresent()) {
                clientId = basic.get()[0];
                clientSecret = basic.get()[1];
            } else {
                malformedBasic = true;
                clientSecret = null;
            }
        }

        IssuedTokens tokens = tokenExchangeService.exchange(new TokenRequest(grantType, code, redirectUri,
            clientId, clientSecret, request.getRemoteAddr(), malformedBasic));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("access_token", tokens.getAccessToken());
        body.put("token_type", "Bearer");
        body.put("expires_in", tokens.getExpiresIn());
        body.put("id_token", tokens.getIdToken());
        if (tokens.getScope() != null) {
            body.put("scope", tokens.getScope());
        }
        return ResponseEntity.ok()
            .cacheControl(CacheControl.noStore())
            .header(HttpHeaders.PRAGMA, "no-cache")
            .body(body);
    }

    /**
     * RFC 6749 section 2.3.1: id and secret are form-urlencoded before base64.
     * Empty when the header is not valid base64, has no colon, or carries a bad
     * percent-escape.
     */
    static Optional<String[]> decodeBasic(String encoded) {
        try {
            String decoded = new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
            int colon = decoded.indexOf(':');
            if (colon < 0) {
                return Optional.empty();
            }
            return Optional.of(new String[] {
                URLDecoder.decode(decoded.substring(0, colon), StandardCharsets.UTF_8),
                URLDecoder.decode(decoded.substring(colon + 1), StandardCharsets.UTF_8)
            });
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
