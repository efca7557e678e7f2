package com.openmeet.oidc.web;

import com.openmeet.oidc.error.OidcErrorKind;
import com.openmeet.oidc.error.OidcException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns request failures into {"error", "error_description"} JSON bodies.
 *
 * Status comes from the {@link OidcErrorKind}. 401s on /userinfo carry a Bearer
 * challenge, 429s carry Retry-After. Error bodies are never cached.
 */
@RestControllerAdvice
public class OidcExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(OidcExceptionHandler.class);

    @ExceptionHandler(OidcException.class)
    public ResponseEntity<Map<String, Object>> handleOidcException(OidcException e) {
        log.debug("OIDC request rejected: {} {} ({})", e.getKind(), e.getErrorCode(), e.getMessage());
        HttpHeaders headers = new HttpHeaders();
        if (e.getKind() == OidcErrorKind.INVALID_TOKEN) {
            headers.set(HttpHeaders.WWW_AUTHENTICATE,
                "Bearer error=\"" + e.getErrorCode() + "\", error_description=\"" + e.getMessage() + "\"");
        }
        if (e.getKind() == OidcErrorKind.CLIENT_AUTH_FAILURE) {
            headers.set(HttpHeaders.WWW_AUTHENTICATE, "Basic realm=\"oidc\"");
        }
        if (e.getRetryAfter() != null) {
            headers.set(HttpHeaders.RETRY_AFTER, String.valueOf(Math.max(1L, e.getRetryAfter().getSeconds())));
        }
        return body(e.getKind().getStatus(), headers, e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, Object>> handleMissingParameter(MissingServletRequestParameterException e) {
        return body(HttpStatus.BAD_REQUEST, new HttpHeaders(), "invalid_request",
            "Missing required parameter: " + e.getParameterName());
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<Map<String, Object>> handleMediaType(HttpMediaTypeNotSupportedException e) {
        return body(HttpStatus.BAD_REQUEST, new HttpHeaders(), "invalid_request",
            "Content type not supported: " + e.getContentType());
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, HttpHeaders headers,
                                                            String error, String description) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("error_description", description);
        return ResponseEntity.status(status)
            .headers(headers)
            .cacheControl(CacheControl.noStore())
            .contentType(MediaType.APPLICATION_JSON)
            .body(body);
    }
}
