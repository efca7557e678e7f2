package com.openmeet.oidc.web;

import com.openmeet.oidc.token.UserInfoResolver;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class UserInfoController {

    private static final String BEARER_PREFIX = "Bearer ";

    private final UserInfoResolver userInfoResolver;

    public UserInfoController(UserInfoResolver userInfoResolver) {
        this.userInfoResolver = userInfoResolver;
    }

    @RequestMapping(path = "/userinfo", method = {RequestMethod.GET, RequestMethod.POST},
        produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> userInfo(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        String token = null;
        if (authorization != null && authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            token = authorization.substring(BEARER_PREFIX.length()).trim();
        }
        return ResponseEntity.ok()
            .cacheControl(CacheControl.noStore())
            .body(userInfoResolver.resolve(token));
    }
}
