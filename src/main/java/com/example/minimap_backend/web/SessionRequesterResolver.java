package com.example.minimap_backend.web;

import com.example.minimap_backend.dto.Requester;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

import java.time.Duration;
import java.util.UUID;

/**
 * Resolves {@link Requester} controller arguments from the {@code session_id} cookie. A caller
 * without the cookie gets a fresh token, set on the response.
 */
@Component
public class SessionRequesterResolver implements HandlerMethodArgumentResolver {
    public static final String COOKIE_NAME = "session_id";
    private static final int MAX_TOKEN_LENGTH = 128;

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return Requester.class.equals(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        HttpServletRequest request = webRequest.getNativeRequest(HttpServletRequest.class);
        String token = request == null ? null : readCookie(request);
        if (token == null) {
            token = UUID.randomUUID().toString();
            HttpServletResponse response = webRequest.getNativeResponse(HttpServletResponse.class);
            if (response != null) {
                ResponseCookie cookie = ResponseCookie.from(COOKIE_NAME, token)
                        .httpOnly(true)
                        .path("/")
                        .sameSite("Lax")
                        .maxAge(Duration.ofDays(365))
                        .build();
                response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
            }
        }
        return Requester.owner(token);
    }

    private static String readCookie(HttpServletRequest request) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return null;
        }
        for (Cookie c : cookies) {
            if (COOKIE_NAME.equals(c.getName())) {
                String v = c.getValue();
                if (v != null && !v.isBlank() && v.length() <= MAX_TOKEN_LENGTH) {
                    return v;
                }
            }
        }
        return null;
    }
}
