package com.tradecontrol.config;

import com.tradecontrol.api.dto.response.ApiErrorResponse;
import com.tradecontrol.api.dto.response.ApiResponse;
import org.springframework.core.MethodParameter;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

/**
 * Wraps bodies returned by the operator controllers ({@code /api/**}) in {@link ApiResponse}.
 * Bodies that are already envelopes, plain strings and anything outside {@code /api} pass through.
 */
@RestControllerAdvice
public class ApiResponseAdvice implements ResponseBodyAdvice<Object> {

    private static final String API_PREFIX = "/api/";

    @Override
    public boolean supports(MethodParameter returnType, Class<? extends HttpMessageConverter<?>> converterType) {
        return !StringHttpMessageConverter.class.isAssignableFrom(converterType);
    }

    @Override
    public Object beforeBodyWrite(
            Object body,
            MethodParameter returnType,
            MediaType selectedContentType,
            Class<? extends HttpMessageConverter<?>> selectedConverterType,
            ServerHttpRequest request,
            ServerHttpResponse response) {
        if (!request.getURI().getPath().startsWith(API_PREFIX) || isEnvelope(body)) {
            return body;
        }
        return ApiResponse.ok(body);
    }

    private static boolean isEnvelope(Object body) {
        return body instanceof ApiResponse<?> || body instanceof ApiErrorResponse;
    }
}
