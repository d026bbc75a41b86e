package com.nextactiontracker.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nextactiontracker.exception.ErrorCode;
import com.nextactiontracker.exception.InvalidTenantException;
import com.nextactiontracker.model.dto.ErrorResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.Set;
import java.util.UUID;

/**
 * Filter resolving the calling tenant from the X-Tenant-ID header.
 * Sets the tenant UUID as the authentication principal, or rejects the
 * request with 400 when the header is missing or not a UUID.
 */
@Slf4j
@RequiredArgsConstructor
public class TenantHeaderAuthenticationFilter implements WebFilter {

    public static final String TENANT_HEADER = "X-Tenant-ID";
    public static final String[] PUBLIC_PATHS = {"/", "/health"};

    private static final Set<String> PUBLIC_PATH_SET = Set.of(PUBLIC_PATHS);

    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();
        HttpMethod method = exchange.getRequest().getMethod();

        if (isPublicEndpoint(path) || HttpMethod.OPTIONS.equals(method)) {
            return chain.filter(exchange);
        }

        UUID tenantId;
        try {
            tenantId = parseTenantId(exchange.getRequest().getHeaders().getFirst(TENANT_HEADER));
        } catch (InvalidTenantException e) {
            log.warn("Rejected request: {} (method={}, path={})", e.getMessage(), method, path);
            return writeError(exchange.getResponse(), e);
        }

        log.info("Processing request: tenant={}, method={}, path={}", tenantId, method, path);

        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(tenantId, null, AuthorityUtils.NO_AUTHORITIES);

        return chain.filter(exchange)
                .contextWrite(ReactiveSecurityContextHolder.withAuthentication(authentication));
    }

    static UUID parseTenantId(String header) {
        if (header == null || header.isBlank()) {
            throw new InvalidTenantException(TENANT_HEADER + " header is required");
        }
        try {
            return UUID.fromString(header.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidTenantException(TENANT_HEADER + " must be a valid UUID");
        }
    }

    private boolean isPublicEndpoint(String path) {
        return PUBLIC_PATH_SET.contains(path) || path.startsWith("/actuator");
    }

    private Mono<Void> writeError(ServerHttpResponse response, InvalidTenantException ex) {
        ErrorResponse error = ErrorResponse.builder()
                .detail(ex.getMessage())
                .errorCode(ErrorCode.INVALID_TENANT)
                .traceId(UUID.randomUUID().toString())
                .build();
        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(error);
        } catch (JsonProcessingException e) {
            return Mono.error(new IllegalStateException("Failed to serialize error response", e));
        }
        response.setStatusCode(HttpStatus.BAD_REQUEST);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        DataBuffer buffer = response.bufferFactory().wrap(body);
        return response.writeWith(Mono.just(buffer));
    }
}
