/*
 * どこで: Box セキュリティ設定
 * 何を: 内部トークンと転送ユーザー ID から認証情報を組み立てる
 * なぜ: 呼び出し元ユーザーを X-User-Id で受け取り、トークン不一致の呼び出しを弾くため
 */
package com.example.lockbox.box.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

public class InternalApiAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger =
      LoggerFactory.getLogger(InternalApiAuthenticationFilter.class);
  private static final String INTERNAL_ROLE = "ROLE_INTERNAL";
  private static final String EVENT_PRINCIPAL = "invitation-event-relay";

  private final BoxInternalApiProperties properties;

  public InternalApiAuthenticationFilter(BoxInternalApiProperties properties) {
    this.properties = properties;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !isBoxRequest(request) && !isInternalRequest(request);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    if (!isValidInternalToken(request.getHeader(properties.headerName()))) {
      logger.debug("internal token missing or invalid path={}", request.getRequestURI());
      filterChain.doFilter(request, response);
      return;
    }
    if (isBoxRequest(request)) {
      final String forwardedUserId = request.getHeader(properties.userIdHeaderName());
      if (forwardedUserId == null || forwardedUserId.isBlank()) {
        logger.warn(
            "box request rejected: missing required header {} on path={}",
            properties.userIdHeaderName(),
            request.getRequestURI());
        response.sendError(HttpServletResponse.SC_UNAUTHORIZED);
        return;
      }
      authenticate(forwardedUserId);
    } else {
      authenticate(EVENT_PRINCIPAL);
    }
    filterChain.doFilter(request, response);
  }

  private void authenticate(String principal) {
    SecurityContextHolder.getContext()
        .setAuthentication(
            new UsernamePasswordAuthenticationToken(
                principal, "N/A", List.of(new SimpleGrantedAuthority(INTERNAL_ROLE))));
  }

  private boolean isBoxRequest(HttpServletRequest request) {
    final String uri = request.getRequestURI();
    return uri != null && uri.startsWith("/v1/boxes");
  }

  private boolean isInternalRequest(HttpServletRequest request) {
    final String uri = request.getRequestURI();
    return uri != null && uri.startsWith("/internal/");
  }

  private boolean isValidInternalToken(String actualToken) {
    return actualToken != null
        && !properties.token().isBlank()
        && actualToken.equals(properties.token());
  }
}
