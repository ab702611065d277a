package com.ospicorp.capacityforecast.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

  @Override
  protected void doFilterInternal(@NonNull HttpServletRequest request,
      @NonNull HttpServletResponse response, @NonNull FilterChain filterChain)
      throws ServletException, IOException {
    long started = System.nanoTime();
    try {
      filterChain.doFilter(request, response);
    } catch (ServletException | IOException | RuntimeException ex) {
      log.error("{} {} from {} failed: {}", request.getMethod(), RequestInfo.uriWithQuery(request),
          RequestInfo.clientIp(request), ex.getMessage(), ex);
      throw ex;
    } finally {
      long elapsedMs = (System.nanoTime() - started) / 1_000_000;
      log.info("HTTP {} {} ({} bytes in) -> {} ({} ms)", request.getMethod(),
          RequestInfo.uriWithQuery(request), request.getContentLengthLong(), response.getStatus(),
          elapsedMs);
    }
  }
}
