package com.ospicorp.capacityforecast.config;

import jakarta.servlet.http.HttpServletRequest;

final class RequestInfo {
  private RequestInfo() {
  }

  static String uriWithQuery(HttpServletRequest request) {
    String query = request.getQueryString();
    if (query == null || query.isBlank()) {
      return request.getRequestURI();
    }
    return request.getRequestURI() + "?" + query;
  }

  static String clientIp(HttpServletRequest request) {
    String forwarded = request.getHeader("X-Forwarded-For");
    if (forwarded != null && !forwarded.isBlank()) {
      return forwarded.split(",")[0].trim();
    }
    return request.getRemoteAddr();
  }
}
