package com.tasks.api.infra;

import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags each request with an id, taken from {@value #REQ_ID_HEADER} or generated, that is echoed
 * on the response and available to log lines as {@code %X{requestId}}.
 */
@Component
public class RequestIdFilter implements Filter {

  public static final String MDC_KEY = "requestId";
  public static final String REQ_ID_HEADER = "X-Request-Id";

  @Override
  public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
      throws IOException, ServletException {

    String rid = ((HttpServletRequest) request).getHeader(REQ_ID_HEADER);
    if (rid == null || rid.isBlank()) {
      rid = UUID.randomUUID().toString();
    }
    ((HttpServletResponse) response).setHeader(REQ_ID_HEADER, rid);

    MDC.put(MDC_KEY, rid);
    try {
      chain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_KEY);
    }
  }
}
