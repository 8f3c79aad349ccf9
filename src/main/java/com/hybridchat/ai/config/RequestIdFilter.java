package com.hybridchat.ai.config;

import com.hybridchat.ai.memory.MemoryStore;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Puts the request id and the addressed conversation into the MDC and onto the current span.
 */
@Component
public class RequestIdFilter extends OncePerRequestFilter {

  static final String REQUEST_ID_HEADER = "X-Request-Id";
  static final String REQUEST_ID_KEY = "requestId";
  static final String CONVERSATION_ID_PARAM = "conversationId";

  private final Tracer tracer;

  public RequestIdFilter(Tracer tracer) {
    this.tracer = tracer;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain) throws ServletException, IOException {
    String requestId = request.getHeader(REQUEST_ID_HEADER);
    if (requestId == null || requestId.isBlank()) {
      requestId = UUID.randomUUID().toString();
    }
    // Chat requests carry the id in the body; ChatService overwrites this entry for them.
    String conversationId =
        MemoryStore.resolveConversationId(request.getParameter(CONVERSATION_ID_PARAM));

    MDC.put(REQUEST_ID_KEY, requestId);
    MDC.put(CONVERSATION_ID_PARAM, conversationId);
    response.setHeader(REQUEST_ID_HEADER, requestId);

    Span span = tracer.currentSpan();
    if (span != null) {
      span.tag(REQUEST_ID_KEY, requestId);
      span.tag(CONVERSATION_ID_PARAM, conversationId);
    }

    try {
      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(REQUEST_ID_KEY);
      MDC.remove(CONVERSATION_ID_PARAM);
    }
  }
}
