package com.phillippitts.platemate.config.logging;

import com.phillippitts.platemate.service.conversation.ConversationClient;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Adds request-scoped values to Log4j2's MDC (ThreadContext) for every API call.
 *
 * <p>Values added:</p>
 * <ul>
 *   <li>requestId: from X-Request-ID header, or generated UUID</li>
 *   <li>sessionToken: token of the open chat session, when there is one</li>
 *   <li>method and uri of the request</li>
 * </ul>
 *
 * <p>The chat executor copies the context to its workers, so a query's log lines on both threads
 * share the request id and session token. The context is always cleared after the request.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String REQUEST_ID_KEY = "requestId";

    private final ObjectProvider<ConversationClient> conversation;

    public MdcFilter(ObjectProvider<ConversationClient> conversation) {
        this.conversation = conversation;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                ThreadContext.put(REQUEST_ID_KEY, requestIdOf(http));
                ThreadContext.put("method", http.getMethod());
                ThreadContext.put("uri", http.getRequestURI());
                ConversationClient client = conversation.getIfAvailable();
                if (client != null) {
                    client.currentToken().ifPresent(token ->
                            ThreadContext.put(ConversationClient.MDC_SESSION_TOKEN, token.toString()));
                }
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    private static String requestIdOf(HttpServletRequest req) {
        String v = req.getHeader(REQUEST_ID_HEADER);
        return (v == null || v.isBlank()) ? UUID.randomUUID().toString() : v;
    }
}
