package com.hidego.security;

import com.hidego.config.HidegoProperties;
import com.hidego.config.SecretsConfig;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.security.web.util.matcher.IpAddressMatcher;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * Authenticates inbound Telegram webhook requests: the source address must fall in
 * the platform's published ranges (when enforced) and the secret header must match
 * the configured webhook secret. Other requests pass through.
 */
@Component
public class WebhookAuthFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(WebhookAuthFilter.class);

    static final String SECRET_HEADER = "X-Telegram-Bot-Api-Secret-Token";
    private static final String WEBHOOK_PATH = "/webhook/";

    private final boolean enforceIpAllowlist;
    private final List<IpAddressMatcher> allowedRanges;
    private final byte[] secret;

    public WebhookAuthFilter(HidegoProperties properties, SecretsConfig secretsConfig) {
        HidegoProperties.WebhookProperties webhook = properties.getWebhook();
        this.enforceIpAllowlist = webhook.isEnforceIpAllowlist();
        this.allowedRanges = webhook.getAllowedIpRanges().stream().map(IpAddressMatcher::new).toList();
        String configured = secretsConfig.getWebhookSecretToken();
        this.secret = configured == null ? new byte[0] : configured.getBytes(StandardCharsets.UTF_8);
        if (secret.length == 0) {
            log.warn("hidego.secrets.webhook-secret-token is not set, all webhook deliveries will be rejected");
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith(WEBHOOK_PATH);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                   HttpServletResponse response,
                                   FilterChain filterChain) throws ServletException, IOException {
        String remoteAddr = request.getRemoteAddr();
        if (enforceIpAllowlist && !fromAllowedRange(remoteAddr)) {
            log.warn("Webhook call from outside the allowed ranges: ip={}", remoteAddr);
            reject(response);
            return;
        }
        if (!secretMatches(request.getHeader(SECRET_HEADER))) {
            log.warn("Webhook secret mismatch: ip={}", remoteAddr);
            reject(response);
            return;
        }
        filterChain.doFilter(request, response);
    }

    private boolean fromAllowedRange(String remoteAddr) {
        if (remoteAddr == null) {
            return false;
        }
        try {
            return allowedRanges.stream().anyMatch(range -> range.matches(remoteAddr));
        } catch (IllegalArgumentException e) {
            log.warn("Unparseable remote address {}: {}", remoteAddr, e.getMessage());
            return false;
        }
    }

    private boolean secretMatches(String header) {
        if (secret.length == 0 || header == null) {
            return false;
        }
        return MessageDigest.isEqual(secret, header.getBytes(StandardCharsets.UTF_8));
    }

    private void reject(HttpServletResponse response) throws IOException {
        response.setStatus(HttpServletResponse.SC_FORBIDDEN);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write("{\"status\":\"error\",\"message\":\"Forbidden\"}");
    }
}
