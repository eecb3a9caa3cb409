package com.fever.assessment.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Bearer token for calls to the dialogue backend. A configured static token wins; otherwise an
 * HS256 service token is minted from the shared secret and cached until shortly before expiry.
 * With neither configured, calls go out unauthenticated.
 */
@Component
public class BackendTokenProvider {
  private static final String ALGORITHM = "HmacSHA256";
  private static final Map<String, Object> JWT_HEADER = Map.of("alg", "HS256", "typ", "JWT");
  private static final long MIN_TTL_SECONDS = 60;
  private static final long REFRESH_MARGIN_SECONDS = 30;

  private final ObjectMapper objectMapper;
  private final String staticToken;
  private final SecretKeySpec signingKey;
  private final String issuer;
  private final String audience;
  private final String subject;
  private final List<String> roles;
  private final long ttlSeconds;
  private final Clock clock;

  private String current;
  private long currentExpiresAt;

  @Autowired
  public BackendTokenProvider(
      ObjectMapper objectMapper,
      @Value("${assessment.remote.service-token:}") String staticToken,
      @Value("${assessment.remote.service-secret:}") String secret,
      @Value("${assessment.remote.service-issuer:}") String issuer,
      @Value("${assessment.remote.service-audience:}") String audience,
      @Value("${assessment.remote.service-subject:fever-assessment}") String subject,
      @Value("${assessment.remote.service-roles:service}") List<String> roles,
      @Value("${assessment.remote.service-ttl-seconds:3600}") long ttlSeconds) {
    this(objectMapper, staticToken, secret, issuer, audience, subject, roles, ttlSeconds,
        Clock.systemUTC());
  }

  BackendTokenProvider(ObjectMapper objectMapper, String staticToken, String secret, String issuer,
                       String audience, String subject, List<String> roles, long ttlSeconds,
                       Clock clock) {
    this.objectMapper = objectMapper;
    this.staticToken = StringUtils.hasText(staticToken) ? staticToken.trim() : null;
    this.signingKey = StringUtils.hasText(secret)
        ? new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM)
        : null;
    this.issuer = issuer;
    this.audience = audience;
    this.subject = subject;
    this.roles = roles == null ? List.of() : List.copyOf(roles);
    this.ttlSeconds = Math.max(ttlSeconds, MIN_TTL_SECONDS);
    this.clock = clock;
  }

  public synchronized Optional<String> getToken() {
    if (staticToken != null) {
      return Optional.of(staticToken);
    }
    if (signingKey == null) {
      return Optional.empty();
    }
    long now = clock.instant().getEpochSecond();
    if (current == null || now >= currentExpiresAt - REFRESH_MARGIN_SECONDS) {
      currentExpiresAt = now + ttlSeconds;
      current = mint(claims(now, currentExpiresAt));
    }
    return Optional.of(current);
  }

  private Map<String, Object> claims(long issuedAt, long expiresAt) {
    Map<String, Object> claims = new LinkedHashMap<>();
    claims.put("sub", subject);
    claims.put("iat", issuedAt);
    claims.put("exp", expiresAt);
    if (StringUtils.hasText(issuer)) {
      claims.put("iss", issuer);
    }
    if (StringUtils.hasText(audience)) {
      claims.put("aud", List.of(audience));
    }
    if (!roles.isEmpty()) {
      claims.put("roles", roles);
      claims.put("role", roles.get(0));
    }
    return claims;
  }

  private String mint(Map<String, Object> claims) {
    String unsigned = segment(JWT_HEADER) + "." + segment(claims);
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(signingKey);
      return unsigned + "." + encode(mac.doFinal(unsigned.getBytes(StandardCharsets.UTF_8)));
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Unable to sign backend service token", e);
    }
  }

  private String segment(Map<String, Object> json) {
    try {
      return encode(objectMapper.writeValueAsBytes(json));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to encode backend service token", e);
    }
  }

  private static String encode(byte[] bytes) {
    return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
  }
}
