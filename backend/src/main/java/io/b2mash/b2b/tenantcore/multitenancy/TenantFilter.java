package io.b2mash.b2b.tenantcore.multitenancy;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.b2b.tenantcore.config.TenancyProperties;
import io.b2mash.b2b.tenantcore.exception.TenantNotFoundException;
import io.b2mash.b2b.tenantcore.security.TenantClaims;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds the request's {@link TenantContext} from the authenticated token's tenant claim for the
 * rest of the filter chain. Requests for an unknown tenant are rejected before reaching any
 * handler.
 */
@Component
public class TenantFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(TenantFilter.class);

  private final TenantDirectory tenantDirectory;
  private final Cache<String, TenantContext> tenantCache;

  public TenantFilter(TenantDirectory tenantDirectory, TenancyProperties properties) {
    this.tenantDirectory = tenantDirectory;
    this.tenantCache =
        Caffeine.newBuilder()
            .maximumSize(properties.cache().maximumSize())
            .expireAfterWrite(properties.cache().ttl())
            .build();
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

    if (authentication instanceof JwtAuthenticationToken jwtAuth) {
      Jwt jwt = jwtAuth.getToken();
      String tenantIdentifier = TenantClaims.extractTenantIdentifier(jwt);

      if (tenantIdentifier != null) {
        TenantContext tenant = resolveTenant(tenantIdentifier);
        if (tenant == null) {
          response.sendError(HttpServletResponse.SC_FORBIDDEN, "Tenant not provisioned");
          return;
        }
        try (TenantScope.Binding ignored = TenantScope.bind(tenant)) {
          filterChain.doFilter(request, response);
        }
        return;
      }
    }

    // No JWT or no tenant claim: continue unbound, tenant-scoped access will fail fast
    filterChain.doFilter(request, response);
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getRequestURI();
    return path.startsWith("/internal/") || path.startsWith("/actuator/");
  }

  private TenantContext resolveTenant(String tenantIdentifier) {
    // Caffeine's cache.get(key, loader) throws NPE if loader returns null.
    // Use getIfPresent + manual put so unknown tenants are never cached.
    TenantContext cached = tenantCache.getIfPresent(tenantIdentifier);
    if (cached != null) {
      return cached;
    }
    try {
      TenantContext tenant = tenantDirectory.resolve(tenantIdentifier).toContext();
      tenantCache.put(tenantIdentifier, tenant);
      return tenant;
    } catch (TenantNotFoundException e) {
      log.warn("Rejected request for unknown tenant {}", tenantIdentifier);
      return null;
    }
  }
}
