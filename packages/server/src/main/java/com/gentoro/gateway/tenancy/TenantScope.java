package com.gentoro.gateway.tenancy;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Ordered, de-duplicated tenant ids a caller may act on. */
public record TenantScope(List<String> tenants) {

  public TenantScope {
    tenants = List.copyOf(new LinkedHashSet<>(tenants));
  }

  /** Keeps first-seen order; blank entries are dropped. */
  public static TenantScope of(Collection<String> tenants) {
    Set<String> ordered = new LinkedHashSet<>();
    for (String tenant : tenants) {
      if (tenant != null && !tenant.isBlank()) {
        ordered.add(tenant);
      }
    }
    return new TenantScope(List.copyOf(ordered));
  }

  public static TenantScope empty() {
    return new TenantScope(Collections.emptyList());
  }

  public boolean contains(String tenant) {
    return tenants.contains(tenant);
  }

  public boolean isEmpty() {
    return tenants.isEmpty();
  }

  public int size() {
    return tenants.size();
  }
}
