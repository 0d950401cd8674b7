package com.gentoro.gateway.tenancy;

import java.util.Collections;
import java.util.Map;

/**
 * Authenticated caller as seen by the gateway.
 *
 * @param username login name, also used for ownership checks in the directory
 * @param email contact address, informational only
 * @param teamId id of the caller's own team or {@code null}
 * @param role caller's role in the directory
 * @param metadata free-form member metadata; tenant tags live under {@link #MEMBER_OF_KEY} and
 *     {@link #INSTANCES_KEY}
 */
public record CallerIdentity(
    String username, String email, String teamId, TeamRole role, Map<String, Object> metadata) {
  public static final String MEMBER_OF_KEY = "ai_core_member_of";
  public static final String INSTANCES_KEY = "ai_instances";

  public CallerIdentity {
    role = role == null ? TeamRole.MEMBER : role;
    metadata = metadata == null ? Collections.emptyMap() : Collections.unmodifiableMap(metadata);
  }

  public static CallerIdentity member(String username, String teamId) {
    return new CallerIdentity(username, null, teamId, TeamRole.MEMBER, null);
  }
}
