package com.gentoro.gateway.tenancy;

import com.gentoro.gateway.ConfigurationProvider;
import com.gentoro.gateway.credentials.CredentialStore;
import com.gentoro.gateway.exception.ConfigMissingException;
import com.gentoro.gateway.exception.NoTenantScopeException;
import com.gentoro.gateway.exception.TenantNotFoundException;
import com.gentoro.gateway.tenancy.OrganizationDirectory.Group;
import com.gentoro.gateway.tenancy.OrganizationDirectory.Organization;
import com.gentoro.gateway.tenancy.OrganizationDirectory.Team;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.apache.commons.configuration2.Configuration;

/**
 * Computes which tenants a caller may act on.
 *
 * <p>The role-derived part comes first: a plain member gets their own team, a group manager every
 * team of the group they own, an organization manager every team of every group of the
 * organization they own. Tenants tagged in the caller's metadata are appended after that, keeping
 * first-seen order.
 */
public class TenantResolver {
  private static final org.slf4j.Logger log =
      com.gentoro.gateway.logging.LoggingService.getLogger(TenantResolver.class);
  public static final int DEFAULT_TEAM_LIMIT = 1000;

  private final OrganizationDirectory directory;
  private final CredentialStore credentials;
  private final int teamLimit;

  public TenantResolver(
      OrganizationDirectory directory, CredentialStore credentials, int teamLimit) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.credentials = Objects.requireNonNull(credentials, "credentials");
    this.teamLimit = teamLimit > 0 ? teamLimit : DEFAULT_TEAM_LIMIT;
  }

  /**
   * Team limit from {@code AI_CORE_TEAM_LIMIT}, else {@code gateway.team-limit}, else {@value
   * #DEFAULT_TEAM_LIMIT}. Non-numeric or non-positive values fall back to the default.
   */
  public static int teamLimit(Configuration configuration) {
    String fromEnv = ConfigurationProvider.environment(configuration, "AI_CORE_TEAM_LIMIT");
    String raw =
        fromEnv != null && !fromEnv.isBlank()
            ? fromEnv
            : configuration.getString("gateway.team-limit", null);
    if (raw == null || raw.isBlank()) return DEFAULT_TEAM_LIMIT;
    try {
      int limit = Integer.parseInt(raw.trim());
      return limit > 0 ? limit : DEFAULT_TEAM_LIMIT;
    } catch (NumberFormatException e) {
      log.warn("Ignoring invalid team limit '{}', using {}", raw, DEFAULT_TEAM_LIMIT);
      return DEFAULT_TEAM_LIMIT;
    }
  }

  int teamLimit() {
    return teamLimit;
  }

  /**
   * Full scope of {@code identity}: role-derived tenants followed by {@code ai_core_member_of}
   * tags.
   *
   * @throws TenantNotFoundException if the caller's own team id is unknown to the directory
   * @throws NoTenantScopeException if nothing is derived at all
   */
  public TenantScope resolve(CallerIdentity identity) {
    List<String> tenants = new ArrayList<>(roleDerived(identity, true));
    tenants.addAll(tags(identity.metadata(), CallerIdentity.MEMBER_OF_KEY));
    TenantScope scope = TenantScope.of(tenants);
    if (scope.isEmpty()) {
      throw new NoTenantScopeException(identity.username());
    }
    log.debug("Resolved scope of {}: {}", identity.username(), scope.tenants());
    return scope;
  }

  /**
   * Tenants the caller can use right now: the role-derived tenants that have credentials, then the
   * {@code ai_instances} tags unfiltered. When the credential set cannot be loaded the role-derived
   * part is kept as is. May be empty.
   */
  public TenantScope resolveUsable(CallerIdentity identity) {
    List<String> discovered = roleDerived(identity, false);
    List<String> usable;
    try {
      Set<String> known = credentials.tenants();
      usable = discovered.stream().filter(known::contains).toList();
    } catch (ConfigMissingException e) {
      log.warn("Credentials unavailable, not filtering tenants of {}", identity.username());
      usable = discovered;
    }
    log.info(
        "Tenants of {}: discovered {}, with credentials {}",
        identity.username(),
        discovered,
        usable);
    List<String> tenants = new ArrayList<>(usable);
    tenants.addAll(tags(identity.metadata(), CallerIdentity.INSTANCES_KEY));
    return TenantScope.of(tenants);
  }

  /** The caller's own team, the target of single-tenant lifecycle operations. */
  public String resolveHomeTenant(CallerIdentity identity) {
    if (identity.teamId() == null) {
      throw new TenantNotFoundException(
          "User is not assigned to a team: " + identity.username(),
          Map.of("user", String.valueOf(identity.username())));
    }
    return ownTeam(identity).map(Team::name).orElseThrow(() -> unknownTeam(identity));
  }

  private List<String> roleDerived(CallerIdentity identity, boolean strict) {
    return switch (identity.role()) {
      case MANAGER -> managedGroup(identity).map(this::teamNamesOf).orElse(List.of());
      case MMM -> ownedOrganization(identity).map(this::teamNamesOfOrganization).orElse(List.of());
      case MEMBER -> {
        if (identity.teamId() == null) yield List.of();
        Optional<Team> team = ownTeam(identity);
        if (team.isEmpty() && strict) throw unknownTeam(identity);
        yield team.map(t -> List.of(t.name())).orElse(List.of());
      }
    };
  }

  private Optional<Group> managedGroup(CallerIdentity identity) {
    String username = identity.username();
    Optional<Group> ownGroup = ownTeam(identity).flatMap(t -> directory.findGroup(t.groupId()));
    if (ownGroup.isPresent()) {
      Group group = ownGroup.get();
      if (username.equals(group.owner())) {
        return ownGroup;
      }
      Optional<Group> sibling =
          firstOwned(directory.groupsOf(group.organizationId(), teamLimit), username);
      if (sibling.isPresent()) {
        return sibling;
      }
    }
    for (Organization organization : directory.organizations(teamLimit)) {
      Optional<Group> owned =
          firstOwned(directory.groupsOf(organization.id(), teamLimit), username);
      if (owned.isPresent()) {
        return owned;
      }
    }
    if (ownGroup.isPresent()) {
      log.debug("{} owns no group, falling back to own team's group", username);
    }
    return ownGroup;
  }

  private Optional<Organization> ownedOrganization(CallerIdentity identity) {
    String username = identity.username();
    Optional<Organization> ownOrganization =
        ownTeam(identity)
            .flatMap(t -> directory.findGroup(t.groupId()))
            .flatMap(g -> directory.findOrganization(g.organizationId()))
            .filter(o -> username.equals(o.owner()));
    if (ownOrganization.isPresent()) {
      return ownOrganization;
    }
    return directory.organizations(teamLimit).stream()
        .filter(o -> username.equals(o.owner()))
        .findFirst();
  }

  private static Optional<Group> firstOwned(List<Group> groups, String username) {
    return groups.stream().filter(g -> username.equals(g.owner())).findFirst();
  }

  private List<String> teamNamesOf(Group group) {
    return directory.teamsOf(group.id(), teamLimit).stream().map(Team::name).toList();
  }

  private List<String> teamNamesOfOrganization(Organization organization) {
    List<String> names = new ArrayList<>();
    for (Group group : directory.groupsOf(organization.id(), teamLimit)) {
      names.addAll(teamNamesOf(group));
    }
    return names;
  }

  private Optional<Team> ownTeam(CallerIdentity identity) {
    return identity.teamId() == null ? Optional.empty() : directory.findTeam(identity.teamId());
  }

  private static TenantNotFoundException unknownTeam(CallerIdentity identity) {
    return new TenantNotFoundException(
        "Team %s of user %s not found".formatted(identity.teamId(), identity.username()),
        Map.of("team", identity.teamId(), "user", String.valueOf(identity.username())));
  }

  /** Accepts a single string, or any collection / array whose non-blank string entries count. */
  static List<String> tags(Map<String, Object> metadata, String key) {
    Object value = metadata.get(key);
    List<String> out = new ArrayList<>();
    if (value instanceof String s) {
      if (!s.isBlank()) out.add(s);
    } else if (value instanceof Collection<?> items) {
      for (Object item : items) {
        if (item instanceof String s && !s.isBlank()) out.add(s);
      }
    } else if (value instanceof Object[] items) {
      for (Object item : items) {
        if (item instanceof String s && !s.isBlank()) out.add(s);
      }
    }
    return out;
  }
}
