package com.gentoro.gateway.tenancy;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.gentoro.gateway.credentials.CredentialStore;
import com.gentoro.gateway.exception.ConfigMissingException;
import com.gentoro.gateway.exception.NoTenantScopeException;
import com.gentoro.gateway.exception.TenantNotFoundException;
import com.gentoro.gateway.exception.ValidationException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TenantResolverTest {

  @Mock private CredentialStore credentials;

  private TenantResolver resolver;

  @BeforeEach
  void setUp() {
    OrganizationDirectory directory =
        InMemoryOrganizationDirectory.builder()
            .organization("org-1", "olivia")
            .group("grp-a", "org-1", "gary")
            .group("grp-b", "org-1", "bea")
            .team("t-1", "team-a1", "grp-a")
            .team("t-2", "team-a2", "grp-a")
            .team("t-3", "team-b1", "grp-b")
            .build();
    resolver = new TenantResolver(directory, credentials, 100);
  }

  private static CallerIdentity caller(
      String username, String teamId, TeamRole role, Map<String, Object> metadata) {
    return new CallerIdentity(username, username + "@example.com", teamId, role, metadata);
  }

  @Test
  void memberGetsOwnTeamFollowedByTags() {
    CallerIdentity alice =
        caller(
            "alice",
            "t-1",
            TeamRole.MEMBER,
            Map.of(CallerIdentity.MEMBER_OF_KEY, List.of("team-x", "team-a1", " ")));

    TenantScope scope = resolver.resolve(alice);

    assertEquals(List.of("team-a1", "team-x"), scope.tenants());
  }

  @Test
  void singleStringTagIsAccepted() {
    CallerIdentity alice =
        caller("alice", "t-1", TeamRole.MEMBER, Map.of(CallerIdentity.MEMBER_OF_KEY, "team-x"));

    assertEquals(List.of("team-a1", "team-x"), resolver.resolve(alice).tenants());
  }

  @Test
  void managerGetsEveryTeamOfOwnedGroup() {
    CallerIdentity gary = caller("gary", "t-1", TeamRole.MANAGER, null);

    assertEquals(List.of("team-a1", "team-a2"), resolver.resolve(gary).tenants());
  }

  @Test
  void managerOwningSiblingGroupGetsThatGroup() {
    // bea sits in team-a1 but owns grp-b
    CallerIdentity bea = caller("bea", "t-1", TeamRole.MANAGER, null);

    assertEquals(List.of("team-b1"), resolver.resolve(bea).tenants());
  }

  @Test
  void managerOwningNothingFallsBackToOwnGroup() {
    CallerIdentity mike = caller("mike", "t-3", TeamRole.MANAGER, null);

    assertEquals(List.of("team-b1"), resolver.resolve(mike).tenants());
  }

  @Test
  void organizationManagerGetsWholeOrganization() {
    CallerIdentity olivia = caller("olivia", null, TeamRole.MMM, null);

    assertEquals(List.of("team-a1", "team-a2", "team-b1"), resolver.resolve(olivia).tenants());
  }

  @Test
  void callerWithoutAnythingHasNoScope() {
    CallerIdentity nobody = caller("nobody", null, TeamRole.MEMBER, null);

    NoTenantScopeException ex =
        assertThrows(NoTenantScopeException.class, () -> resolver.resolve(nobody));
    assertTrue(ex.getMessage().contains("nobody"));
  }

  @Test
  void unknownOwnTeamIsReported() {
    CallerIdentity ghost = CallerIdentity.member("ghost", "t-404");

    assertThrows(TenantNotFoundException.class, () -> resolver.resolve(ghost));
  }

  @Test
  void usableScopeDropsTenantsWithoutCredentials() {
    when(credentials.tenants()).thenReturn(Set.of("team-a2", "team-x"));
    CallerIdentity gary =
        caller(
            "gary",
            "t-1",
            TeamRole.MANAGER,
            Map.of(CallerIdentity.INSTANCES_KEY, new String[] {"team-z", "team-a2"}));

    TenantScope scope = resolver.resolveUsable(gary);

    assertEquals(List.of("team-a2", "team-z"), scope.tenants());
  }

  @Test
  void usableScopeSkipsFilterWhenCredentialsAreMissing() {
    when(credentials.tenants()).thenThrow(new ConfigMissingException("no credentials"));
    CallerIdentity gary = caller("gary", "t-1", TeamRole.MANAGER, null);

    assertEquals(List.of("team-a1", "team-a2"), resolver.resolveUsable(gary).tenants());
  }

  @Test
  void usableScopeToleratesUnknownTeam() {
    when(credentials.tenants()).thenReturn(Set.of());

    assertTrue(resolver.resolveUsable(CallerIdentity.member("ghost", "t-404")).isEmpty());
  }

  @Test
  void homeTenantIsOwnTeamName() {
    assertEquals("team-a2", resolver.resolveHomeTenant(CallerIdentity.member("al", "t-2")));
    assertThrows(
        TenantNotFoundException.class,
        () -> resolver.resolveHomeTenant(CallerIdentity.member("al", null)));
    assertThrows(
        TenantNotFoundException.class,
        () -> resolver.resolveHomeTenant(CallerIdentity.member("al", "t-404")));
  }

  @Test
  void teamLimitReadsConfigurationAndFallsBack() {
    BaseConfiguration cfg = new BaseConfiguration();
    assertEquals(TenantResolver.DEFAULT_TEAM_LIMIT, TenantResolver.teamLimit(cfg));

    cfg.setProperty("gateway.team-limit", "25");
    assertEquals(25, TenantResolver.teamLimit(cfg));

    cfg.setProperty("gateway.team-limit", "lots");
    assertEquals(TenantResolver.DEFAULT_TEAM_LIMIT, TenantResolver.teamLimit(cfg));

    cfg.setProperty("gateway.team-limit", "-3");
    assertEquals(TenantResolver.DEFAULT_TEAM_LIMIT, TenantResolver.teamLimit(cfg));
  }

  @Test
  void teamLimitCapsDirectoryQueries() {
    OrganizationDirectory directory =
        InMemoryOrganizationDirectory.builder()
            .organization("org-1", "olivia")
            .group("grp-a", "org-1", "gary")
            .team("a1", "grp-a")
            .team("a2", "grp-a")
            .team("a3", "grp-a")
            .build();
    TenantResolver limited = new TenantResolver(directory, credentials, 2);

    assertEquals(2, limited.teamLimit());
    assertEquals(
        List.of("a1", "a2"),
        limited.resolve(caller("gary", "a1", TeamRole.MANAGER, null)).tenants());
  }

  @Test
  void directoryRejectsDanglingParents() {
    assertThrows(
        ValidationException.class,
        () -> InMemoryOrganizationDirectory.builder().team("lost", "grp-missing").build());
  }
}
