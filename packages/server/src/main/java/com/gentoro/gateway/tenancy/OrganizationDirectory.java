package com.gentoro.gateway.tenancy;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the organization / group / team hierarchy. A team's name doubles as its
 * tenant id.
 *
 * <p>Listing methods return at most {@code limit} entries.
 */
public interface OrganizationDirectory {

  record Organization(String id, String name, String owner) {}

  record Group(String id, String name, String organizationId, String owner) {}

  record Team(String id, String name, String groupId) {}

  Optional<Team> findTeam(String teamId);

  Optional<Group> findGroup(String groupId);

  Optional<Organization> findOrganization(String organizationId);

  List<Organization> organizations(int limit);

  List<Group> groupsOf(String organizationId, int limit);

  List<Team> teamsOf(String groupId, int limit);
}
