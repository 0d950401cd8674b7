package com.gentoro.gateway.tenancy;

import com.gentoro.gateway.exception.ValidationException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** {@link OrganizationDirectory} backed by maps, filled through {@link #builder()}. */
public class InMemoryOrganizationDirectory implements OrganizationDirectory {
  private final Map<String, Organization> organizations;
  private final Map<String, Group> groups;
  private final Map<String, Team> teams;
  private final List<String> organizationOrder;
  private final List<String> groupOrder;
  private final List<String> teamOrder;

  private InMemoryOrganizationDirectory(Builder builder) {
    this.organizations = Map.copyOf(builder.organizations);
    this.groups = Map.copyOf(builder.groups);
    this.teams = Map.copyOf(builder.teams);
    this.organizationOrder = List.copyOf(builder.organizations.keySet());
    this.groupOrder = List.copyOf(builder.groups.keySet());
    this.teamOrder = List.copyOf(builder.teams.keySet());
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public Optional<Team> findTeam(String teamId) {
    return Optional.ofNullable(teamId).map(teams::get);
  }

  @Override
  public Optional<Group> findGroup(String groupId) {
    return Optional.ofNullable(groupId).map(groups::get);
  }

  @Override
  public Optional<Organization> findOrganization(String organizationId) {
    return Optional.ofNullable(organizationId).map(organizations::get);
  }

  @Override
  public List<Organization> organizations(int limit) {
    return organizationOrder.stream().limit(limit).map(organizations::get).toList();
  }

  @Override
  public List<Group> groupsOf(String organizationId, int limit) {
    return groupOrder.stream()
        .map(groups::get)
        .filter(g -> g.organizationId().equals(organizationId))
        .limit(limit)
        .toList();
  }

  @Override
  public List<Team> teamsOf(String groupId, int limit) {
    return teamOrder.stream()
        .map(teams::get)
        .filter(t -> t.groupId().equals(groupId))
        .limit(limit)
        .toList();
  }

  public static final class Builder {
    private final Map<String, Organization> organizations = new LinkedHashMap<>();
    private final Map<String, Group> groups = new LinkedHashMap<>();
    private final Map<String, Team> teams = new LinkedHashMap<>();

    private Builder() {}

    public Builder organization(String id, String owner) {
      organizations.put(id, new Organization(id, id, owner));
      return this;
    }

    public Builder group(String id, String organizationId, String owner) {
      groups.put(id, new Group(id, id, organizationId, owner));
      return this;
    }

    /** Adds a team whose id and name are the same. */
    public Builder team(String name, String groupId) {
      return team(name, name, groupId);
    }

    public Builder team(String id, String name, String groupId) {
      teams.put(id, new Team(id, name, groupId));
      return this;
    }

    public InMemoryOrganizationDirectory build() {
      List<String> dangling = new ArrayList<>();
      groups.values().stream()
          .filter(g -> !organizations.containsKey(g.organizationId()))
          .forEach(g -> dangling.add("group " + g.id()));
      teams.values().stream()
          .filter(t -> !groups.containsKey(t.groupId()))
          .forEach(t -> dangling.add("team " + t.id()));
      if (!dangling.isEmpty()) {
        throw new ValidationException("Entries reference unknown parents: " + dangling);
      }
      return new InMemoryOrganizationDirectory(this);
    }
  }
}
