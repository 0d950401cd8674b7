package com.gentoro.gateway.tenancy;

import java.util.Locale;

/** Role of a member inside the organization directory. */
public enum TeamRole {
  MEMBER,
  /** Group manager: sees every team of the group they own. */
  MANAGER,
  /** Organization manager: sees every team of the organization they own. */
  MMM;

  /** Lenient parse; unknown or blank values map to {@link #MEMBER}. */
  public static TeamRole parse(String value) {
    if (value == null || value.isBlank()) return MEMBER;
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "manager" -> MANAGER;
      case "mmm" -> MMM;
      default -> MEMBER;
    };
  }
}
