package io.books4all.gateway.auth;

public enum Role {
  BUYER("buyer"),
  SELLER("seller"),
  ADMIN("admin");

  private final String code;

  Role(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static Role fromCode(String value) {
    if (value == null) throw new IllegalArgumentException("role required");
    for (Role role : values()) {
      if (role.code.equalsIgnoreCase(value.trim())) return role;
    }
    throw new IllegalArgumentException("unsupported role: " + value);
  }
}
