package io.intellixity.recordql.persistence.acl;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/** Acting user: id plus the distinct role names it holds, in the order given. */
public record UserInfo(String id, List<String> roles) {
  public UserInfo {
    id = id == null ? "" : id;
    roles = roles == null ? List.of() : List.copyOf(new LinkedHashSet<>(roles));
  }

  public static UserInfo of(String id, String... roles) {
    return new UserInfo(id, List.of(roles));
  }

  public static UserInfo of(String id, Collection<String> roles) {
    return new UserInfo(id, roles == null ? List.of() : new ArrayList<>(roles));
  }

  public boolean isAnonymous() { return id.isEmpty(); }
}
