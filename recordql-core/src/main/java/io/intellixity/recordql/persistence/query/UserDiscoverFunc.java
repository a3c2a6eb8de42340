package io.intellixity.recordql.persistence.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Finds users by identifying attributes, e.g. {@code {"email": ["a@x.com", "b@x.com"]}}. */
public record UserDiscoverFunc(Map<String, List<Object>> args) implements Func {
  public UserDiscoverFunc {
    Map<String, List<Object>> copy = new LinkedHashMap<>();
    if (args != null) {
      for (var e : args.entrySet()) {
        copy.put(e.getKey(), e.getValue() == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(e.getValue())));
      }
    }
    args = Collections.unmodifiableMap(copy);
  }

  public static UserDiscoverFunc byEmails(List<?> emails) {
    return new UserDiscoverFunc(Map.of("email", new ArrayList<>(emails)));
  }

  /** Values given for {@code name}; empty when absent. */
  public List<Object> argsByName(String name) {
    List<Object> v = args.get(name);
    return v == null ? List.of() : v;
  }

  @Override
  public <R> R accept(FuncVisitor<R> visitor) { return visitor.visit(this); }
}
