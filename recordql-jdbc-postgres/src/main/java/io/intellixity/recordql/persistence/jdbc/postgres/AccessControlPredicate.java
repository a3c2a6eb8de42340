package io.intellixity.recordql.persistence.jdbc.postgres;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.recordql.persistence.acl.AclLevel;
import io.intellixity.recordql.persistence.acl.UserInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Row-visibility predicate over the {@code _access} JSONB column.
 *
 * <p>Record accessible by user alice: {@code _access @> '[{"user_id":"alice"}]'}<br>
 * Record accessible by role admin: {@code _access @> '[{"role":"admin"}]'}</p>
 *
 * <p>A record is visible when any of the user's roles or the user id is granted, when it has no
 * access list at all, or when the user owns it. {@link AclLevel#WRITE} only accepts grants
 * carrying {@code "level":"write"}; ownership and a missing access list grant every level.</p>
 */
public final class AccessControlPredicate {
  private static final ObjectMapper JSON = new ObjectMapper();

  private AccessControlPredicate() {}

  /** Empty fragment for an anonymous user; callers omit the predicate in that case. */
  public static SqlFragment build(UserInfo user, AclLevel level) {
    Objects.requireNonNull(user, "user");
    AclLevel effective = level == null ? AclLevel.READ : level;
    if (user.isAnonymous()) return SqlFragment.empty();

    List<String> terms = new ArrayList<>();
    for (String role : user.roles()) {
      terms.add("_access @> " + grant("role", role, effective));
    }
    terms.add("_access @> " + grant("user_id", user.id(), effective));
    terms.add("_access IS NULL");
    terms.add("_owner_id = ?");
    return new SqlFragment("(" + String.join(" OR ", terms) + ")", Collections.singletonList(user.id()));
  }

  private static String grant(String key, String value, AclLevel level) {
    ArrayNode entries = JSON.createArrayNode();
    ObjectNode entry = entries.addObject();
    entry.put(key, value);
    if (level == AclLevel.WRITE) entry.put("level", level.value());
    try {
      return PostgresIdentifiers.quoteLiteral(JSON.writeValueAsString(entries));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("unexpected serialize error on access entry " + key, e);
    }
  }
}
