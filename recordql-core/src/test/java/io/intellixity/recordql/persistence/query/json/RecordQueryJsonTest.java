package io.intellixity.recordql.persistence.query.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.recordql.persistence.acl.UserInfo;
import io.intellixity.recordql.persistence.query.*;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static io.intellixity.recordql.persistence.query.Predicates.*;
import static org.junit.jupiter.api.Assertions.*;

final class RecordQueryJsonTest {
  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void readsFullQuery() throws Exception {
    String json = """
        {
          "recordType": "note",
          "filter": {"and": [
            {"eq": [{"keyPath": "title"}, {"value": "hello"}]},
            {"not": {"in": [{"keyPath": "tag"}, {"value": ["a", "b"]}]}},
            {"func": {"userRelation": {"name": "_friend", "direction": "mutual", "user": "bob"}}}
          ]},
          "sort": [
            {"keyPath": "title", "order": "desc"},
            {"func": {"distance": {"field": "location", "lat": 22.3, "lng": 114.2}}}
          ],
          "viewAs": {"id": "alice", "roles": ["admin", "admin", "writer"]},
          "limit": 10,
          "offset": 5,
          "count": true
        }
        """;

    RecordQuery q = mapper.readValue(json, RecordQuery.class);

    assertEquals("note", q.recordType());
    CompoundPredicate and = assertInstanceOf(CompoundPredicate.class, q.predicate());
    assertEquals(Operator.AND, and.operator());
    assertEquals(eq("title", "hello"), and.children().get(0));
    assertEquals(not(in("tag", List.of("a", "b"))), and.children().get(1));
    assertEquals(functional(new UserRelationFunc("", "_friend", UserRelationFunc.MUTUAL, "bob")),
        and.children().get(2));

    assertEquals(Sort.by("title", SortOrder.DESC), q.sorts().get(0));
    assertEquals(Sort.by(new DistanceFunc("location", Location.of(22.3, 114.2)), SortOrder.ASC), q.sorts().get(1));

    assertEquals(UserInfo.of("alice", "admin", "writer"), q.viewAsUser());
    assertFalse(q.bypassAccessControl());
    assertEquals(Integer.valueOf(10), q.limit());
    assertEquals(5, q.offset());
    assertTrue(q.withCount());
  }

  @Test
  void decodesTaggedValuesAtAnyDepth() throws Exception {
    String json = """
        {"recordType": "note", "filter": {"eq": [{"keyPath": "meta"}, {"value": {
          "owner": {"$ref": {"type": "user", "key": "u1"}},
          "places": [{"$location": {"lat": 1.5, "lng": 2.5}}, null]
        }}]}}
        """;

    ComparisonPredicate eq = (ComparisonPredicate) mapper.readValue(json, RecordQuery.class).predicate();
    Map<?, ?> value = (Map<?, ?>) ((Literal) eq.right()).value();
    assertEquals(new Reference("user", "u1"), value.get("owner"));
    assertEquals(Arrays.asList(Location.of(1.5, 2.5), null), value.get("places"));
  }

  @Test
  void readsDiscoverAndUserDataFunctions() throws Exception {
    String json = """
        {"recordType": "user", "filter": {"and": [
          {"func": {"userDiscover": {"email": ["a@x.com", "b@x.com"], "phone": "123"}}},
          {"eq": [{"func": {"userData": "email"}}, {"value": "a@x.com"}]}
        ]}}
        """;

    CompoundPredicate and = (CompoundPredicate) mapper.readValue(json, RecordQuery.class).predicate();
    FunctionalPredicate discover = (FunctionalPredicate) and.children().get(0);
    UserDiscoverFunc fn = (UserDiscoverFunc) ((FunctionCall) discover.expression()).func();
    assertEquals(List.of("a@x.com", "b@x.com"), fn.argsByName("email"));
    assertEquals(List.of("123"), fn.argsByName("phone"));
    assertEquals(List.of(), fn.argsByName("username"));

    ComparisonPredicate byUserData = (ComparisonPredicate) and.children().get(1);
    assertEquals(call(new UserDataFunc("email")), byUserData.left());
  }

  @Test
  void unknownSortOrderIsAValidationFailure() {
    String json = "{\"recordType\":\"note\",\"sort\":[{\"keyPath\":\"title\",\"order\":\"sideways\"}]}";
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> mapper.readValue(json, RecordQuery.class));
    assertEquals(QueryValidationException.Reason.UNKNOWN_SORT_ORDER, ex.reason());
  }

  @Test
  void rejectsMalformedPredicates() {
    assertThrows(IllegalArgumentException.class,
        () -> mapper.readValue("{\"filter\":{\"between\":[{\"keyPath\":\"a\"},{\"value\":1}]}}", RecordQuery.class));
    assertThrows(IllegalArgumentException.class,
        () -> mapper.readValue("{\"filter\":{\"eq\":[{\"keyPath\":\"a\"}]}}", RecordQuery.class));
    assertThrows(IllegalArgumentException.class,
        () -> mapper.readValue("{\"filter\":{\"func\":{\"median\":{}}}}", RecordQuery.class));
  }

  @Test
  void writesCanonicalForm() throws Exception {
    RecordQuery q = RecordQuery.of("note", and(
            gte("score", 3),
            contains("tags", new Reference("tag", "t1")),
            functional(new UserRelationFunc("author", "_follow", UserRelationFunc.INWARD, "bob"))))
        .withSort(Sort.by("score", SortOrder.DESC))
        .withBypassAccessControl(true)
        .withLimit(20);

    JsonNode tree = mapper.readTree(mapper.writeValueAsString(q));
    JsonNode children = tree.get("filter").get("and");
    assertEquals(3, children.size());
    assertEquals(3, children.get(0).get("gte").get(1).get("value").asInt());
    assertEquals("t1", children.get(1).get("in").get(0).get("value").get("$ref").get("key").asText());
    assertEquals("tags", children.get(1).get("in").get(1).get("keyPath").asText());
    assertEquals("inward", children.get(2).get("func").get("userRelation").get("direction").asText());
    assertEquals("desc", tree.get("sort").get(0).get("order").asText());
    assertTrue(tree.get("bypassAccessControl").asBoolean());
    assertEquals(20, tree.get("limit").asInt());
    assertFalse(tree.has("offset"));
    assertFalse(tree.has("viewAs"));

    assertEquals(q.predicate(), mapper.readValue(mapper.writeValueAsString(q), RecordQuery.class).predicate());
  }
}
