package io.intellixity.recordql.persistence.query.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.recordql.persistence.acl.UserInfo;
import io.intellixity.recordql.persistence.query.*;

import java.io.IOException;
import java.util.*;

/** Canonical JSON deserializer for {@link RecordQuery}. */
public final class RecordQueryJsonDeserializer extends JsonDeserializer<RecordQuery> {
  static final Map<String, Operator> COMPARISON_KEYS;

  static {
    Map<String, Operator> m = new LinkedHashMap<>();
    m.put("eq", Operator.EQUAL);
    m.put("ne", Operator.NOT_EQUAL);
    m.put("gt", Operator.GREATER_THAN);
    m.put("lt", Operator.LESS_THAN);
    m.put("gte", Operator.GREATER_THAN_OR_EQUAL);
    m.put("lte", Operator.LESS_THAN_OR_EQUAL);
    m.put("like", Operator.LIKE);
    m.put("ilike", Operator.ILIKE);
    m.put("in", Operator.IN);
    COMPARISON_KEYS = Collections.unmodifiableMap(m);
  }

  @Override
  public RecordQuery deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("RecordQuery JSON must be an object");

    RecordQuery q = new RecordQuery(textOrNull(root.get("recordType")));

    JsonNode filter = root.get("filter");
    if (filter != null && !filter.isNull()) {
      q.withPredicate(parsePredicate(filter, codec));
    }

    JsonNode sort = root.get("sort");
    if (sort != null && sort.isArray()) {
      List<Sort> sorts = new ArrayList<>();
      for (JsonNode s : sort) {
        if (!s.isObject()) throw new IllegalArgumentException("sort entry must be an object: " + s);
        sorts.add(parseSort(s, codec));
      }
      q.withSorts(sorts);
    }

    JsonNode viewAs = root.get("viewAs");
    if (viewAs != null && viewAs.isObject()) {
      List<String> roles = new ArrayList<>();
      JsonNode r = viewAs.get("roles");
      if (r != null && r.isArray()) for (JsonNode x : r) if (x.isTextual()) roles.add(x.asText());
      q.viewAs(new UserInfo(textOrNull(viewAs.get("id")), roles));
    }

    q.withBypassAccessControl(boolOrDefault(root.get("bypassAccessControl"), false));
    JsonNode limit = root.get("limit");
    if (limit != null && !limit.isNull()) q.withLimit(limit.asInt());
    q.withOffset(intOrDefault(root.get("offset"), 0));
    q.withCount(boolOrDefault(root.get("count"), false));
    return q;
  }

  static Predicate parsePredicate(JsonNode n, ObjectCodec codec) throws IOException {
    if (n == null || !n.isObject() || n.size() != 1) {
      throw new IllegalArgumentException("Predicate must be an object with exactly one key: " + n);
    }
    String key = n.fieldNames().next();
    JsonNode body = n.get(key);

    switch (key) {
      case "and":
        return new CompoundPredicate(Operator.AND, parseChildren(body, codec));
      case "or":
        return new CompoundPredicate(Operator.OR, parseChildren(body, codec));
      case "not":
        return new CompoundPredicate(Operator.NOT, List.of(parsePredicate(body, codec)));
      case "func":
        return new FunctionalPredicate(new FunctionCall(parseFunc(body, codec)));
      default:
        break;
    }

    Operator op = COMPARISON_KEYS.get(key);
    if (op == null) throw new IllegalArgumentException("Unknown predicate key: " + key);
    if (body == null || !body.isArray() || body.size() != 2) {
      throw new IllegalArgumentException(key + " requires an array of two expressions");
    }
    return new ComparisonPredicate(op, parseExpression(body.get(0), codec), parseExpression(body.get(1), codec));
  }

  private static List<Predicate> parseChildren(JsonNode arr, ObjectCodec codec) throws IOException {
    if (arr == null || !arr.isArray()) throw new IllegalArgumentException("Compound predicate requires an array");
    List<Predicate> out = new ArrayList<>();
    for (JsonNode x : arr) out.add(parsePredicate(x, codec));
    return out;
  }

  static Expression parseExpression(JsonNode n, ObjectCodec codec) throws IOException {
    if (n == null || !n.isObject()) throw new IllegalArgumentException("Expression must be an object: " + n);
    if (n.has("keyPath")) return new KeyPath(n.get("keyPath").asText());
    if (n.has("value")) return new Literal(decodeValue(n.get("value"), codec));
    if (n.has("func")) return new FunctionCall(parseFunc(n.get("func"), codec));
    throw new IllegalArgumentException("Unsupported expression: " + n);
  }

  static Func parseFunc(JsonNode n, ObjectCodec codec) throws IOException {
    if (n == null || !n.isObject() || n.size() != 1) {
      throw new IllegalArgumentException("Function must be an object with exactly one key: " + n);
    }
    String name = n.fieldNames().next();
    JsonNode body = n.get(name);
    switch (name) {
      case "distance":
        return new DistanceFunc(requireText(body, "field"),
            new Location(requireDouble(body, "lat"), requireDouble(body, "lng")));
      case "count":
        return new CountFunc(boolOrDefault(body == null ? null : body.get("overall"), false));
      case "userData":
        if (body == null || !body.isTextual()) throw new IllegalArgumentException("userData requires a column name");
        return new UserDataFunc(body.asText());
      case "userRelation":
        return new UserRelationFunc(
            textOrNull(body.get("keyPath")),
            requireText(body, "name"),
            textOrNull(body.get("direction")),
            requireText(body, "user"));
      case "userDiscover": {
        if (body == null || !body.isObject()) throw new IllegalArgumentException("userDiscover requires an object");
        Map<String, List<Object>> args = new LinkedHashMap<>();
        Iterator<String> it = body.fieldNames();
        while (it.hasNext()) {
          String arg = it.next();
          Object v = decodeValue(body.get(arg), codec);
          args.put(arg, v instanceof List<?> l ? new ArrayList<>(l) : Collections.singletonList(v));
        }
        return new UserDiscoverFunc(args);
      }
      default:
        throw new IllegalArgumentException("Unknown function: " + name);
    }
  }

  private static Sort parseSort(JsonNode s, ObjectCodec codec) throws IOException {
    String keyPath = textOrNull(s.get("keyPath"));
    Func func = s.has("func") ? parseFunc(s.get("func"), codec) : null;
    String order = textOrNull(s.get("order"));
    SortOrder o;
    if (order == null) {
      o = SortOrder.ASC;
    } else if (order.equalsIgnoreCase("asc")) {
      o = SortOrder.ASC;
    } else if (order.equalsIgnoreCase("desc")) {
      o = SortOrder.DESC;
    } else {
      throw new QueryValidationException(QueryValidationException.Reason.UNKNOWN_SORT_ORDER,
          "unknown sort order = " + order);
    }
    return new Sort(keyPath, func, o);
  }

  /** Plain JSON, except {@code {"$ref":{type,key}}} and {@code {"$location":{lat,lng}}} anywhere in the tree. */
  static Object decodeValue(JsonNode v, ObjectCodec codec) throws IOException {
    if (v == null || v.isNull()) return null;
    if (v.isArray()) {
      List<Object> out = new ArrayList<>(v.size());
      for (JsonNode x : v) out.add(decodeValue(x, codec));
      return out;
    }
    if (v.isObject()) {
      JsonNode ref = v.get("$ref");
      if (ref != null && v.size() == 1) {
        return new Reference(requireText(ref, "type"), requireText(ref, "key"));
      }
      JsonNode loc = v.get("$location");
      if (loc != null && v.size() == 1) {
        return new Location(requireDouble(loc, "lat"), requireDouble(loc, "lng"));
      }
      Map<String, Object> out = new LinkedHashMap<>();
      Iterator<String> it = v.fieldNames();
      while (it.hasNext()) {
        String k = it.next();
        out.put(k, decodeValue(v.get(k), codec));
      }
      return out;
    }
    return codec.treeToValue(v, Object.class);
  }

  private static String requireText(JsonNode n, String field) {
    String v = n == null ? null : textOrNull(n.get(field));
    if (v == null) throw new IllegalArgumentException("missing '" + field + "' in " + n);
    return v;
  }

  private static double requireDouble(JsonNode n, String field) {
    JsonNode v = n == null ? null : n.get(field);
    if (v == null || !v.isNumber()) throw new IllegalArgumentException("missing numeric '" + field + "' in " + n);
    return v.doubleValue();
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }

  private static int intOrDefault(JsonNode n, int def) {
    if (n == null || n.isNull()) return def;
    return n.isNumber() ? n.intValue() : Integer.parseInt(n.asText());
  }

  private static boolean boolOrDefault(JsonNode n, boolean def) {
    if (n == null || n.isNull()) return def;
    return n.isBoolean() ? n.booleanValue() : Boolean.parseBoolean(n.asText());
  }
}
