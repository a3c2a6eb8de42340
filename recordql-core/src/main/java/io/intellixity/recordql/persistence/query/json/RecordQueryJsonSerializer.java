package io.intellixity.recordql.persistence.query.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import io.intellixity.recordql.persistence.query.*;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collection;
import java.util.Map;

/** Canonical JSON serializer for {@link RecordQuery}; inverse of {@link RecordQueryJsonDeserializer}. */
public final class RecordQueryJsonSerializer extends JsonSerializer<RecordQuery> {
  @Override
  public void serialize(RecordQuery q, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (q == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    if (q.recordType() != null) g.writeStringField("recordType", q.recordType());

    if (q.predicate() != null) {
      g.writeFieldName("filter");
      writePredicate(q.predicate(), g, serializers);
    }

    if (!q.sorts().isEmpty()) {
      g.writeArrayFieldStart("sort");
      for (Sort s : q.sorts()) {
        g.writeStartObject();
        if (s.keyPath() != null) g.writeStringField("keyPath", s.keyPath());
        if (s.func() != null) {
          g.writeFieldName("func");
          writeFunc(s.func(), g, serializers);
        }
        if (s.order() != null) g.writeStringField("order", s.order().name().toLowerCase());
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    if (q.viewAsUser() != null) {
      g.writeObjectFieldStart("viewAs");
      g.writeStringField("id", q.viewAsUser().id());
      g.writeObjectField("roles", q.viewAsUser().roles());
      g.writeEndObject();
    }
    if (q.bypassAccessControl()) g.writeBooleanField("bypassAccessControl", true);
    if (q.limit() != null) g.writeNumberField("limit", q.limit());
    if (q.offset() > 0) g.writeNumberField("offset", q.offset());
    if (q.withCount()) g.writeBooleanField("count", true);
    g.writeEndObject();
  }

  private static void writePredicate(Predicate p, JsonGenerator g, SerializerProvider serializers) throws IOException {
    g.writeStartObject();
    if (p instanceof CompoundPredicate c) {
      if (c.operator() == Operator.NOT && c.children().size() == 1) {
        g.writeFieldName("not");
        writePredicate(c.children().get(0), g, serializers);
      } else {
        g.writeArrayFieldStart(c.operator().name().toLowerCase());
        for (Predicate child : c.children()) writePredicate(child, g, serializers);
        g.writeEndArray();
      }
    } else if (p instanceof ComparisonPredicate c) {
      g.writeArrayFieldStart(comparisonKey(c.operator()));
      writeExpression(c.left(), g, serializers);
      writeExpression(c.right(), g, serializers);
      g.writeEndArray();
    } else if (p instanceof FunctionalPredicate f) {
      if (!(f.expression() instanceof FunctionCall call)) {
        throw new IllegalArgumentException("Functional predicate must wrap a function call: " + f);
      }
      g.writeFieldName("func");
      writeFunc(call.func(), g, serializers);
    }
    g.writeEndObject();
  }

  private static String comparisonKey(Operator op) {
    for (var e : RecordQueryJsonDeserializer.COMPARISON_KEYS.entrySet()) {
      if (e.getValue() == op) return e.getKey();
    }
    throw new IllegalArgumentException("Operator has no JSON form: " + op);
  }

  private static void writeExpression(Expression e, JsonGenerator g, SerializerProvider serializers) throws IOException {
    g.writeStartObject();
    if (e instanceof KeyPath k) {
      g.writeStringField("keyPath", k.name());
    } else if (e instanceof Literal l) {
      g.writeFieldName("value");
      writeValue(l.value(), g, serializers);
    } else if (e instanceof FunctionCall f) {
      g.writeFieldName("func");
      writeFunc(f.func(), g, serializers);
    }
    g.writeEndObject();
  }

  private static void writeFunc(Func f, JsonGenerator g, SerializerProvider serializers) throws IOException {
    g.writeStartObject();
    if (f instanceof DistanceFunc d) {
      g.writeObjectFieldStart("distance");
      g.writeStringField("field", d.field());
      g.writeNumberField("lat", d.location().latitude());
      g.writeNumberField("lng", d.location().longitude());
      g.writeEndObject();
    } else if (f instanceof CountFunc c) {
      g.writeObjectFieldStart("count");
      g.writeBooleanField("overall", c.overallRecords());
      g.writeEndObject();
    } else if (f instanceof UserDataFunc u) {
      g.writeStringField("userData", u.dataName());
    } else if (f instanceof UserRelationFunc r) {
      g.writeObjectFieldStart("userRelation");
      if (!r.keyPath().isEmpty()) g.writeStringField("keyPath", r.keyPath());
      g.writeStringField("name", r.relationName());
      if (!r.direction().isEmpty()) g.writeStringField("direction", r.direction());
      g.writeStringField("user", r.user());
      g.writeEndObject();
    } else if (f instanceof UserDiscoverFunc u) {
      g.writeObjectFieldStart("userDiscover");
      for (var e : u.args().entrySet()) {
        g.writeFieldName(e.getKey());
        writeValue(e.getValue(), g, serializers);
      }
      g.writeEndObject();
    }
    g.writeEndObject();
  }

  private static void writeValue(Object v, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (v instanceof Reference r) {
      g.writeStartObject();
      g.writeObjectFieldStart("$ref");
      g.writeStringField("type", r.recordType());
      g.writeStringField("key", r.key());
      g.writeEndObject();
      g.writeEndObject();
      return;
    }
    if (v instanceof Location l) {
      g.writeStartObject();
      g.writeObjectFieldStart("$location");
      g.writeNumberField("lat", l.latitude());
      g.writeNumberField("lng", l.longitude());
      g.writeEndObject();
      g.writeEndObject();
      return;
    }
    if (v instanceof Collection<?> c) {
      g.writeStartArray();
      for (Object x : c) writeValue(x, g, serializers);
      g.writeEndArray();
      return;
    }
    if (v instanceof Map<?, ?> m) {
      g.writeStartObject();
      for (var e : m.entrySet()) {
        g.writeFieldName(String.valueOf(e.getKey()));
        writeValue(e.getValue(), g, serializers);
      }
      g.writeEndObject();
      return;
    }
    if (v instanceof Object[] arr) {
      writeValue(Arrays.asList(arr), g, serializers);
      return;
    }
    serializers.defaultSerializeValue(v, g);
  }
}
