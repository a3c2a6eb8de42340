package io.intellixity.recordql.persistence.schema;

import io.intellixity.recordql.persistence.query.FunctionCall;
import io.intellixity.recordql.persistence.query.UserDataFunc;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class RecordSchemaTest {
  @Test
  void keepsDeclarationOrder() {
    RecordSchema s = RecordSchema.builder()
        .field("b", DataType.STRING)
        .field("a", DataType.INTEGER)
        .field("c", DataType.LOCATION)
        .build();
    assertEquals(List.of("b", "a", "c"), List.copyOf(s.fields().keySet()));
    assertThrows(UnsupportedOperationException.class, () -> s.fields().put("d", FieldType.of(DataType.JSON)));
  }

  @Test
  void extendAppendsWithoutReplacing() {
    RecordSchema base = RecordSchema.builder().field("email", DataType.STRING).build();
    FieldType computed = FieldType.computed(DataType.STRING, new FunctionCall(new UserDataFunc("email")));

    RecordSchema out = base.extend(Map.of("email", computed, "_transient__email", computed));

    assertEquals(2, out.size());
    assertFalse(out.get("email").isComputed());
    assertTrue(out.get("_transient__email").isComputed());
    assertEquals(1, base.size());
    assertSame(base, base.extend(Map.of()));
  }

  @Test
  void unknownColumnIsNull() {
    assertNull(RecordSchema.empty().get("missing"));
    assertFalse(RecordSchema.empty().contains("missing"));
  }
}
