package com.zenlib.type;

import static org.junit.jupiter.api.Assertions.*;

import com.zenlib.ContractViolationException;
import com.zenlib.InvalidFieldException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ObjectTypeTest {

  private static final ObjectType PERSON = ObjectType.builder("Person")
    .field("name", ExprType.STRING)
    .field("age", ExprType.UINT8)
    .field("tags", ExprType.STRING.list())
    .build();

  @Test
  void testFieldsKeepDeclarationOrder() {
    assertEquals(List.of("name", "age", "tags"), List.copyOf(PERSON.fields().keySet()));
    assertEquals(ExprType.UINT8, PERSON.fieldType("age"));
    assertTrue(PERSON.hasField("tags"));
    assertFalse(PERSON.hasField("email"));
    assertThrows(InvalidFieldException.class, () -> PERSON.fieldType("email"));
  }

  @Test
  void testTypesCompareStructurally() {
    ObjectType copy = ObjectType.builder("Person")
      .field("name", ExprType.STRING)
      .field("age", ExprType.UINT8)
      .field("tags", new ListType<>(ExprType.STRING))
      .build();
    assertEquals(PERSON, copy);
    assertEquals(PERSON.hashCode(), copy.hashCode());
  }

  @Test
  void testBuilderRejectsDuplicateFields() {
    ObjectType.Builder builder = ObjectType.builder("Dup").field("a", ExprType.BOOL);
    assertThrows(ContractViolationException.class, () -> builder.field("a", ExprType.INT8));
  }

  @Test
  void testDefaultValue() {
    ObjectValue value = PERSON.defaultValue();
    assertEquals("", value.get("name"));
    assertEquals(0L, value.get("age"));
    assertEquals(List.of(), value.get("tags"));
    assertEquals("Person{name=, age=0, tags=[]}", value.toString());
  }

  @Test
  void testValues() {
    ObjectValue value = ObjectValue.of(PERSON, Map.of("tags", List.of("x"), "age", 30, "name", "Ann"));
    assertEquals(List.of("name", "age", "tags"), List.copyOf(value.values().keySet()));
    assertEquals(30L, value.get("age"));
    ObjectValue older = value.with("age", 31L);
    assertEquals(31L, older.get("age"));
    assertEquals(30L, value.get("age"));
    assertNotEquals(value, older);
    assertEquals(value, older.with("age", 30));
    assertThrows(ContractViolationException.class, () -> value.with("age", 300));
    assertThrows(InvalidFieldException.class, () -> value.with("email", "a@b"));
    assertThrows(InvalidFieldException.class, () -> ObjectValue.of(PERSON, Map.of("name", "Ann")));
    assertSame(value, PERSON.checkValue(value));
    assertThrows(ContractViolationException.class, () -> PERSON.checkValue("Ann"));
  }

  @Test
  void testListValues() {
    ListType<Long> type = ExprType.INT8.list();
    assertEquals("list<int8>", type.name());
    assertEquals(List.of(1L, 2L), type.checkValue(List.of(1, 2L)));
    assertThrows(ContractViolationException.class, () -> type.checkValue(List.of(1000)));
    assertThrows(ContractViolationException.class, () -> type.checkValue("[]"));
  }
}
