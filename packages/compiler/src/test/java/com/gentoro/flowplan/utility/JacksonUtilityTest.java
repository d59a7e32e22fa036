package com.gentoro.flowplan.utility;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.flowplan.exception.SerializationException;
import org.junit.jupiter.api.Test;

class JacksonUtilityTest {

  @Test
  void truthiness() {
    JsonNode doc =
        JacksonUtility.readTree(
            "{\"t\":true,\"n\":0,\"m\":2,\"s\":\"yes\",\"e\":\"\",\"a\":[],\"o\":{\"k\":1}}");

    assertTrue(JacksonUtility.isTruthy(doc.get("t")));
    assertFalse(JacksonUtility.isTruthy(doc.get("n")));
    assertTrue(JacksonUtility.isTruthy(doc.get("m")));
    assertTrue(JacksonUtility.isTruthy(doc.get("s")));
    assertFalse(JacksonUtility.isTruthy(doc.get("e")));
    assertFalse(JacksonUtility.isTruthy(doc.get("a")));
    assertTrue(JacksonUtility.isTruthy(doc.get("o")));
    assertFalse(JacksonUtility.isTruthy(doc.get("missing")));
  }

  @Test
  void textAccess() {
    JsonNode doc = JacksonUtility.readTree("{\"a\":\"x\",\"b\":3,\"c\":null,\"d\":[1]}");

    assertEquals("x", JacksonUtility.text(doc, "a"));
    assertEquals("3", JacksonUtility.text(doc, "b"));
    assertNull(JacksonUtility.text(doc, "c"));
    assertNull(JacksonUtility.text(doc, "d"));
    assertEquals("dflt", JacksonUtility.text(doc, "zz", "dflt"));
    assertEquals(1, JacksonUtility.elements(doc, "d").size());
    assertTrue(JacksonUtility.elements(doc, "a").isEmpty());
  }

  @Test
  void invalidJson() {
    assertThrows(SerializationException.class, () -> JacksonUtility.readTree("{"));
  }
}
