package com.gentoro.flowplan.utility;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class StringUtilityTest {

  @Test
  void parsesNumbers() {
    assertEquals(42L, StringUtility.parseInteger(" 42 "));
    assertEquals(-7L, StringUtility.parseInteger("-7"));
    assertNull(StringUtility.parseInteger("4.2"));
    assertNull(StringUtility.parseInteger(null));
    assertEquals(2.5, StringUtility.parseDecimal("2.5"));
    assertEquals(3.0, StringUtility.parseDecimal("3"));
    assertNull(StringUtility.parseDecimal("three"));
  }

  @Test
  void formatsDecimalsLikePython() {
    assertEquals("1.0", StringUtility.formatDecimal(1));
    assertEquals("-2.0", StringUtility.formatDecimal(-2));
    assertEquals("2.5", StringUtility.formatDecimal(2.5));
    assertEquals("nan", StringUtility.formatDecimal(Double.NaN));
    assertEquals("-inf", StringUtility.formatDecimal(Double.NEGATIVE_INFINITY));
  }

  @Test
  void booleansAndQuoting() {
    assertTrue(StringUtility.parseBoolean("True"));
    assertTrue(StringUtility.parseBoolean("yes"));
    assertFalse(StringUtility.parseBoolean("1"));
    assertFalse(StringUtility.parseBoolean(null));
    assertEquals("'it\\'s'", StringUtility.quote("it's"));
    assertTrue(StringUtility.isBlank("  "));
    assertFalse(StringUtility.isBlank("x"));
  }
}
