/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.hostmonitor.common.config;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import org.junit.Test;

import static com.linkedin.hostmonitor.common.config.ConfigDef.Range.aboveAndAtMost;
import static com.linkedin.hostmonitor.common.config.ConfigDef.Range.atLeast;
import static com.linkedin.hostmonitor.common.config.ConfigDef.Range.greaterThan;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;


public class ConfigDefTest {

  @Test
  public void testBasicTypes() {
    ConfigDef def = new ConfigDef().define("a", ConfigDef.Type.INT, 5, atLeast(0), ConfigDef.Importance.HIGH, "docs")
                                   .define("b", ConfigDef.Type.LONG, ConfigDef.Importance.HIGH, "docs")
                                   .define("c", ConfigDef.Type.STRING, "hello", ConfigDef.Importance.HIGH, "docs")
                                   .define("d", ConfigDef.Type.LIST, ConfigDef.Importance.HIGH, "docs")
                                   .define("e", ConfigDef.Type.DOUBLE, ConfigDef.Importance.HIGH, "docs")
                                   .define("f", ConfigDef.Type.CLASS, ConfigDef.Importance.HIGH, "docs")
                                   .define("g", ConfigDef.Type.BOOLEAN, ConfigDef.Importance.HIGH, "docs");

    Properties props = new Properties();
    props.put("a", "1   ");
    props.put("b", 2);
    props.put("d", " a , b, c");
    props.put("e", 42.5d);
    props.put("f", String.class.getName());
    props.put("g", "true");

    Map<String, Object> vals = def.parse(props);
    assertEquals(1, vals.get("a"));
    assertEquals(2L, vals.get("b"));
    assertEquals("hello", vals.get("c"));
    assertEquals(Arrays.asList("a", "b", "c"), vals.get("d"));
    assertEquals(42.5d, vals.get("e"));
    assertEquals(String.class, vals.get("f"));
    assertEquals(true, vals.get("g"));
  }

  @Test(expected = ConfigException.class)
  public void testMissingRequired() {
    new ConfigDef().define("a", ConfigDef.Type.INT, ConfigDef.Importance.HIGH, "docs").parse(new HashMap<String, Object>());
  }

  @Test
  public void testEmptyListParsesToEmptyList() {
    ConfigDef def = new ConfigDef().define("a", ConfigDef.Type.LIST, "", ConfigDef.Importance.HIGH, "docs");
    assertEquals(Collections.emptyList(), def.parse(Collections.singletonMap("a", "")).get("a"));
  }

  @Test
  public void testBadInputs() {
    testBadInputs(ConfigDef.Type.INT, "hello", "42.5", 42.5, Long.MAX_VALUE, Long.toString(Long.MAX_VALUE), new Object());
    testBadInputs(ConfigDef.Type.LONG, "hello", "42.5", Long.toString(Long.MAX_VALUE) + "00", new Object());
    testBadInputs(ConfigDef.Type.DOUBLE, "hello", new Object());
    testBadInputs(ConfigDef.Type.STRING, new Object());
    testBadInputs(ConfigDef.Type.LIST, 53, new Object());
    testBadInputs(ConfigDef.Type.BOOLEAN, "hello", "truee", "fals");
    testBadInputs(ConfigDef.Type.CLASS, "ClassDoesNotExist");
  }

  private void testBadInputs(ConfigDef.Type type, Object... values) {
    for (Object value : values) {
      Map<String, Object> m = new HashMap<>();
      m.put("name", value);
      ConfigDef def = new ConfigDef().define("name", type, ConfigDef.Importance.HIGH, "docs");
      try {
        def.parse(m);
        fail("Expected a config exception on bad input for value " + value);
      } catch (ConfigException e) {
        // this is good
      }
    }
  }

  @Test
  public void testRanges() {
    testValidators(ConfigDef.Type.INT, atLeast(1), 1, new Object[]{1, 5, "10"}, new Object[]{0, -1});
    testValidators(ConfigDef.Type.DOUBLE, greaterThan(0.0), 1.0, new Object[]{0.001, "3"}, new Object[]{0.0, -1.0, Double.NaN});
    testValidators(ConfigDef.Type.DOUBLE, aboveAndAtMost(0.0, 100.0), 50.0, new Object[]{100.0, 0.5},
                   new Object[]{0.0, 100.1});
  }

  @Test
  public void testValidString() {
    testValidators(ConfigDef.Type.STRING, ConfigDef.ValidString.in("table", "json"), "table", new Object[]{"json", " table "},
                   new Object[]{"yaml", ""});
  }

  private void testValidators(ConfigDef.Type type, ConfigDef.Validator validator, Object defaultVal, Object[] okValues,
                              Object[] badValues) {
    ConfigDef def = new ConfigDef().define("name", type, defaultVal, validator, ConfigDef.Importance.HIGH, "docs");

    for (Object value : okValues) {
      def.parse(Collections.singletonMap("name", value));
    }

    for (Object value : badValues) {
      try {
        def.parse(Collections.singletonMap("name", value));
        fail("Expected a config exception due to invalid value " + value);
      } catch (ConfigException e) {
        // this is good
      }
    }
  }
}
