// This file is part of OpenTSDB.
// Copyright (C) 2018 The OpenTSDB Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.tsgateway.rollup;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.Test;

import net.tsgateway.data.AggregationFunctions;
import net.tsgateway.data.Point;
import net.tsgateway.data.PointStore;
import net.tsgateway.exceptions.InvalidRollupRulesException;
import net.tsgateway.rollup.RollupResolver.Resolution;

public class TestRetentionRules {

  private static final String COMPACT =
        "^hourly;;3600:60,86400:3600\n"
      + "^live;;0:1\n"
      + "total$;sum;\n"
      + "min$;min;\n"
      + "max$;max;\n"
      + ";avg;\n"
      + ";;60:10\n"
      + ";;0:42";

  private static final String TYPED_XML =
        "<graphite_rollup>\n"
      + "  <pattern>\n"
      + "    <regexp>^hourly</regexp>\n"
      + "    <retention><age>3600</age><precision>60</precision></retention>\n"
      + "    <retention><age>86400</age><precision>3600</precision></retention>\n"
      + "  </pattern>\n"
      + "  <pattern>\n"
      + "    <regexp>^live</regexp>\n"
      + "    <retention><age>0</age><precision>1</precision></retention>\n"
      + "  </pattern>\n"
      + "  <pattern>\n"
      + "    <rule_type>tag_list</rule_type>\n"
      + "    <regexp>fake3;tag3=Fake3</regexp>\n"
      + "    <retention><age>0</age><precision>1</precision></retention>\n"
      + "  </pattern>\n"
      + "  <pattern>\n"
      + "    <rule_type>tag_list</rule_type>\n"
      + "    <regexp>tag5=Fake5;tag3=Fake3</regexp>\n"
      + "    <retention><age>0</age><precision>90</precision></retention>\n"
      + "  </pattern>\n"
      + "  <pattern>\n"
      + "    <rule_type>tag_list</rule_type>\n"
      + "    <regexp>fake_name</regexp>\n"
      + "    <retention><age>0</age><precision>20</precision></retention>\n"
      + "  </pattern>\n"
      + "  <pattern>\n"
      + "    <rule_type>plain</rule_type>\n"
      + "    <regexp>total$</regexp>\n"
      + "    <function>sum</function>\n"
      + "  </pattern>\n"
      + "  <pattern>\n"
      + "    <rule_type>plain</rule_type>\n"
      + "    <regexp>min$</regexp>\n"
      + "    <function>min</function>\n"
      + "  </pattern>\n"
      + "  <pattern>\n"
      + "    <rule_type>plain</rule_type>\n"
      + "    <regexp>max$</regexp>\n"
      + "    <function>max</function>\n"
      + "  </pattern>\n"
      + "  <pattern>\n"
      + "    <rule_type>tagged</rule_type>\n"
      + "    <regexp>total?</regexp>\n"
      + "    <function>sum</function>\n"
      + "  </pattern>\n"
      + "  <pattern>\n"
      + "    <rule_type>tagged</rule_type>\n"
      + "    <regexp>min\\?</regexp>\n"
      + "    <function>min</function>\n"
      + "  </pattern>\n"
      + "  <pattern>\n"
      + "    <rule_type>tagged</rule_type>\n"
      + "    <regexp>max\\?</regexp>\n"
      + "    <function>max</function>\n"
      + "  </pattern>\n"
      + "  <pattern>\n"
      + "    <rule_type>tagged</rule_type>\n"
      + "    <regexp>^hourly</regexp>\n"
      + "    <function>sum</function>\n"
      + "  </pattern>\n"
      + "  <default>\n"
      + "    <function>avg</function>\n"
      + "    <retention><age>0</age><precision>42</precision></retention>\n"
      + "    <retention><age>60</age><precision>10</precision></retention>\n"
      + "  </default>\n"
      + "</graphite_rollup>\n";

  @Test
  public void lookupCompact() throws Exception {
    final RetentionRules rules = RetentionRules.newBuilder()
        .setPatterns(RetentionRulesParser.parseCompact(COMPACT))
        .build();
    assertFalse(rules.isSplit());

    assertLookup(rules, "hello.world", 0, "avg", 42);
    assertLookup(rules, "hourly.rps", 0, "avg", 42);
    assertLookup(rules, "hourly.rps_total", 0, "sum", 42);
    assertLookup(rules, "live.rps_total", 0, "sum", 1);
    assertLookup(rules, "hourly.rps_min", 0, "min", 42);
    assertLookup(rules, "hourly.rps_min", 1, "min", 42);
    assertLookup(rules, "hourly.rps_min", 59, "min", 42);
    assertLookup(rules, "hourly.rps_min", 60, "min", 10);
    assertLookup(rules, "hourly.rps_min", 61, "min", 10);
    assertLookup(rules, "hourly.rps_min", 3599, "min", 10);
    assertLookup(rules, "hourly.rps_min", 3600, "min", 60);
    assertLookup(rules, "hourly.rps_min", 3601, "min", 60);
    assertLookup(rules, "hourly.rps_min", 86399, "min", 60);
    assertLookup(rules, "hourly.rps_min", 86400, "min", 3600);
    assertLookup(rules, "hourly.rps_min", 86401, "min", 3600);
  }

  @Test
  public void lookupTyped() throws Exception {
    final RetentionRules rules = RetentionRules.newBuilder()
        .setPatterns(RetentionRulesParser.parseXml(
            TYPED_XML.getBytes(StandardCharsets.UTF_8)))
        .build();
    assertTrue(rules.isSplit());

    assertLookup(rules, "hello.world", 0, "avg", 42);
    assertLookup(rules, "hourly.rps", 0, "avg", 42);
    assertLookup(rules, "hourly.rps?tag=value", 0, "sum", 42);
    assertLookup(rules, "hourly.rps_total", 0, "sum", 42);
    assertLookup(rules, "live.rps_total", 0, "sum", 1);
    assertLookup(rules, "hourly.rps_min", 0, "min", 42);
    assertLookup(rules, "hourly.rps_min?tag=value", 0, "min", 42);
    assertLookup(rules, "hourly.rps_min", 59, "min", 42);
    assertLookup(rules, "hourly.rps_min?tag=value", 59, "min", 42);
    assertLookup(rules, "hourly.rps_min", 60, "min", 10);
    assertLookup(rules, "hourly.rps_min", 3600, "min", 60);
    assertLookup(rules, "hourly.rps_min", 86400, "min", 3600);
    assertLookup(rules, "fake3?tag3=Fake3", 0, "avg", 1);
    assertLookup(rules, "fake3?tag1=Fake1&tag3=Fake3", 0, "avg", 1);
    assertLookup(rules, "fake3?tag1=Fake1&tag3=Fake3&tag4=Fake4", 0, "avg", 1);
    assertLookup(rules, "fake3?tag3=Fake", 0, "avg", 42);
    assertLookup(rules, "fake3?tag1=Fake1&tag3=Fake&tag4=Fake4", 0, "avg", 42);
    assertLookup(rules, "fake?tag3=Fake3", 0, "avg", 42);
    assertLookup(rules, "fake_name?tag3=Fake3", 0, "avg", 20);
    assertLookup(rules, "fake5?tag1=Fake1&tag3=Fake3&tag4=Fake4&tag5=Fake5",
        0, "avg", 90);
    assertLookup(rules, "fake5?tag3=Fake3&tag4=Fake4&tag5=Fake5&tag6=Fake6",
        0, "avg", 90);
    assertLookup(rules, "fake5?tag4=Fake4&tag5=Fake5&tag6=Fake6", 0, "avg", 42);
  }

  @Test
  public void lookupFallsBack() throws Exception {
    RetentionRules rules = RetentionRules.newBuilder().build();
    assertEquals(new Resolution(60, AggregationFunctions.AVG),
        rules.lookup("anything", 0));
    assertEquals(2, rules.patterns().size());

    rules = RetentionRules.defaults(300, "max");
    assertEquals(new Resolution(300, AggregationFunctions.MAX),
        rules.lookup("anything", 1000000));

    // age below every tier falls through to the defaults
    rules = RetentionRules.newBuilder()
        .setPatterns(RetentionRulesParser.parseCompact("^a;sum;3600:300"))
        .setDefaultFunction("min")
        .build();
    assertEquals(new Resolution(60, AggregationFunctions.SUM),
        rules.lookup("a.b", 0));
    assertEquals(new Resolution(300, AggregationFunctions.SUM),
        rules.lookup("a.b", 3600));
    assertEquals(new Resolution(60, AggregationFunctions.MIN),
        rules.lookup("b.a", 3600));
  }

  @Test
  public void lookupVerbose() throws Exception {
    final RetentionRules rules = RetentionRules.newBuilder()
        .setPatterns(RetentionRulesParser.parseCompact(COMPACT))
        .build();
    RetentionRules.Match match = rules.lookupVerbose("live.rps_total", 0);
    assertEquals("total$", match.functionPattern().regexp());
    assertEquals("^live", match.precisionPattern().regexp());

    // only the built-in pattern answers
    final RetentionRules defaults = RetentionRules.newBuilder().build();
    match = defaults.lookupVerbose("a", 0);
    assertSame(defaults.patterns().get(1), match.functionPattern());
    assertSame(defaults.patterns().get(1), match.precisionPattern());
    assertSame(RetentionRules.FALLBACK_FUNCTION, match.resolution().function());
  }

  @Test
  public void lookupIsDeterministic() throws Exception {
    final RetentionRules rules = RetentionRules.newBuilder()
        .setPatterns(RetentionRulesParser.parseCompact(COMPACT))
        .build();
    final Resolution first = rules.lookup("hourly.rps_max", 7200);
    for (int i = 0; i < 10; i++) {
      rules.lookup("other" + i, i * 1000);
      assertEquals(first, rules.lookup("hourly.rps_max", 7200));
    }
    assertEquals(new Resolution(60, AggregationFunctions.MAX), first);
  }

  @Test
  public void buildInvalidDefaults() throws Exception {
    try {
      RetentionRules.newBuilder().setDefaultFunction("median").build();
      fail("Expected InvalidRollupRulesException");
    } catch (InvalidRollupRulesException e) { }
    try {
      RetentionRules.newBuilder().setDefaultPrecision(-1).build();
      fail("Expected InvalidRollupRulesException");
    } catch (InvalidRollupRulesException e) { }
  }

  @Test
  public void rollupPoints() throws Exception {
    final RetentionRules rules = RetentionRules.newBuilder()
        .setPatterns(RetentionRulesParser.parseCompact(
            "^10sec;;0:10,3600:60\n;max;0:20"))
        .build();

    // young data keeps full resolution
    PointStore store = newPoints();
    store.rollupPoints(10000, 0, rules, 10010);
    assertPoints(store, newPoints().points());

    // old data rolls up the 10sec metric to 60s
    store = newPoints();
    store.rollupPoints(10, 0, rules, 10010);
    PointStore expected = new PointStore();
    int id = expected.intern("10sec");
    expected.appendPoint(id, 3, 0, 0);
    expected.appendPoint(id, 7, 60, 0);
    id = expected.intern("default");
    expected.appendPoint(id, 2, 20, 0);
    expected.appendPoint(id, 4, 40, 0);
    expected.appendPoint(id, 6, 60, 0);
    expected.appendPoint(id, 8, 80, 0);
    assertPoints(store, expected.points());

    // common step of 10 changes nothing
    store = newPoints();
    store.rollupPoints(10000, 10, rules, 10010);
    assertPoints(store, newPoints().points());

    // common step of 60 applies to every metric
    store = newPoints();
    store.rollupPoints(10, 60, rules, 10010);
    expected = new PointStore();
    id = expected.intern("10sec");
    expected.appendPoint(id, 3, 0, 0);
    expected.appendPoint(id, 7, 60, 0);
    id = expected.intern("default");
    expected.appendPoint(id, 4, 0, 0);
    expected.appendPoint(id, 8, 60, 0);
    assertPoints(store, expected.points());
  }

  @Test
  public void sortUniqRollupEmpty() throws Exception {
    final PointStore store = new PointStore();
    store.sort();
    store.uniq();
    store.rollupPoints(0, 0, RetentionRules.newBuilder().build(), 100);
    assertEquals(0, store.size());
    assertTrue(store.points().isEmpty());
  }

  private static PointStore newPoints() {
    final PointStore store = new PointStore();
    int id = store.intern("10sec");
    store.appendPoint(id, 1, 10, 0);
    store.appendPoint(id, 2, 20, 0);
    store.appendPoint(id, 3, 30, 0);
    store.appendPoint(id, 6, 60, 0);
    store.appendPoint(id, 7, 70, 0);
    id = store.intern("default");
    store.appendPoint(id, 2, 20, 0);
    store.appendPoint(id, 4, 40, 0);
    store.appendPoint(id, 6, 60, 0);
    store.appendPoint(id, 8, 80, 0);
    return store;
  }

  private static void assertPoints(final PointStore store,
                                   final List<Point> expected) {
    assertEquals(expected, store.points());
  }

  private static void assertLookup(final RetentionRules rules,
                                   final String metric,
                                   final long age,
                                   final String function,
                                   final long precision) {
    final Resolution resolution = rules.lookup(metric, age);
    assertEquals(metric + "@" + age, function, resolution.function().name());
    assertEquals(metric + "@" + age, precision, resolution.precision());
  }
}
