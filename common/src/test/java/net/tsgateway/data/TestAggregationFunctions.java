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
package net.tsgateway.data;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.NoSuchElementException;

import org.junit.Test;

public class TestAggregationFunctions {
  private static final double[] VALUES = new double[] { 9, 3, 1, 4, 7 };

  @Test
  public void get() throws Exception {
    assertSame(AggregationFunctions.AVG, AggregationFunctions.get("avg"));
    assertSame(AggregationFunctions.AVG, AggregationFunctions.get("average"));
    assertSame(AggregationFunctions.ANY, AggregationFunctions.get("first"));
    assertSame(AggregationFunctions.ANY_LAST, AggregationFunctions.get("last"));
    assertSame(AggregationFunctions.ANY_LAST, AggregationFunctions.get("anyLast"));

    try {
      AggregationFunctions.get("median");
      fail("Expected NoSuchElementException");
    } catch (NoSuchElementException e) { }
    try {
      AggregationFunctions.get(null);
      fail("Expected NoSuchElementException");
    } catch (NoSuchElementException e) { }

    assertTrue(AggregationFunctions.contains("sum"));
    assertFalse(AggregationFunctions.contains(""));
  }

  @Test
  public void apply() throws Exception {
    assertEquals(13, AggregationFunctions.SUM.apply(VALUES, 1, 5), 0.0001);
    assertEquals(3.75, AggregationFunctions.AVG.apply(VALUES, 1, 5), 0.0001);
    assertEquals(1, AggregationFunctions.MIN.apply(VALUES, 0, 5), 0.0001);
    assertEquals(9, AggregationFunctions.MAX.apply(VALUES, 0, 5), 0.0001);
    assertEquals(3, AggregationFunctions.ANY.apply(VALUES, 1, 3), 0.0001);
    assertEquals(1, AggregationFunctions.ANY_LAST.apply(VALUES, 1, 3), 0.0001);
  }

  @Test
  public void applyEmpty() throws Exception {
    assertEquals(0, AggregationFunctions.SUM.apply(VALUES, 2, 2), 0.0001);
    assertTrue(Double.isNaN(AggregationFunctions.AVG.apply(VALUES, 2, 2)));
    assertTrue(Double.isNaN(AggregationFunctions.MAX.apply(VALUES, 2, 2)));
    assertTrue(Double.isNaN(AggregationFunctions.MIN.apply(VALUES, 2, 2)));
    assertTrue(Double.isNaN(AggregationFunctions.ANY.apply(VALUES, 2, 2)));
    assertTrue(Double.isNaN(AggregationFunctions.ANY_LAST.apply(VALUES, 2, 2)));
    assertTrue(Double.isNaN(AggregationFunctions.AVG.apply(VALUES, 3, 1)));
  }

  @Test
  public void graphiteNames() throws Exception {
    assertEquals("first", AggregationFunctions.ANY.graphiteName());
    assertEquals("last", AggregationFunctions.ANY_LAST.graphiteName());
    assertEquals("max", AggregationFunctions.MAX.graphiteName());
    assertEquals("anyLast", AggregationFunctions.ANY_LAST.name());
  }
}
