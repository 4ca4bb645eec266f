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
package net.tsgateway.query.plan;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

import java.time.ZoneId;
import java.time.ZoneOffset;

import org.junit.Test;

public class TestWhere {

  @Test
  public void and() throws Exception {
    assertEquals("", new Where().sql());
    assertEquals("", new Where().and(null).and("").preWhereSql());
    assertEquals("WHERE a=1", new Where().and("a=1").sql());
    assertEquals("WHERE (a=1) AND (b=2)", new Where().and("a=1").and("b=2").sql());
    assertEquals("PREWHERE ((a=1) AND (b=2)) AND (c=3)",
        new Where().and("a=1").and("b=2").and("c=3").preWhereSql());
  }

  @Test
  public void conditions() throws Exception {
    assertEquals("Path in metrics_list", Where.inTable("Path", "metrics_list"));
    assertEquals("Time >= 60 AND Time <= 120",
        Where.timestampBetween("Time", 60, 120));
    assertEquals("Date >= '2022-11-11' AND Date <= '2022-11-13'",
        Where.dateBetween("Date", 1668124800, 1668325322, DayFormat.UTC));
  }

  @Test
  public void dayFormats() throws Exception {
    // 2022-11-11 23:30:00 UTC, already the 12th east of UTC
    final long late = 1668209400;
    final ZoneId east = ZoneId.of("Asia/Tokyo");
    final ZoneId west = ZoneId.of("America/New_York");

    assertEquals("2022-11-11", DayFormat.UTC.from(late, east));
    assertEquals("2022-11-11", DayFormat.UTC.until(late, east));

    assertEquals("2022-11-12", DayFormat.DEFAULT.from(late, east));
    assertEquals("2022-11-12", DayFormat.DEFAULT.until(late, east));
    assertEquals("2022-11-11", DayFormat.DEFAULT.from(late, west));

    // both takes the earlier start and the later end
    assertEquals("2022-11-11", DayFormat.BOTH.from(late, east));
    assertEquals("2022-11-12", DayFormat.BOTH.until(late, east));
    // 2022-11-12 02:00:00 UTC, still the 11th west of UTC
    final long early = 1668218400;
    assertEquals("2022-11-11", DayFormat.BOTH.from(early, west));
    assertEquals("2022-11-12", DayFormat.BOTH.until(early, west));
    assertEquals("2022-11-12", DayFormat.BOTH.from(early, ZoneOffset.UTC));
  }

  @Test
  public void dayFormatFromString() throws Exception {
    assertSame(DayFormat.DEFAULT, DayFormat.fromString(null));
    assertSame(DayFormat.DEFAULT, DayFormat.fromString(""));
    assertSame(DayFormat.DEFAULT, DayFormat.fromString("default"));
    assertSame(DayFormat.UTC, DayFormat.fromString("UTC"));
    assertSame(DayFormat.BOTH, DayFormat.fromString(" both "));
    try {
      DayFormat.fromString("local");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
