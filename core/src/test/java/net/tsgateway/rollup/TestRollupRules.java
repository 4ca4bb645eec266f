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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.google.common.io.Files;
import com.stumbleupon.async.Deferred;

import io.netty.util.Timeout;
import io.netty.util.Timer;
import net.tsgateway.data.AggregationFunctions;
import net.tsgateway.exceptions.InvalidRollupRulesException;
import net.tsgateway.rollup.RollupResolver.Resolution;
import net.tsgateway.storage.StorageClient;

public class TestRollupRules {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private Timer timer;
  private RetentionRulesSource source;

  @Before
  public void before() throws Exception {
    timer = mock(Timer.class);
    source = mock(RetentionRulesSource.class);
    when(source.describe()).thenReturn("mock");
  }

  @Test
  public void buildDefaultsOnly() throws Exception {
    final RollupRules rules = RollupRules.newBuilder()
        .setDefaultPrecision(300)
        .setDefaultFunction("sum")
        .build();
    assertEquals(new Resolution(300, AggregationFunctions.SUM),
        rules.lookup("a.b", 0));
    assertFalse(rules.reload(true));
  }

  @Test
  public void buildLoadsAndSchedules() throws Exception {
    when(source.load(true)).thenReturn(
        RetentionRulesParser.parseCompact("^a;max;0:10"));
    final RollupRules rules = RollupRules.newBuilder()
        .setSource(source)
        .setTimer(timer)
        .setInterval(60000)
        .build();
    assertEquals(new Resolution(10, AggregationFunctions.MAX),
        rules.lookup("a.b", 0));
    verify(timer, times(1)).newTimeout(rules, 60000, TimeUnit.MILLISECONDS);
  }

  @Test
  public void buildNoInterval() throws Exception {
    when(source.load(true)).thenReturn(
        RetentionRulesParser.parseCompact("^a;max;0:10"));
    RollupRules.newBuilder()
        .setSource(source)
        .setTimer(timer)
        .build();
    verify(timer, never()).newTimeout(any(RollupRules.class), anyLong(),
        any(TimeUnit.class));
  }

  @Test
  public void buildErrors() throws Exception {
    when(source.load(true)).thenThrow(new IOException("Boo!"));
    try {
      RollupRules.newBuilder().setSource(source).build();
      fail("Expected InvalidRollupRulesException");
    } catch (InvalidRollupRulesException e) { }

    try {
      RollupRules.newBuilder().setSource(source).setInterval(1000).build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      RollupRules.newBuilder().setInterval(-1).build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      RollupRules.newBuilder().setDefaultFunction("median").build();
      fail("Expected InvalidRollupRulesException");
    } catch (InvalidRollupRulesException e) { }
  }

  @Test
  public void runReloads() throws Exception {
    final List<RetentionPattern> first =
        RetentionRulesParser.parseCompact("^a;max;0:10");
    final List<RetentionPattern> second =
        RetentionRulesParser.parseCompact("^a;min;0:20");
    when(source.load(true)).thenReturn(first);
    when(source.load(false)).thenReturn(second);
    final RollupRules rules = RollupRules.newBuilder()
        .setSource(source)
        .setTimer(timer)
        .setInterval(1000)
        .build();
    final RetentionRules original = rules.current();

    rules.run(mock(Timeout.class));
    assertEquals(new Resolution(20, AggregationFunctions.MIN),
        rules.lookup("a.b", 0));
    assertTrue(original != rules.current());
    verify(timer, times(2)).newTimeout(rules, 1000, TimeUnit.MILLISECONDS);
  }

  @Test
  public void runUnchanged() throws Exception {
    when(source.load(true)).thenReturn(
        RetentionRulesParser.parseCompact("^a;max;0:10"));
    when(source.load(false)).thenReturn(null);
    final RollupRules rules = RollupRules.newBuilder()
        .setSource(source)
        .setTimer(timer)
        .setInterval(1000)
        .build();
    final RetentionRules original = rules.current();
    rules.run(null);
    assertSame(original, rules.current());
  }

  @Test
  public void runFailureKeepsRules() throws Exception {
    when(source.load(true)).thenReturn(
        RetentionRulesParser.parseCompact("^a;max;0:10"));
    when(source.load(false)).thenThrow(
        new InvalidRollupRulesException("Bad regex"));
    final RollupRules rules = RollupRules.newBuilder()
        .setSource(source)
        .setTimer(timer)
        .setInterval(1000)
        .build();
    final RetentionRules original = rules.current();
    rules.run(null);
    assertSame(original, rules.current());
    assertEquals(new Resolution(10, AggregationFunctions.MAX),
        rules.lookup("a.b", 0));
    // still re-armed
    verify(timer, times(2)).newTimeout(rules, 1000, TimeUnit.MILLISECONDS);
  }

  @Test
  public void close() throws Exception {
    final Timeout timeout = mock(Timeout.class);
    when(source.load(anyBoolean())).thenReturn(
        RetentionRulesParser.parseCompact("^a;max;0:10"));
    when(timer.newTimeout(any(RollupRules.class), anyLong(),
        any(TimeUnit.class))).thenReturn(timeout);
    final RollupRules rules = RollupRules.newBuilder()
        .setSource(source)
        .setTimer(timer)
        .setInterval(1000)
        .build();
    rules.close();
    verify(timeout, times(1)).cancel();
    rules.run(timeout);
    verify(source, never()).load(false);
    verify(timer, times(1)).newTimeout(rules, 1000, TimeUnit.MILLISECONDS);
  }

  @Test
  public void fileSource() throws Exception {
    final File file = folder.newFile("rollup.xml");
    Files.asCharSink(file, StandardCharsets.UTF_8).write(
        "<yandex><graphite_rollup><pattern><regexp>^a</regexp>"
        + "<function>sum</function></pattern></graphite_rollup></yandex>");
    final FileRetentionRulesSource file_source =
        new FileRetentionRulesSource(file.getAbsolutePath());
    assertTrue(file_source.describe().contains("XML"));

    final RollupRules rules = RollupRules.newBuilder()
        .setSource(file_source)
        .build();
    assertEquals(new Resolution(60, AggregationFunctions.SUM),
        rules.lookup("a.b", 0));

    // unchanged
    assertNull(file_source.load(false));
    assertFalse(rules.reload(false));
    assertEquals(1, file_source.load(true).size());

    Files.asCharSink(file, StandardCharsets.UTF_8).write(
        "<graphite_rollup><pattern><regexp>^a</regexp>"
        + "<function>min</function></pattern></graphite_rollup>");
    assertTrue(rules.reload(false));
    assertEquals(new Resolution(60, AggregationFunctions.MIN),
        rules.lookup("a.b", 0));

    // broken file keeps the last good rules
    Files.asCharSink(file, StandardCharsets.UTF_8).write("<graphite_rollup>");
    assertFalse(rules.reload(false));
    assertEquals(new Resolution(60, AggregationFunctions.MIN),
        rules.lookup("a.b", 0));
  }

  @Test
  public void fileSourceMissing() throws Exception {
    try {
      RollupRules.newBuilder()
          .setSource(new FileRetentionRulesSource(
              new File(folder.getRoot(), "nope.xml").getAbsolutePath()))
          .build();
      fail("Expected InvalidRollupRulesException");
    } catch (InvalidRollupRulesException e) { }
    try {
      new FileRetentionRulesSource("");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void storageSource() throws Exception {
    final StorageClient client = mock(StorageClient.class);
    final InputStream body = new ByteArrayInputStream(("{\"data\":["
        + "{\"rule_type\":\"all\",\"regexp\":\"^a\",\"function\":\"sum\","
        + "\"age\":\"0\",\"precision\":\"10\",\"is_default\":0}]}")
        .getBytes(StandardCharsets.UTF_8));
    when(client.query(eq("http://localhost:8123"), any(String.class),
        isNull(), eq(5000L)))
        .thenReturn(Deferred.fromResult(body));

    final StorageRetentionRulesSource storage = new StorageRetentionRulesSource(
        client, "http://localhost:8123", "graphite.data", 5000);
    assertEquals("SELECT rule_type, regexp, function, age, precision, is_default"
        + " FROM system.graphite_retentions ARRAY JOIN Tables AS table"
        + " WHERE (table.database = 'graphite') AND (table.table = 'data')"
        + " ORDER BY is_default ASC, priority ASC, regexp ASC, age ASC"
        + " FORMAT JSON", storage.query());
    assertEquals("storage:graphite.data", storage.describe());

    final RollupRules rules = RollupRules.newBuilder()
        .setSource(storage)
        .build();
    assertEquals(new Resolution(10, AggregationFunctions.SUM),
        rules.lookup("a.b", 0));

    assertEquals("storage:default.data", new StorageRetentionRulesSource(
        client, "http://localhost:8123", "data", 5000).describe());
  }
}
