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
import static org.junit.Assert.fail;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.Test;

import com.google.common.collect.Lists;

public class TestCommonStepResolver {

  @Test
  public void lcmOfContributions() throws Exception {
    final CommonStepResolver resolver = new CommonStepResolver();
    resolver.addParticipants(4);
    final CountDownLatch start = new CountDownLatch(1);
    final List<Thread> threads = Lists.newArrayList();
    for (final long step : new long[] { 0, 6, 8, 10 }) {
      final Thread thread = new Thread(new Runnable() {
        @Override
        public void run() {
          try {
            start.await();
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
          }
          resolver.contribute(step);
        }
      });
      thread.start();
      threads.add(thread);
    }
    start.countDown();
    assertEquals(120, resolver.getResult());
    for (final Thread thread : threads) {
      thread.join();
    }
    assertEquals(0, resolver.pending());
    // reading again is stable
    assertEquals(120, resolver.getResult(0));
  }

  @Test
  public void missingContributionTimesOut() throws Exception {
    final CommonStepResolver resolver = new CommonStepResolver();
    resolver.addParticipants(3);
    resolver.contribute(60);
    resolver.contribute(300);
    final long start = System.nanoTime();
    assertEquals(CommonStepResolver.FAILED, resolver.getResult(50));
    assertEquals(1, resolver.pending());
    assertEquals(true,
        System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(40));
  }

  @Test
  public void doneWithoutContribution() throws Exception {
    final CommonStepResolver resolver = new CommonStepResolver();
    resolver.addParticipants(2);
    resolver.contribute(60);
    resolver.doneWithoutContribution();
    assertEquals(60, resolver.getResult(10));
  }

  @Test
  public void allWithoutOpinion() throws Exception {
    final CommonStepResolver resolver = new CommonStepResolver();
    resolver.addParticipants(1);
    resolver.addParticipants(1);
    resolver.contribute(0);
    resolver.doneWithoutContribution();
    assertEquals(0, resolver.getResult(10));
  }

  @Test
  public void waitsForLateContributor() throws Exception {
    final CommonStepResolver resolver = new CommonStepResolver();
    resolver.addParticipants(2);
    resolver.contribute(6);
    final Thread late = new Thread(new Runnable() {
      @Override
      public void run() {
        try {
          Thread.sleep(50);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
        resolver.contribute(4);
      }
    });
    late.start();
    assertEquals(12, resolver.getResult(5000));
    late.join();
  }

  @Test
  public void errors() throws Exception {
    final CommonStepResolver resolver = new CommonStepResolver();
    try {
      resolver.addParticipants(0);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    resolver.addParticipants(1);
    try {
      resolver.contribute(-1);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    assertEquals(1, resolver.pending());

    resolver.contribute(10);
    try {
      resolver.contribute(10);
      fail("Expected IllegalStateException");
    } catch (IllegalStateException e) { }
    assertEquals(0, resolver.pending());
    assertEquals(10, resolver.getResult(0));
  }
}
