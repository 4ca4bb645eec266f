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
package net.tsgateway.utils;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class TestReversePath {

  @Test
  public void reverse() throws Exception {
    assertEquals("c.b.a", ReversePath.reverse("a.b.c"));
    assertEquals("a.b.c", ReversePath.reverse(ReversePath.reverse("a.b.c")));
    assertEquals("single", ReversePath.reverse("single"));
    assertEquals("c..a", ReversePath.reverse("a..c"));
  }

  @Test
  public void taggedNotReversed() throws Exception {
    assertEquals("cpu.load?host=a.b", ReversePath.reverse("cpu.load?host=a.b"));
    assertTrue(ReversePath.isTagged("cpu?host=a"));
    assertFalse(ReversePath.isTagged("cpu.host"));
  }
}
