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

import org.junit.Test;

public class TestStepMath {

  @Test
  public void lcm() throws Exception {
    assertEquals(120, StepMath.lcm(StepMath.lcm(6, 8), 10));
    assertEquals(300, StepMath.lcm(60, 300));
    assertEquals(7, StepMath.lcm(0, 7));
    assertEquals(7, StepMath.lcm(7, 0));
    assertEquals(0, StepMath.lcm(0, 0));
  }

  @Test
  public void gcd() throws Exception {
    assertEquals(6, StepMath.gcd(12, 18));
    assertEquals(5, StepMath.gcd(5, 0));
  }

  @Test
  public void rounding() throws Exception {
    assertEquals(9, StepMath.ceilDiv(900, 100));
    assertEquals(10, StepMath.ceilDiv(901, 100));
    assertEquals(300, StepMath.ceilToMultiple(9, 300));
    assertEquals(600, StepMath.ceilToMultiple(301, 300));
    assertEquals(900, StepMath.ceilToMultiple(900, 300));
    assertEquals(900, StepMath.floorToMultiple(901, 300));
    assertEquals(0, StepMath.floorToMultiple(299, 300));
    assertEquals(17, StepMath.floorToMultiple(17, 0));
  }
}
