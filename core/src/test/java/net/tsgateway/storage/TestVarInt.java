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
package net.tsgateway.storage;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;

import org.junit.Test;

public class TestVarInt {

  @Test
  public void readSingleByte() throws Exception {
    final VarInt.Result result = VarInt.read(new byte[] { 0x05, 0x7F }, 0, 2);
    assertTrue(result.isOk());
    assertEquals(5, result.value());
    assertEquals(1, result.length());

    assertEquals(127, VarInt.read(new byte[] { 0x05, 0x7F }, 1, 2).value());
  }

  @Test
  public void readMultiByte() throws Exception {
    // 300 = 0b1_0010_1100
    VarInt.Result result = VarInt.read(new byte[] { (byte) 0xAC, 0x02 }, 0, 2);
    assertEquals(VarInt.Status.OK, result.status());
    assertEquals(300, result.value());
    assertEquals(2, result.length());

    final byte[] max = new byte[] { (byte) 0xFF, (byte) 0xFF, (byte) 0xFF,
        (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF,
        (byte) 0xFF, 0x01 };
    result = VarInt.read(max, 0, max.length);
    assertEquals(VarInt.Status.OK, result.status());
    assertEquals(-1L, result.value());
    assertEquals(10, result.length());
  }

  @Test
  public void readNeedMore() throws Exception {
    assertEquals(VarInt.Status.NEED_MORE,
        VarInt.read(new byte[] { (byte) 0xAC, 0x02 }, 0, 1).status());
    assertEquals(VarInt.Status.NEED_MORE,
        VarInt.read(new byte[0], 0, 0).status());
    assertEquals(VarInt.Status.NEED_MORE,
        VarInt.read(new byte[] { 0x01 }, 1, 1).status());
  }

  @Test
  public void readOverflow() throws Exception {
    // 10th byte may only carry one bit
    byte[] buf = new byte[] { (byte) 0xFF, (byte) 0xFF, (byte) 0xFF,
        (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF,
        (byte) 0xFF, 0x02 };
    assertEquals(VarInt.Status.OVERFLOW, VarInt.read(buf, 0, buf.length).status());

    // 11 bytes
    buf = new byte[11];
    for (int i = 0; i < 10; i++) {
      buf[i] = (byte) 0x80;
    }
    assertEquals(VarInt.Status.OVERFLOW, VarInt.read(buf, 0, buf.length).status());
    // overflow is known before the buffer ends
    assertEquals(VarInt.Status.OVERFLOW, VarInt.read(buf, 0, 10).status());
  }

  @Test
  public void write() throws Exception {
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    VarInt.write(out, 300);
    assertArrayEquals(new byte[] { (byte) 0xAC, 0x02 }, out.toByteArray());

    final byte[] buf = new byte[12];
    assertEquals(1, VarInt.write(buf, 0, 0));
    assertEquals(10, VarInt.write(buf, 2, -1L));
    assertEquals(-1L, VarInt.read(buf, 2, 12).value());

    assertEquals(1, VarInt.length(0));
    assertEquals(1, VarInt.length(127));
    assertEquals(2, VarInt.length(128));
    assertEquals(10, VarInt.length(Long.MIN_VALUE));
  }
}
