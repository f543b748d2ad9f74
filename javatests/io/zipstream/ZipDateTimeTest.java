// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package io.zipstream;

import static com.google.common.truth.Truth.assertThat;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ZipDateTimeTest {

  /** A clock whose current instant cannot be determined. */
  private static final class BrokenClock extends Clock {
    @Override public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override public Instant instant() {
      throw new DateTimeException("no time source");
    }
  }

  @Test public void testPacking() {
    ZipDateTime time = ZipDateTime.create(2024, 3, 15, 14, 30, 45);
    assertThat(time.dosDate()).isEqualTo((44 << 9) | (3 << 5) | 15);
    assertThat(time.dosTime()).isEqualTo((14 << 11) | (30 << 5) | 22);
  }

  @Test public void testDosEpoch() {
    ZipDateTime time = ZipDateTime.create(1980, 1, 1, 0, 0, 0);
    assertThat(time.dosDate()).isEqualTo((1 << 5) | 1);
    assertThat(time.dosTime()).isEqualTo(0);
  }

  @Test public void testMaximum() {
    ZipDateTime time = ZipDateTime.create(2107, 12, 31, 23, 59, 59);
    assertThat(time.dosDate()).isEqualTo((127 << 9) | (12 << 5) | 31);
    assertThat(time.dosTime()).isEqualTo((23 << 11) | (59 << 5) | 29);
  }

  @Test public void testOutOfRangeValuesWrap() {
    // 2108 is one past the last representable year and wraps to 1980.
    assertThat(ZipDateTime.create(2108, 1, 1, 0, 0, 0).dosDate())
        .isEqualTo(ZipDateTime.create(1980, 1, 1, 0, 0, 0).dosDate());
    assertThat(ZipDateTime.create(1979, 1, 1, 0, 0, 0).dosDate() >> 9).isEqualTo(127);
    assertThat(ZipDateTime.create(2000, 1, 1, 32, 64, 0).dosTime()).isEqualTo(0);
  }

  @Test public void testOfLocalDateTime() {
    ZipDateTime time = ZipDateTime.of(LocalDateTime.of(2019, 11, 2, 8, 7, 6));
    assertThat(time).isEqualTo(ZipDateTime.create(2019, 11, 2, 8, 7, 6));
  }

  @Test public void testNow() {
    Clock clock = Clock.fixed(
        LocalDateTime.of(2022, 2, 22, 22, 22, 22).toInstant(ZoneOffset.ofHours(2)),
        ZoneOffset.ofHours(2));
    assertThat(ZipDateTime.now(clock)).isEqualTo(ZipDateTime.create(2022, 2, 22, 22, 22, 22));
  }

  @Test public void testNowFallsBack() {
    ZipDateTime time = ZipDateTime.now(new BrokenClock());
    assertThat(time).isEqualTo(ZipDateTime.FALLBACK);
    assertThat(time).isEqualTo(ZipDateTime.create(2000, 1, 1, 0, 0, 0));
  }
}
