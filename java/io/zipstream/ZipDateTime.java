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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.auto.value.AutoValue;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDateTime;

/**
 * A calendar date and time for a ZIP entry, and its packed MS-DOS representation.
 *
 * <p>The DOS format has 2 second resolution and stores years 1980 to 2107. Components are not
 * validated: each one is masked to the width of its bit field, so out of range values wrap the
 * same way the format itself would.
 *
 * <p>See <a href="http://www.pkware.com/documents/casestudies/APPNOTE.TXT">ZIP Format</a>
 * section 4.4.6 and
 * <a href="https://msdn.microsoft.com/en-us/library/windows/desktop/ms724247.aspx">DOS date
 * format</a>.
 */
@AutoValue
public abstract class ZipDateTime {

  /** Used when the local time cannot be determined. */
  public static final ZipDateTime FALLBACK = create(2000, 1, 1, 0, 0, 0);

  /* DOS format timestamp field offsets, within the 16-bit time and date fields. */
  private static final int DOS_MINUTE_OFFSET = 5;
  private static final int DOS_HOUR_OFFSET = 11;
  private static final int DOS_MONTH_OFFSET = 5;
  private static final int DOS_YEAR_OFFSET = 9;

  private static final int DOS_BASE_YEAR = 1980;

  public abstract int year();

  /** Month of the year, 1 to 12. */
  public abstract int month();

  public abstract int day();

  public abstract int hours();

  public abstract int minutes();

  public abstract int seconds();

  public static ZipDateTime create(
      int year, int month, int day, int hours, int minutes, int seconds) {
    return new AutoValue_ZipDateTime(year, month, day, hours, minutes, seconds);
  }

  public static ZipDateTime of(LocalDateTime dateTime) {
    return create(dateTime.getYear(), dateTime.getMonthValue(), dateTime.getDayOfMonth(),
        dateTime.getHour(), dateTime.getMinute(), dateTime.getSecond());
  }

  /**
   * Returns the current local date and time of {@code clock}, or {@link #FALLBACK} if the
   * clock's zone cannot be resolved.
   */
  public static ZipDateTime now(Clock clock) {
    checkNotNull(clock);
    try {
      return of(LocalDateTime.now(clock));
    } catch (DateTimeException e) {
      return FALLBACK;
    }
  }

  /** Returns the 16-bit DOS time: hours, minutes and seconds / 2. */
  public int dosTime() {
    int time = (seconds() / 2) & 0x1f;
    time |= (minutes() & 0x3f) << DOS_MINUTE_OFFSET;
    time |= (hours() & 0x1f) << DOS_HOUR_OFFSET;
    return time;
  }

  /** Returns the 16-bit DOS date: years since 1980, month and day. */
  public int dosDate() {
    int date = day() & 0x1f;
    date |= (month() & 0x0f) << DOS_MONTH_OFFSET;
    date |= ((year() - DOS_BASE_YEAR) & 0x7f) << DOS_YEAR_OFFSET;
    return date;
  }
}
