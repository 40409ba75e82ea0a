/********************************************************************
 *  As a subpart of Twake Mail, this file is edited by Linagora.    *
 *                                                                  *
 *  https://twake-mail.com/                                         *
 *  https://linagora.com                                            *
 *                                                                  *
 *  This file is subject to The Affero Gnu Public License           *
 *  version 3.                                                      *
 *                                                                  *
 *  https://www.gnu.org/licenses/agpl-3.0.en.html                   *
 *                                                                  *
 *  This program is distributed in the hope that it will be         *
 *  useful, but WITHOUT ANY WARRANTY; without even the implied      *
 *  warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR         *
 *  PURPOSE. See the GNU Affero General Public License for          *
 *  more details.                                                   *
 ********************************************************************/

package com.linagora.calendar.feed.expansion;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.Temporal;

import com.google.common.base.Preconditions;
import com.google.common.collect.Range;

/**
 * Half-open civil date interval {@code [start, end)}.
 */
public record DateWindow(LocalDate start, LocalDate end) {

    public static DateWindow of(LocalDate start, LocalDate end) {
        return new DateWindow(start, end);
    }

    public DateWindow {
        Preconditions.checkArgument(start != null, "start must not be null");
        Preconditions.checkArgument(end != null, "end must not be null");
        if (start.isAfter(end)) {
            throw new InvalidWindowException(start, end);
        }
    }

    public Range<LocalDate> dates() {
        return Range.closedOpen(start, end);
    }

    /**
     * Date-only starts compare as calendar dates. Date-time starts compare against the
     * window bounds taken at the start of day in the start's own zone.
     */
    public boolean contains(Temporal occurrenceStart, ZoneId floatingZone) {
        if (occurrenceStart instanceof LocalDate date) {
            return dates().contains(date);
        }
        ZonedDateTime zonedStart = EventTemporals.toZonedDateTime(occurrenceStart, floatingZone);
        return Range.closedOpen(start.atStartOfDay(zonedStart.getZone()).toInstant(),
                end.atStartOfDay(zonedStart.getZone()).toInstant())
            .contains(zonedStart.toInstant());
    }

    /**
     * @return this window extended on both sides by whole days covering {@code margin}
     */
    public DateWindow widen(Duration margin) {
        if (margin.isZero()) {
            return this;
        }
        long days = margin.toDays() + 1;
        return new DateWindow(start.minusDays(days), end.plusDays(days));
    }
}
