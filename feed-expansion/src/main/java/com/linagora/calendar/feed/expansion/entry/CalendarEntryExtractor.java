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

package com.linagora.calendar.feed.expansion.entry;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.Temporal;
import java.time.temporal.TemporalAmount;
import java.util.Optional;

import com.linagora.calendar.feed.expansion.CanonicalValue;
import com.linagora.calendar.feed.expansion.NormalizedRecord;

import net.fortuna.ical4j.model.Property;

/**
 * Builds a {@link CalendarEntry} out of a {@link NormalizedRecord}.
 * <p>
 * A missing DTEND is derived from DURATION, or spans one day for an all-day entry.
 */
public class CalendarEntryExtractor {

    private static class KindVisitor<T> implements CanonicalValue.Visitor<Optional<T>> {
        @Override
        public Optional<T> visitInstant(Instant instant) {
            return Optional.empty();
        }

        @Override
        public Optional<T> visitDate(LocalDate date) {
            return Optional.empty();
        }

        @Override
        public Optional<T> visitDuration(TemporalAmount duration) {
            return Optional.empty();
        }

        @Override
        public Optional<T> visitInteger(long value) {
            return Optional.empty();
        }

        @Override
        public Optional<T> visitText(String text) {
            return Optional.empty();
        }
    }

    private static final KindVisitor<String> TEXT = new KindVisitor<>() {
        @Override
        public Optional<String> visitText(String text) {
            return Optional.of(text);
        }
    };

    private static final KindVisitor<Instant> INSTANT = new KindVisitor<>() {
        @Override
        public Optional<Instant> visitInstant(Instant instant) {
            return Optional.of(instant);
        }
    };

    private static final KindVisitor<Long> INTEGER = new KindVisitor<>() {
        @Override
        public Optional<Long> visitInteger(long value) {
            return Optional.of(value);
        }
    };

    private static final KindVisitor<TemporalAmount> DURATION = new KindVisitor<>() {
        @Override
        public Optional<TemporalAmount> visitDuration(TemporalAmount duration) {
            return Optional.of(duration);
        }
    };

    private static final KindVisitor<Temporal> DATE_OR_INSTANT = new KindVisitor<>() {
        @Override
        public Optional<Temporal> visitInstant(Instant instant) {
            return Optional.of(instant);
        }

        @Override
        public Optional<Temporal> visitDate(LocalDate date) {
            return Optional.of(date);
        }
    };

    public CalendarEntry extract(NormalizedRecord record) {
        return new CalendarEntry(
            required(record, Property.SUMMARY, TEXT),
            optional(record, Property.DESCRIPTION, TEXT),
            optional(record, Property.LOCATION, TEXT),
            required(record, Property.UID, TEXT),
            optional(record, Property.STATUS, TEXT),
            optional(record, Property.TRANSP, TEXT),
            optional(record, Property.SEQUENCE, INTEGER),
            startEnd(record),
            required(record, Property.DTSTAMP, INSTANT),
            optional(record, Property.CREATED, INSTANT),
            optional(record, Property.LAST_MODIFIED, INSTANT),
            optional(record, Property.RECURRENCE_ID, DATE_OR_INSTANT));
    }

    private StartEnd startEnd(NormalizedRecord record) {
        Temporal start = required(record, Property.DTSTART, DATE_OR_INSTANT);
        Optional<Temporal> end = optional(record, Property.DTEND, DATE_OR_INSTANT)
            .or(() -> optional(record, Property.DURATION, DURATION).map(duration -> plus(start, duration)));

        if (start instanceof LocalDate startDate) {
            Temporal endValue = end.orElseGet(() -> startDate.plusDays(1));
            if (endValue instanceof LocalDate endDate) {
                return new StartEnd.Dates(startDate, endDate);
            }
            throw new InvalidCalendarEntryException("DTSTART is a date but DTEND is a date-time in " + describe(record));
        }
        Temporal endValue = end.orElse(start);
        if (endValue instanceof Instant endInstant) {
            return new StartEnd.DateTimes((Instant) start, endInstant);
        }
        throw new InvalidCalendarEntryException("DTSTART is a date-time but DTEND is a date in " + describe(record));
    }

    private Temporal plus(Temporal start, TemporalAmount amount) {
        if (start instanceof LocalDate date && amount instanceof Duration duration) {
            return date.plusDays(duration.toDays());
        }
        return start.plus(amount);
    }

    private <T> T required(NormalizedRecord record, String name, KindVisitor<T> kind) {
        CanonicalValue value = record.get(name)
            .orElseThrow(() -> new InvalidCalendarEntryException(name + " is missing in " + describe(record)));
        return value.accept(kind)
            .orElseThrow(() -> new InvalidCalendarEntryException(name + " has an unexpected kind " + value + " in " + describe(record)));
    }

    private <T> Optional<T> optional(NormalizedRecord record, String name, KindVisitor<T> kind) {
        return record.get(name)
            .map(value -> value.accept(kind)
                .orElseThrow(() -> new InvalidCalendarEntryException(name + " has an unexpected kind " + value + " in " + describe(record))));
    }

    private String describe(NormalizedRecord record) {
        return "entry " + record.get(Property.UID).flatMap(value -> value.accept(TEXT)).orElse("without UID");
    }
}
