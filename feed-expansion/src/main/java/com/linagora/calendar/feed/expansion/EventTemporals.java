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

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.Temporal;
import java.util.Optional;

import com.linagora.calendar.feed.parser.CalendarParseException;

import net.fortuna.ical4j.model.Property;
import net.fortuna.ical4j.model.component.VEvent;
import net.fortuna.ical4j.model.property.DateProperty;

public class EventTemporals {

    private EventTemporals() {
    }

    public static ZonedDateTime toZonedDateTime(Temporal temporal, ZoneId floatingZone) {
        if (temporal instanceof ZonedDateTime zonedDateTime) {
            return zonedDateTime;
        }
        if (temporal instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toZonedDateTime();
        }
        if (temporal instanceof Instant instant) {
            return instant.atZone(ZoneOffset.UTC);
        }
        if (temporal instanceof LocalDateTime localDateTime) {
            return localDateTime.atZone(floatingZone);
        }
        if (temporal instanceof LocalDate localDate) {
            return localDate.atStartOfDay(floatingZone);
        }
        throw new IllegalArgumentException("Cannot convert: " + temporal);
    }

    public static boolean isDateTime(Temporal temporal) {
        return temporal instanceof ZonedDateTime
            || temporal instanceof OffsetDateTime
            || temporal instanceof Instant
            || temporal instanceof LocalDateTime;
    }

    public static Instant toInstant(Temporal temporal, ZoneId floatingZone) {
        return toZonedDateTime(temporal, floatingZone).toInstant();
    }

    /**
     * Key under which two temporals denoting the same occurrence compare equal: the date
     * itself for date values, the absolute instant for date-time values.
     */
    public static Temporal matchingKey(Temporal temporal, ZoneId floatingZone) {
        if (temporal instanceof LocalDate) {
            return temporal;
        }
        return toInstant(temporal, floatingZone);
    }

    public static Optional<Temporal> dateOf(VEvent event, String propertyName) {
        return event.getProperty(propertyName)
            .filter(DateProperty.class::isInstance)
            .<Temporal>map(property -> ((DateProperty<?>) property).getDate());
    }

    public static Temporal startOf(VEvent event) {
        return dateOf(event, Property.DTSTART)
            .orElseThrow(() -> new CalendarParseException("DTSTART property is missing in VEVENT " + uidOf(event).orElse("without UID")));
    }

    public static Optional<String> uidOf(VEvent event) {
        return event.getUid().map(Property::getValue);
    }
}
