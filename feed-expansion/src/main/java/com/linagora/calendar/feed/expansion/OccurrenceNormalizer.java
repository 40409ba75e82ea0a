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

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.Temporal;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.linagora.calendar.feed.expansion.CanonicalValue.CivilDate;
import com.linagora.calendar.feed.expansion.CanonicalValue.DurationValue;
import com.linagora.calendar.feed.expansion.CanonicalValue.IntegerValue;
import com.linagora.calendar.feed.expansion.CanonicalValue.TextValue;
import com.linagora.calendar.feed.expansion.CanonicalValue.UtcInstant;

import net.fortuna.ical4j.model.Property;
import net.fortuna.ical4j.model.property.DateProperty;
import net.fortuna.ical4j.model.property.Duration;

/**
 * Maps every property of an {@link Occurrence} to a {@link CanonicalValue}.
 * <p>
 * A property whose shape has no canonical counterpart fails the whole normalization with
 * {@link UnsupportedPropertyTypeException}: dropping it would hide data from the consumer.
 */
public class OccurrenceNormalizer {
    private final ZoneId floatingZone;

    public OccurrenceNormalizer(ZoneId floatingZone) {
        Preconditions.checkArgument(floatingZone != null, "floatingZone must not be null");
        this.floatingZone = floatingZone;
    }

    public NormalizedRecord normalize(Occurrence occurrence) {
        Map<String, CanonicalValue> values = new LinkedHashMap<>();
        for (Property property : occurrence.properties()) {
            Temporal resolved = occurrence.resolvedTimes().get(property.getName());
            CanonicalValue value = resolved != null
                ? normalize(property.getName(), resolved)
                : normalize(property);
            put(values, property, value);
        }
        occurrence.resolvedTimes().forEach((name, temporal) -> values.putIfAbsent(name, normalize(name, temporal)));
        return NormalizedRecord.of(values);
    }

    public CanonicalValue normalize(Property property) {
        return switch (PropertyKind.of(property)) {
            case DATE_TIME, DATE -> normalize(property.getName(), ((DateProperty<?>) property).getDate());
            case DURATION -> new DurationValue(((Duration) property).getDuration());
            case INTEGER -> toInteger(property);
            case TEXT -> new TextValue(property.getValue());
            case UNSUPPORTED -> throw new UnsupportedPropertyTypeException(property.getName(), property.getValue(),
                "no canonical representation");
        };
    }

    CanonicalValue normalize(String propertyName, Temporal temporal) {
        if (temporal instanceof LocalDate date) {
            return new CivilDate(date);
        }
        if (EventTemporals.isDateTime(temporal)) {
            return new UtcInstant(EventTemporals.toInstant(temporal, floatingZone));
        }
        throw new UnsupportedPropertyTypeException(propertyName, String.valueOf(temporal), "unknown temporal type");
    }

    private IntegerValue toInteger(Property property) {
        try {
            return new IntegerValue(Long.parseLong(property.getValue().trim()));
        } catch (NumberFormatException e) {
            throw new UnsupportedPropertyTypeException(property.getName(), property.getValue(), e);
        }
    }

    private void put(Map<String, CanonicalValue> values, Property property, CanonicalValue value) {
        if (values.putIfAbsent(property.getName(), value) != null) {
            throw new UnsupportedPropertyTypeException(property.getName(), property.getValue(),
                "property is repeated, a record holds a single value per property");
        }
    }
}
