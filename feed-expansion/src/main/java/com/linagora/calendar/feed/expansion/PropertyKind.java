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
import java.util.Set;

import net.fortuna.ical4j.model.Parameter;
import net.fortuna.ical4j.model.Property;
import net.fortuna.ical4j.model.parameter.Value;
import net.fortuna.ical4j.model.property.DateListProperty;
import net.fortuna.ical4j.model.property.DateProperty;
import net.fortuna.ical4j.model.property.Duration;

/**
 * Shape of an iCalendar property value, as far as normalization is concerned.
 */
public enum PropertyKind {
    DATE_TIME,
    DATE,
    DURATION,
    INTEGER,
    TEXT,
    UNSUPPORTED;

    static final Set<String> SERIES_PROPERTIES = Set.of(Property.RRULE, Property.EXRULE, Property.RDATE, Property.EXDATE);
    private static final Set<String> INTEGER_PROPERTIES = Set.of(Property.SEQUENCE, Property.PRIORITY,
        Property.PERCENT_COMPLETE, Property.REPEAT);
    private static final Set<String> STRUCTURED_PROPERTIES = Set.of(Property.GEO, Property.CATEGORIES,
        Property.FREEBUSY);

    public static PropertyKind of(Property property) {
        String name = property.getName();
        if (SERIES_PROPERTIES.contains(name) || STRUCTURED_PROPERTIES.contains(name)) {
            return UNSUPPORTED;
        }
        if (property instanceof DateListProperty) {
            return UNSUPPORTED;
        }
        if (property instanceof DateProperty<?> dateProperty) {
            return dateProperty.getDate() instanceof LocalDate ? DATE : DATE_TIME;
        }
        if (property instanceof Duration) {
            return DURATION;
        }
        if (INTEGER_PROPERTIES.contains(name)) {
            return INTEGER;
        }
        if (isBinary(property)) {
            return UNSUPPORTED;
        }
        return TEXT;
    }

    private static boolean isBinary(Property property) {
        return property.getParameter(Parameter.VALUE)
            .map(value -> Value.BINARY.getValue().equalsIgnoreCase(value.getValue()))
            .orElse(false);
    }
}
