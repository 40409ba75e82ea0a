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
import java.time.temporal.TemporalAmount;

import com.google.common.base.Preconditions;

/**
 * The closed set of value kinds a normalized property can take.
 * <p>
 * Consumers branch on the kind through {@link #accept(Visitor)}: adding a kind adds a
 * visitor method, so every consumer fails to compile until it handles it.
 */
public sealed interface CanonicalValue permits CanonicalValue.UtcInstant, CanonicalValue.CivilDate,
    CanonicalValue.DurationValue, CanonicalValue.IntegerValue, CanonicalValue.TextValue {

    interface Visitor<T> {
        T visitInstant(Instant instant);

        T visitDate(LocalDate date);

        T visitDuration(TemporalAmount duration);

        T visitInteger(long value);

        T visitText(String text);
    }

    <T> T accept(Visitor<T> visitor);

    /**
     * An absolute instant, always expressed in UTC.
     */
    record UtcInstant(Instant value) implements CanonicalValue {
        public UtcInstant {
            Preconditions.checkArgument(value != null, "value must not be null");
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitInstant(value);
        }
    }

    /**
     * A calendar date without time of day nor zone, as used by all-day events.
     */
    record CivilDate(LocalDate value) implements CanonicalValue {
        public CivilDate {
            Preconditions.checkArgument(value != null, "value must not be null");
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitDate(value);
        }
    }

    record DurationValue(TemporalAmount value) implements CanonicalValue {
        public DurationValue {
            Preconditions.checkArgument(value != null, "value must not be null");
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitDuration(value);
        }
    }

    record IntegerValue(long value) implements CanonicalValue {
        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitInteger(value);
        }
    }

    record TextValue(String value) implements CanonicalValue {
        public TextValue {
            Preconditions.checkArgument(value != null, "value must not be null");
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitText(value);
        }
    }
}
