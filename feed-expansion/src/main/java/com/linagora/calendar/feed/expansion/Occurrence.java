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

import java.time.temporal.Temporal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import net.fortuna.ical4j.model.Property;

/**
 * One concrete instance of an event.
 *
 * @param uid           the UID shared by every occurrence of a series
 * @param start         the effective start, used for window filtering
 * @param properties    the properties describing this occurrence, in declaration order
 * @param resolvedTimes values replacing (or adding) date properties of a generated occurrence:
 *                      DTSTART, DTEND and RECURRENCE-ID
 */
public record Occurrence(Optional<String> uid,
                         Temporal start,
                         ImmutableList<Property> properties,
                         ImmutableMap<String, Temporal> resolvedTimes) {
    public Occurrence {
        Preconditions.checkArgument(start != null, "start must not be null");
    }

    public static Occurrence of(Optional<String> uid, Temporal start, List<Property> properties) {
        return new Occurrence(uid, start, ImmutableList.copyOf(properties), ImmutableMap.of());
    }

    public static Occurrence generated(Optional<String> uid, Temporal start, List<Property> properties,
                                       Map<String, Temporal> resolvedTimes) {
        return new Occurrence(uid, start, ImmutableList.copyOf(properties), ImmutableMap.copyOf(resolvedTimes));
    }
}
