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

import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * One occurrence, flattened to property name (upper case, as written in the calendar)
 * and canonical value. Iteration follows the order properties were declared in.
 */
public record NormalizedRecord(ImmutableMap<String, CanonicalValue> values) {
    public NormalizedRecord {
        Preconditions.checkArgument(values != null, "values must not be null");
    }

    public static NormalizedRecord of(Map<String, CanonicalValue> values) {
        return new NormalizedRecord(ImmutableMap.copyOf(values));
    }

    public Optional<CanonicalValue> get(String propertyName) {
        return Optional.ofNullable(values.get(propertyName));
    }

    public Set<String> propertyNames() {
        return values.keySet();
    }
}
