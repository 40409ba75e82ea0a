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

import java.time.Instant;
import java.time.LocalDate;

import com.google.common.base.Preconditions;

/**
 * Bounds of an entry: both dates for an all-day entry, both instants otherwise.
 */
public sealed interface StartEnd permits StartEnd.Dates, StartEnd.DateTimes {

    record Dates(LocalDate start, LocalDate end) implements StartEnd {
        public Dates {
            Preconditions.checkArgument(start != null, "start must not be null");
            Preconditions.checkArgument(end != null, "end must not be null");
        }
    }

    record DateTimes(Instant start, Instant end) implements StartEnd {
        public DateTimes {
            Preconditions.checkArgument(start != null, "start must not be null");
            Preconditions.checkArgument(end != null, "end must not be null");
        }
    }
}
