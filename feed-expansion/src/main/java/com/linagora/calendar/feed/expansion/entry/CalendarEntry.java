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
import java.time.temporal.Temporal;
import java.util.Optional;

/**
 * Typed view of a normalized occurrence, carrying the fields schedulers act upon.
 *
 * @param recurrenceId the start this occurrence has within its series, either a
 *                     {@link java.time.LocalDate} or an {@link Instant}
 */
public record CalendarEntry(String summary,
                            Optional<String> description,
                            Optional<String> location,
                            String uid,
                            Optional<String> status,
                            Optional<String> transparency,
                            Optional<Long> sequence,
                            StartEnd startEnd,
                            Instant stamp,
                            Optional<Instant> created,
                            Optional<Instant> lastModified,
                            Optional<Temporal> recurrenceId) {
}
