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
import java.time.ZoneOffset;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.linagora.calendar.feed.parser.CalendarDocument;
import com.linagora.calendar.feed.parser.IcsParser;

/**
 * Expands the events of a calendar over a date window and normalizes every occurrence.
 * <p>
 * Stateless: instances can be shared between threads.
 */
public class CalendarFeedProcessor {
    private static final Logger LOGGER = LoggerFactory.getLogger(CalendarFeedProcessor.class);

    private final RecurrenceExpander expander;
    private final OccurrenceNormalizer normalizer;

    public CalendarFeedProcessor() {
        this(ZoneOffset.UTC);
    }

    /**
     * @param floatingZone zone applied to date-times carrying neither TZID nor UTC designator
     */
    public CalendarFeedProcessor(ZoneId floatingZone) {
        this.expander = new RecurrenceExpander(floatingZone);
        this.normalizer = new OccurrenceNormalizer(floatingZone);
    }

    public List<NormalizedRecord> expandAndNormalize(byte[] icsContent, LocalDate windowStart, LocalDate windowEnd) {
        DateWindow window = DateWindow.of(windowStart, windowEnd);
        return expandAndNormalize(IcsParser.parse(icsContent), window);
    }

    public List<NormalizedRecord> expandAndNormalize(CalendarDocument document, LocalDate windowStart, LocalDate windowEnd) {
        return expandAndNormalize(document, DateWindow.of(windowStart, windowEnd));
    }

    public List<NormalizedRecord> expandAndNormalize(CalendarDocument document, DateWindow window) {
        List<NormalizedRecord> records = expander.expand(document, window).stream()
            .map(normalizer::normalize)
            .toList();
        LOGGER.debug("Normalized {} occurrence(s) between {} and {}", records.size(), window.start(), window.end());
        return records;
    }
}
