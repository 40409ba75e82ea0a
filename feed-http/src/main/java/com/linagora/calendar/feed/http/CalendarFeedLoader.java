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

package com.linagora.calendar.feed.http;

import java.net.URI;
import java.time.LocalDate;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.linagora.calendar.feed.expansion.CalendarFeedProcessor;
import com.linagora.calendar.feed.expansion.DateWindow;
import com.linagora.calendar.feed.expansion.NormalizedRecord;
import com.linagora.calendar.feed.expansion.entry.CalendarEntry;
import com.linagora.calendar.feed.expansion.entry.CalendarEntryExtractor;
import com.linagora.calendar.feed.parser.IcsParser;

import reactor.core.publisher.Mono;

/**
 * Fetches a feed, then expands and normalizes its events over a window.
 * <p>
 * The window is checked before any request is sent. Fetch, parse, window and
 * normalization failures reach the subscriber as their own exception types.
 */
public class CalendarFeedLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(CalendarFeedLoader.class);

    private final IcsFetcher fetcher;
    private final CalendarFeedProcessor processor;
    private final CalendarEntryExtractor entryExtractor;

    public CalendarFeedLoader(IcsFetcher fetcher, CalendarFeedProcessor processor) {
        this.fetcher = fetcher;
        this.processor = processor;
        this.entryExtractor = new CalendarEntryExtractor();
    }

    public static CalendarFeedLoader create(FeedConfiguration configuration) {
        return new CalendarFeedLoader(new IcsFetcher(configuration),
            new CalendarFeedProcessor(configuration.defaultTimeZone()));
    }

    public Mono<List<NormalizedRecord>> load(URI url, LocalDate windowStart, LocalDate windowEnd) {
        return Mono.fromCallable(() -> DateWindow.of(windowStart, windowEnd))
            .flatMap(window -> fetcher.fetch(url)
                .map(bytes -> processor.expandAndNormalize(IcsParser.parse(bytes), window)))
            .doOnNext(records -> LOGGER.debug("Loaded {} occurrence(s) from {} between {} and {}",
                records.size(), url, windowStart, windowEnd));
    }

    public Mono<List<CalendarEntry>> loadEntries(URI url, LocalDate windowStart, LocalDate windowEnd) {
        return load(url, windowStart, windowEnd)
            .map(records -> records.stream()
                .map(entryExtractor::extract)
                .toList());
    }
}
