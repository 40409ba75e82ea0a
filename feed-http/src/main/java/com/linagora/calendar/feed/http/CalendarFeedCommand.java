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

import java.io.File;
import java.net.URI;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.io.FileHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.linagora.calendar.feed.expansion.NormalizedRecord;

/**
 * Prints the occurrences of a feed as JSON.
 * <p>
 * Usage: {@code CalendarFeedCommand <url|-> <start> <end> [feed.properties]}. With {@code -}
 * the url is read from {@code feed.url}.
 */
public class CalendarFeedCommand {
    private static final Logger LOGGER = LoggerFactory.getLogger(CalendarFeedCommand.class);
    private static final String URL_FROM_CONFIGURATION = "-";

    public static void main(String[] args) throws ConfigurationException {
        if (args.length < 3 || args.length > 4) {
            System.err.println("Usage: CalendarFeedCommand <url|-> <start yyyy-MM-dd> <end yyyy-MM-dd> [feed.properties]");
            System.exit(2);
            return;
        }

        FeedConfiguration configuration = FeedConfiguration.parse(loadConfiguration(args.length == 4 ? Optional.of(args[3]) : Optional.empty()));
        URI url = resolveUrl(args[0], configuration);
        LocalDate start = LocalDate.parse(args[1]);
        LocalDate end = LocalDate.parse(args[2]);

        LOGGER.info("Loading {} between {} and {}", url, start, end);
        List<NormalizedRecord> records = CalendarFeedLoader.create(configuration)
            .load(url, start, end)
            .block();
        LOGGER.info("Found {} occurrence(s)", records.size());
        System.out.println(new NormalizedRecordJsonSerializer().toJson(records));
    }

    static Configuration loadConfiguration(Optional<String> path) throws ConfigurationException {
        if (path.isEmpty()) {
            return new BaseConfiguration();
        }
        PropertiesConfiguration configuration = new PropertiesConfiguration();
        new FileHandler(configuration).load(new File(path.get()));
        return configuration;
    }

    static URI resolveUrl(String argument, FeedConfiguration configuration) {
        if (URL_FROM_CONFIGURATION.equals(argument)) {
            return configuration.feedUrl()
                .orElseThrow(() -> new IllegalArgumentException("'feed.url' is mandatory when no url is given"));
        }
        return URI.create(argument);
    }
}
