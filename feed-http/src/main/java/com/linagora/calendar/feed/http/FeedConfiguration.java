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
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;

import org.apache.commons.configuration2.AbstractConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.convert.DisabledListDelimiterHandler;

import com.google.common.base.Preconditions;

public record FeedConfiguration(ZoneId defaultTimeZone,
                                Duration responseTimeout,
                                boolean followRedirects,
                                Optional<URI> feedUrl) {
    public static final ZoneId DEFAULT_TIME_ZONE = ZoneOffset.UTC;
    public static final Duration DEFAULT_RESPONSE_TIMEOUT = Duration.ofSeconds(10);
    public static final FeedConfiguration DEFAULT = new FeedConfiguration(DEFAULT_TIME_ZONE, DEFAULT_RESPONSE_TIMEOUT, true, Optional.empty());

    public FeedConfiguration {
        Preconditions.checkArgument(defaultTimeZone != null, "defaultTimeZone must not be null");
        Preconditions.checkArgument(responseTimeout != null && !responseTimeout.isNegative() && !responseTimeout.isZero(),
            "responseTimeout must be strictly positive");
        Preconditions.checkArgument(feedUrl != null, "feedUrl must not be null");
    }

    public static FeedConfiguration parse(Configuration configuration) {
        if (configuration instanceof AbstractConfiguration) {
            ((AbstractConfiguration) configuration)
                .setListDelimiterHandler(new DisabledListDelimiterHandler());
        }

        return new FeedConfiguration(
            Optional.ofNullable(configuration.getString("feed.default.timezone", null))
                .map(FeedConfiguration::parseZone)
                .orElse(DEFAULT_TIME_ZONE),
            Optional.ofNullable(configuration.getString("feed.http.response.timeout", null))
                .map(FeedConfiguration::parseTimeout)
                .orElse(DEFAULT_RESPONSE_TIMEOUT),
            configuration.getBoolean("feed.http.follow.redirects", true),
            Optional.ofNullable(configuration.getString("feed.url", null))
                .map(URI::create));
    }

    private static ZoneId parseZone(String value) {
        try {
            return ZoneId.of(value);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("'feed.default.timezone' is not a valid zone id: " + value, e);
        }
    }

    private static Duration parseTimeout(String value) {
        try {
            return Duration.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("'feed.http.response.timeout' is not an ISO-8601 duration: " + value, e);
        }
    }
}
