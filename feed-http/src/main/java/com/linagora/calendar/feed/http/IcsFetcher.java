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
import java.nio.charset.StandardCharsets;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.handler.codec.http.HttpHeaderNames;
import reactor.core.publisher.Mono;
import reactor.netty.ByteBufMono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.http.client.HttpClientResponse;

/**
 * Downloads the raw bytes of an iCalendar feed.
 */
public class IcsFetcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(IcsFetcher.class);
    private static final String ACCEPTED_CONTENT = "text/calendar, */*;q=0.5";

    private final HttpClient client;

    public IcsFetcher(FeedConfiguration configuration) {
        this.client = HttpClient.create()
            .followRedirect(configuration.followRedirects())
            .responseTimeout(configuration.responseTimeout())
            .headers(headers -> headers.add(HttpHeaderNames.ACCEPT, ACCEPTED_CONTENT));
    }

    public Mono<byte[]> fetch(URI url) {
        return client.get()
            .uri(url)
            .responseSingle((response, byteBufMono) -> handleResponse(url, response, byteBufMono))
            .onErrorMap(e -> !(e instanceof CalendarFetchException),
                e -> new CalendarFetchException("Failed to fetch calendar from " + url, e));
    }

    private Mono<byte[]> handleResponse(URI url, HttpClientResponse response, ByteBufMono responseContent) {
        int statusCode = response.status().code();
        if (statusCode >= 200 && statusCode < 300) {
            return responseContent.asByteArray()
                .defaultIfEmpty(new byte[0])
                .doOnNext(bytes -> LOGGER.debug("Fetched {} bytes from {}", bytes.length, url));
        }
        return responseContent.asString(StandardCharsets.UTF_8)
            .switchIfEmpty(Mono.just(StringUtils.EMPTY))
            .flatMap(responseBody -> Mono.error(new CalendarFetchException("""
                Unexpected status code: %d when fetching calendar from %s
                %s
                """.formatted(statusCode, url, StringUtils.abbreviate(responseBody, 512)))));
    }
}
