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

package com.linagora.calendar.feed.parser;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.fortuna.ical4j.model.TimeZoneRegistryImpl;

/**
 * Resolves TZID values that neither the calendar's VTIMEZONE components nor the ical4j
 * bundled definitions know about.
 * <p>
 * Falls back first to the JDK region ids, then to the Windows zone names Outlook publishes
 * (e.g. {@code W. Europe Standard Time}) mapped to IANA ids through ICU4J.
 */
public class FeedTimeZoneRegistry extends TimeZoneRegistryImpl {
    private static final Logger LOGGER = LoggerFactory.getLogger(FeedTimeZoneRegistry.class);
    private static final String WINDOWS_ZONE_REGION = "001";

    @Override
    public ZoneId getZoneId(String tzId) {
        try {
            ZoneId zoneId = super.getZoneId(tzId);
            if (zoneId != null) {
                return zoneId;
            }
        } catch (DateTimeException e) {
            LOGGER.debug("ical4j does not know TZID '{}', trying global resolution", tzId);
        }
        return resolveGlobalZoneId(tzId)
            .orElseThrow(() -> new DateTimeException("Unknown timezone identifier: " + tzId));
    }

    public static Optional<ZoneId> resolveGlobalZoneId(String tzId) {
        try {
            return Optional.of(ZoneId.of(tzId));
        } catch (DateTimeException e) {
            return Optional.ofNullable(com.ibm.icu.util.TimeZone.getIDForWindowsID(tzId, WINDOWS_ZONE_REGION))
                .map(ZoneId::of);
        }
    }
}
