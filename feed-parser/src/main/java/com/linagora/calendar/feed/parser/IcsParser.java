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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.fortuna.ical4j.data.CalendarBuilder;
import net.fortuna.ical4j.data.CalendarParserFactory;
import net.fortuna.ical4j.data.ContentHandlerContext;
import net.fortuna.ical4j.data.ParserException;
import net.fortuna.ical4j.model.Calendar;
import net.fortuna.ical4j.model.Property;
import net.fortuna.ical4j.model.component.VEvent;
import net.fortuna.ical4j.model.property.DateListProperty;
import net.fortuna.ical4j.model.property.DateProperty;
import net.fortuna.ical4j.model.property.ExRule;
import net.fortuna.ical4j.model.property.RRule;
import net.fortuna.ical4j.util.CompatibilityHints;
import net.fortuna.ical4j.util.MapTimeZoneCache;

public class IcsParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(IcsParser.class);

    static {
        CompatibilityHints.setHintEnabled(CompatibilityHints.KEY_RELAXED_UNFOLDING, true);
        CompatibilityHints.setHintEnabled(CompatibilityHints.KEY_OUTLOOK_COMPATIBILITY, true);
        CompatibilityHints.setHintEnabled(CompatibilityHints.KEY_NOTES_COMPATIBILITY, true);

        System.setProperty("net.fortuna.ical4j.timezone.cache.impl", MapTimeZoneCache.class.getName());
    }

    private IcsParser() {
    }

    public static CalendarDocument parse(String icsContent) {
        return parse(icsContent.getBytes(StandardCharsets.UTF_8));
    }

    public static CalendarDocument parse(byte[] icsContent) {
        CalendarBuilder builder = new CalendarBuilder(
            CalendarParserFactory.getInstance().get(),
            new ContentHandlerContext(),
            new FeedTimeZoneRegistry());
        try {
            Calendar calendar = builder.build(new ByteArrayInputStream(icsContent));
            CalendarDocument document = new CalendarDocument(calendar);
            document.events().forEach(IcsParser::validateValues);
            LOGGER.debug("Parsed calendar with {} component(s)", document.components().size());
            return document;
        } catch (IOException e) {
            throw new CalendarParseException("Error while reading calendar input", e);
        } catch (ParserException e) {
            throw new CalendarParseException("Error while parsing ICal object: " + e.getMessage(), e);
        } catch (CalendarParseException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CalendarParseException("Invalid ICal value: " + e.getMessage(), e);
        }
    }

    /**
     * ical4j decodes some values lazily: force them so that a malformed value fails here
     * rather than halfway through an expansion.
     */
    private static void validateValues(VEvent event) {
        for (Property property : event.getProperties()) {
            try {
                if (property instanceof DateProperty<?> dateProperty) {
                    dateProperty.getDate();
                } else if (property instanceof DateListProperty<?> dateListProperty) {
                    dateListProperty.getDates();
                }
            } catch (RuntimeException e) {
                throw new CalendarParseException("Invalid " + property.getName() + " value '" + property.getValue()
                    + "' in VEVENT " + uidOf(event), e);
            }
            if (isRuleProperty(property) && !isValidRecurrenceRule(property)) {
                throw new CalendarParseException("Invalid " + property.getName() + " '" + property.getValue()
                    + "' in VEVENT " + uidOf(event));
            }
        }
    }

    private static boolean isRuleProperty(Property property) {
        return Property.RRULE.equals(property.getName()) || Property.EXRULE.equals(property.getName());
    }

    private static boolean isValidRecurrenceRule(Property property) {
        if (property instanceof RRule<?> rRule) {
            return rRule.getRecur() != null && rRule.getRecur().getFrequency() != null;
        }
        if (property instanceof ExRule<?> exRule) {
            return exRule.getRecur() != null && exRule.getRecur().getFrequency() != null;
        }
        return false;
    }

    private static String uidOf(VEvent event) {
        return event.getUid().map(Property::getValue).orElse("without UID");
    }
}
