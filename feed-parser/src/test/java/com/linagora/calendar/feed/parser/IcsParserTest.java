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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.temporal.Temporal;

import org.junit.jupiter.api.Test;

import net.fortuna.ical4j.model.Property;
import net.fortuna.ical4j.model.component.VEvent;
import net.fortuna.ical4j.model.property.DtEnd;
import net.fortuna.ical4j.model.property.DtStart;
import net.fortuna.ical4j.model.property.Summary;

class IcsParserTest {

    @Test
    void parseShouldReturnEventsInDocumentOrder() {
        String ics = """
            BEGIN:VCALENDAR
            VERSION:2.0
            PRODID:-//Linagora//Feed test//EN
            BEGIN:VEVENT
            UID:first
            DTSTART:20190310T100000Z
            SUMMARY:First
            END:VEVENT
            BEGIN:VEVENT
            UID:second
            DTSTART:20190311T100000Z
            SUMMARY:Second
            END:VEVENT
            END:VCALENDAR
            """;

        CalendarDocument document = IcsParser.parse(ics);

        assertThat(document.events())
            .extracting(event -> event.getUid().map(Property::getValue).orElseThrow())
            .containsExactly("first", "second");
    }

    @Test
    void parseShouldDecodeTypedValues() {
        String ics = """
            BEGIN:VCALENDAR
            VERSION:2.0
            PRODID:-//Linagora//Feed test//EN
            BEGIN:VEVENT
            UID:typed
            DTSTART;TZID=Europe/Paris:20190310T110000
            DTEND;VALUE=DATE:20190311
            SUMMARY:Typed\\, escaped
            END:VEVENT
            END:VCALENDAR
            """;

        VEvent event = IcsParser.parse(ics).events().get(0);
        Temporal start = event.<DtStart<Temporal>>getProperty(Property.DTSTART).orElseThrow().getDate();
        Temporal end = event.<DtEnd<Temporal>>getProperty(Property.DTEND).orElseThrow().getDate();

        assertThat(ZonedDateTime.from(start).toInstant()).isEqualTo(Instant.parse("2019-03-10T10:00:00Z"));
        assertThat(end).isEqualTo(LocalDate.of(2019, 3, 11));
        assertThat(event.<Summary>getProperty(Property.SUMMARY).map(Summary::getValue))
            .contains("Typed, escaped");
    }

    @Test
    void parseShouldAcceptBytes() {
        byte[] ics = """
            BEGIN:VCALENDAR
            VERSION:2.0
            PRODID:-//Linagora//Feed test//EN
            BEGIN:VEVENT
            UID:bytes
            DTSTART:20190310T100000Z
            SUMMARY:Réunion
            END:VEVENT
            END:VCALENDAR
            """.getBytes(StandardCharsets.UTF_8);

        CalendarDocument document = IcsParser.parse(ics);

        assertThat(document.events().get(0).getProperty(Property.SUMMARY).map(Property::getValue))
            .contains("Réunion");
    }

    @Test
    void parseShouldFailWhenInputIsNotICalendar() {
        assertThatThrownBy(() -> IcsParser.parse("this is not a calendar"))
            .isInstanceOf(CalendarParseException.class);
    }

    @Test
    void parseShouldFailWhenComponentIsUnterminated() {
        String ics = """
            BEGIN:VCALENDAR
            VERSION:2.0
            BEGIN:VEVENT
            UID:unterminated
            DTSTART:20190310T100000Z
            """;

        assertThatThrownBy(() -> IcsParser.parse(ics))
            .isInstanceOf(CalendarParseException.class);
    }

    @Test
    void parseShouldFailWhenDateTimeValueIsMalformed() {
        String ics = """
            BEGIN:VCALENDAR
            VERSION:2.0
            BEGIN:VEVENT
            UID:bad-date
            DTSTART:2019-03-10 ten o'clock
            END:VEVENT
            END:VCALENDAR
            """;

        assertThatThrownBy(() -> IcsParser.parse(ics))
            .isInstanceOf(CalendarParseException.class);
    }

    @Test
    void parseShouldFailWhenRecurrenceRuleFrequencyIsMalformed() {
        String ics = """
            BEGIN:VCALENDAR
            VERSION:2.0
            BEGIN:VEVENT
            UID:bad-rule
            DTSTART:20190310T100000Z
            RRULE:FREQ=SOMETIMES;COUNT=3
            END:VEVENT
            END:VCALENDAR
            """;

        assertThatThrownBy(() -> IcsParser.parse(ics))
            .isInstanceOf(CalendarParseException.class);
    }

    @Test
    void parseShouldFailWhenExclusionRuleFrequencyIsMalformed() {
        String ics = """
            BEGIN:VCALENDAR
            VERSION:2.0
            BEGIN:VEVENT
            UID:bad-exclusion
            DTSTART:20190310T100000Z
            RRULE:FREQ=DAILY;COUNT=3
            EXRULE:FREQ=NEVER
            END:VEVENT
            END:VCALENDAR
            """;

        assertThatThrownBy(() -> IcsParser.parse(ics))
            .isInstanceOf(CalendarParseException.class);
    }
}
