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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import org.junit.jupiter.api.Test;

class DateWindowTest {
    private static final LocalDate MARCH_10 = LocalDate.of(2019, 3, 10);
    private static final LocalDate MARCH_11 = LocalDate.of(2019, 3, 11);
    private static final ZoneId PARIS = ZoneId.of("Europe/Paris");

    @Test
    void shouldRejectStartAfterEnd() {
        assertThatThrownBy(() -> DateWindow.of(MARCH_11, MARCH_10))
            .isInstanceOf(InvalidWindowException.class)
            .hasMessageContaining("2019-03-11")
            .hasMessageContaining("2019-03-10");
    }

    @Test
    void shouldAcceptEmptyWindow() {
        DateWindow window = DateWindow.of(MARCH_10, MARCH_10);

        assertThat(window.contains(MARCH_10, ZoneOffset.UTC)).isFalse();
        assertThat(window.contains(MARCH_10.atTime(12, 0).atZone(PARIS), ZoneOffset.UTC)).isFalse();
    }

    @Test
    void containsShouldIncludeStartDate() {
        assertThat(DateWindow.of(MARCH_10, MARCH_11).contains(MARCH_10, ZoneOffset.UTC)).isTrue();
    }

    @Test
    void containsShouldExcludeEndDate() {
        assertThat(DateWindow.of(MARCH_10, MARCH_11).contains(MARCH_11, ZoneOffset.UTC)).isFalse();
    }

    @Test
    void containsShouldUseStartOfDayInTheOccurrenceZone() {
        DateWindow window = DateWindow.of(MARCH_10, MARCH_11);

        assertThat(window.contains(ZonedDateTime.of(MARCH_10.atStartOfDay(), PARIS), ZoneOffset.UTC)).isTrue();
        assertThat(window.contains(ZonedDateTime.of(MARCH_11.atStartOfDay(), PARIS), ZoneOffset.UTC)).isFalse();
        assertThat(window.contains(ZonedDateTime.of(MARCH_10.atTime(23, 59), PARIS), ZoneOffset.UTC)).isTrue();
    }

    @Test
    void containsShouldUseFloatingZoneForLocalDateTimes() {
        DateWindow window = DateWindow.of(MARCH_10, MARCH_11);
        LocalDateTime lateEvening = MARCH_10.atTime(23, 30);

        assertThat(window.contains(lateEvening, PARIS)).isTrue();
        assertThat(window.contains(MARCH_11.atTime(0, 30), PARIS)).isFalse();
    }

    @Test
    void widenShouldKeepWindowWhenMarginIsZero() {
        DateWindow window = DateWindow.of(MARCH_10, MARCH_11);

        assertThat(window.widen(Duration.ZERO)).isEqualTo(window);
    }

    @Test
    void widenShouldCoverMarginOnBothSides() {
        DateWindow widened = DateWindow.of(MARCH_10, MARCH_11).widen(Duration.ofHours(30));

        assertThat(widened).isEqualTo(DateWindow.of(LocalDate.of(2019, 3, 8), LocalDate.of(2019, 3, 13)));
    }
}
