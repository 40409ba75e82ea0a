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

import java.util.List;

import com.google.common.base.Preconditions;

import net.fortuna.ical4j.model.Calendar;
import net.fortuna.ical4j.model.Component;
import net.fortuna.ical4j.model.component.CalendarComponent;
import net.fortuna.ical4j.model.component.VEvent;

/**
 * A parsed iCalendar document.
 * <p>
 * The wrapped ical4j {@link Calendar} is mutable: consumers must copy components
 * before altering them.
 */
public record CalendarDocument(Calendar calendar) {
    public CalendarDocument {
        Preconditions.checkArgument(calendar != null, "calendar must not be null");
    }

    public List<CalendarComponent> components() {
        return calendar.getComponents();
    }

    /**
     * @return the VEVENT components in document order
     */
    public List<VEvent> events() {
        return calendar.getComponents(Component.VEVENT);
    }
}
