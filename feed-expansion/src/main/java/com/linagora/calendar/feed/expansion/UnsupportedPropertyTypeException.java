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

public class UnsupportedPropertyTypeException extends RuntimeException {
    private final String propertyName;
    private final String rawValue;

    public UnsupportedPropertyTypeException(String propertyName, String rawValue, String reason) {
        super("Unsupported value for property " + propertyName + ": '" + rawValue + "' (" + reason + ")");
        this.propertyName = propertyName;
        this.rawValue = rawValue;
    }

    public UnsupportedPropertyTypeException(String propertyName, String rawValue, Throwable cause) {
        super("Unsupported value for property " + propertyName + ": '" + rawValue + "'", cause);
        this.propertyName = propertyName;
        this.rawValue = rawValue;
    }

    public String getPropertyName() {
        return propertyName;
    }

    public String getRawValue() {
        return rawValue;
    }
}
