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

import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.TemporalAmount;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linagora.calendar.feed.expansion.CanonicalValue;
import com.linagora.calendar.feed.expansion.NormalizedRecord;

/**
 * Renders normalized records as JSON: one object per record, keyed by property name.
 * Instants, dates and durations are ISO-8601 strings, integers are numbers.
 */
public class NormalizedRecordJsonSerializer {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private static final CanonicalValue.Visitor<JsonNode> TO_JSON = new CanonicalValue.Visitor<>() {
        @Override
        public JsonNode visitInstant(Instant instant) {
            return JsonNodeFactory.instance.textNode(instant.toString());
        }

        @Override
        public JsonNode visitDate(LocalDate date) {
            return JsonNodeFactory.instance.textNode(date.toString());
        }

        @Override
        public JsonNode visitDuration(TemporalAmount duration) {
            return JsonNodeFactory.instance.textNode(duration.toString());
        }

        @Override
        public JsonNode visitInteger(long value) {
            return JsonNodeFactory.instance.numberNode(value);
        }

        @Override
        public JsonNode visitText(String text) {
            return JsonNodeFactory.instance.textNode(text);
        }
    };

    public ObjectNode toJsonNode(NormalizedRecord record) {
        ObjectNode node = OBJECT_MAPPER.createObjectNode();
        record.values().forEach((name, value) -> node.set(name, value.accept(TO_JSON)));
        return node;
    }

    public String toJson(List<NormalizedRecord> records) {
        ArrayNode array = OBJECT_MAPPER.createArrayNode();
        records.forEach(record -> array.add(toJsonNode(record)));
        try {
            return OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(array);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize normalized records", e);
        }
    }
}
