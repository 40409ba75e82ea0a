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

import static com.linagora.calendar.feed.expansion.EventTemporals.matchingKey;
import static com.linagora.calendar.feed.expansion.EventTemporals.toInstant;
import static com.linagora.calendar.feed.expansion.EventTemporals.toZonedDateTime;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.Period;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.Temporal;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.linagora.calendar.feed.parser.CalendarDocument;

import net.fortuna.ical4j.model.Property;
import net.fortuna.ical4j.model.Recur;
import net.fortuna.ical4j.model.component.VEvent;
import net.fortuna.ical4j.model.property.DateListProperty;
import net.fortuna.ical4j.model.property.ExRule;
import net.fortuna.ical4j.model.property.RRule;

/**
 * Turns the VEVENTs of a document into the occurrences starting within a window.
 * <p>
 * Non-recurring events yield themselves. A recurring master (RRULE or RDATE, no
 * RECURRENCE-ID) yields its DTSTART, the RRULE and RDATE instants minus its EXDATE and EXRULE
 * instants, each replaced by the override sharing its UID and RECURRENCE-ID when there is one. Overrides
 * matching no generated instant are never surfaced.
 */
public class RecurrenceExpander {
    private static final Logger LOGGER = LoggerFactory.getLogger(RecurrenceExpander.class);

    private final ZoneId floatingZone;

    public RecurrenceExpander(ZoneId floatingZone) {
        Preconditions.checkArgument(floatingZone != null, "floatingZone must not be null");
        this.floatingZone = floatingZone;
    }

    public List<Occurrence> expand(CalendarDocument document, DateWindow window) {
        List<VEvent> events = document.events();
        Map<String, List<VEvent>> overridesByUid = events.stream()
            .filter(RecurrenceExpander::isOverride)
            .filter(event -> EventTemporals.uidOf(event).isPresent())
            .collect(Collectors.groupingBy(event -> EventTemporals.uidOf(event).get()));

        ImmutableList.Builder<Occurrence> occurrences = ImmutableList.builder();
        for (VEvent event : events) {
            if (isOverride(event)) {
                continue;
            }
            if (isRecurrentMaster(event)) {
                List<VEvent> overrides = EventTemporals.uidOf(event)
                    .map(uid -> overridesByUid.getOrDefault(uid, List.of()))
                    .orElse(List.of());
                occurrences.addAll(expandSeries(event, overrides, window));
            } else {
                Occurrence occurrence = asOccurrence(event);
                if (window.contains(occurrence.start(), floatingZone)) {
                    occurrences.add(occurrence);
                }
            }
        }
        return occurrences.build();
    }

    public static boolean isOverride(VEvent event) {
        return event.getProperty(Property.RECURRENCE_ID).isPresent();
    }

    public static boolean isRecurrentMaster(VEvent event) {
        return !isOverride(event)
            && (event.getProperty(Property.RRULE).isPresent() || event.getProperty(Property.RDATE).isPresent());
    }

    private List<Occurrence> expandSeries(VEvent master, List<VEvent> overrides, DateWindow window) {
        Temporal seed = EventTemporals.startOf(master);
        Map<Temporal, VEvent> overridesByRecurrenceId = overrides.stream()
            .collect(Collectors.toMap(this::recurrenceKey, Function.identity(), (first, second) -> second, LinkedHashMap::new));
        DateWindow generationWindow = window.widen(largestShift(overrides));
        Set<Temporal> excluded = excludedKeys(master, seed, generationWindow);

        List<Occurrence> occurrences = candidates(master, seed, generationWindow).stream()
            .filter(candidate -> !isExcluded(candidate, excluded))
            .map(candidate -> Optional.ofNullable(overridesByRecurrenceId.get(matchingKey(candidate, floatingZone)))
                .map(this::asOccurrence)
                .orElseGet(() -> generateOccurrence(master, seed, candidate)))
            .filter(occurrence -> window.contains(occurrence.start(), floatingZone))
            .toList();

        LOGGER.debug("Expanded series {} into {} occurrence(s) between {} and {}",
            EventTemporals.uidOf(master).orElse("without UID"), occurrences.size(), window.start(), window.end());
        return occurrences;
    }

    private List<Temporal> candidates(VEvent master, Temporal seed, DateWindow window) {
        if (seed instanceof LocalDate seedDate) {
            return ImmutableList.copyOf(dateCandidates(master, seedDate, window));
        }
        return ImmutableList.copyOf(dateTimeCandidates(master, toZonedDateTime(seed, floatingZone), window).values());
    }

    private TreeSet<LocalDate> dateCandidates(VEvent master, LocalDate seed, DateWindow window) {
        TreeSet<LocalDate> dates = new TreeSet<>();
        dates.add(seed);
        for (Recur recur : recurrenceRules(master)) {
            List<Temporal> generated = recur.getDates(seed, window.start(), window.end());
            generated.forEach(date -> dates.add(toLocalDate(date)));
        }
        recurrenceDates(master).forEach(date -> dates.add(toLocalDate(date)));
        return dates;
    }

    private TreeMap<Instant, ZonedDateTime> dateTimeCandidates(VEvent master, ZonedDateTime seed, DateWindow window) {
        TreeMap<Instant, ZonedDateTime> dateTimes = new TreeMap<>();
        dateTimes.put(seed.toInstant(), seed);
        ZonedDateTime periodStart = window.start().atStartOfDay(seed.getZone());
        ZonedDateTime periodEnd = window.end().atStartOfDay(seed.getZone());
        for (Recur recur : recurrenceRules(master)) {
            List<Temporal> generated = recur.getDates(seed, periodStart, periodEnd);
            generated.forEach(dateTime -> {
                ZonedDateTime zoned = toZonedDateTime(dateTime, floatingZone);
                dateTimes.put(zoned.toInstant(), zoned);
            });
        }
        recurrenceDates(master).forEach(temporal -> {
            ZonedDateTime zoned = temporal instanceof LocalDate date
                ? date.atTime(seed.toLocalTime()).atZone(seed.getZone())
                : toZonedDateTime(temporal, floatingZone);
            dateTimes.put(zoned.toInstant(), zoned);
        });
        return dateTimes;
    }

    private List<Recur> recurrenceRules(VEvent master) {
        List<Property> rules = master.getProperties(Property.RRULE);
        return rules.stream()
            .map(rule -> (Recur) ((RRule<?>) rule).getRecur())
            .toList();
    }

    private List<Recur> exclusionRules(VEvent master) {
        List<Property> rules = master.getProperties(Property.EXRULE);
        return rules.stream()
            .map(rule -> (Recur) ((ExRule<?>) rule).getRecur())
            .toList();
    }

    /**
     * Instants an exclusion rule generates from the series seed, bounded like the candidates.
     */
    private List<Temporal> exclusionRuleDates(Temporal seed, Recur recur, DateWindow window) {
        if (seed instanceof LocalDate seedDate) {
            return recur.getDates(seedDate, window.start(), window.end());
        }
        ZonedDateTime zonedSeed = toZonedDateTime(seed, floatingZone);
        return recur.getDates(zonedSeed,
            window.start().atStartOfDay(zonedSeed.getZone()),
            window.end().atStartOfDay(zonedSeed.getZone()));
    }

    private List<Temporal> recurrenceDates(VEvent master) {
        return datesOf(master, Property.RDATE);
    }

    private Set<Temporal> excludedKeys(VEvent master, Temporal seed, DateWindow window) {
        Stream<Temporal> ruleDates = exclusionRules(master).stream()
            .flatMap(recur -> exclusionRuleDates(seed, recur, window).stream());
        return Stream.concat(datesOf(master, Property.EXDATE).stream(), ruleDates)
            .map(temporal -> matchingKey(temporal, floatingZone))
            .collect(ImmutableSet.toImmutableSet());
    }

    private List<Temporal> datesOf(VEvent event, String propertyName) {
        List<Property> properties = event.getProperties(propertyName);
        return properties.stream()
            .filter(DateListProperty.class::isInstance)
            .flatMap(property -> ((DateListProperty<?>) property).getDates().stream())
            .map(Temporal.class::cast)
            .toList();
    }

    /**
     * A date-only exclusion removes every instance starting on that date.
     */
    private boolean isExcluded(Temporal candidate, Set<Temporal> excluded) {
        if (excluded.contains(matchingKey(candidate, floatingZone))) {
            return true;
        }
        return !(candidate instanceof LocalDate)
            && excluded.contains(toZonedDateTime(candidate, floatingZone).toLocalDate());
    }

    private Occurrence generateOccurrence(VEvent master, Temporal seed, Temporal candidate) {
        List<Property> properties = master.getProperties().stream()
            .filter(property -> !PropertyKind.SERIES_PROPERTIES.contains(property.getName()))
            .toList();

        Map<String, Temporal> resolvedTimes = new LinkedHashMap<>();
        resolvedTimes.put(Property.DTSTART, candidate);
        EventTemporals.dateOf(master, Property.DTEND)
            .ifPresent(end -> resolvedTimes.put(Property.DTEND, shift(seed, end, candidate)));
        resolvedTimes.put(Property.RECURRENCE_ID, candidate);

        return Occurrence.generated(EventTemporals.uidOf(master), candidate, properties, resolvedTimes);
    }

    private Occurrence asOccurrence(VEvent event) {
        return Occurrence.of(EventTemporals.uidOf(event), EventTemporals.startOf(event), event.getProperties());
    }

    /**
     * @return {@code end} moved by the offset separating {@code seed} from {@code candidate}
     */
    private Temporal shift(Temporal seed, Temporal end, Temporal candidate) {
        if (seed instanceof LocalDate seedDate && end instanceof LocalDate endDate && candidate instanceof LocalDate candidateDate) {
            return candidateDate.plus(Period.between(seedDate, endDate));
        }
        Duration length = Duration.between(toInstant(seed, floatingZone), toInstant(end, floatingZone));
        return toZonedDateTime(candidate, floatingZone).plus(length);
    }

    private Temporal recurrenceKey(VEvent override) {
        return EventTemporals.dateOf(override, Property.RECURRENCE_ID)
            .map(recurrenceId -> matchingKey(recurrenceId, floatingZone))
            .orElseThrow(() -> new IllegalArgumentException("Override without RECURRENCE-ID: " + override));
    }

    private Duration largestShift(List<VEvent> overrides) {
        return overrides.stream()
            .map(override -> Duration.between(
                toInstant(EventTemporals.dateOf(override, Property.RECURRENCE_ID).orElseThrow(), floatingZone),
                toInstant(EventTemporals.startOf(override), floatingZone)).abs())
            .max(Comparator.naturalOrder())
            .orElse(Duration.ZERO);
    }

    private LocalDate toLocalDate(Temporal temporal) {
        if (temporal instanceof LocalDate date) {
            return date;
        }
        return toZonedDateTime(temporal, floatingZone).toLocalDate();
    }
}
