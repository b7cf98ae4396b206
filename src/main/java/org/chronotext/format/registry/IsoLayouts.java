package org.chronotext.format.registry;

import lombok.experimental.UtilityClass;
import org.chronotext.format.calendar.CalendarField;
import org.chronotext.format.plan.CompiledPlan;
import org.chronotext.format.plan.PlanBuilder;

/**
 * ISO-8601 plans, extended and basic forms, built from shared elements.
 *
 * <p>Extended forms separate date components with {@code -} and time components with
 * {@code :}; basic forms use fixed widths without separators. Printing plans also parse; the
 * {@code *Parser} plans accept the optional and alternative shapes of the standard.</p>
 */
@UtilityClass
class IsoLayouts {
    private static final String ZERO_OFFSET = "Z";

    // Elements.

    static CompiledPlan yearElement() {
        return new PlanBuilder().appendSignedNumber(CalendarField.YEAR, 4, 9).build();
    }

    static CompiledPlan monthElement() {
        return new PlanBuilder().appendLiteral('-').appendNumber(CalendarField.MONTH_OF_YEAR, 2, 2).build();
    }

    static CompiledPlan dayOfMonthElement() {
        return new PlanBuilder().appendLiteral('-').appendNumber(CalendarField.DAY_OF_MONTH, 2, 2).build();
    }

    static CompiledPlan weekyearElement() {
        return new PlanBuilder().appendSignedNumber(CalendarField.WEEKYEAR, 4, 9).build();
    }

    static CompiledPlan weekElement() {
        return new PlanBuilder().appendLiteral("-W").appendNumber(CalendarField.WEEK_OF_WEEKYEAR, 2, 2).build();
    }

    static CompiledPlan dayOfWeekElement() {
        return new PlanBuilder().appendLiteral('-').appendNumber(CalendarField.DAY_OF_WEEK, 1, 1).build();
    }

    static CompiledPlan dayOfYearElement() {
        return new PlanBuilder().appendLiteral('-').appendNumber(CalendarField.DAY_OF_YEAR, 3, 3).build();
    }

    static CompiledPlan hourElement() {
        return new PlanBuilder().appendNumber(CalendarField.HOUR_OF_DAY, 2, 2).build();
    }

    static CompiledPlan minuteElement() {
        return new PlanBuilder().appendLiteral(':').appendNumber(CalendarField.MINUTE_OF_HOUR, 2, 2).build();
    }

    static CompiledPlan secondElement() {
        return new PlanBuilder().appendLiteral(':').appendNumber(CalendarField.SECOND_OF_MINUTE, 2, 2).build();
    }

    static CompiledPlan fractionElement() {
        return new PlanBuilder().appendLiteral('.').appendFraction(3, 9).build();
    }

    static CompiledPlan offsetElement() {
        return new PlanBuilder().appendOffset(ZERO_OFFSET, ZERO_OFFSET, true).build();
    }

    // Extended printers.

    static CompiledPlan year() {
        return yearElement();
    }

    static CompiledPlan yearMonth() {
        return new PlanBuilder().append(yearElement()).append(monthElement()).build();
    }

    static CompiledPlan date() {
        return new PlanBuilder().append(yearMonth()).append(dayOfMonthElement()).build();
    }

    static CompiledPlan weekyear() {
        return weekyearElement();
    }

    static CompiledPlan weekyearWeek() {
        return new PlanBuilder().append(weekyearElement()).append(weekElement()).build();
    }

    static CompiledPlan weekDate() {
        return new PlanBuilder().append(weekyearWeek()).append(dayOfWeekElement()).build();
    }

    static CompiledPlan ordinalDate() {
        return new PlanBuilder().append(yearElement()).append(dayOfYearElement()).build();
    }

    static CompiledPlan hour() {
        return hourElement();
    }

    static CompiledPlan hourMinute() {
        return new PlanBuilder().append(hourElement()).append(minuteElement()).build();
    }

    static CompiledPlan hourMinuteSecond() {
        return new PlanBuilder().append(hourMinute()).append(secondElement()).build();
    }

    static CompiledPlan hourMinuteSecondMillis() {
        return new PlanBuilder().append(hourMinuteSecond()).appendLiteral('.').appendFraction(3, 3).build();
    }

    static CompiledPlan hourMinuteSecondFraction() {
        return new PlanBuilder().append(hourMinuteSecond()).append(fractionElement()).build();
    }

    static CompiledPlan withDate(CompiledPlan time) {
        return new PlanBuilder().append(date()).appendLiteral('T').append(time).build();
    }

    static CompiledPlan time() {
        return new PlanBuilder().append(hourMinuteSecondFraction()).append(offsetElement()).build();
    }

    static CompiledPlan timeNoMillis() {
        return new PlanBuilder().append(hourMinuteSecond()).append(offsetElement()).build();
    }

    static CompiledPlan tTime() {
        return new PlanBuilder().appendLiteral('T').append(time()).build();
    }

    static CompiledPlan tTimeNoMillis() {
        return new PlanBuilder().appendLiteral('T').append(timeNoMillis()).build();
    }

    static CompiledPlan dateTime() {
        return new PlanBuilder().append(date()).append(tTime()).build();
    }

    static CompiledPlan dateTimeNoMillis() {
        return new PlanBuilder().append(date()).append(tTimeNoMillis()).build();
    }

    static CompiledPlan ordinalDateTime() {
        return new PlanBuilder().append(ordinalDate()).append(tTime()).build();
    }

    static CompiledPlan ordinalDateTimeNoMillis() {
        return new PlanBuilder().append(ordinalDate()).append(tTimeNoMillis()).build();
    }

    static CompiledPlan weekDateTime() {
        return new PlanBuilder().append(weekDate()).append(tTime()).build();
    }

    static CompiledPlan weekDateTimeNoMillis() {
        return new PlanBuilder().append(weekDate()).append(tTimeNoMillis()).build();
    }

    // Basic printers.

    static CompiledPlan basicDate() {
        return new PlanBuilder()
                .appendSignedNumber(CalendarField.YEAR, 4, 4)
                .appendFixedNumber(CalendarField.MONTH_OF_YEAR, 2)
                .appendFixedNumber(CalendarField.DAY_OF_MONTH, 2)
                .build();
    }

    static CompiledPlan basicTime() {
        return new PlanBuilder()
                .append(basicHourMinuteSecond())
                .appendLiteral('.')
                .appendFraction(3, 9)
                .appendOffset(ZERO_OFFSET, ZERO_OFFSET, false)
                .build();
    }

    static CompiledPlan basicTimeNoMillis() {
        return new PlanBuilder()
                .append(basicHourMinuteSecond())
                .appendOffset(ZERO_OFFSET, ZERO_OFFSET, false)
                .build();
    }

    static CompiledPlan basicTTime() {
        return new PlanBuilder().appendLiteral('T').append(basicTime()).build();
    }

    static CompiledPlan basicTTimeNoMillis() {
        return new PlanBuilder().appendLiteral('T').append(basicTimeNoMillis()).build();
    }

    static CompiledPlan basicDateTime() {
        return new PlanBuilder().append(basicDate()).append(basicTTime()).build();
    }

    static CompiledPlan basicDateTimeNoMillis() {
        return new PlanBuilder().append(basicDate()).append(basicTTimeNoMillis()).build();
    }

    static CompiledPlan basicOrdinalDate() {
        return new PlanBuilder()
                .appendSignedNumber(CalendarField.YEAR, 4, 4)
                .appendFixedNumber(CalendarField.DAY_OF_YEAR, 3)
                .build();
    }

    static CompiledPlan basicOrdinalDateTime() {
        return new PlanBuilder().append(basicOrdinalDate()).append(basicTTime()).build();
    }

    static CompiledPlan basicOrdinalDateTimeNoMillis() {
        return new PlanBuilder().append(basicOrdinalDate()).append(basicTTimeNoMillis()).build();
    }

    static CompiledPlan basicWeekDate() {
        return new PlanBuilder()
                .appendSignedNumber(CalendarField.WEEKYEAR, 4, 4)
                .appendLiteral('W')
                .appendFixedNumber(CalendarField.WEEK_OF_WEEKYEAR, 2)
                .appendFixedNumber(CalendarField.DAY_OF_WEEK, 1)
                .build();
    }

    static CompiledPlan basicWeekDateTime() {
        return new PlanBuilder().append(basicWeekDate()).append(basicTTime()).build();
    }

    static CompiledPlan basicWeekDateTimeNoMillis() {
        return new PlanBuilder().append(basicWeekDate()).append(basicTTimeNoMillis()).build();
    }

    private static CompiledPlan basicHourMinuteSecond() {
        return new PlanBuilder()
                .appendFixedNumber(CalendarField.HOUR_OF_DAY, 2)
                .appendFixedNumber(CalendarField.MINUTE_OF_HOUR, 2)
                .appendFixedNumber(CalendarField.SECOND_OF_MINUTE, 2)
                .build();
    }

    // Parsers.

    /**
     * {@code yyyy[-MM[-dd]]}, {@code xxxx-Www[-e]} or {@code yyyy-DDD}.
     */
    static CompiledPlan dateElementParser() {
        CompiledPlan calendarDate = new PlanBuilder()
                .append(yearElement())
                .appendOptional(new PlanBuilder()
                        .append(monthElement())
                        .appendOptional(dayOfMonthElement())
                        .build())
                .build();
        CompiledPlan weekDate = new PlanBuilder()
                .append(weekyearElement())
                .append(weekElement())
                .appendOptional(dayOfWeekElement())
                .build();
        CompiledPlan ordinal = new PlanBuilder()
                .append(yearElement())
                .append(dayOfYearElement())
                .build();
        return new PlanBuilder().appendAlternatives(calendarDate, weekDate, ordinal).build();
    }

    /**
     * {@code HH[:mm[:ss[(.|,)fraction]]]}.
     */
    static CompiledPlan timeElementParser() {
        CompiledPlan decimalPoint = new PlanBuilder()
                .appendAlternatives(
                        new PlanBuilder().appendLiteral('.').build(),
                        new PlanBuilder().appendLiteral(',').build())
                .build();
        CompiledPlan fraction = new PlanBuilder().append(decimalPoint).appendFraction(1, 9).build();
        CompiledPlan seconds = new PlanBuilder().append(secondElement()).appendOptional(fraction).build();
        CompiledPlan minutes = new PlanBuilder().append(minuteElement()).appendOptional(seconds).build();
        return new PlanBuilder().append(hourElement()).appendOptional(minutes).build();
    }

    static CompiledPlan dateParser() {
        CompiledPlan tOffset = new PlanBuilder().appendLiteral('T').append(offsetElement()).build();
        return new PlanBuilder().append(dateElementParser()).appendOptional(tOffset).build();
    }

    static CompiledPlan localDateParser() {
        return dateElementParser();
    }

    static CompiledPlan timeParser() {
        return new PlanBuilder()
                .appendOptional(new PlanBuilder().appendLiteral('T').build())
                .append(timeElementParser())
                .appendOptional(offsetElement())
                .build();
    }

    static CompiledPlan localTimeParser() {
        return new PlanBuilder()
                .appendOptional(new PlanBuilder().appendLiteral('T').build())
                .append(timeElementParser())
                .build();
    }

    static CompiledPlan dateOptionalTimeParser() {
        CompiledPlan timeOrOffset = new PlanBuilder()
                .appendLiteral('T')
                .appendOptional(timeElementParser())
                .appendOptional(offsetElement())
                .build();
        return new PlanBuilder().append(dateElementParser()).appendOptional(timeOrOffset).build();
    }

    static CompiledPlan localDateOptionalTimeParser() {
        CompiledPlan time = new PlanBuilder().appendLiteral('T').append(timeElementParser()).build();
        return new PlanBuilder().append(dateElementParser()).appendOptional(time).build();
    }

    static CompiledPlan dateTimeParser() {
        CompiledPlan time = new PlanBuilder()
                .appendLiteral('T')
                .append(timeElementParser())
                .appendOptional(offsetElement())
                .build();
        return new PlanBuilder().appendAlternatives(time, dateOptionalTimeParser()).build();
    }
}
