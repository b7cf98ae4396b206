package org.chronotext.format.plan;

import org.chronotext.format.calendar.CalendarField;
import org.chronotext.format.locale.LocaleNameTable;
import org.chronotext.format.locale.NameStyle;

import java.util.Objects;

/**
 * Locale name of an era, month, weekday or halfday.
 */
public record NameField(CalendarField field, NameStyle style) implements PlanInstruction {

    public NameField {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(style, "style");
    }

    @Override
    public void print(PrintContext context, StringBuilder out) {
        out.append(context.names().text(field, context.fields().get(field), style));
    }

    @Override
    public int parse(ParseContext context, CharSequence text, int position) {
        LocaleNameTable.NameMatch match = context.names().match(field, text, position);
        if (match == null) {
            return context.fail(position, "name of " + field);
        }
        context.set(field, match.value());
        return position + match.length();
    }
}
