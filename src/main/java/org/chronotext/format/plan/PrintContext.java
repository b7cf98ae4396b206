package org.chronotext.format.plan;

import org.chronotext.format.calendar.FieldValues;
import org.chronotext.format.locale.LocaleNameTable;

import java.time.ZoneId;

/**
 * Immutable inputs of one print call.
 *
 * @param fields complete field snapshot of the printed instant.
 * @param names locale name table.
 * @param zone zone the fields were observed in.
 */
public record PrintContext(FieldValues fields, LocaleNameTable names, ZoneId zone) {
}
