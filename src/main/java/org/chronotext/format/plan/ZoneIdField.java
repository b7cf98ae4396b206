package org.chronotext.format.plan;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Set;

/**
 * Region or fixed zone identifier.
 *
 * <p>UTC prints as {@code UTC}; other fixed offsets print as {@code ±HH:mm}. Parsing takes the
 * longest known region id at the position, or a {@code ±HH:mm} offset id.</p>
 */
public record ZoneIdField() implements PlanInstruction {
    private static final String UTC_ID = "UTC";
    private static final int OFFSET_ID_LENGTH = 6;

    @Override
    public void print(PrintContext context, StringBuilder out) {
        ZoneId zone = context.zone();
        out.append(ZoneOffset.UTC.equals(zone) ? UTC_ID : zone.getId());
    }

    @Override
    public int parse(ParseContext context, CharSequence text, int position) {
        int limit = Math.min(text.length(), position + KnownZones.MAX_LENGTH);
        for (int end = limit; end > position; end--) {
            String candidate = text.subSequence(position, end).toString();
            if (KnownZones.IDS.contains(candidate)) {
                context.setParsedZone(ZoneId.of(candidate));
                return end;
            }
        }
        ZoneOffset offset = offsetId(text, position);
        if (offset != null) {
            context.setParsedZone(offset);
            return position + OFFSET_ID_LENGTH;
        }
        return context.fail(position, "zone id");
    }

    private static ZoneOffset offsetId(CharSequence text, int position) {
        if (position + OFFSET_ID_LENGTH > text.length()) {
            return null;
        }
        char sign = text.charAt(position);
        if ((sign != '+' && sign != '-')
                || !NumberField.isDigit(text.charAt(position + 1))
                || !NumberField.isDigit(text.charAt(position + 2))
                || text.charAt(position + 3) != ':'
                || !NumberField.isDigit(text.charAt(position + 4))
                || !NumberField.isDigit(text.charAt(position + 5))) {
            return null;
        }
        int hours = (text.charAt(position + 1) - '0') * 10 + (text.charAt(position + 2) - '0');
        int minutes = (text.charAt(position + 4) - '0') * 10 + (text.charAt(position + 5) - '0');
        if (hours > 18 || minutes > 59 || (hours == 18 && minutes > 0)) {
            return null;
        }
        int total = hours * 3600 + minutes * 60;
        return ZoneOffset.ofTotalSeconds(sign == '-' ? -total : total);
    }

    private static final class KnownZones {
        static final Set<String> IDS = Set.copyOf(ZoneId.getAvailableZoneIds());
        static final int MAX_LENGTH = IDS.stream().mapToInt(String::length).max().orElse(0);
    }
}
