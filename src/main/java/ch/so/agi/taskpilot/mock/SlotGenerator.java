package ch.so.agi.taskpilot.mock;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * Produces the value for one named slot of a {@link ResponseTemplate}.
 */
public interface SlotGenerator {

    String next(Random random);

    record IntegerRange(int min, int max, boolean grouping, String prefix, String suffix) implements SlotGenerator {

        public IntegerRange {
            if (max < min) {
                throw new IllegalArgumentException("max " + max + " is lower than min " + min);
            }
            prefix = prefix == null ? "" : prefix;
            suffix = suffix == null ? "" : suffix;
        }

        @Override
        public String next(Random random) {
            long value = min + random.nextLong((long) max - min + 1);
            String formatted = grouping ? String.format(Locale.US, "%,d", value) : Long.toString(value);
            return prefix + formatted + suffix;
        }
    }

    record DecimalRange(double min, double max, int scale, String prefix, String suffix) implements SlotGenerator {

        public DecimalRange {
            if (max < min) {
                throw new IllegalArgumentException("max " + max + " is lower than min " + min);
            }
            if (scale < 0) {
                throw new IllegalArgumentException("scale must not be negative");
            }
            prefix = prefix == null ? "" : prefix;
            suffix = suffix == null ? "" : suffix;
        }

        @Override
        public String next(Random random) {
            double value = min + random.nextDouble() * (max - min);
            BigDecimal rounded = BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP);
            return prefix + rounded.toPlainString() + suffix;
        }
    }

    record Choice(List<String> values) implements SlotGenerator {

        public Choice {
            if (values == null || values.isEmpty()) {
                throw new IllegalArgumentException("choice slot needs at least one value");
            }
            values = List.copyOf(values);
        }

        @Override
        public String next(Random random) {
            return values.get(random.nextInt(values.size()));
        }
    }
}
