package com.gridcalc.fill;

import com.gridcalc.api.Value;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Series continuation for fill operations.
 *
 * {@link #detect(List)} looks at the non-empty values of a selection and
 * picks the first pattern that fits, in this order: arithmetic
 * ({@code 1, 3, 5}), known sequence ({@code Mon, Tue}, {@code Jan},
 * {@code Q1}), prefixed number ({@code Item1, Item2}), copy.
 * {@link #generate(int)} then yields the value at a position counted from
 * the first selected value.
 */
public interface AutofillPattern {

    double EPSILON = 1e-9;

    List<String> DAYS_SHORT = List.of("Mon", "Tue", "Wed", "Thu", "Fri", "Sat", "Sun");
    List<String> DAYS_FULL = List.of("Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday", "Sunday");
    List<String> MONTHS_SHORT = List.of("Jan", "Feb", "Mar", "Apr", "May", "Jun", "Jul", "Aug", "Sep", "Oct", "Nov", "Dec");
    List<String> MONTHS_FULL = List.of("January", "February", "March", "April", "May", "June", "July", "August",
            "September", "October", "November", "December");
    List<String> QUARTERS = List.of("Q1", "Q2", "Q3", "Q4");

    /** Value at {@code index}, where 0 is the first selected value. */
    String generate(int index);

    /** Short human-readable name, for status messages. */
    String description();

    record Arithmetic(double start, double step) implements AutofillPattern {
        @Override
        public String generate(int index) {
            return Series.format(start + step * index);
        }

        @Override
        public String description() {
            return step >= 0
                    ? "arithmetic sequence (+" + Series.format(step) + ")"
                    : "arithmetic sequence (" + Series.format(step) + ")";
        }
    }

    record PrefixedNumber(String prefix, String suffix, double start, double step) implements AutofillPattern {
        @Override
        public String generate(int index) {
            return prefix + Series.format(start + step * index) + suffix;
        }

        @Override
        public String description() {
            return "\"" + prefix + "...\" sequence (+" + Series.format(step) + ")";
        }
    }

    /** Cyclic sequence; wraps around after the last element. */
    record KnownSequence(List<String> sequence, int startIndex) implements AutofillPattern {
        @Override
        public String generate(int index) {
            return sequence.get(Math.floorMod(startIndex + index, sequence.size()));
        }

        @Override
        public String description() {
            if (sequence.equals(DAYS_SHORT) || sequence.equals(DAYS_FULL))
                return "days sequence";
            if (sequence.equals(MONTHS_SHORT) || sequence.equals(MONTHS_FULL))
                return "months sequence";
            if (sequence.equals(QUARTERS))
                return "quarters sequence";
            return "known sequence";
        }
    }

    record Copy(String value) implements AutofillPattern {
        @Override
        public String generate(int index) {
            return value;
        }

        @Override
        public String description() {
            return "copy";
        }
    }

    static AutofillPattern detect(List<String> values) {
        if (values.isEmpty())
            return new Copy("");
        if (values.size() == 1)
            return new Copy(values.get(0));

        AutofillPattern p = Series.arithmetic(values);
        if (p == null)
            p = Series.knownSequence(values);
        if (p == null)
            p = Series.prefixedNumber(values);
        return p != null ? p : new Copy(values.get(0));
    }

    /** Detection helpers. */
    final class Series {
        private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
        private static final List<List<String>> KNOWN = List.of(DAYS_SHORT, DAYS_FULL, MONTHS_SHORT, MONTHS_FULL, QUARTERS);

        private Series() {
        }

        static Arithmetic arithmetic(List<String> values) {
            double[] nums = new double[values.size()];
            for (int i = 0; i < nums.length; i++) {
                String s = values.get(i).trim();
                if (!NUMBER.matcher(s).matches())
                    return null;
                nums[i] = Double.parseDouble(s);
            }
            double step = nums[1] - nums[0];
            return constantStep(nums, step) ? new Arithmetic(nums[0], step) : null;
        }

        static KnownSequence knownSequence(List<String> values) {
            for (List<String> seq : KNOWN) {
                int start = matchSequence(values, seq);
                if (start >= 0)
                    return new KnownSequence(seq, start);
            }
            return null;
        }

        static PrefixedNumber prefixedNumber(List<String> values) {
            String prefix = null;
            String suffix = null;
            double[] nums = new double[values.size()];
            for (int i = 0; i < nums.length; i++) {
                String s = values.get(i);
                int first = firstDigit(s);
                if (first < 0)
                    return null;
                int end = first;
                while (end < s.length() && isNumberChar(s.charAt(end)))
                    end++;
                String num = s.substring(first, end);
                if (!NUMBER.matcher(num).matches())
                    return null;
                String pre = s.substring(0, first);
                String suf = s.substring(end);
                if (prefix == null) {
                    prefix = pre;
                    suffix = suf;
                } else if (!prefix.equals(pre) || !suffix.equals(suf)) {
                    return null;
                }
                nums[i] = Double.parseDouble(num);
            }
            double step = nums[1] - nums[0];
            return constantStep(nums, step) ? new PrefixedNumber(prefix, suffix, nums[0], step) : null;
        }

        private static int matchSequence(List<String> values, List<String> seq) {
            if (values.size() > seq.size())
                return -1;
            String first = values.get(0).toLowerCase(Locale.ROOT);
            int start = -1;
            for (int i = 0; i < seq.size(); i++) {
                if (seq.get(i).toLowerCase(Locale.ROOT).equals(first)) {
                    start = i;
                    break;
                }
            }
            if (start < 0)
                return -1;
            for (int i = 0; i < values.size(); i++)
                if (!values.get(i).equalsIgnoreCase(seq.get((start + i) % seq.size())))
                    return -1;
            return start;
        }

        private static boolean constantStep(double[] nums, double step) {
            for (int i = 2; i < nums.length; i++)
                if (Math.abs(nums[i] - nums[i - 1] - step) > EPSILON)
                    return false;
            return true;
        }

        private static int firstDigit(String s) {
            for (int i = 0; i < s.length(); i++)
                if (s.charAt(i) >= '0' && s.charAt(i) <= '9')
                    return i;
            return -1;
        }

        private static boolean isNumberChar(char c) {
            return (c >= '0' && c <= '9') || c == '.' || c == '-';
        }

        /** Whole numbers without a decimal point, others in shortest form. */
        static String format(double n) {
            double frac = n - (long) n;
            if (Math.abs(frac) < EPSILON && Math.abs(n) < Long.MAX_VALUE)
                return Long.toString((long) n);
            return Value.formatNumber(n);
        }
    }
}
