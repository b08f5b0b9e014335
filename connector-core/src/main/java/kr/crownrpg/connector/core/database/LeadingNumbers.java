package kr.crownrpg.connector.core.database;

/**
 * 필드 텍스트 앞부분의 숫자만 읽는 파서.
 *
 * 앞쪽 공백을 건너뛰고 부호와 숫자(실수는 소수점/지수 포함)로 이루어진 가장 긴 접두사를 해석한다.
 * 나머지 문자는 무시하므로 {@code "27.5000"}은 정수로 27, {@code "12abc"}는 12가 된다.
 * 숫자 접두사가 없거나 범위를 넘으면 {@link NumberFormatException}.
 */
final class LeadingNumbers {

    private LeadingNumbers() {}

    static int parseInt(String text) {
        long value = parseLong(text);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new NumberFormatException("out of int range: '" + text + "'");
        }
        return (int) value;
    }

    static long parseLong(String text) {
        int start = skipWhitespace(text, 0);
        int i = skipSign(text, start);
        int digits = skipDigits(text, i);
        if (digits == i) {
            throw new NumberFormatException("no numeric prefix: '" + text + "'");
        }
        try {
            return Long.parseLong(text.substring(start, digits));
        } catch (NumberFormatException e) {
            throw new NumberFormatException("out of long range: '" + text + "'");
        }
    }

    static double parseDouble(String text) {
        int start = skipWhitespace(text, 0);
        int i = skipSign(text, start);
        boolean negative = i > start && text.charAt(start) == '-';

        if (text.regionMatches(true, i, "inf", 0, 3)) {
            return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        if (text.regionMatches(true, i, "nan", 0, 3)) {
            return Double.NaN;
        }

        int intEnd = skipDigits(text, i);
        int end = intEnd;
        boolean anyDigit = intEnd > i;
        if (end < text.length() && text.charAt(end) == '.') {
            int fracEnd = skipDigits(text, end + 1);
            anyDigit |= fracEnd > end + 1;
            end = fracEnd;
        }
        if (!anyDigit) {
            throw new NumberFormatException("no numeric prefix: '" + text + "'");
        }
        // 지수는 뒤에 숫자가 하나 이상 있을 때만 포함
        if (end < text.length() && (text.charAt(end) == 'e' || text.charAt(end) == 'E')) {
            int expDigitsStart = skipSign(text, end + 1);
            int expEnd = skipDigits(text, expDigitsStart);
            if (expEnd > expDigitsStart) {
                end = expEnd;
            }
        }

        double value = Double.parseDouble(text.substring(start, end));
        if (Double.isInfinite(value)) {
            throw new NumberFormatException("out of double range: '" + text + "'");
        }
        return value;
    }

    private static int skipWhitespace(String text, int from) {
        int i = from;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static int skipSign(String text, int from) {
        if (from < text.length() && (text.charAt(from) == '+' || text.charAt(from) == '-')) {
            return from + 1;
        }
        return from;
    }

    private static int skipDigits(String text, int from) {
        int i = from;
        while (i < text.length() && text.charAt(i) >= '0' && text.charAt(i) <= '9') {
            i++;
        }
        return i;
    }
}
