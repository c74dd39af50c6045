package com.xgpt.search.service;

/**
 * Ordering of source-assigned tweet ids used when a resumed session skips items it has
 * already examined. All-digit ids compare numerically, so "999" sorts before "1000";
 * anything else compares lexically.
 */
public final class IdOrdering {

    private IdOrdering() {
    }

    public static int compare(String a, String b) {
        if (isDigits(a) && isDigits(b)) {
            String x = stripLeadingZeros(a);
            String y = stripLeadingZeros(b);
            if (x.length() != y.length()) {
                return Integer.compare(x.length(), y.length());
            }
            return x.compareTo(y);
        }
        return a.compareTo(b);
    }

    public static boolean isAtOrBefore(String id, String checkpoint) {
        return compare(id, checkpoint) <= 0;
    }

    private static boolean isDigits(String value) {
        if (value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    private static String stripLeadingZeros(String value) {
        int i = 0;
        while (i < value.length() - 1 && value.charAt(i) == '0') {
            i++;
        }
        return value.substring(i);
    }
}
