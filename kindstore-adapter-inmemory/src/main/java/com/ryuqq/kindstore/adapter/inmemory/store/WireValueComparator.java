package com.ryuqq.kindstore.adapter.inmemory.store;

import com.ryuqq.kindstore.core.key.Key;

import java.time.ZonedDateTime;
import java.util.Comparator;
import java.util.List;

/**
 * 저장된 wire 값의 전순서 비교기.
 *
 * <p>타입 순서: null &lt; 숫자 &lt; 날짜/시간 &lt; Boolean &lt; byte[] &lt; String &lt; Key &lt; 기타.
 * 같은 타입 안에서는 자연 순서이며, byte[]는 부호 없는 사전순으로 비교합니다.</p>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
final class WireValueComparator implements Comparator<Object> {

    static final WireValueComparator INSTANCE = new WireValueComparator();

    private WireValueComparator() {
    }

    /**
     * 두 값이 같은 타입 그룹인지 확인. 필터는 같은 그룹의 값끼리만 비교합니다.
     */
    static boolean comparable(Object a, Object b) {
        return rank(a) == rank(b);
    }

    @Override
    public int compare(Object a, Object b) {
        int rankA = rank(a);
        int rankB = rank(b);
        if (rankA != rankB) {
            return Integer.compare(rankA, rankB);
        }

        return switch (rankA) {
            case 0 -> 0;
            case 1 -> compareNumbers((Number) a, (Number) b);
            case 2 -> ((ZonedDateTime) a).toInstant().compareTo(((ZonedDateTime) b).toInstant());
            case 3 -> Boolean.compare((Boolean) a, (Boolean) b);
            case 4 -> compareBytes((byte[]) a, (byte[]) b);
            case 5 -> ((String) a).compareTo((String) b);
            case 6 -> compareKeys((Key) a, (Key) b);
            default -> String.valueOf(a).compareTo(String.valueOf(b));
        };
    }

    private static int rank(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Number) {
            return 1;
        }
        if (value instanceof ZonedDateTime) {
            return 2;
        }
        if (value instanceof Boolean) {
            return 3;
        }
        if (value instanceof byte[]) {
            return 4;
        }
        if (value instanceof String) {
            return 5;
        }
        if (value instanceof Key) {
            return 6;
        }
        return 7;
    }

    private static int compareNumbers(Number a, Number b) {
        if ((a instanceof Long || a instanceof Integer) && (b instanceof Long || b instanceof Integer)) {
            return Long.compare(a.longValue(), b.longValue());
        }
        return Double.compare(a.doubleValue(), b.doubleValue());
    }

    private static int compareBytes(byte[] a, byte[] b) {
        int length = Math.min(a.length, b.length);
        for (int i = 0; i < length; i++) {
            int cmp = Integer.compare(a[i] & 0xff, b[i] & 0xff);
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(a.length, b.length);
    }

    static int compareKeys(Key a, Key b) {
        int cmp = a.getNamespace().compareTo(b.getNamespace());
        if (cmp != 0) {
            return cmp;
        }
        List<Object> pathA = a.path();
        List<Object> pathB = b.path();
        int length = Math.min(pathA.size(), pathB.size());
        for (int i = 0; i < length; i++) {
            cmp = comparePathElement(pathA.get(i), pathB.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(pathA.size(), pathB.size());
    }

    private static int comparePathElement(Object a, Object b) {
        if (a instanceof Long la && b instanceof Long lb) {
            return Long.compare(la, lb);
        }
        if (a instanceof Long) {
            return -1;
        }
        if (b instanceof Long) {
            return 1;
        }
        return String.valueOf(a).compareTo(String.valueOf(b));
    }
}
