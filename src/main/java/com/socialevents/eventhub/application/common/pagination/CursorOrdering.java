package com.socialevents.eventhub.application.common.pagination;

import java.util.Comparator;

/**
 * (sortKey, tieBreakId) 전순서 비교기.
 *
 * <p>sortKey를 먼저 비교하며 null은 가장 작은 값으로 본다.
 * sortKey가 같으면(둘 다 null 포함) tieBreakId 사전순으로 결정한다.
 * 문자열은 UTF-16 코드 유닛이 아닌 유니코드 코드 포인트 순서로 비교한다(저장소의 바이트 순서와 일치).
 * tieBreakId가 유일하므로 서로 다른 두 아이템은 절대 equal이 되지 않는다.</p>
 */
public final class CursorOrdering implements Comparator<CursorKeyed> {

    public static final CursorOrdering INSTANCE = new CursorOrdering();

    private CursorOrdering() {}

    @Override
    public int compare(CursorKeyed a, CursorKeyed b) {
        int bySortKey = compareSortKeys(a.sortKey(), b.sortKey());
        if (bySortKey != 0) return bySortKey;
        return compareCodePoints(a.tieBreakId(), b.tieBreakId());
    }

    /**
     * null을 최소값으로 취급하여 sortKey를 비교한다.
     *
     * @param a 좌변(null 가능)
     * @param b 우변(null 가능)
     * @return 비교 결과
     */
    public static int compareSortKeys(String a, String b) {
        if (a == null) return (b == null) ? 0 : -1;
        if (b == null) return 1;
        return compareCodePoints(a, b);
    }

    static int compareCodePoints(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            int ca = a.codePointAt(i);
            int cb = b.codePointAt(j);
            if (ca != cb) return Integer.compare(ca, cb);
            i += Character.charCount(ca);
            j += Character.charCount(cb);
        }
        return Integer.compare(a.length() - i, b.length() - j);
    }
}
