package org.convcase.words;

import org.convcase.model.Boundary;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 경계 규칙에 따라 텍스트를 단어로 분할합니다.
 * <p>
 * 알고리즘:
 * <ol>
 *   <li>코드 포인트 단위로 왼쪽에서 오른쪽으로 한 번 순회</li>
 *   <li>활성화된 구분자 규칙이 소비하는 문자에서 현재 단어를 끊고 그 문자는 버림</li>
 *   <li>ACRONYM: 대문자 두 개 뒤 소문자이면 마지막 대문자 앞에서 끊음</li>
 *   <li>LOWER_UPPER, DIGIT: 직전 문자와 현재 문자 사이에서 끊음</li>
 *   <li>길이 0인 조각은 버림</li>
 * </ol>
 * 규칙은 같은 단어 안의 문자끼리만 비교합니다. 구분자를 넘어 판단하지 않습니다.
 * 구두점 등 나머지 문자는 경계를 만들지 않고 단어 안에 그대로 남습니다.
 */
public final class WordSplitter {

    private WordSplitter() {
    }

    public static List<String> split(String text, Set<Boundary> boundaries) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        int[] cps = text.codePoints().toArray();
        List<String> words = new ArrayList<>();
        int start = 0;

        for (int i = 0; i < cps.length; i++) {
            int current = cps[i];

            if (isConsumed(current, boundaries)) {
                addWord(words, cps, start, i);
                start = i + 1;
                continue;
            }

            if (i - 2 >= start && firesAcronym(cps[i - 2], cps[i - 1], current, boundaries)) {
                addWord(words, cps, start, i - 1);
                start = i - 1;
            } else if (i - 1 >= start && firesBetween(cps[i - 1], current, boundaries)) {
                addWord(words, cps, start, i);
                start = i;
            }
        }
        addWord(words, cps, start, cps.length);

        return List.copyOf(words);
    }

    private static boolean isConsumed(int codePoint, Set<Boundary> boundaries) {
        for (Boundary boundary : boundaries) {
            if (boundary.consumes(codePoint)) {
                return true;
            }
        }
        return false;
    }

    private static boolean firesAcronym(int first, int second, int third, Set<Boundary> boundaries) {
        for (Boundary boundary : boundaries) {
            if (boundary.splitsAcronym(first, second, third)) {
                return true;
            }
        }
        return false;
    }

    private static boolean firesBetween(int previous, int current, Set<Boundary> boundaries) {
        for (Boundary boundary : boundaries) {
            if (boundary.splitsBefore(previous, current)) {
                return true;
            }
        }
        return false;
    }

    private static void addWord(List<String> words, int[] cps, int from, int to) {
        if (to > from) {
            words.add(new String(cps, from, to - from));
        }
    }
}
