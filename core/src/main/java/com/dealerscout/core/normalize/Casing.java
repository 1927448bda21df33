package com.dealerscout.core.normalize;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** 전부 대문자/소문자로 들어온 이름을 Title Case로 바꾸는 유틸 */
final class Casing {
    private Casing() {}

    /** Title Case 이후 다시 대문자로 되돌릴 약어 */
    private static final List<String> UPPERCASE_WORDS = List.of(
            "NE", "NW", "SE", "SW", "GMC", "FIAT", "RAM", "BMW", "USA", "II", "III", "IV",
            "CDJR", "CDJRF", "VW", "AMG", "LLC", "RV");

    private static final List<Pattern> RESTORE;
    static {
        RESTORE = UPPERCASE_WORDS.stream()
                .map(w -> Pattern.compile("\\b" + Pattern.quote(titleWord(w)) + "\\b"))
                .toList();
    }

    /** 글자가 하나 이상 있고, 그 글자가 전부 대문자이거나 전부 소문자면 true */
    static boolean isSingleCase(String s) {
        if (s == null) return false;
        boolean anyLetter = false, anyUpper = false, anyLower = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (!Character.isLetter(c)) continue;
            anyLetter = true;
            if (Character.isUpperCase(c)) anyUpper = true;
            if (Character.isLowerCase(c)) anyLower = true;
        }
        return anyLetter && !(anyUpper && anyLower);
    }

    static String titleCase(String s) {
        if (s == null || s.isEmpty()) return s;
        StringBuilder sb = new StringBuilder(s.length());
        boolean start = true;
        int wordLetters = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isLetter(c)) {
                sb.append(start ? Character.toUpperCase(c) : Character.toLowerCase(c));
                start = false;
                wordLetters++;
            } else if (c == '\'') {
                sb.append(c);
                // O'Brien 은 대문자, Joe's 는 소문자
                start = (wordLetters == 1);
            } else {
                sb.append(c);
                start = Character.isWhitespace(c) || c == '-' || c == '/' || c == '(' || c == '&' || c == '.';
                if (start) wordLetters = 0;
            }
        }
        String out = sb.toString();
        for (int i = 0; i < RESTORE.size(); i++) {
            Matcher m = RESTORE.get(i).matcher(out);
            out = m.replaceAll(UPPERCASE_WORDS.get(i));
        }
        return out;
    }

    private static String titleWord(String w) {
        return w.charAt(0) + w.substring(1).toLowerCase(Locale.ROOT);
    }
}
