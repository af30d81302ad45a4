package com.sitewatch.core.validation;

/**
 * 단어 경계 기반 토큰 매칭.
 * 바늘이 전부 문자/숫자면 앞뒤 글자가 ASCII 영숫자가 아닐 때만 일치("none" 안의 "one"은 불일치).
 * 그 외 문자가 섞여 있으면 단순 부분 문자열 검색.
 */
public final class TokenMatcher {
    private TokenMatcher() {}

    public static boolean containsToken(String text, String needle) {
        if (needle == null || needle.isEmpty()) return true;
        if (text == null) return false;

        boolean wordy = needle.codePoints().allMatch(Character::isLetterOrDigit);
        if (!wordy) return text.contains(needle);

        final int n = needle.length();
        int from = 0;
        while (true) {
            int start = text.indexOf(needle, from);
            if (start < 0) return false;
            int end = start + n;

            boolean leftOk = (start == 0) || !isAsciiAlnum(text.charAt(start - 1));
            boolean rightOk = (end >= text.length()) || !isAsciiAlnum(text.charAt(end));
            if (leftOk && rightOk) return true;

            from = start + 1;
        }
    }

    static boolean isAsciiAlnum(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
    }
}
