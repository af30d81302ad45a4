package com.sitewatch.core.validation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TokenMatcherTest {

    @Test
    void word_inside_another_word_does_not_match() {
        assertFalse(TokenMatcher.containsToken("none", "one"));
        assertFalse(TokenMatcher.containsToken("someone else", "one"));
    }

    @Test
    void standalone_word_matches_with_non_alnum_neighbours() {
        assertTrue(TokenMatcher.containsToken("one two", "two"));
        assertTrue(TokenMatcher.containsToken("<b>Welcome</b>", "Welcome"));
        assertTrue(TokenMatcher.containsToken("Welcome", "Welcome"));
        assertTrue(TokenMatcher.containsToken("x-one.", "one"));
    }

    @Test
    void later_occurrence_is_found_after_rejected_one() {
        // 첫 등장("phone")은 경계 실패, 두 번째는 성공
        assertTrue(TokenMatcher.containsToken("phone one", "one"));
    }

    @Test
    void non_word_needle_uses_plain_substring() {
        assertTrue(TokenMatcher.containsToken("public, max-age=3600", "max-age="));
        assertTrue(TokenMatcher.containsToken("Sign in", "Sign in"));
        assertTrue(TokenMatcher.containsToken("xSign iny", "Sign in"));
    }

    @Test
    void empty_needle_always_matches_and_null_text_never() {
        assertTrue(TokenMatcher.containsToken("", ""));
        assertTrue(TokenMatcher.containsToken("anything", ""));
        assertFalse(TokenMatcher.containsToken(null, "x"));
    }

    @Test
    void case_sensitive() {
        assertFalse(TokenMatcher.containsToken("welcome", "Welcome"));
    }
}
