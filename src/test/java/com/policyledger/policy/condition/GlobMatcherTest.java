package com.policyledger.policy.condition;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GlobMatcherTest {

    @Test
    void singleStar_staysWithinOneSegment() {
        assertTrue(GlobMatcher.matches("src/App.java", "src/*.java"));
        assertFalse(GlobMatcher.matches("src/main/App.java", "src/*.java"));
    }

    @Test
    void doubleStar_crossesSegments() {
        assertTrue(GlobMatcher.matches("src/main/java/App.java", "src/**"));
        assertTrue(GlobMatcher.matches("a/b/c.ts", "**/*.ts"));
    }

    @Test
    void questionMark_matchesOneCharacter() {
        assertTrue(GlobMatcher.matches("v1", "v?"));
        assertFalse(GlobMatcher.matches("v10", "v?"));
    }

    @Test
    void regexMetacharacters_areLiteral() {
        assertTrue(GlobMatcher.matches("package.json", "package.json"));
        assertFalse(GlobMatcher.matches("packageXjson", "package.json"));
        assertTrue(GlobMatcher.matches("a+b(1).txt", "a+b(1).*"));
    }

    @Test
    void nullValue_neverMatches() {
        assertFalse(GlobMatcher.matches(null, "**"));
    }
}
