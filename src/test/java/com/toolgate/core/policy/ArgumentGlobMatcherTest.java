package com.toolgate.core.policy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArgumentGlobMatcherTest {

    @Test
    @DisplayName("* matches any run of characters")
    void star() {
        assertTrue(ArgumentGlobMatcher.matches("git status*", "git status --short"));
        assertTrue(ArgumentGlobMatcher.matches("rm -rf *", "rm -rf /tmp/x"));
        assertFalse(ArgumentGlobMatcher.matches("git status*", "git push"));
    }

    @Test
    @DisplayName("? matches exactly one character")
    void questionMark() {
        assertTrue(ArgumentGlobMatcher.matches("ls -?", "ls -l"));
        assertFalse(ArgumentGlobMatcher.matches("ls -?", "ls -la"));
    }

    @Test
    @DisplayName("the whole subject must match")
    void anchored() {
        assertFalse(ArgumentGlobMatcher.matches("ls", "ls -la"));
        assertFalse(ArgumentGlobMatcher.matches("push", "git push"));
    }

    @Test
    @DisplayName("regex metacharacters are literal")
    void literalMetacharacters() {
        assertTrue(ArgumentGlobMatcher.matches("src/*.java", "src/Main.java"));
        assertFalse(ArgumentGlobMatcher.matches("src/*.java", "src/Mainxjava"));
        assertTrue(ArgumentGlobMatcher.matches("echo (a|b)", "echo (a|b)"));
    }

    @Test
    @DisplayName("an empty subject never matches")
    void emptySubject() {
        assertFalse(ArgumentGlobMatcher.matchesAny(List.of("*"), ""));
        assertFalse(ArgumentGlobMatcher.matchesAny(List.of("*"), null));
    }

    @Test
    @DisplayName("[...] matches one character from the class")
    void characterClass() {
        assertTrue(ArgumentGlobMatcher.matches("rm -rf [/~]*", "rm -rf /"));
        assertTrue(ArgumentGlobMatcher.matches("rm -rf [/~]*", "rm -rf ~/projects"));
        assertFalse(ArgumentGlobMatcher.matches("rm -rf [/~]*", "rm -rf build"));
        assertTrue(ArgumentGlobMatcher.matches("file[0-9].txt", "file7.txt"));
        assertFalse(ArgumentGlobMatcher.matches("file[0-9].txt", "fileA.txt"));
    }

    @Test
    @DisplayName("[!...] negates the class")
    void negatedClass() {
        assertTrue(ArgumentGlobMatcher.matches("git push [!-]*", "git push origin"));
        assertFalse(ArgumentGlobMatcher.matches("git push [!-]*", "git push --force"));
    }

    @Test
    @DisplayName("an unclosed [ and regex class syntax inside brackets are literal")
    void bracketEdgeCases() {
        assertTrue(ArgumentGlobMatcher.matches("echo [abc", "echo [abc"));
        assertTrue(ArgumentGlobMatcher.matches("x[]]y", "x]y"));
        assertTrue(ArgumentGlobMatcher.matches("x[&^]y", "x^y"));
        assertFalse(ArgumentGlobMatcher.matches("x[&^]y", "xay"));
    }
}
