package org.dxworks.codesync;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class LanguageDetectorTest {

    @Test
    void detect_by_extension() {
        assertEquals(Optional.of(Language.JAVA), LanguageDetector.detectLanguage(Paths.get("src/Main.java")));
        assertEquals(Optional.of(Language.MARKDOWN), LanguageDetector.detectLanguage("docs/README.MD"));
        assertEquals(Optional.of(Language.MARKDOWN), LanguageDetector.detectLanguage("guide.markdown"));
        assertTrue(LanguageDetector.detectLanguage("build.gradle").isEmpty());
    }
}
