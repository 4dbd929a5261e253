package org.dxworks.codesync;

import java.nio.file.Path;
import java.util.Optional;

public class LanguageDetector {

    public static Optional<Language> detectLanguage(Path filePath) {
        return detectLanguage(filePath.getFileName().toString());
    }

    public static Optional<Language> detectLanguage(String fileName) {
        String lowerCaseName = fileName.toLowerCase();

        if (lowerCaseName.endsWith(".java")) {
            return Optional.of(Language.JAVA);
        } else if (lowerCaseName.endsWith(".md") || lowerCaseName.endsWith(".markdown")) {
            return Optional.of(Language.MARKDOWN);
        }

        return Optional.empty();
    }
}
