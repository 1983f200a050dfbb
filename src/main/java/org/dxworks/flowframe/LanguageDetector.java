package org.dxworks.flowframe;

import java.nio.file.Path;
import java.util.Optional;

public class LanguageDetector {

    public static Optional<Language> detectLanguage(Path filePath) {
        String fileName = filePath.getFileName().toString();
        for (Language language : Language.values()) {
            if (language.matchesFileName(fileName)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }

    /**
     * Lower-cased extension including the dot, or an empty string when the file name has none.
     */
    public static String extensionOf(Path filePath) {
        String fileName = filePath.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(dot).toLowerCase() : "";
    }
}
