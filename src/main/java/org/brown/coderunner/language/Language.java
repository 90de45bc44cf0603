package org.brown.coderunner.language;

import java.util.Locale;
import java.util.Optional;

/**
 * 지원 언어 식별자
 */
public enum Language {
    JAVASCRIPT("javascript"),
    PYTHON("python"),
    JAVA("java"),
    CPP("cpp"),
    C("c"),
    GO("go"),
    RUBY("ruby"),
    RUST("rust"),
    PHP("php"),
    SHELL("shell");

    private final String id;

    Language(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /**
     * 대소문자 무시. "c++", "js" 같은 흔한 별칭도 받는다.
     */
    public static Optional<Language> fromId(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "c++":
                return Optional.of(CPP);
            case "js":
            case "node":
                return Optional.of(JAVASCRIPT);
            case "sh":
            case "bash":
                return Optional.of(SHELL);
            default:
                break;
        }
        for (Language language : values()) {
            if (language.id.equals(normalized)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }
}
