package org.brown.coderunner.language;

import lombok.extern.slf4j.Slf4j;
import org.brown.coderunner.config.RunnerProperties;
import org.brown.coderunner.exception.UnsupportedLanguageException;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 언어 프로파일 레지스트리
 *
 * 시작 시 한 번 구성되며 이후에는 I/O 없이 조회만 한다.
 * 언어 추가는 아래 테이블에 한 줄을 추가하는 것으로 끝난다.
 * 이미지 이름은 runner.images.{language} 로 덮어쓸 수 있다.
 */
@Slf4j
@Component
public class LanguageProfileRegistry {

    public static final String STDIN_FILE_NAME = "input.txt";

    private static final List<String> SHELL = List.of("/bin/sh");

    private final Map<Language, LanguageProfile> profiles;

    public LanguageProfileRegistry(RunnerProperties runnerProperties) {
        Map<Language, LanguageProfile> table = new EnumMap<>(Language.class);
        for (LanguageProfile profile : defaultProfiles()) {
            String override = runnerProperties.getImages().get(profile.getId());
            if (override != null && !override.isBlank()) {
                log.info("Image override for {}: {} -> {}", profile.getId(), profile.getImage(), override);
                profile = profile.toBuilder().image(override.trim()).build();
            }
            table.put(profile.getLanguage(), profile);
        }
        this.profiles = Collections.unmodifiableMap(table);
        log.info("Loaded {} language profiles: {}", profiles.size(), profiles.keySet());
    }

    /**
     * 언어 ID 로 프로파일 조회
     *
     * @throws UnsupportedLanguageException 등록되지 않은 언어
     */
    public LanguageProfile lookup(String languageId) {
        Language language = Language.fromId(languageId)
                .orElseThrow(() -> new UnsupportedLanguageException("Unsupported language: " + languageId));
        return lookup(language);
    }

    public LanguageProfile lookup(Language language) {
        LanguageProfile profile = profiles.get(language);
        if (profile == null) {
            throw new UnsupportedLanguageException("No profile registered for language: " + language.getId());
        }
        return profile;
    }

    public Map<Language, LanguageProfile> all() {
        return profiles;
    }

    private static List<LanguageProfile> defaultProfiles() {
        return List.of(
                profile(Language.JAVASCRIPT, "node:16-alpine", SourceFileRule.fixed("program.js"),
                        List.of("node", "${file}"), false),
                profile(Language.PYTHON, "python:3.9-alpine", SourceFileRule.fixed("program.py"),
                        List.of("python", "-u", "${file}"), false),
                profile(Language.JAVA, "openjdk:11-jdk-slim", SourceFileRule.publicClassName("Main"),
                        List.of("sh", "-c", "javac ${file} && java ${main}"), true),
                profile(Language.CPP, "gcc:latest", SourceFileRule.fixed("program.cpp"),
                        List.of("sh", "-c", "g++ -o program ${file} && ./program"), true),
                profile(Language.C, "gcc:latest", SourceFileRule.fixed("program.c"),
                        List.of("sh", "-c", "gcc -o program ${file} && ./program"), true),
                profile(Language.GO, "golang:alpine", SourceFileRule.fixed("main.go"),
                        List.of("sh", "-c", "GOCACHE=/tmp/go-cache go run ${file}"), false),
                profile(Language.RUBY, "ruby:alpine", SourceFileRule.fixed("main.rb"),
                        List.of("ruby", "${file}"), false),
                profile(Language.RUST, "rust:slim", SourceFileRule.fixed("main.rs"),
                        List.of("sh", "-c", "rustc -o /tmp/main ${file} && /tmp/main"), false),
                profile(Language.PHP, "php:cli-alpine", SourceFileRule.fixed("main.php"),
                        List.of("php", "${file}"), false),
                profile(Language.SHELL, "alpine:latest", SourceFileRule.fixed("main.sh"),
                        List.of("sh", "${file}"), false)
        );
    }

    private static LanguageProfile profile(Language language, String image, SourceFileRule rule,
                                           List<String> runCommand, boolean compiled) {
        return LanguageProfile.builder()
                .language(language)
                .image(image)
                .sourceFileRule(rule)
                .runCommand(runCommand)
                .inputCommand(withStdinFile(runCommand))
                .shellCommand(SHELL)
                .compiled(compiled)
                .build();
    }

    /**
     * 실행 커맨드의 마지막 프로세스가 input.txt 를 stdin 으로 읽도록 변환
     */
    static List<String> withStdinFile(List<String> runCommand) {
        String script;
        if (runCommand.size() == 3 && "sh".equals(runCommand.get(0)) && "-c".equals(runCommand.get(1))) {
            script = runCommand.get(2);
        } else {
            script = String.join(" ", runCommand);
        }
        return List.of("sh", "-c", script + " < " + STDIN_FILE_NAME);
    }
}
