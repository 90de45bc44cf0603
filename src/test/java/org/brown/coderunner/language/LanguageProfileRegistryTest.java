package org.brown.coderunner.language;

import org.brown.coderunner.config.RunnerProperties;
import org.brown.coderunner.exception.UnsupportedLanguageException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LanguageProfileRegistryTest {

    private final LanguageProfileRegistry registry = new LanguageProfileRegistry(new RunnerProperties());

    @Test
    void everyLanguageHasAProfile() {
        assertThat(registry.all()).containsOnlyKeys(Language.values());
    }

    @Test
    void lookupIsCaseInsensitiveAndAcceptsAliases() {
        assertThat(registry.lookup("Python").getLanguage()).isEqualTo(Language.PYTHON);
        assertThat(registry.lookup("c++").getLanguage()).isEqualTo(Language.CPP);
        assertThat(registry.lookup("js").getLanguage()).isEqualTo(Language.JAVASCRIPT);
        assertThat(registry.lookup("bash").getLanguage()).isEqualTo(Language.SHELL);
    }

    @Test
    void unknownLanguageIsRejected() {
        assertThatThrownBy(() -> registry.lookup("cobol"))
                .isInstanceOf(UnsupportedLanguageException.class)
                .hasMessageContaining("cobol");
        assertThatThrownBy(() -> registry.lookup((String) null))
                .isInstanceOf(UnsupportedLanguageException.class);
    }

    @Test
    void pythonRunsUnbufferedFromFixedFile() {
        LanguageProfile python = registry.lookup("python");

        assertThat(python.getImage()).isEqualTo("python:3.9-alpine");
        assertThat(python.sourceFileName("print(1)")).isEqualTo("program.py");
        assertThat(python.renderRunCommand("program.py")).containsExactly("python", "-u", "program.py");
    }

    @Test
    void javaFileNameFollowsPublicClass() {
        LanguageProfile java = registry.lookup("java");

        assertThat(java.sourceFileName("public class Solution { public static void main(String[] a) {} }"))
                .isEqualTo("Solution.java");
        assertThat(java.sourceFileName("public final class Greeter {}")).isEqualTo("Greeter.java");
        assertThat(java.sourceFileName("class Hidden {}")).isEqualTo("Main.java");
        assertThat(java.renderRunCommand("Solution.java"))
                .containsExactly("sh", "-c", "javac Solution.java && java Solution");
    }

    @Test
    void inputCommandRedirectsStdinFile() {
        assertThat(registry.lookup("python").renderInputCommand("program.py"))
                .containsExactly("sh", "-c", "python -u program.py < input.txt");
        assertThat(registry.lookup("cpp").renderInputCommand("program.cpp"))
                .containsExactly("sh", "-c", "g++ -o program program.cpp && ./program < input.txt");
    }

    @Test
    void withStdinFileUnwrapsShellScripts() {
        assertThat(LanguageProfileRegistry.withStdinFile(List.of("node", "${file}")))
                .containsExactly("sh", "-c", "node ${file} < input.txt");
    }

    @Test
    void imageCanBeOverridden() {
        RunnerProperties properties = new RunnerProperties();
        properties.getImages().put("python", "python:3.12-alpine");

        LanguageProfileRegistry overridden = new LanguageProfileRegistry(properties);

        assertThat(overridden.lookup("python").getImage()).isEqualTo("python:3.12-alpine");
        assertThat(overridden.lookup("ruby").getImage()).isEqualTo("ruby:alpine");
    }
}
