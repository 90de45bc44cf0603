package org.brown.coderunner.language;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 소스 파일 이름 규칙
 */
@FunctionalInterface
public interface SourceFileRule {

    String fileNameFor(String sourceCode);

    static SourceFileRule fixed(String fileName) {
        return sourceCode -> fileName;
    }

    /**
     * Java 는 public class 이름이 파일 이름이 되어야 한다.
     * 선언이 없으면 fallback 이름을 쓴다.
     */
    static SourceFileRule publicClassName(String fallbackName) {
        Pattern publicClass = Pattern.compile(
                "\\bpublic\\s+(?:(?:final|abstract|strictfp)\\s+)*class\\s+([A-Za-z_$][A-Za-z0-9_$]*)");
        return sourceCode -> {
            if (sourceCode != null) {
                Matcher matcher = publicClass.matcher(sourceCode);
                if (matcher.find()) {
                    return matcher.group(1) + ".java";
                }
            }
            return fallbackName + ".java";
        };
    }
}
