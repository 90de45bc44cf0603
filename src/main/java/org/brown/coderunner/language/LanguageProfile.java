package org.brown.coderunner.language;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 언어별 실행 프로파일 (불변)
 *
 * 커맨드 템플릿은 ${file} (소스 파일 이름), ${main} (확장자 제외 이름) 을 치환한다.
 */
@Value
@Builder(toBuilder = true)
public class LanguageProfile {

    Language language;

    String image;

    SourceFileRule sourceFileRule;

    /**
     * 일반 실행 커맨드
     */
    List<String> runCommand;

    /**
     * 워크스페이스의 input.txt 를 stdin 으로 파이프하는 변형
     */
    List<String> inputCommand;

    /**
     * 인터랙티브 터미널 셸
     */
    List<String> shellCommand;

    /**
     * 컴파일 결과물을 소스 옆에 쓰는지 여부 (쓰기 가능한 마운트 필요)
     */
    boolean compiled;

    public String getId() {
        return language.getId();
    }

    public String sourceFileName(String sourceCode) {
        return sourceFileRule.fileNameFor(sourceCode);
    }

    public List<String> renderRunCommand(String sourceFileName) {
        return render(runCommand, sourceFileName);
    }

    public List<String> renderInputCommand(String sourceFileName) {
        return render(inputCommand, sourceFileName);
    }

    private static List<String> render(List<String> template, String sourceFileName) {
        int dot = sourceFileName.lastIndexOf('.');
        String main = dot > 0 ? sourceFileName.substring(0, dot) : sourceFileName;
        return template.stream()
                .map(part -> part.replace("${file}", sourceFileName).replace("${main}", main))
                .toList();
    }
}
