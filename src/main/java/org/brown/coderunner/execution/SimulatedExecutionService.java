package org.brown.coderunner.execution;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.brown.coderunner.language.Language;
import org.brown.coderunner.language.LanguageProfile;
import org.brown.coderunner.language.LanguageProfileRegistry;
import org.brown.coderunner.model.ErrorKind;
import org.brown.coderunner.model.ExecutionRequest;
import org.brown.coderunner.model.ExecutionResult;
import org.brown.coderunner.model.ExecutionStatus;
import org.brown.coderunner.simulation.InterpretationException;
import org.brown.coderunner.simulation.PythonSubsetInterpreter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.UUID;

/**
 * 시뮬레이션 모드 실행 서비스 (로컬 테스트 / 격리 백엔드가 없는 환경용)
 *
 * 실제 격리 실행을 하지 않으므로 모든 결과에 simulated=true, errorKind=SimulatedExecution 을 붙이고
 * 측정하지 않은 exitCode 는 채우지 않는다. Python 만 제한된 인터프리터로 평가한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "runner.simulation.enabled", havingValue = "true")
public class SimulatedExecutionService implements ExecutionService {

    private final LanguageProfileRegistry languageProfileRegistry;
    private final PythonSubsetInterpreter interpreter = new PythonSubsetInterpreter();

    @Override
    public ExecutionResult run(ExecutionRequest request, Duration timeout) {
        LanguageProfile profile = languageProfileRegistry.lookup(request.getLanguage());
        String executionId = request.getExecutionId() != null && !request.getExecutionId().isBlank()
                ? request.getExecutionId()
                : UUID.randomUUID().toString();
        long startTime = System.currentTimeMillis();

        log.warn("[SIMULATION] Simulating execution {} (language={}), no isolation backend in use",
                executionId, profile.getId());

        ExecutionResult.ExecutionResultBuilder result = ExecutionResult.builder()
                .executionId(executionId)
                .errorKind(ErrorKind.SIMULATED_EXECUTION)
                .simulated(true);

        if (profile.getLanguage() != Language.PYTHON) {
            return result
                    .status(ExecutionStatus.ERROR)
                    .output("Simulation unavailable for " + profile.getId()
                            + ": code was not executed because the isolation backend is disabled")
                    .durationMillis(System.currentTimeMillis() - startTime)
                    .build();
        }

        try {
            String output = interpreter.run(request.getSourceCode(), request.getStdin());
            return result
                    .status(ExecutionStatus.SUCCESS)
                    .output(output)
                    .durationMillis(System.currentTimeMillis() - startTime)
                    .build();
        } catch (InterpretationException e) {
            String message = e.isUnsupportedConstruct()
                    ? "Simulation unavailable (line " + e.getLine() + "): " + e.getMessage()
                    : "Traceback (simulated), line " + e.getLine() + "\n" + e.getMessage();
            log.info("Simulated execution {} stopped at line {}: {}", executionId, e.getLine(), e.getMessage());
            return result
                    .status(ExecutionStatus.ERROR)
                    .output(e.getPartialOutput() + message)
                    .durationMillis(System.currentTimeMillis() - startTime)
                    .build();
        }
    }

    @Override
    public String getMode() {
        return "simulation";
    }
}
