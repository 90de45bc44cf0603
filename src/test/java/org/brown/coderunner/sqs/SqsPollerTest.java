package org.brown.coderunner.sqs;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.brown.coderunner.config.RunnerProperties;
import org.brown.coderunner.exception.UnsupportedLanguageException;
import org.brown.coderunner.execution.ExecutionService;
import org.brown.coderunner.model.ExecutionRequest;
import org.brown.coderunner.model.ExecutionResult;
import org.brown.coderunner.model.ExecutionStatus;
import org.brown.coderunner.redis.RedisResultPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.ObjectProvider;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageResponse;


import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SqsPollerTest {

    private static final String QUEUE_URL = "https://sqs.ap-northeast-2.amazonaws.com/123/code-exec";

    private SqsClient sqsClient;
    private ExecutionService executionService;
    private RedisResultPublisher publisher;
    private SqsPoller poller;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        sqsClient = mock(SqsClient.class);
        executionService = mock(ExecutionService.class);
        publisher = mock(RedisResultPublisher.class);
        ObjectProvider<RedisResultPublisher> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(publisher);

        RunnerProperties properties = new RunnerProperties();
        properties.getSqs().setQueueUrl(QUEUE_URL);
        poller = new SqsPoller(sqsClient, new ObjectMapper(), properties, executionService, provider);
    }

    @Test
    void executesPublishesAndDeletes() {
        ExecutionResult result = ExecutionResult.builder()
                .executionId("q-1").status(ExecutionStatus.SUCCESS).output("hi\n").exitCode(0).build();
        when(executionService.run(any(), any())).thenReturn(result);
        receive(message("{\"requestId\":\"q-1\",\"runtime\":\"python\",\"code\":\"print('hi')\",\"timeoutMs\":2000}"));

        poller.pollQueue();

        ArgumentCaptor<ExecutionRequest> request = ArgumentCaptor.forClass(ExecutionRequest.class);
        verify(executionService).run(request.capture(), any());
        assertThat(request.getValue().getExecutionId()).isEqualTo("q-1");
        assertThat(request.getValue().getLanguage()).isEqualTo("python");
        verify(publisher).publishResult(result);
        verify(sqsClient).deleteMessage(any(DeleteMessageRequest.class));
    }

    @Test
    void malformedJsonIsDeleted() {
        receive(message("{not json"));

        poller.pollQueue();

        verifyNoInteractions(executionService);
        verify(sqsClient).deleteMessage(any(DeleteMessageRequest.class));
    }

    @Test
    void incompleteRequestIsDeleted() {
        receive(message("{\"executionId\":\"q-2\",\"language\":\"python\"}"));

        poller.pollQueue();

        verifyNoInteractions(executionService);
        verify(sqsClient).deleteMessage(any(DeleteMessageRequest.class));
    }

    @Test
    void unsupportedLanguageIsLeftForDeadLetterQueue() {
        when(executionService.run(any(), any())).thenThrow(new UnsupportedLanguageException("Unsupported language: cobol"));
        receive(message("{\"executionId\":\"q-3\",\"language\":\"cobol\",\"code\":\"x\"}"));

        poller.pollQueue();

        verify(sqsClient, never()).deleteMessage(any(DeleteMessageRequest.class));
        verifyNoInteractions(publisher);
    }

    @Test
    void missingQueueUrlSkipsPolling() {
        RunnerProperties properties = new RunnerProperties();
        @SuppressWarnings("unchecked")
        ObjectProvider<RedisResultPublisher> provider = mock(ObjectProvider.class);
        SqsPoller unconfigured = new SqsPoller(sqsClient, new ObjectMapper(), properties, executionService, provider);

        unconfigured.pollQueue();

        verifyNoInteractions(sqsClient);
    }

    private void receive(Message message) {
        when(sqsClient.receiveMessage(any(ReceiveMessageRequest.class)))
                .thenReturn(ReceiveMessageResponse.builder().messages(message).build());
    }

    private static Message message(String body) {
        return Message.builder().messageId("m-1").receiptHandle("rh-1").body(body).build();
    }
}
