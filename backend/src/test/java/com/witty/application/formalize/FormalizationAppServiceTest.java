package com.witty.application.formalize;

import com.witty.application.formalize.FormalizationAppService.FormalizationTicket;
import com.witty.application.formalize.exception.FormalizationCancelledException;
import com.witty.domain.formalize.model.FormalizationResult;
import com.witty.domain.formalize.model.FormalizeOptions;
import com.witty.infrastructure.pipeline.CancellationToken;
import com.witty.infrastructure.pipeline.FormalizationOrchestrator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FormalizationAppServiceTest {

    @Mock
    private FormalizationOrchestrator orchestrator;

    private ExecutorService executor;
    private FormalizationAppService service;
    private final FormalizeOptions options = FormalizeOptions.defaults();

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        service = new FormalizationAppService(orchestrator, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static FormalizationResult result(String requestId) {
        return FormalizationResult.builder().requestId(requestId).cnf("P1").confidence(1.0).build();
    }

    @Test
    @DisplayName("Synchronous call delegates to the orchestrator")
    void formalize() {
        when(orchestrator.run(eq("Alice runs."), eq(options), any(CancellationToken.class))).thenReturn(result("req_1"));

        assertThat(service.formalize("Alice runs.", options).requestId()).isEqualTo("req_1");
    }

    @Test
    @DisplayName("Async ticket completes and leaves no in-flight entry")
    void formalizeAsync() {
        when(orchestrator.run(eq("Alice runs."), eq(options), any(CancellationToken.class))).thenReturn(result("req_2"));

        FormalizationTicket ticket = service.formalizeAsync("Alice runs.", options);

        assertThat(ticket.ticketId()).isNotBlank();
        assertThat(ticket.result().join().requestId()).isEqualTo("req_2");
        assertThat(service.inFlightCount()).isZero();
        assertThat(service.cancel(ticket.ticketId())).isFalse();
    }

    @Test
    @DisplayName("Cancelling a running request fails its future")
    void cancelRunning() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        when(orchestrator.run(any(), any(), any(CancellationToken.class))).thenAnswer(invocation -> {
            CancellationToken token = invocation.getArgument(2);
            started.countDown();
            while (!token.isCancelled()) {
                Thread.sleep(5);
            }
            token.throwIfCancelled();
            return result("never");
        });

        FormalizationTicket ticket = service.formalizeAsync("Alice runs.", options);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(service.inFlightCount()).isEqualTo(1);

        assertThat(service.cancel(ticket.ticketId())).isTrue();

        assertThatThrownBy(() -> ticket.result().join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(FormalizationCancelledException.class);
        assertThat(service.inFlightCount()).isZero();
    }

    @Test
    void unknownTicketCannotBeCancelled() {
        assertThat(service.cancel("missing")).isFalse();
    }
}
