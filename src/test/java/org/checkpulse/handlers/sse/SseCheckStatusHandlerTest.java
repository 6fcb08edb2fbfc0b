package org.checkpulse.handlers.sse;

import org.checkpulse.services.CheckOrchestrator;
import org.checkpulse.state.StateListener;
import org.checkpulse.state.StateStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SseCheckStatusHandlerTest {

    @Mock
    private CheckOrchestrator orchestrator;

    @Mock
    private StateStore stateStore;

    @Test
    void shutdownDetachesFromTheStateStore() {
        when(orchestrator.getStateStore()).thenReturn(stateStore);
        SseCheckStatusHandler handler = new SseCheckStatusHandler(orchestrator, 60);
        ArgumentCaptor<StateListener> listener = ArgumentCaptor.forClass(StateListener.class);
        verify(stateStore).addListener(listener.capture());

        handler.shutdown();

        verify(stateStore).removeListener(listener.getValue());
    }

    @Test
    void payloadCountsStatuses() {
        when(orchestrator.getStateStore()).thenReturn(stateStore);
        when(orchestrator.snapshot()).thenReturn(List.of());
        SseCheckStatusHandler handler = new SseCheckStatusHandler(orchestrator, 60);
        try {
            Map<String, Object> data = handler.generateData();

            assertEquals(0, data.get("total_checks"));
            assertEquals(60L, data.get("sse_push_interval_seconds"));
        } finally {
            handler.shutdown();
        }
    }
}
