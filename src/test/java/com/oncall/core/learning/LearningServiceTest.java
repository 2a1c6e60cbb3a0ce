package com.oncall.core.learning;

import com.oncall.core.config.InvestigatorProperties;
import com.oncall.core.model.LearningInsights;
import com.oncall.core.model.SessionLearning;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class LearningServiceTest {

    private LearningStore store;
    private LearningInsightsExtractor extractor;
    private InvestigatorProperties props;
    private LearningService service;

    @BeforeEach
    void setUp() {
        store = mock(LearningStore.class);
        extractor = mock(LearningInsightsExtractor.class);
        props = new InvestigatorProperties();
        service = new LearningService(store, extractor, props);
    }

    @Test
    @DisplayName("historical context summarises the latest session and deduplicates insights")
    void rendersContext() {
        when(store.recent(20)).thenReturn(List.of(
                new SessionLearning("INV-1", Instant.now(), "old query", "old report",
                        List.of("spines run BGP"), List.of("xrd-1 peers with xrd-2")),
                new SessionLearning("INV-2", Instant.now(), "check xrd-2", "x".repeat(400),
                        List.of("spines run BGP", "leaf uplinks are 100G"), List.of())));

        String context = service.historicalContext();

        assertTrue(context.startsWith("Previous sessions: 2\n"));
        assertTrue(context.contains("Latest session INV-2 asked: check xrd-2"));
        assertTrue(context.contains("x".repeat(300) + "..."));
        assertEquals(1, context.split("spines run BGP", -1).length - 1);
        assertTrue(context.contains("- leaf uplinks are 100G"));
        assertTrue(context.contains("Device relationships:\n- xrd-1 peers with xrd-2"));
    }

    @Test
    @DisplayName("historical context is empty when there is no history, it is disabled, or the store fails")
    void emptyContext() {
        when(store.recent(anyInt())).thenReturn(List.of());
        assertEquals("", service.historicalContext());

        when(store.recent(anyInt())).thenThrow(new LearningStoreException("disk full", null));
        assertEquals("", service.historicalContext());

        props.getLearning().setEnabled(false);
        assertEquals("", service.historicalContext());
    }

    @Test
    @DisplayName("record stores the session with the extracted insights")
    void recordsSession() {
        when(extractor.extract("check xrd-1", "# Report"))
                .thenReturn(new LearningInsights(List.of("pattern"), List.of("relationship")));

        LearningInsights insights = service.record("INV-9", "check xrd-1", "# Report");

        var captor = ArgumentCaptor.forClass(SessionLearning.class);
        verify(store).append(captor.capture());
        assertEquals("INV-9", captor.getValue().sessionId());
        assertEquals(List.of("pattern"), captor.getValue().learnedPatterns());
        assertEquals(List.of("relationship"), insights.deviceRelationships());
    }

    @Test
    @DisplayName("a store failure while recording does not propagate")
    void recordIsBestEffort() {
        when(extractor.extract(any(), any())).thenReturn(LearningInsights.empty());
        doThrow(new LearningStoreException("read-only", null)).when(store).append(any());

        assertDoesNotThrow(() -> service.record("INV-9", "q", "r"));
    }
}
