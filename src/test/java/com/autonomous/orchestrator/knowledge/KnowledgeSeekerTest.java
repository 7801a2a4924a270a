package com.autonomous.orchestrator.knowledge;

import com.autonomous.orchestrator.model.KnowledgeItem;
import com.autonomous.orchestrator.model.SourceRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class KnowledgeSeekerTest {

    private KnowledgeSynthesizer synthesizer;
    private final List<String> synthesizedQueries = Collections.synchronizedList(new ArrayList<>());

    @BeforeEach
    void setUp() {
        synthesizer = mock(KnowledgeSynthesizer.class);
        when(synthesizer.synthesize(anyString(), anyList())).thenAnswer(invocation -> {
            String query = invocation.getArgument(0);
            List<SourceRecord> records = invocation.getArgument(1);
            synthesizedQueries.add(query);
            if (query.contains("explode")) {
                throw new IllegalStateException("synthesis failed");
            }
            return KnowledgeItem.builder()
                .query(query)
                .topic("topic of " + query)
                .content("content")
                .confidence(KnowledgeSynthesizer.confidenceFor(records.size()))
                .relatedTopics(List.of("r1", "r2", "r3", "r4"))
                .build();
        });
    }

    @Test
    void shouldKeepQueryOrder() {
        KnowledgeSeeker seeker = seeker(List.of(source("Static", "text")), 1);

        List<KnowledgeItem> items = seeker.seekKnowledge(List.of("a", "b", "c"));

        assertEquals(List.of("a", "b", "c"), items.stream().map(KnowledgeItem::getQuery).toList());
    }

    @Test
    void shouldDropOnlyTheFailingQuery() {
        KnowledgeSeeker seeker = seeker(List.of(source("Static", "text")), 1);

        List<KnowledgeItem> items = seeker.seekKnowledge(List.of("first", "explode please", "last"));

        assertEquals(List.of("first", "last"), items.stream().map(KnowledgeItem::getQuery).toList());
    }

    @Test
    void shouldToleratePartialSourceFailure() {
        KnowledgeSource broken = mock(KnowledgeSource.class);
        when(broken.name()).thenReturn("Broken");
        when(broken.retrieve(anyString())).thenThrow(new RuntimeException("connection refused"));
        KnowledgeSeeker seeker = seeker(List.of(broken, source("Static", "text")), 1);

        List<KnowledgeItem> items = seeker.seekKnowledge(List.of("q"));

        assertEquals(1, items.size());
        assertEquals(0.6, items.get(0).getConfidence());
    }

    @Test
    void shouldProduceLowConfidenceItemWhenEverySourceFails() {
        KnowledgeSource broken = mock(KnowledgeSource.class);
        when(broken.name()).thenReturn("Broken");
        when(broken.retrieve(anyString())).thenThrow(new RuntimeException("connection refused"));
        KnowledgeSeeker seeker = seeker(List.of(broken), 1);

        List<KnowledgeItem> items = seeker.seekKnowledge(List.of("q"));

        assertEquals(1, items.size());
        assertEquals(0.1, items.get(0).getConfidence());
    }

    @Test
    void shouldReturnEmptyForNoQueries() {
        assertTrue(seeker(List.of(source("Static", "text")), 1).seekKnowledge(List.of()).isEmpty());
        verifyNoInteractions(synthesizer);
    }

    @Test
    void shouldBoundExpansionByDepthAndTopicCount() {
        KnowledgeSeeker seeker = seeker(List.of(source("Static", "text")), 1);
        KnowledgeItem base = KnowledgeItem.builder()
            .query("q")
            .topic("entropy")
            .relatedTopics(List.of("heat", "order", "time", "information"))
            .build();

        List<KnowledgeItem> expanded = seeker.expandKnowledge(List.of(base));

        assertEquals(List.of(
            "How does heat relate to entropy?",
            "How does order relate to entropy?",
            "How does time relate to entropy?"), expanded.stream().map(KnowledgeItem::getQuery).toList());
    }

    @Test
    void shouldFollowExpansionToConfiguredDepth() {
        KnowledgeSeeker seeker = seeker(List.of(source("Static", "text")), 2);
        KnowledgeItem base = KnowledgeItem.builder()
            .query("q")
            .topic("entropy")
            .relatedTopics(List.of("heat"))
            .build();

        List<KnowledgeItem> expanded = seeker.expandKnowledge(List.of(base));

        // one item at depth 1, three follow-ups of it at depth 2
        assertEquals(4, expanded.size());
    }

    @Test
    void shouldRunQueriesOnPooledExecutor() {
        var executor = Executors.newFixedThreadPool(4);
        try {
            KnowledgeSeeker seeker = new KnowledgeSeeker(List.of(source("Static", "text")), synthesizer,
                executor, 5_000, 1, 3);

            List<KnowledgeItem> items = seeker.seekKnowledge(List.of("a", "b", "c", "d", "e"));

            assertEquals(List.of("a", "b", "c", "d", "e"), items.stream().map(KnowledgeItem::getQuery).toList());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldNotCountQueueWaitAgainstQueryTimeout() {
        ExecutorService single = Executors.newSingleThreadExecutor();
        try {
            KnowledgeSeeker seeker = new KnowledgeSeeker(List.of(slowSource(150)), synthesizer, single, 400, 1, 3);

            List<KnowledgeItem> items = seeker.seekKnowledge(List.of("a", "b", "c", "d"));

            assertEquals(List.of("a", "b", "c", "d"), items.stream().map(KnowledgeItem::getQuery).toList());
        } finally {
            single.shutdownNow();
        }
    }

    @Test
    void shouldDropQueryThatExceedsTimeout() {
        ExecutorService single = Executors.newSingleThreadExecutor();
        try {
            KnowledgeSource source = new KnowledgeSource() {
                @Override
                public String name() {
                    return "Stalling";
                }

                @Override
                public List<SourceRecord> retrieve(String query) {
                    pause(query.equals("stall") ? 1_000 : 50);
                    return List.of(SourceRecord.builder().title(query).content("text").source(name()).build());
                }
            };
            KnowledgeSeeker seeker = new KnowledgeSeeker(List.of(source), synthesizer, single, 300, 1, 3);

            List<KnowledgeItem> items = seeker.seekKnowledge(List.of("first", "stall", "last"));

            assertEquals(List.of("first", "last"), items.stream().map(KnowledgeItem::getQuery).toList());
        } finally {
            single.shutdownNow();
        }
    }

    private KnowledgeSource slowSource(long millis) {
        return new KnowledgeSource() {
            @Override
            public String name() {
                return "Slow";
            }

            @Override
            public List<SourceRecord> retrieve(String query) {
                pause(millis);
                return List.of(SourceRecord.builder().title(query).content("text").source(name()).build());
            }
        };
    }

    private static void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private KnowledgeSeeker seeker(List<KnowledgeSource> sources, int depth) {
        return new KnowledgeSeeker(sources, synthesizer, Runnable::run, 5_000, depth, 3);
    }

    private KnowledgeSource source(String name, String content) {
        return new KnowledgeSource() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public List<SourceRecord> retrieve(String query) {
                return List.of(SourceRecord.builder().title(name).content(content).source(name).build());
            }
        };
    }
}
