package com.llmcouncil.service.conversation;

import com.llmcouncil.domain.AggregateRankingEntry;
import com.llmcouncil.domain.Conversation;
import com.llmcouncil.domain.ConversationMetadata;
import com.llmcouncil.domain.CouncilOverrides;
import com.llmcouncil.domain.DeliberationMode;
import com.llmcouncil.domain.DeliberationResult;
import com.llmcouncil.domain.ErrorKind;
import com.llmcouncil.domain.ModelQueryError;
import com.llmcouncil.domain.RawRanking;
import com.llmcouncil.domain.Stage1Result;
import com.llmcouncil.domain.Stage3Result;
import com.llmcouncil.domain.TournamentRankingEntry;
import com.llmcouncil.exception.ConversationNotFoundException;
import com.llmcouncil.exception.ConversationStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileConversationStoreTest {

    @TempDir
    Path dir;

    private MutableClock clock;
    private JsonFileConversationStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T10:00:00Z"));
        store = new JsonFileConversationStore(dir, clock);
    }

    private static DeliberationResult councilTurn() {
        return new DeliberationResult(DeliberationMode.COUNCIL,
                List.of(new Stage1Result("a", "answer a"), new Stage1Result("b", "answer b")),
                List.of(new ModelQueryError("c", ErrorKind.RATE_LIMIT, "Rate limited", 429)),
                List.of(new RawRanking("a", "FINAL RANKING:\n1. Response B\n2. Response A", List.of("B", "A"))),
                List.of(ModelQueryError.of("b", ErrorKind.TIMEOUT, "Request timed out after 100 ms")),
                Map.of("A", "a", "B", "b"),
                List.of(new AggregateRankingEntry("b", 1.0, 1), new AggregateRankingEntry("a", 2.0, 1)),
                List.of(new TournamentRankingEntry("b", 1, 0, 0, 1, 1, 1),
                        new TournamentRankingEntry("a", 0, 1, 0, -1, 0, 1)),
                new Stage3Result("chair", "final"),
                List.of(),
                null);
    }

    @Test
    void createdConversationIsEmptyWithDefaultTitle() {
        Conversation c = store.create();

        Conversation loaded = store.get(c.id()).orElseThrow();
        assertThat(loaded.title()).isEqualTo(Conversation.DEFAULT_TITLE);
        assertThat(loaded.messages()).isEmpty();
        assertThat(loaded.createdAt()).isEqualTo(Instant.parse("2025-01-01T10:00:00Z"));
        assertThat(loaded.overrides()).isEqualTo(CouncilOverrides.NONE);
    }

    @Test
    void persistsFullDeliberationIncludingErrors() {
        Conversation c = store.create();
        DeliberationResult turn = councilTurn();

        store.addUserMessage(c.id(), "Why is the sky blue?");
        store.addAssistantMessage(c.id(), turn);

        JsonFileConversationStore reopened = new JsonFileConversationStore(dir, clock);
        Conversation loaded = reopened.get(c.id()).orElseThrow();
        assertThat(loaded.messages()).hasSize(2);
        assertThat(loaded.messages().get(0).content()).isEqualTo("Why is the sky blue?");
        assertThat(loaded.messages().get(1).deliberation()).isEqualTo(turn);
        assertThat(loaded.messages().get(1).content()).isEqualTo("final");
    }

    @Test
    void storedFileUsesSnakeCaseAndErrorTypes() throws IOException {
        Conversation c = store.create();
        store.addAssistantMessage(c.id(), councilTurn());

        String json = Files.readString(dir.resolve(c.id() + ".json"), StandardCharsets.UTF_8);

        assertThat(json).contains("\"label_to_model\"")
                .contains("\"aggregate_rankings\"")
                .contains("\"error_type\": \"rate_limit\"")
                .contains("\"status_code\": 429")
                .contains("\"created_at\"");
    }

    @Test
    void failedTurnRoundTripsWithNullStage3() {
        Conversation c = store.create();
        DeliberationResult failed = DeliberationResult.chairmanDirect(null,
                List.of(ModelQueryError.of("chair", ErrorKind.AUTH, "Invalid API key")), "Chairman failed to answer.");

        store.addAssistantMessage(c.id(), failed);

        DeliberationResult loaded = store.get(c.id()).orElseThrow().messages().get(0).deliberation();
        assertThat(loaded).isEqualTo(failed);
        assertThat(loaded.stage3()).isNull();
    }

    @Test
    void titleAndOverridesAreUpdated() {
        Conversation c = store.create();

        store.updateTitle(c.id(), "Sky Color");
        store.updateOverrides(c.id(), new CouncilOverrides(List.of("x", "y"), "x", true));

        Conversation loaded = store.get(c.id()).orElseThrow();
        assertThat(loaded.title()).isEqualTo("Sky Color");
        assertThat(loaded.overrides().councilModels()).containsExactly("x", "y");
        assertThat(loaded.overrides().chairmanModel()).isEqualTo("x");
        assertThat(loaded.overrides().webSearchEnabled()).isTrue();
    }

    @Test
    void listsNewestFirstWithMessageCounts() {
        Conversation older = store.create();
        clock.advance(Duration.ofMinutes(5));
        Conversation newer = store.create();
        store.addUserMessage(older.id(), "hi");

        List<ConversationMetadata> list = store.list();

        assertThat(list).extracting(ConversationMetadata::id).containsExactly(newer.id(), older.id());
        assertThat(list.get(1).messageCount()).isEqualTo(1);
    }

    @Test
    void listSkipsCorruptFilesButGetReportsThem() throws IOException {
        Conversation ok = store.create();
        Files.writeString(dir.resolve("broken.json"), "{not json", StandardCharsets.UTF_8);

        assertThat(store.list()).extracting(ConversationMetadata::id).containsExactly(ok.id());
        assertThatThrownBy(() -> store.get("broken")).isInstanceOf(ConversationStoreException.class);
    }

    @Test
    void unknownIdIsNotFound() {
        assertThat(store.get("missing")).isEmpty();
        assertThatThrownBy(() -> store.addUserMessage("missing", "hi"))
                .isInstanceOf(ConversationNotFoundException.class)
                .hasMessageContaining("missing");
        assertThat(store.delete("missing")).isFalse();
    }

    @Test
    void idsCannotEscapeDataDirectory() throws IOException {
        Path outside = dir.getParent().resolve("secret.json");
        Files.writeString(outside, "{}", StandardCharsets.UTF_8);
        try {
            assertThat(store.resolve("../secret")).isNull();
            assertThat(store.resolve("a/b")).isNull();
            assertThat(store.resolve("")).isNull();
            assertThat(store.get("../secret")).isEmpty();
            assertThat(store.delete("../secret")).isFalse();
            assertThat(outside).exists();
        } finally {
            Files.deleteIfExists(outside);
        }
    }

    @Test
    void deleteAndDeleteAll() {
        Conversation a = store.create();
        store.create();
        store.create();

        assertThat(store.delete(a.id())).isTrue();
        assertThat(store.get(a.id())).isEmpty();
        assertThat(store.deleteAll()).isEqualTo(2);
        assertThat(store.list()).isEmpty();
    }

    @Test
    void deletingConversationsReleasesTheirLocks() {
        Conversation a = store.create();
        Conversation b = store.create();
        store.addUserMessage(b.id(), "hello");
        assertThat(store.lockCount()).isEqualTo(2);

        store.delete(a.id());
        assertThat(store.lockCount()).isEqualTo(1);

        store.deleteAll();
        assertThat(store.lockCount()).isZero();
    }

    @Test
    void concurrentAppendsAreNotLost() throws Exception {
        Conversation c = store.create();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                int n = i;
                futures.add(pool.submit(() -> store.addUserMessage(c.id(), "message " + n)));
            }
            for (Future<?> f : futures) {
                f.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.get(c.id()).orElseThrow().messages()).hasSize(40);
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
