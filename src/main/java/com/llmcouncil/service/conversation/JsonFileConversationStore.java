package com.llmcouncil.service.conversation;

import com.llmcouncil.config.properties.StorageProperties;
import com.llmcouncil.domain.Conversation;
import com.llmcouncil.domain.ConversationMessage;
import com.llmcouncil.domain.ConversationMetadata;
import com.llmcouncil.domain.CouncilOverrides;
import com.llmcouncil.domain.DeliberationResult;
import com.llmcouncil.exception.ConversationNotFoundException;
import com.llmcouncil.exception.ConversationStoreException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * {@link ConversationStore} keeping one JSON file per conversation under a data directory.
 *
 * <p>Writes go to a temporary file that is then moved over the target, so a crash never
 * leaves a half-written conversation. Read-modify-write cycles on one conversation are
 * serialized by a per-id lock; different conversations never contend.
 *
 * <p>Ids are restricted to {@code [A-Za-z0-9_-]} and the resolved path must stay inside the
 * data directory, so an id cannot address any other file.
 */
@Component
public class JsonFileConversationStore implements ConversationStore {

    private static final Logger LOG = LogManager.getLogger(JsonFileConversationStore.class);

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");
    private static final String SUFFIX = ".json";

    private final Path dataDir;
    private final Clock clock;
    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    @Autowired
    public JsonFileConversationStore(StorageProperties props) {
        this(Paths.get(props.getDataDir()), Clock.systemUTC());
    }

    public JsonFileConversationStore(Path dataDir, Clock clock) {
        this.dataDir = dataDir.toAbsolutePath().normalize();
        this.clock = clock;
        try {
            Files.createDirectories(this.dataDir);
        } catch (IOException e) {
            throw new ConversationStoreException("Cannot create data directory " + this.dataDir, e);
        }
    }

    @Override
    public Conversation create() {
        String id = UUID.randomUUID().toString();
        Conversation c = new Conversation(id, clock.instant(), Conversation.DEFAULT_TITLE, List.of(),
                CouncilOverrides.NONE);
        withLock(id, () -> {
            save(c);
            return null;
        });
        LOG.info("Conversation created: id={}", id);
        return c;
    }

    @Override
    public Optional<Conversation> get(String id) {
        Path file = resolve(id);
        if (file == null || !Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(load(id, file));
    }

    @Override
    public List<ConversationMetadata> list() {
        List<ConversationMetadata> out = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dataDir, "*" + SUFFIX)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                String id = name.substring(0, name.length() - SUFFIX.length());
                try {
                    out.add(load(id, file).metadata());
                } catch (ConversationStoreException e) {
                    LOG.warn("Skipping unreadable conversation file {}: {}", name, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new ConversationStoreException("Cannot list conversations in " + dataDir, e);
        }
        out.sort(Comparator.comparing(ConversationMetadata::createdAt).reversed());
        return out;
    }

    @Override
    public void addUserMessage(String id, String content) {
        update(id, c -> withMessage(c, ConversationMessage.user(content)));
    }

    @Override
    public void addAssistantMessage(String id, DeliberationResult deliberation) {
        update(id, c -> withMessage(c, ConversationMessage.assistant(deliberation)));
    }

    @Override
    public void updateTitle(String id, String title) {
        update(id, c -> new Conversation(c.id(), c.createdAt(), title, c.messages(), c.overrides()));
    }

    @Override
    public void updateOverrides(String id, CouncilOverrides overrides) {
        update(id, c -> new Conversation(c.id(), c.createdAt(), c.title(), c.messages(), overrides));
    }

    @Override
    public boolean delete(String id) {
        Path file = resolve(id);
        if (file == null) {
            return false;
        }
        boolean deleted = withLock(id, () -> {
            try {
                return Files.deleteIfExists(file);
            } catch (IOException e) {
                throw new ConversationStoreException("Cannot delete conversation " + id, e);
            }
        });
        // ids are never reused, so a deleted conversation needs no lock
        locks.remove(id);
        if (deleted) {
            LOG.info("Conversation deleted: id={}", id);
        }
        return deleted;
    }

    @Override
    public int deleteAll() {
        int count = 0;
        for (ConversationMetadata m : list()) {
            if (delete(m.id())) {
                count++;
            }
        }
        LOG.info("Deleted {} conversations", count);
        return count;
    }

    private void update(String id, UnaryOperator<Conversation> change) {
        Path file = resolve(id);
        if (file == null) {
            throw new ConversationNotFoundException(id);
        }
        withLock(id, () -> {
            if (!Files.exists(file)) {
                throw new ConversationNotFoundException(id);
            }
            save(change.apply(load(id, file)));
            return null;
        });
    }

    private static Conversation withMessage(Conversation c, ConversationMessage m) {
        List<ConversationMessage> messages = new ArrayList<>(c.messages());
        messages.add(m);
        return new Conversation(c.id(), c.createdAt(), c.title(), messages, c.overrides());
    }

    private Conversation load(String id, Path file) {
        try {
            String text = Files.readString(file, StandardCharsets.UTF_8);
            return ConversationJsonCodec.read(new JSONObject(text));
        } catch (IOException e) {
            throw new ConversationStoreException("Cannot read conversation " + id, e);
        } catch (JSONException | IllegalArgumentException | DateTimeParseException e) {
            throw new ConversationStoreException("Malformed conversation file for " + id, e);
        }
    }

    private void save(Conversation c) {
        Path file = resolve(c.id());
        if (file == null) {
            throw new ConversationStoreException("Refusing to write unsafe id " + c.id());
        }
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.writeString(tmp, ConversationJsonCodec.write(c).toString(2), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new ConversationStoreException("Cannot write conversation " + c.id(), e);
        }
    }

    /**
     * @return the file for {@code id}, or {@code null} if the id is not safe
     */
    Path resolve(String id) {
        if (id == null || !SAFE_ID.matcher(id).matches()) {
            return null;
        }
        Path file = dataDir.resolve(id + SUFFIX).normalize();
        return file.startsWith(dataDir) ? file : null;
    }

    // Package-private for tests
    int lockCount() {
        return locks.size();
    }

    private <T> T withLock(String id, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(id, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
