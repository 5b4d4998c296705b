package com.smurthy.ai.derma.dynamodb;

import com.smurthy.ai.derma.history.ConcurrentTurnException;
import com.smurthy.ai.derma.history.ConversationContext;
import com.smurthy.ai.derma.history.ConversationStore;
import com.smurthy.ai.derma.history.Turn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.PutItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * DynamoDB-backed conversation store.
 *
 * Turns are keyed by (sessionId, sequence). An append is a conditional put that only succeeds when
 * no item exists at that key yet, so of two concurrent turns that read the same history exactly one
 * is stored; the other gets a {@link ConcurrentTurnException}.
 *
 * Turns expire through DynamoDB TTL, which deletes lazily. Expired items are hidden from reads,
 * and the next position is always one past the newest stored sequence, never the number of
 * turns left in the table.
 *
 * Usage:
 * ```java
 * ConversationStore store = new DynamoDBConversationStore(enhancedClient, "derma_conversations", 30, Clock.systemUTC());
 * store.append("session-42", 0, turn);
 * List<Turn> history = store.read("session-42");
 * ```
 */
public class DynamoDBConversationStore implements ConversationStore {

    private static final Logger log = LoggerFactory.getLogger(DynamoDBConversationStore.class);

    private static final Expression KEY_NOT_TAKEN = Expression.builder()
            .expression("attribute_not_exists(sessionId)")
            .build();

    private final DynamoDbTable<TurnEntity> table;
    private final int ttlDays;
    private final Clock clock;

    /**
     * @param ttlDays number of days before turns expire (0 = no expiration)
     */
    public DynamoDBConversationStore(DynamoDbEnhancedClient enhancedClient, String tableName, int ttlDays, Clock clock) {
        this(enhancedClient.table(tableName, TableSchema.fromBean(TurnEntity.class)), ttlDays, clock);
        log.info("DynamoDBConversationStore initialized with table='{}', ttl={}days", tableName, ttlDays);
    }

    DynamoDBConversationStore(DynamoDbTable<TurnEntity> table, int ttlDays, Clock clock) {
        this.table = table;
        this.ttlDays = ttlDays;
        this.clock = clock;
    }

    @Override
    public List<Turn> read(String sessionId) {
        log.debug("Retrieving turns of session '{}'", sessionId);

        QueryEnhancedRequest queryRequest = QueryEnhancedRequest.builder()
                .queryConditional(sessionKey(sessionId))
                .scanIndexForward(true)  // Oldest first
                .consistentRead(true)
                .build();

        long now = clock.instant().getEpochSecond();
        List<Turn> turns = table.query(queryRequest)
                .items()
                .stream()
                .filter(entity -> isLive(entity, now))
                .map(TurnEntity::toTurn)
                .collect(Collectors.toList());

        log.debug("Found {} turns for session '{}'", turns.size(), sessionId);
        return turns;
    }

    /**
     * Reads only the newest {@code window} items, newest first, so opening a long session does not
     * scan its whole history.
     */
    @Override
    public ConversationContext open(String sessionId, int window) {
        int fetch = Math.max(window, 1);
        QueryEnhancedRequest queryRequest = QueryEnhancedRequest.builder()
                .queryConditional(sessionKey(sessionId))
                .scanIndexForward(false)  // Newest first
                .consistentRead(true)
                .limit(fetch)
                .build();

        List<TurnEntity> newest = table.query(queryRequest)
                .items()
                .stream()
                .limit(fetch)
                .collect(Collectors.toList());
        if (newest.isEmpty()) {
            return new ConversationContext(sessionId, List.of(), 0);
        }

        long nextSequence = newest.get(0).getSequence() + 1;
        long now = clock.instant().getEpochSecond();
        List<Turn> recent = new ArrayList<>();
        for (TurnEntity entity : newest.subList(0, Math.min(window, newest.size()))) {
            if (isLive(entity, now)) {
                recent.add(entity.toTurn());
            }
        }
        Collections.reverse(recent);

        log.debug("Opened session '{}' at turn #{} with {} recent turns", sessionId, nextSequence, recent.size());
        return new ConversationContext(sessionId, recent, nextSequence);
    }

    @Override
    public void append(String sessionId, long sequence, Turn turn) {
        Long expirationTime = ttlDays > 0
                ? clock.instant().plusSeconds(ttlDays * 24L * 60 * 60).getEpochSecond()
                : null;
        TurnEntity entity = TurnEntity.from(sessionId, sequence, turn, expirationTime);

        try {
            table.putItem(PutItemEnhancedRequest.builder(TurnEntity.class)
                    .item(entity)
                    .conditionExpression(KEY_NOT_TAKEN)
                    .build());
        } catch (ConditionalCheckFailedException e) {
            log.warn("Turn #{} of session '{}' was already written by a concurrent request", sequence, sessionId);
            throw new ConcurrentTurnException(sessionId, sequence, e);
        }

        log.info("Stored turn #{} of session '{}'", sequence, sessionId);
        log.trace("Stored turn: {}", entity);
    }

    private static QueryConditional sessionKey(String sessionId) {
        return QueryConditional.keyEqualTo(Key.builder()
                .partitionValue(sessionId)
                .build());
    }

    private static boolean isLive(TurnEntity entity, long nowEpochSecond) {
        return entity.getExpirationTime() == null || entity.getExpirationTime() > nowEpochSecond;
    }
}
