package com.smurthy.ai.derma.dynamodb;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smurthy.ai.derma.agents.Citation;
import com.smurthy.ai.derma.agents.EvidenceBundle;
import com.smurthy.ai.derma.agents.Intent;
import com.smurthy.ai.derma.history.Turn;
import com.smurthy.ai.derma.retrieval.Constraint;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

import java.time.Instant;
import java.util.List;

/**
 * DynamoDB entity for one conversation turn.
 *
 * Table Design:
 * - Partition Key: sessionId (all turns of a conversation)
 * - Sort Key: sequence (0, 1, 2... position of the turn in the conversation)
 * - TTL: expirationTime (auto-delete old conversations)
 *
 * Structured parts of the turn (constraints, evidence, citations) are stored as JSON strings.
 *
 * Example DynamoDB Item:
 * {
 *   "sessionId": "session-42",
 *   "sequence": 3,
 *   "query": "Recommend a moisturizer under 1200 for oily skin",
 *   "intent": "catalog-lookup",
 *   "agentUsed": "catalog-lookup",
 *   "answer": "Here are two options... [1] [2]",
 *   "constraintsJson": "[{\"attribute\":\"price\",\"operator\":\"AT_MOST\",\"value\":1200.0}]",
 *   "evidenceJson": "{...}",
 *   "citationsJson": "[...]",
 *   "timestamp": 1704672000000,
 *   "expirationTime": 1705276800
 * }
 */
@DynamoDbBean
public class TurnEntity {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private String sessionId;
    private Long sequence;
    private String query;
    private String intent;
    private String agentUsed;
    private String answer;
    private String constraintsJson;
    private String evidenceJson;
    private String citationsJson;
    private Long timestamp;       // epoch millis
    private Long expirationTime;  // TTL in epoch seconds

    // Default constructor (required by DynamoDB Enhanced Client)
    public TurnEntity() {
    }

    public static TurnEntity from(String sessionId, long sequence, Turn turn, Long expirationTime) {
        TurnEntity entity = new TurnEntity();
        entity.sessionId = sessionId;
        entity.sequence = sequence;
        entity.query = turn.query();
        entity.intent = turn.intent().label();
        entity.agentUsed = turn.agentUsed();
        entity.answer = turn.answer();
        entity.constraintsJson = write(turn.constraints());
        entity.evidenceJson = write(turn.evidenceBundle());
        entity.citationsJson = write(turn.citations());
        entity.timestamp = turn.timestamp().toEpochMilli();
        entity.expirationTime = expirationTime;
        return entity;
    }

    public Turn toTurn() {
        Intent parsedIntent = Intent.fromLabel(intent)
                .orElseThrow(() -> new IllegalStateException(
                        "Unknown intent '" + intent + "' in turn " + sessionId + "#" + sequence));
        return new Turn(
                query,
                parsedIntent,
                read(constraintsJson, new TypeReference<List<Constraint>>() {}),
                read(evidenceJson, new TypeReference<EvidenceBundle>() {}),
                answer,
                read(citationsJson, new TypeReference<List<Citation>>() {}),
                agentUsed,
                Instant.ofEpochMilli(timestamp)
        );
    }

    @DynamoDbPartitionKey
    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    @DynamoDbSortKey
    public Long getSequence() {
        return sequence;
    }

    public void setSequence(Long sequence) {
        this.sequence = sequence;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public String getIntent() {
        return intent;
    }

    public void setIntent(String intent) {
        this.intent = intent;
    }

    public String getAgentUsed() {
        return agentUsed;
    }

    public void setAgentUsed(String agentUsed) {
        this.agentUsed = agentUsed;
    }

    public String getAnswer() {
        return answer;
    }

    public void setAnswer(String answer) {
        this.answer = answer;
    }

    public String getConstraintsJson() {
        return constraintsJson;
    }

    public void setConstraintsJson(String constraintsJson) {
        this.constraintsJson = constraintsJson;
    }

    public String getEvidenceJson() {
        return evidenceJson;
    }

    public void setEvidenceJson(String evidenceJson) {
        this.evidenceJson = evidenceJson;
    }

    public String getCitationsJson() {
        return citationsJson;
    }

    public void setCitationsJson(String citationsJson) {
        this.citationsJson = citationsJson;
    }

    public Long getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Long timestamp) {
        this.timestamp = timestamp;
    }

    public Long getExpirationTime() {
        return expirationTime;
    }

    public void setExpirationTime(Long expirationTime) {
        this.expirationTime = expirationTime;
    }

    private static String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize turn part " + value.getClass().getSimpleName(), e);
        }
    }

    private static <T> T read(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not deserialize stored turn part: " + type.getType(), e);
        }
    }

    @Override
    public String toString() {
        return "TurnEntity{" +
                "sessionId='" + sessionId + '\'' +
                ", sequence=" + sequence +
                ", intent='" + intent + '\'' +
                ", agentUsed='" + agentUsed + '\'' +
                ", query='" + (query != null && query.length() > 50 ? query.substring(0, 50) + "..." : query) + '\'' +
                ", expirationTime=" + expirationTime +
                '}';
    }
}
